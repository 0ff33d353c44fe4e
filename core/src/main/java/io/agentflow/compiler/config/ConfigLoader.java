package io.agentflow.compiler.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.agentflow.compiler.parser.ParseStrategy;
import io.agentflow.compiler.report.ReportFormat;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link CompilerConfig} from a YAML file with an environment variable overlay.
 *
 * <pre>
 * cache:
 *   capacity: 100
 * parser:
 *   strategy: predictive
 *   lookahead: 3
 * diagnostics:
 *   format: human
 *   context-lines: 1
 * codegen:
 *   package: agentflow.generated
 * </pre>
 *
 * <p>
 * Missing keys keep the defaults of {@link CompilerConfig.Builder}. Every key can be overridden
 * by an {@code AGENTFLOW_*} environment variable, which takes precedence over YAML. A variable
 * counts as set only if it is defined and non-blank after trimming.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String ENV_CACHE_CAPACITY = "AGENTFLOW_CACHE_CAPACITY";
    static final String ENV_PARSE_STRATEGY = "AGENTFLOW_PARSE_STRATEGY";
    static final String ENV_LOOKAHEAD = "AGENTFLOW_LOOKAHEAD";
    static final String ENV_OUTPUT_FORMAT = "AGENTFLOW_OUTPUT_FORMAT";
    static final String ENV_CONTEXT_LINES = "AGENTFLOW_CONTEXT_LINES";
    static final String ENV_GENERATED_PACKAGE = "AGENTFLOW_GENERATED_PACKAGE";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from {@code configPath}, overlaid with {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or holds an
     *                             invalid value
     */
    public static CompilerConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from {@code configPath}, overlaid with variables from
     * {@code envLookup}. A {@code null} lookup result means the variable is not defined.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or holds an
     *                             invalid value
     */
    public static CompilerConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        CompilerConfig config = fromTree(root == null ? YAML_MAPPER.missingNode() : root, envLookup, configPath.toString());
        LOG.info("Loaded compiler config: file={}, strategy={}, cache_capacity={}, format={}",
                configPath, config.parseStrategy(), config.cacheCapacity(), config.outputFormat());
        return config;
    }

    /** Defaults overlaid with environment variables only. */
    public static CompilerConfig fromEnvironment(Function<String, String> envLookup) {
        return fromTree(YAML_MAPPER.missingNode(), envLookup, "environment");
    }

    private static CompilerConfig fromTree(JsonNode root, Function<String, String> envLookup, String origin) {
        if (!root.isMissingNode() && !root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping: " + origin);
        }
        CompilerConfig.Builder builder = CompilerConfig.builder();

        JsonNode cache = root.path("cache");
        if (cache.has("capacity")) builder.cacheCapacity(intValue(cache, "capacity", "cache.capacity"));

        JsonNode parser = root.path("parser");
        if (parser.has("strategy")) builder.parseStrategy(strategy(parser.get("strategy").asText(), "parser.strategy"));
        if (parser.has("lookahead")) builder.lookahead(intValue(parser, "lookahead", "parser.lookahead"));

        JsonNode diagnostics = root.path("diagnostics");
        if (diagnostics.has("format")) builder.outputFormat(format(diagnostics.get("format").asText(), "diagnostics.format"));
        if (diagnostics.has("context-lines"))
            builder.contextLines(intValue(diagnostics, "context-lines", "diagnostics.context-lines"));

        JsonNode codegen = root.path("codegen");
        if (codegen.has("package")) builder.generatedPackage(codegen.get("package").asText());

        // --- Environment variable overlay ---
        envInt(envLookup, ENV_CACHE_CAPACITY, builder::cacheCapacity);
        envString(envLookup, ENV_PARSE_STRATEGY, value -> builder.parseStrategy(strategy(value, ENV_PARSE_STRATEGY)));
        envInt(envLookup, ENV_LOOKAHEAD, builder::lookahead);
        envString(envLookup, ENV_OUTPUT_FORMAT, value -> builder.outputFormat(format(value, ENV_OUTPUT_FORMAT)));
        envInt(envLookup, ENV_CONTEXT_LINES, builder::contextLines);
        envString(envLookup, ENV_GENERATED_PACKAGE, builder::generatedPackage);

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration in " + origin + ": " + e.getMessage(), e);
        }
    }

    private static int intValue(JsonNode node, String field, String key) {
        JsonNode value = node.get(field);
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new ConfigLoadException("Expected an integer for '" + key + "', got: " + value.asText());
        }
        return value.asInt();
    }

    private static ParseStrategy strategy(String value, String key) {
        try {
            return ParseStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException(
                    "Unknown parser strategy '" + value + "' for '" + key + "'; expected predictive or backtracking", e);
        }
    }

    private static ReportFormat format(String value, String key) {
        try {
            return ReportFormat.parse(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException(e.getMessage() + " (" + key + ")", e);
        }
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException("Expected an integer in " + envVar + ", got: " + value, e);
            }
        }
    }
}
