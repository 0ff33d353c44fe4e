package io.agentflow.compiler.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.agentflow.compiler.parser.ParseStrategy;
import io.agentflow.compiler.report.ReportFormat;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

/**
 * Tests for {@link ConfigLoader}: YAML mapping, defaults for missing keys, the environment
 * overlay and the error paths.
 */
@DisplayName("ConfigLoader")
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private final Map<String, String> env = new HashMap<>();

    private ListAppender<ILoggingEvent> logAppender;
    private Logger loaderLogger;

    @BeforeEach
    void setUp() {
        loaderLogger = (Logger) LoggerFactory.getLogger(ConfigLoader.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        loaderLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        loaderLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    private static Path fixture(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class.getClassLoader().getResource(name).toURI());
    }

    private Path write(String yaml) throws Exception {
        Path file = tempDir.resolve("agentflow.yaml");
        Files.writeString(file, yaml);
        return file;
    }

    @Nested
    @DisplayName("YAML files")
    class YamlFiles {

        @Test
        @DisplayName("every key of the full fixture is mapped")
        void fullConfig() throws Exception {
            CompilerConfig config = ConfigLoader.load(fixture("config/full-config.yaml"), env::get);

            assertThat(config.cacheCapacity()).isEqualTo(25);
            assertThat(config.parseStrategy()).isEqualTo(ParseStrategy.BACKTRACKING);
            assertThat(config.lookahead()).isEqualTo(5);
            assertThat(config.outputFormat()).isEqualTo(ReportFormat.JSON);
            assertThat(config.contextLines()).isEqualTo(2);
            assertThat(config.generatedPackage()).isEqualTo("com.example.flows");
        }

        @Test
        @DisplayName("missing keys keep their defaults")
        void minimalConfig() throws Exception {
            CompilerConfig config = ConfigLoader.load(fixture("config/minimal-config.yaml"), env::get);

            assertThat(config).isEqualTo(CompilerConfig.defaults());
        }

        @Test
        @DisplayName("an empty file yields the defaults")
        void emptyFile() throws Exception {
            assertThat(ConfigLoader.load(write(""), env::get)).isEqualTo(CompilerConfig.defaults());
        }

        @Test
        @DisplayName("a successful load is logged at INFO")
        void loadLogged() throws Exception {
            Path file = write("cache:\n  capacity: 7\n");

            ConfigLoader.load(file, env::get);

            assertThat(logAppender.list)
                    .filteredOn(event -> event.getLevel() == Level.INFO)
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .containsExactly("Loaded compiler config: file=" + file
                            + ", strategy=PREDICTIVE, cache_capacity=7, format=HUMAN");
        }
    }

    @Nested
    @DisplayName("environment overlay")
    class Environment {

        @Test
        @DisplayName("variables take precedence over the file")
        void overridesFile() throws Exception {
            env.put(ConfigLoader.ENV_CACHE_CAPACITY, " 3 ");
            env.put(ConfigLoader.ENV_PARSE_STRATEGY, "predictive");
            env.put(ConfigLoader.ENV_OUTPUT_FORMAT, "HUMAN");

            CompilerConfig config = ConfigLoader.load(fixture("config/full-config.yaml"), env::get);

            assertThat(config.cacheCapacity()).isEqualTo(3);
            assertThat(config.parseStrategy()).isEqualTo(ParseStrategy.PREDICTIVE);
            assertThat(config.outputFormat()).isEqualTo(ReportFormat.HUMAN);
            assertThat(config.lookahead()).isEqualTo(5);
        }

        @Test
        @DisplayName("blank variables count as unset")
        void blankIgnored() {
            env.put(ConfigLoader.ENV_LOOKAHEAD, "   ");
            env.put(ConfigLoader.ENV_GENERATED_PACKAGE, "");

            assertThat(ConfigLoader.fromEnvironment(env::get)).isEqualTo(CompilerConfig.defaults());
        }

        @Test
        void environmentOnly() {
            env.put(ConfigLoader.ENV_CONTEXT_LINES, "0");
            env.put(ConfigLoader.ENV_GENERATED_PACKAGE, "flows");
            env.put(ConfigLoader.ENV_LOOKAHEAD, "8");

            CompilerConfig config = ConfigLoader.fromEnvironment(env::get);

            assertThat(config.contextLines()).isZero();
            assertThat(config.generatedPackage()).isEqualTo("flows");
            assertThat(config.lookahead()).isEqualTo(8);
        }

        @Test
        void nonNumericVariable() {
            env.put(ConfigLoader.ENV_CACHE_CAPACITY, "lots");

            assertThatThrownBy(() -> ConfigLoader.fromEnvironment(env::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Expected an integer in AGENTFLOW_CACHE_CAPACITY, got: lots");
        }
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        @Test
        void missingFile() {
            Path missing = tempDir.resolve("nope.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(missing, env::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Configuration file not found: " + missing);
        }

        @Test
        void malformedYaml() throws Exception {
            Path file = write("cache: [unclosed\n");

            assertThatThrownBy(() -> ConfigLoader.load(file, env::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Failed to parse YAML configuration: " + file)
                    .hasCauseInstanceOf(java.io.IOException.class);
        }

        @Test
        void rootMustBeMapping() throws Exception {
            Path file = write("- just\n- a list\n");

            assertThatThrownBy(() -> ConfigLoader.load(file, env::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Configuration root must be a mapping: " + file);
        }

        @Test
        void nonIntegerValue() throws Exception {
            Path file = write("cache:\n  capacity: many\n");

            assertThatThrownBy(() -> ConfigLoader.load(file, env::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Expected an integer for 'cache.capacity', got: many");
        }

        @Test
        void unknownStrategy() throws Exception {
            Path file = write("parser:\n  strategy: earley\n");

            assertThatThrownBy(() -> ConfigLoader.load(file, env::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Unknown parser strategy 'earley' for 'parser.strategy'; expected predictive or backtracking");
        }

        @Test
        void unknownFormat() throws Exception {
            Path file = write("diagnostics:\n  format: xml\n");

            assertThatThrownBy(() -> ConfigLoader.load(file, env::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Unknown output format 'xml'; expected human or json (diagnostics.format)");
        }

        @Test
        @DisplayName("out-of-range values name the file they came from")
        void outOfRange() throws Exception {
            Path file = write("parser:\n  lookahead: 12\n");

            assertThatThrownBy(() -> ConfigLoader.load(file, env::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Invalid configuration in " + file + ": lookahead must be between 1 and 8, got: 12")
                    .hasCauseInstanceOf(IllegalArgumentException.class);
        }
    }
}
