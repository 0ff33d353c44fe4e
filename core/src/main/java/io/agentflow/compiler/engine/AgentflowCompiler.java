package io.agentflow.compiler.engine;

import io.agentflow.compiler.ast.CompilationUnit;
import io.agentflow.compiler.cache.CompilationCache;
import io.agentflow.compiler.codegen.CodeGenerator;
import io.agentflow.compiler.codegen.GeneratedWorkflow;
import io.agentflow.compiler.config.CompilerConfig;
import io.agentflow.compiler.diagnostics.Diagnostic;
import io.agentflow.compiler.diagnostics.ErrorCode;
import io.agentflow.compiler.error.CompilerException;
import io.agentflow.compiler.grammar.AgentflowGrammar;
import io.agentflow.compiler.lexer.Lexer;
import io.agentflow.compiler.lexer.Token;
import io.agentflow.compiler.model.CompilationResult;
import io.agentflow.compiler.model.CompilationStats;
import io.agentflow.compiler.parser.ParseNode;
import io.agentflow.compiler.parser.Parser;
import io.agentflow.compiler.report.DiagnosticReporter;
import io.agentflow.compiler.report.ReportFormat;
import io.agentflow.compiler.semantic.AnalysisResult;
import io.agentflow.compiler.semantic.SemanticAnalyzer;
import io.agentflow.compiler.source.SourceFile;
import io.agentflow.compiler.transform.AstTransformer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the compiler: source text in, {@link CompilationResult} out.
 *
 * <p>
 * The pipeline runs lexer, parser, AST transformer, import resolution, semantic analysis and,
 * for {@link #compile}, code generation. Lexical and syntax faults stop it at once; semantic
 * findings are collected in full; code is generated only if no error was found. No
 * {@link CompilerException} escapes: every fault ends up as a diagnostic of the result.
 *
 * <p>
 * Results without errors are memoised in the {@link CompilationCache} by content hash. A hit
 * whose imported files have changed on disk is discarded and compiled again.
 *
 * <p>
 * Thread-safe: every call builds its own pipeline objects; only the cache is shared.
 */
public final class AgentflowCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(AgentflowCompiler.class);

    private static final String VALIDATE_PREFIX = "validate:";

    private final CompilerConfig config;
    private final CompilationCache cache;
    private final DiagnosticReporter reporter;

    public AgentflowCompiler(CompilerConfig config, CompilationCache cache) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.reporter = new DiagnosticReporter(config.contextLines());
    }

    /** A compiler with its own cache of {@link CompilerConfig#cacheCapacity()} entries. */
    public AgentflowCompiler(CompilerConfig config, Clock clock) {
        this(config, new CompilationCache(config.cacheCapacity(), clock));
    }

    public AgentflowCompiler(CompilerConfig config) {
        this(config, Clock.systemUTC());
    }

    public AgentflowCompiler() {
        this(CompilerConfig.defaults());
    }

    public CompilerConfig config() {
        return config;
    }

    public CompilationCache cache() {
        return cache;
    }

    /**
     * Compiles a file held in memory. Local imports are read relative to the directory of
     * {@code fileId}.
     *
     * @param fileId name used in diagnostics, the generated class name and import resolution
     */
    public CompilationResult compile(String sourceText, String fileId) {
        return run(sourceText, fileId, true);
    }

    /** Like {@link #compile} without code generation; reports the same diagnostics. */
    public CompilationResult validate(String sourceText, String fileId) {
        return run(sourceText, fileId, false);
    }

    /** Reads and compiles a file; an unreadable file yields a file-error result. */
    public CompilationResult compileFile(Path path) {
        return runFile(path, true);
    }

    public CompilationResult validateFile(Path path) {
        return runFile(path, false);
    }

    /** Renders a result in the configured output format. */
    public String report(CompilationResult result) {
        return report(result, config.outputFormat());
    }

    public String report(CompilationResult result, ReportFormat format) {
        return reporter.render(result, format);
    }

    private CompilationResult runFile(Path path, boolean generate) {
        String fileId = path.toString().replace('\\', '/');
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.warn("Source file could not be read: file={}, reason={}", fileId, e.toString());
            return CompilationResult.fileError(
                    fileId, Diagnostic.withMessage(ErrorCode.E0005, fileId, null, "file not found: " + fileId));
        }
        return run(text, fileId, generate);
    }

    private CompilationResult run(String sourceText, String fileId, boolean generate) {
        Objects.requireNonNull(sourceText, "sourceText must not be null");
        Objects.requireNonNull(fileId, "fileId must not be null");
        String hash = CompilationCache.key(sourceText, fileId);
        String key = generate ? hash : VALIDATE_PREFIX + hash;
        CompilationResult result = cache.getOrCompile(key, () -> pipeline(sourceText, fileId, hash, generate));
        if (importsChanged(result)) {
            LOG.debug("Cached result is stale, imports changed: file={}", fileId);
            cache.invalidate(key);
            result = cache.getOrCompile(key, () -> pipeline(sourceText, fileId, hash, generate));
        }
        return result;
    }

    private static boolean importsChanged(CompilationResult result) {
        for (SourceFile source : result.sources()) {
            if (source.fileId().equals(result.fileId())) {
                continue;
            }
            try {
                if (!Files.readString(Path.of(source.fileId()), StandardCharsets.UTF_8).equals(source.text())) {
                    return true;
                }
            } catch (IOException e) {
                LOG.debug("Imported file no longer readable: file={}, reason={}", source.fileId(), e.toString());
                return true;
            }
        }
        return false;
    }

    private CompilationResult pipeline(String sourceText, String fileId, String hash, boolean generate) {
        long started = System.nanoTime();
        SourceFile source = new SourceFile(fileId, sourceText);
        CompilationResult.Builder result = CompilationResult.builder(fileId).contentHash(hash).source(source);
        try {
            CompilationUnit unit = parse(source);
            result.stats(CompilationStats.of(unit));

            ImportResolver.Resolution imports = new ImportResolver(this::parse).resolve(unit);
            imports.sources().forEach(result::source);
            result.diagnostics(imports.diagnostics());
            if (imports.hasErrors()) {
                return finish(result.build(), started);
            }

            AnalysisResult analysis = new SemanticAnalyzer(fileId).analyze(unit, imports.units());
            result.diagnostics(analysis.diagnostics());
            if (analysis.hasErrors() || !generate) {
                return finish(result.build(), started);
            }

            GeneratedWorkflow generated =
                    new CodeGenerator(config.generatedPackage()).generate(unit, imports.units(), analysis);
            result.generated(generated.qualifiedName(), generated.source(), generated.sourceMap());
        } catch (CompilerException e) {
            LOG.debug("Compilation stopped: file={}, phase={}, code={}", fileId, e.phase(), e.diagnostic().code().code());
            result.diagnostic(e.diagnostic());
        } catch (RuntimeException e) {
            LOG.error("Internal compiler error: file={}", fileId, e);
            result.diagnostic(Diagnostic.of(
                    ErrorCode.E9999, fileId, null, Map.of("detail", e.getClass().getSimpleName() + ": " + e.getMessage())));
        }
        return finish(result.build(), started);
    }

    /** Lexes, parses and transforms one file. */
    private CompilationUnit parse(SourceFile source) {
        List<Token> tokens = new Lexer(source).tokenize();
        Parser parser = new Parser(AgentflowGrammar.instance(), config.parseStrategy(), config.lookahead());
        ParseNode.Branch tree = parser.parse(tokens, source.fileId());
        return new AstTransformer(source.fileId()).transform(tree);
    }

    private static CompilationResult finish(CompilationResult result, long started) {
        LOG.info(
                "Compiled unit: file={}, success={}, generated={}, agents={}, flows={}, errors={}, warnings={}, duration_ms={}",
                result.fileId(),
                result.isSuccess(),
                result.javaSource().isPresent(),
                result.stats().agents(),
                result.stats().flows(),
                result.errors().size(),
                result.warnings().size(),
                (System.nanoTime() - started) / 1_000_000);
        return result;
    }
}
