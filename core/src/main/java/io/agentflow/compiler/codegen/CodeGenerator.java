package io.agentflow.compiler.codegen;

import io.agentflow.compiler.ast.CompilationUnit;
import io.agentflow.compiler.diagnostics.Diagnostic;
import io.agentflow.compiler.diagnostics.ErrorCode;
import io.agentflow.compiler.error.CompilerException;
import io.agentflow.compiler.error.InternalCompilerException;
import io.agentflow.compiler.semantic.AnalysisResult;
import io.agentflow.compiler.sourcemap.SourceMapRegistry;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an analysed {@link CompilationUnit} into the Java source of a class extending
 * {@code io.agentflow.runtime.Workflow}, recording a source mapping for every emitted statement.
 *
 * <p>
 * Must only be given units whose analysis reported no errors. Thread-safe: all state lives in
 * per-call emitters.
 */
public final class CodeGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(CodeGenerator.class);

    private final String packageName;

    /** @param packageName Java package of generated classes */
    public CodeGenerator(String packageName) {
        this.packageName = Objects.requireNonNull(packageName, "packageName must not be null");
    }

    public GeneratedWorkflow generate(CompilationUnit unit, AnalysisResult analysis) {
        return generate(unit, List.of(), analysis);
    }

    /**
     * Generates the workflow class.
     *
     * @param imports  imported units whose definitions are merged into the class
     * @param analysis the unit's analysis, which supplies the merged prompts
     * @throws io.agentflow.compiler.error.CodeGenerationException for constructs that cannot be
     *     generated, such as non-agent statements in a parallel block
     * @throws InternalCompilerException for any other generation failure
     */
    public GeneratedWorkflow generate(CompilationUnit unit, List<CompilationUnit> imports, AnalysisResult analysis) {
        long started = System.nanoTime();
        String className = JavaNames.className(unit.fileId());
        SourceMapRegistry sourceMap = new SourceMapRegistry();
        CodeEmitter out = new CodeEmitter(unit.fileId(), sourceMap);
        try {
            new WorkflowClassEmitter(packageName, className, unit, imports, analysis, out).emit();
        } catch (CompilerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InternalCompilerException(
                    Diagnostic.of(
                            ErrorCode.E9999,
                            unit.fileId(),
                            null,
                            Map.of("detail", "code generation failed: " + e.getMessage())),
                    e,
                    CompilerException.Phase.GENERATE);
        }
        GeneratedWorkflow generated = new GeneratedWorkflow(packageName, className, out.code(), sourceMap.toSourceMap());
        LOG.debug(
                "Generated workflow: file={}, class={}, lines={}, mappings={}, duration_us={}",
                unit.fileId(),
                generated.qualifiedName(),
                out.lineCount(),
                sourceMap.size(),
                (System.nanoTime() - started) / 1_000);
        return generated;
    }
}
