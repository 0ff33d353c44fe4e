package io.agentflow.compiler.codegen;

import io.agentflow.compiler.sourcemap.SourceMap;
import java.util.Objects;

/**
 * Output of the code generator.
 *
 * @param packageName Java package of the class
 * @param className   simple class name
 * @param source      complete Java source of one compilation unit
 * @param sourceMap   generated line to DSL position mappings
 */
public record GeneratedWorkflow(String packageName, String className, String source, SourceMap sourceMap) {

    public GeneratedWorkflow {
        Objects.requireNonNull(packageName, "packageName must not be null");
        Objects.requireNonNull(className, "className must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(sourceMap, "sourceMap must not be null");
    }

    /** Fully qualified class name. */
    public String qualifiedName() {
        return packageName.isEmpty() ? className : packageName + "." + className;
    }
}
