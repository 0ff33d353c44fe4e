package io.agentflow.compiler.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Root of the AST for one DSL file: the optional version declaration and every top-level
 * declaration in source order.
 *
 * <p>
 * Thread-safe and immutable.
 *
 * @param fileId       the file the unit was parsed from
 * @param version      version from {@code agentflow v1}, or {@code null}
 * @param declarations declarations in source order
 */
public record CompilationUnit(String fileId, String version, List<Declaration> declarations) {

    public CompilationUnit {
        Objects.requireNonNull(fileId, "fileId must not be null");
        declarations = List.copyOf(declarations);
    }

    /** Declarations of one variant, in source order. */
    public <T extends Declaration> List<T> declarations(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (Declaration declaration : declarations) {
            if (type.isInstance(declaration)) {
                result.add(type.cast(declaration));
            }
        }
        return result;
    }

    public List<Declaration.ImportStmt> imports() {
        return declarations(Declaration.ImportStmt.class);
    }

    public List<Declaration.ModelDef> models() {
        return declarations(Declaration.ModelDef.class);
    }

    public List<Declaration.ToolDef> tools() {
        return declarations(Declaration.ToolDef.class);
    }

    public List<Declaration.SchemaDef> schemas() {
        return declarations(Declaration.SchemaDef.class);
    }

    public List<Declaration.PromptDef> prompts() {
        return declarations(Declaration.PromptDef.class);
    }

    public List<Declaration.AgentDef> agents() {
        return declarations(Declaration.AgentDef.class);
    }

    public List<Declaration.FlowDef> flows() {
        return declarations(Declaration.FlowDef.class);
    }

    public List<Declaration.HandlerDef> handlers() {
        return declarations(Declaration.HandlerDef.class);
    }
}
