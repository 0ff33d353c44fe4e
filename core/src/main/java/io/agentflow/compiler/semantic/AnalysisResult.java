package io.agentflow.compiler.semantic;

import io.agentflow.compiler.ast.Declaration;
import io.agentflow.compiler.ast.Expression;
import io.agentflow.compiler.diagnostics.Diagnostic;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of semantic analysis.
 *
 * @param diagnostics errors and warnings in source order
 * @param prompts         prompts after merging repeated declarations, in first-declaration order
 * @param guardrailChecks conditions of {@code block} and {@code warn} that name a
 *                        guardrail rather than a variable of the same name
 */
public record AnalysisResult(
        List<Diagnostic> diagnostics,
        Map<String, Declaration.PromptDef> prompts,
        Set<Expression> guardrailChecks) {

    public AnalysisResult {
        diagnostics = List.copyOf(diagnostics);
        prompts = Collections.unmodifiableMap(new LinkedHashMap<>(prompts));
        guardrailChecks = Set.copyOf(guardrailChecks);
    }

    public AnalysisResult(List<Diagnostic> diagnostics, Map<String, Declaration.PromptDef> prompts) {
        this(diagnostics, prompts, Set.of());
    }

    public boolean isGuardrailCheck(Expression condition) {
        return guardrailChecks.contains(condition);
    }

    /** {@code true} if any diagnostic has error severity. Warnings never block generation. */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }
}
