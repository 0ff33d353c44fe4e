package io.agentflow.compiler.model;

import io.agentflow.compiler.ast.CompilationUnit;

/**
 * Definition counts of one compiled file, shown in success summaries and JSON reports. Imported
 * definitions are not counted.
 */
public record CompilationStats(int models, int agents, int flows, int handlers, int schemas, int prompts, int tools) {

    private static final CompilationStats EMPTY = new CompilationStats(0, 0, 0, 0, 0, 0, 0);

    public static CompilationStats empty() {
        return EMPTY;
    }

    /** Counts a unit's declarations; repeated prompt declarations count once. */
    public static CompilationStats of(CompilationUnit unit) {
        long prompts = unit.prompts().stream().map(prompt -> prompt.name()).distinct().count();
        return new CompilationStats(
                unit.models().size(),
                unit.agents().size(),
                unit.flows().size(),
                unit.handlers().size(),
                unit.schemas().size(),
                (int) prompts,
                unit.tools().size());
    }
}
