package io.agentflow.compiler.loader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentflow.compiler.diagnostics.ErrorCode;
import io.agentflow.compiler.engine.AgentflowCompiler;
import io.agentflow.compiler.error.WorkflowLoadException;
import io.agentflow.compiler.model.CompilationResult;
import io.agentflow.compiler.sourcemap.SourceMapRegistry;
import io.agentflow.compiler.testkit.DslFixtures;
import io.agentflow.runtime.InMemoryWorkflowContext;
import io.agentflow.runtime.Values;
import io.agentflow.runtime.Workflow;
import io.agentflow.runtime.model.AgentDefinition;
import io.agentflow.runtime.spi.ExecutionBackend;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Compiles generated workflows with javac in memory and runs them against a mocked backend. */
@DisplayName("WorkflowLoader")
class WorkflowLoaderTest {

    private static WorkflowLoader loader;

    private final AgentflowCompiler compiler = new AgentflowCompiler();
    private ExecutionBackend backend;

    @BeforeAll
    static void createLoader() {
        loader = new WorkflowLoader();
    }

    @BeforeEach
    void setUp() {
        backend = mock(ExecutionBackend.class);
    }

    private Workflow load(String text) {
        CompilationResult result = compiler.compile(text, DslFixtures.FILE);
        assertThat(result.errors()).isEmpty();
        return loader.load(result);
    }

    private static JsonNode finding(long confidence) {
        return Values.object("confidence", Values.number(confidence));
    }

    @Test
    @DisplayName("a filter flow keeps the findings at or above the threshold")
    void filterFlow() {
        Workflow workflow = load(DslFixtures.FILTER_FLOW);
        InMemoryWorkflowContext ctx = new InMemoryWorkflowContext(workflow, backend);

        JsonNode findings = Values.list(finding(95), finding(40), finding(80), finding(79), finding(12));
        JsonNode confident = ctx.runFlow("triage", findings);

        assertThat(confident).hasSize(2);
        assertThat(confident.get(0).path("confidence").asLong()).isEqualTo(95);
        assertThat(confident.get(1).path("confidence").asLong()).isEqualTo(80);
        assertThat(workflow.flowNames()).containsExactly("triage");
        verifyNoInteractions(backend);
    }

    @Test
    @DisplayName("a filter nested in a filter condition reads the outer item")
    void nestedFilterFlow() {
        Workflow workflow = load("""
                flow passing $groups:
                    $r = filter $groups where (filter .items where .ok == true) != []
                    return $r
                """);
        InMemoryWorkflowContext ctx = new InMemoryWorkflowContext(workflow, backend);
        JsonNode good = Values.object("name", Values.text("a"), "items",
                Values.list(Values.object("ok", Values.bool(false)), Values.object("ok", Values.bool(true))));
        JsonNode bad = Values.object("name", Values.text("b"), "items",
                Values.list(Values.object("ok", Values.bool(false))));
        JsonNode empty = Values.object("name", Values.text("c"), "items", Values.list());

        JsonNode passing = ctx.runFlow("passing", Values.list(good, bad, empty));

        assertThat(passing).hasSize(1);
        assertThat(passing.get(0).path("name").asText()).isEqualTo("a");
    }

    @Test
    @DisplayName("agents run through the backend with their rendered instruction")
    void agentFlow() {
        Workflow workflow = load(DslFixtures.MINIMAL_VALID + """

                flow research $topic:
                    $result = run agent researcher with $topic
                    log "got $result"
                    return $result
                """);
        when(backend.runAgent(any(AgentDefinition.class), eq("Analyze the following input: climate"), anyList()))
                .thenReturn(Values.text("done"));
        InMemoryWorkflowContext ctx = new InMemoryWorkflowContext(workflow, backend);
        ctx.set("input_prompt", Values.text("climate"));

        JsonNode result = ctx.runFlow("research", Values.text("climate"));

        assertThat(result.asText()).isEqualTo("done");
        assertThat(ctx.logMessages()).containsExactly("got done");
        verify(backend).runAgent(any(AgentDefinition.class), eq("Analyze the following input: climate"),
                eq(List.of(Values.text("climate"))));
    }

    @Test
    @DisplayName("the registry of the loaded class mirrors the declarations")
    void definitions() {
        Workflow workflow = load(DslFixtures.MINIMAL_VALID);

        assertThat(workflow.definitions().sourceFile()).isEqualTo(DslFixtures.FILE);
        assertThat(workflow.definitions().models()).containsOnlyKeys("main");
        assertThat(workflow.definitions().requireAgent("researcher").instruction()).isEqualTo("analyze");
        assertThat(workflow.handle("on", "input", new InMemoryWorkflowContext(workflow, backend)).isNull())
                .isTrue();
    }

    @Test
    @DisplayName("a result without generated code is rejected")
    void failedResult() {
        CompilationResult failed = compiler.compile(DslFixtures.UNDEFINED_PROMPT, DslFixtures.FILE);

        assertThatThrownBy(() -> loader.load(failed)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("javac errors become internal errors pointing back at the workflow source")
    void javacErrors() {
        SourceMapRegistry map = new SourceMapRegistry();
        map.record(3, "broken.af", 7, 4);
        String source = "package p;\n\npublic class Broken extends io.agentflow.runtime.Workflow {\n"
                + "    not java\n}\n";

        assertThatThrownBy(() -> loader.define("broken.af", "p.Broken", source, map.toSourceMap()))
                .isInstanceOf(WorkflowLoadException.class)
                .satisfies(thrown -> {
                    WorkflowLoadException e = (WorkflowLoadException) thrown;
                    assertThat(e.diagnostic().code()).isEqualTo(ErrorCode.E9999);
                    assertThat(e.diagnostic().message())
                            .startsWith("internal compiler error: generated class p.Broken does not compile");
                    assertThat(e.diagnostic().help()).contains("broken.af:7");
                });
    }

    @Test
    @DisplayName("a class that is not a workflow is rejected")
    void notAWorkflow() {
        assertThatThrownBy(() -> loader.define(
                        "plain.af", "p.Plain", "package p;\npublic class Plain {}\n", new SourceMapRegistry().toSourceMap()))
                .isInstanceOf(WorkflowLoadException.class)
                .hasMessageContaining("does not extend io.agentflow.runtime.Workflow");
    }
}
