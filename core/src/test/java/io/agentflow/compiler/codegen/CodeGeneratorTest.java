package io.agentflow.compiler.codegen;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.agentflow.compiler.ast.CompilationUnit;
import io.agentflow.compiler.diagnostics.ErrorCode;
import io.agentflow.compiler.error.CodeGenerationException;
import io.agentflow.compiler.error.CompilerException;
import io.agentflow.compiler.semantic.AnalysisResult;
import io.agentflow.compiler.semantic.SemanticAnalyzer;
import io.agentflow.compiler.sourcemap.SourceMapEntry;
import io.agentflow.compiler.testkit.DslFixtures;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("CodeGenerator")
class CodeGeneratorTest {

    private static final String PACKAGE = "io.agentflow.generated";

    private static final Pattern ORIGIN_COMMENT = Pattern.compile("^\\s*// (\\S+):(\\d+)$");

    private static GeneratedWorkflow generate(String text, String fileId) {
        CompilationUnit unit = DslFixtures.parse(text, fileId);
        AnalysisResult analysis = new SemanticAnalyzer(fileId).analyze(unit);
        assertThat(analysis.hasErrors()).as("analysis errors: %s", analysis.diagnostics()).isFalse();
        return new CodeGenerator(PACKAGE).generate(unit, analysis);
    }

    private static List<String> lines(GeneratedWorkflow workflow) {
        return List.of(workflow.source().split("\n", -1));
    }

    @Nested
    @DisplayName("class layout")
    class Layout {

        @Test
        void namesAndHeader() {
            GeneratedWorkflow workflow = generate(DslFixtures.RESEARCH, "research.af");

            assertThat(workflow.className()).isEqualTo("ResearchWorkflow");
            assertThat(workflow.qualifiedName()).isEqualTo("io.agentflow.generated.ResearchWorkflow");
            assertThat(workflow.source())
                    .startsWith("// Generated by agentflow from research.af. Do not edit.\n")
                    .contains("package io.agentflow.generated;")
                    .contains("public final class ResearchWorkflow extends Workflow {")
                    .contains("public ResearchWorkflow() {")
                    .endsWith("}\n");
        }

        @Test
        @DisplayName("every declaration is registered in the definitions builder")
        void registry() {
            String source = generate(DslFixtures.RESEARCH, "research.af").source();

            assertThat(source)
                    .contains(".model(new ModelDefinition(\"main\", \"anthropic/claude-sonnet\", Map.of()))")
                    .contains("Map.entry(\"options.temperature\", \"0\")")
                    .contains(".tool(new ToolDefinition(\"fetch\", \"python\", \"lib.fetch.run\", Map.ofEntries(")
                    .contains("new FieldDefinition(\"tags\", \"string\", true, false)")
                    .contains(".prompt(new PromptDefinition(\"analyze\", \"Find articles about $topic\", \"fast\", "
                            + "\"Article\", true, null, new PromptDefinition.Escalation(\"~\", \"DONE\")))")
                    .contains(".agent(new AgentDefinition(\"writer\", \"summarize\", null, null, List.of(), List.of(), "
                            + "List.of(), null, null, 120L, null, null))")
                    .contains(".policy(new PolicyDefinition(\"standard\", PolicyDefinition.Kind.RETRY, Map.ofEntries("
                            + "Map.entry(\"times\", \"3\"), Map.entry(\"backoff\", \"exponential\"))))")
                    .contains(".policy(new PolicyDefinition(\"quick\", PolicyDefinition.Kind.TIMEOUT, Map.ofEntries("
                            + "Map.entry(\"seconds\", \"30\"))))")
                    .contains(".flow(new FlowDefinition(\"research\", List.of(\"topic\")))")
                    .contains(".handler(new HandlerDefinition(\"on\", \"input\"))")
                    .contains(".importRef(\"search_tools from pypi:agentflow-tools\")");
        }

        @Test
        @DisplayName("flows and handlers are reachable through the dispatchers")
        void dispatchers() {
            String source = generate(DslFixtures.RESEARCH, "research.af").source();

            assertThat(source)
                    .contains("case \"research\":")
                    .contains("return flow_research(ctx);")
                    .contains("private JsonNode flow_review(WorkflowContext ctx) {")
                    .contains("throw new UnknownDefinitionException(\"flow\", name);")
                    .contains("case \"after output\":")
                    .contains("return handler_after_output(ctx);")
                    .contains("private JsonNode handler_on_start(WorkflowContext ctx) {");
        }

        @Test
        @DisplayName("the same input always yields the same output")
        void deterministic() {
            GeneratedWorkflow first = generate(DslFixtures.RESEARCH, "research.af");
            GeneratedWorkflow second = generate(DslFixtures.RESEARCH, "research.af");

            assertThat(second).isEqualTo(first);
        }
    }

    @Nested
    @DisplayName("statements")
    class Statements {

        @Test
        @DisplayName("filter compiles to a lambda over a fresh item variable")
        void filter() {
            String source = generate(DslFixtures.FILTER_FLOW, DslFixtures.FILE).source();

            assertThat(source)
                    .contains("ctx.set(\"confident\", Values.filter(ctx.get(\"findings\"), item1 -> "
                            + "(Values.compare(Values.path(item1, \"confidence\"), Values.number(80L)) >= 0)));")
                    .contains("return ctx.get(\"confident\");");
        }

        @Test
        void loops() {
            String source = generate(
                            "flow f $x:\n    loop max 3 do\n        log $x\n    end\n"
                                    + "    loop do\n        if $x:\n            return $x\n    end\n",
                            DslFixtures.FILE)
                    .source();

            assertThat(source)
                    .contains("for (long iteration1 = 0; iteration1 < 3L; iteration1++) {")
                    .contains("while (ctx.active()) {")
                    .contains("ctx.log(Values.display(ctx.get(\"x\")));");
        }

        @Test
        @DisplayName("escalation handlers branch on the agent outcome")
        void escalationHandler() {
            String source = generate(DslFixtures.RESEARCH, "research.af").source();

            assertThat(source)
                    .contains("AgentOutcome outcome")
                    .contains(".runAgentWithEscalation(\"writer\", List.of(ctx.get(\"draft\")));")
                    .contains(".escalated()) {");
        }

        @Test
        @DisplayName("parallel agent runs become one runParallel call")
        void parallel() {
            String source = generate(DslFixtures.RESEARCH, "research.af").source();

            assertThat(source)
                    .contains(" = ctx.runParallel(List.of(")
                    .contains("new AgentInvocation(\"researcher\", List.of(ctx.get(\"draft\"))),")
                    .contains("new AgentInvocation(\"writer\", List.of(ctx.get(\"draft\")))));")
                    .containsPattern("ctx\\.set\\(\"b\", results\\d+\\.get\\(1\\)\\);");
        }

        @Test
        @DisplayName("statements after a return are not emitted")
        void unreachable() {
            String source = generate("flow f:\n    return 1\n    log \"never\"\n", DslFixtures.FILE).source();

            assertThat(source).doesNotContain("never");
            assertThat(source).contains("return Values.number(1L);");
        }

        @Test
        @DisplayName("string messages interpolate variables at run time")
        void interpolation() {
            String source = generate("flow f $name:\n    notify \"hello $name\"\n    log \"plain\"\n", DslFixtures.FILE)
                    .source();

            assertThat(source)
                    .contains("ctx.notify(ctx.interpolate(\"hello $name\"));")
                    .contains("ctx.log(\"plain\");");
        }

        @Test
        void guardrails() {
            String source = generate(DslFixtures.RESEARCH, "research.af").source();

            assertThat(source)
                    .contains("ctx.mask(\"pii\");")
                    .contains("if (ctx.guardrail(\"jailbreak\")) {")
                    .contains("ctx.block(\"guardrail 'jailbreak' triggered\");")
                    .contains("ctx.retryWith(Values.text(\"try again\"));");
        }

        @Test
        @DisplayName("a guardrail name shadowed by a variable is an ordinary condition")
        void shadowedGuardrail() {
            String source = generate("on input do\n    $jailbreak = false\n    block if jailbreak\nend\n", DslFixtures.FILE)
                    .source();

            assertThat(source)
                    .contains("if (Values.truthy(ctx.get(\"jailbreak\"))) {")
                    .contains("ctx.block(\"condition at test.af:3 matched\");")
                    .doesNotContain("ctx.guardrail(");
        }

        @Test
        @DisplayName("a non-agent statement in a parallel block is E0012")
        void parallelLog() {
            String text = "flow f:\n    parallel do\n        log \"x\"\n    end\n";
            CompilationUnit unit = DslFixtures.parse(text);
            AnalysisResult analysis = new SemanticAnalyzer(DslFixtures.FILE).analyze(unit);

            assertThatThrownBy(() -> new CodeGenerator(PACKAGE).generate(unit, analysis))
                    .isInstanceOf(CodeGenerationException.class)
                    .satisfies(thrown -> {
                        CodeGenerationException e = (CodeGenerationException) thrown;
                        assertThat(e.diagnostic().code()).isEqualTo(ErrorCode.E0012);
                        assertThat(e.getMessage()).isEqualTo("statement not allowed in parallel block: 'log'");
                        assertThat(e.diagnostic().line()).isEqualTo(3);
                        assertThat(e.phase()).isEqualTo(CompilerException.Phase.GENERATE);
                    });
        }

        @Test
        void parallelEscalationHandler() {
            String text = """
                    prompt p: "x"

                    agent a:
                        instruction p

                    flow f:
                        parallel do
                            $r = run agent a with 1, on escalate abort
                        end
                    """;
            CompilationUnit unit = DslFixtures.parse(text);
            AnalysisResult analysis = new SemanticAnalyzer(DslFixtures.FILE).analyze(unit);

            assertThatThrownBy(() -> new CodeGenerator(PACKAGE).generate(unit, analysis))
                    .isInstanceOf(CodeGenerationException.class)
                    .hasMessage("statement not allowed in parallel block: 'run agent' with escalation handler");
        }
    }

    @Nested
    @DisplayName("source mapping")
    class Mapping {

        @Test
        @DisplayName("every origin comment and the line after it map to the commented DSL line")
        void commentsAgreeWithMap() {
            GeneratedWorkflow workflow = generate(DslFixtures.RESEARCH, "research.af");
            List<String> lines = lines(workflow);
            int comments = 0;

            for (int i = 0; i < lines.size(); i++) {
                Matcher matcher = ORIGIN_COMMENT.matcher(lines.get(i));
                if (!matcher.matches()) {
                    continue;
                }
                comments++;
                int dslLine = Integer.parseInt(matcher.group(2));
                assertThat(workflow.sourceMap().resolve(i + 1)).map(SourceMapEntry::originalLine).contains(dslLine);
                assertThat(workflow.sourceMap().resolve(i + 2)).map(SourceMapEntry::originalLine).contains(dslLine);
            }
            assertThat(comments).isGreaterThan(20);
        }

        @Test
        @DisplayName("a DSL statement maps back to the Java that implements it")
        void reverseLookup() {
            GeneratedWorkflow workflow = generate(DslFixtures.FILTER_FLOW, DslFixtures.FILE);
            List<String> lines = lines(workflow);

            int generatedLine = workflow.sourceMap().reverseLookup(DslFixtures.FILE, 4, 4).orElseThrow();

            assertThat(lines.get(generatedLine - 1).strip()).isEqualTo("// test.af:4");
            assertThat(lines.get(generatedLine)).contains("ctx.set(\"confident\"");
        }

        @Test
        @DisplayName("a position inside a statement maps to that statement")
        void positionInsideStatement() {
            GeneratedWorkflow workflow = generate(DslFixtures.FILTER_FLOW, DslFixtures.FILE);

            assertThat(workflow.sourceMap().reverseLookup(DslFixtures.FILE, 4, 30))
                    .isEqualTo(workflow.sourceMap().reverseLookup(DslFixtures.FILE, 4, 4));
        }

        @Test
        @DisplayName("imported declarations map to the file they were written in")
        void importedFile() {
            CompilationUnit shared = DslFixtures.parse("flow helper:\n    return 1\n", "shared.af");
            CompilationUnit main = DslFixtures.parse("import \"./shared.af\"\n\nflow f:\n    run helper\n", "main.af");
            AnalysisResult analysis = new SemanticAnalyzer("main.af").analyze(main, List.of(shared));

            GeneratedWorkflow workflow = new CodeGenerator(PACKAGE).generate(main, List.of(shared), analysis);

            assertThat(workflow.source()).contains("// shared.af:2").contains("private JsonNode flow_helper(");
            assertThat(workflow.sourceMap().entries()).extracting(SourceMapEntry::file).contains("shared.af", "main.af");
            assertThat(workflow.sourceMap().reverseLookup("shared.af", 2, 4)).isPresent();
        }
    }

    @Nested
    @DisplayName("JavaNames")
    class Names {

        @Test
        void classNames() {
            assertThat(JavaNames.className("code-review.af")).isEqualTo("CodeReviewWorkflow");
            assertThat(JavaNames.className("flows/research.af")).isEqualTo("ResearchWorkflow");
            assertThat(JavaNames.className("1st.af")).isEqualTo("Anonymous1stWorkflow");
        }

        @Test
        void methodNames() {
            assertThat(JavaNames.flowMethod("triage")).isEqualTo("flow_triage");
            assertThat(JavaNames.handlerMethod("on", "tool-call")).isEqualTo("handler_on_tool_call");
        }

        @Test
        void literals() {
            assertThat(JavaNames.literal("a \"b\"\n\\")).isEqualTo("\"a \\\"b\\\"\\n\\\\\"");
            assertThat(JavaNames.literal("\u0001")).isEqualTo("\"\\u0001\"");
            assertThat(JavaNames.literal(null)).isEqualTo("null");
        }
    }
}
