package io.agentflow.compiler.report;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentflow.compiler.ast.CompilationUnit;
import io.agentflow.compiler.diagnostics.Diagnostic;
import io.agentflow.compiler.diagnostics.ErrorCode;
import io.agentflow.compiler.model.CompilationResult;
import io.agentflow.compiler.model.CompilationStats;
import io.agentflow.compiler.semantic.AnalysisResult;
import io.agentflow.compiler.semantic.SemanticAnalyzer;
import io.agentflow.compiler.source.SourceFile;
import io.agentflow.compiler.source.SourceSpan;
import io.agentflow.compiler.testkit.DslFixtures;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DiagnosticReporter")
class DiagnosticReporterTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final DiagnosticReporter reporter = new DiagnosticReporter();

    /** Analyzes {@code text} and packages the outcome the way the compiler does. */
    private static CompilationResult result(String text) {
        CompilationUnit unit = DslFixtures.parse(text);
        AnalysisResult analysis = new SemanticAnalyzer(DslFixtures.FILE).analyze(unit);
        return CompilationResult.builder(DslFixtures.FILE)
                .diagnostics(analysis.diagnostics())
                .stats(CompilationStats.of(unit))
                .source(new SourceFile(DslFixtures.FILE, text))
                .build();
    }

    @Nested
    @DisplayName("human format")
    class Human {

        @Test
        @DisplayName("an undefined prompt renders with context lines and a caret under the name")
        void undefinedPrompt() {
            String expected = "error[E0001]: undefined reference to prompt 'missing'\n"
                    + "  --> test.af:4:17\n"
                    + "     |\n"
                    + "   3 | agent researcher:\n"
                    + "   4 |     instruction missing\n"
                    + "     | " + " ".repeat(16) + "^".repeat(7) + "\n"
                    + "   5 | \n"
                    + "     |\n"
                    + "\n"
                    + "Found 1 error and 0 warnings in test.af\n";

            assertThat(reporter.human(result(DslFixtures.UNDEFINED_PROMPT))).isEqualTo(expected);
        }

        @Test
        @DisplayName("line numbers use ASCII digits whatever the default locale")
        void localeIndependentGutter() {
            Locale saved = Locale.getDefault();
            Locale.setDefault(Locale.forLanguageTag("th-TH-u-nu-thai"));
            try {
                assertThat(reporter.human(result(DslFixtures.UNDEFINED_PROMPT)))
                        .contains("   3 | agent researcher:\n")
                        .contains("   4 |     instruction missing\n");
            } finally {
                Locale.setDefault(saved);
            }
        }

        @Test
        @DisplayName("help and secondary labels follow the excerpt")
        void helpAndNotes() {
            String output = reporter.human(result("prompt analyze: \"x\"\n\nagent a:\n    instruction analyse\n"
                    + "\nmodel m = a/b\nmodel m = a/c\n"));

            assertThat(output)
                    .contains("     = help: did you mean 'analyze'?\n")
                    .contains("error[E0003]: duplicate definition of model 'm'\n  --> test.af:7:1\n")
                    .contains("note: first defined here\n  --> test.af:6:1\n")
                    .endsWith("\nFound 2 errors and 0 warnings in test.af\n");
        }

        @Test
        @DisplayName("diagnostics are separated by one blank line")
        void separation() {
            String output = reporter.human(result("flow f:\n    log $a\n    log $b\n"));

            assertThat(output).contains("     |\n\nerror[E0002]: variable '$b' used before definition\n");
        }

        @Test
        @DisplayName("a valid file only prints the summary")
        void validSummary() {
            assertThat(reporter.human(result(DslFixtures.MINIMAL_VALID)))
                    .isEqualTo("test.af is valid (1 model, 1 agent)\n");
        }

        @Test
        @DisplayName("warnings alone keep the file valid")
        void warningsOnly() {
            String output = reporter.human(result("flow f:\n    loop do\n        log 1\n    end\n"));

            assertThat(output)
                    .startsWith("warning[W0001]: loop without bound has no exit path\n")
                    .endsWith("\ntest.af is valid (1 flow)\n");
        }

        @Test
        @DisplayName("a diagnostic without a position has no excerpt")
        void fileLevel() {
            CompilationResult result = CompilationResult.fileError(
                    "gone.af", Diagnostic.withMessage(ErrorCode.E0005, "gone.af", null, "file not found: gone.af"));

            assertThat(reporter.human(result)).isEqualTo(
                    "error[E0005]: file not found: gone.af\n  --> gone.af\n\nFound 1 error and 0 warnings in gone.af\n");
        }

        @Test
        @DisplayName("context lines are configurable")
        void noContext() {
            String output = new DiagnosticReporter(0).human(result(DslFixtures.UNDEFINED_PROMPT));

            assertThat(output).contains("   4 |").doesNotContain("   3 |").doesNotContain("   5 |");
        }

        @Test
        void negativeContextRejected() {
            assertThatThrownBy(() -> new DiagnosticReporter(-1)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("carets keep tabs so they line up with the source")
        void caretWithTabs() {
            assertThat(DiagnosticReporter.caret(new SourceSpan(1, 2, 1, 5), "\t x = 1")).isEqualTo("\t ^^^");
            assertThat(DiagnosticReporter.caret(new SourceSpan(1, 4, 2, 0), "log value")).isEqualTo("    ^^^^^");
        }

        @Test
        void pluralization() {
            assertThat(DiagnosticReporter.validity(new CompilationStats(2, 1, 3, 1, 0, 0, 0)))
                    .isEqualTo("valid (2 models, 1 agent, 3 flows, 1 handler)");
            assertThat(DiagnosticReporter.validity(CompilationStats.empty())).isEqualTo("valid");
        }
    }

    @Nested
    @DisplayName("JSON format")
    class Json {

        @Test
        void undefinedPrompt() throws Exception {
            String output = reporter.render(result(DslFixtures.UNDEFINED_PROMPT), ReportFormat.JSON);
            JsonNode root = JSON.readTree(output);
            JsonNode error = root.path("errors").get(0);

            assertThat(output).startsWith("{\n  \"version\"").endsWith("}\n");
            assertThat(root.path("version").asText()).isEqualTo("1.0");
            assertThat(root.path("file").asText()).isEqualTo("test.af");
            assertThat(root.path("valid").asBoolean()).isFalse();
            assertThat(root.path("warnings")).isEmpty();
            assertThat(error.path("code").asText()).isEqualTo("E0001");
            assertThat(error.path("severity").asText()).isEqualTo("error");
            assertThat(error.path("message").asText()).isEqualTo("undefined reference to prompt 'missing'");
            assertThat(error.path("line").asInt()).isEqualTo(4);
            assertThat(error.path("column").asInt()).isEqualTo(17);
            assertThat(error.path("end_column").asInt()).isEqualTo(24);
            assertThat(error.path("help").isNull()).isTrue();
            assertThat(error.has("internal")).isFalse();
            assertThat(root.path("stats").path("models").asInt()).isEqualTo(1);
            assertThat(root.path("stats").path("agents").asInt()).isEqualTo(1);
        }

        @Test
        @DisplayName("warnings and related locations are kept apart from errors")
        void warningsAndRelated() throws Exception {
            JsonNode root = JSON.readTree(reporter.json(result("""
                    model m = a/b
                    model m = a/c

                    flow f:
                        loop do
                            log 1
                        end
                    """)));

            assertThat(root.path("errors")).hasSize(1);
            assertThat(root.path("warnings")).hasSize(1);
            assertThat(root.path("warnings").get(0).path("code").asText()).isEqualTo("W0001");
            JsonNode related = root.path("errors").get(0).path("related").get(0);
            assertThat(related.path("message").asText()).isEqualTo("first defined here");
            assertThat(related.path("line").asInt()).isEqualTo(1);
        }

        @Test
        @DisplayName("internal errors are flagged")
        void internal() throws Exception {
            CompilationResult result = CompilationResult.builder("x.af")
                    .diagnostic(Diagnostic.of(ErrorCode.E9999, "x.af", null, Map.of("detail", "boom")))
                    .build();

            JsonNode error = JSON.readTree(reporter.json(result)).path("errors").get(0);

            assertThat(error.path("internal").asBoolean()).isTrue();
            assertThat(error.path("line").isNull()).isTrue();
            assertThat(error.path("message").asText()).isEqualTo("internal compiler error: boom");
        }
    }

    @Nested
    @DisplayName("exit status and format parsing")
    class Status {

        @Test
        void exitStatus() {
            CompilationResult valid = result(DslFixtures.MINIMAL_VALID);
            CompilationResult invalid = result(DslFixtures.UNDEFINED_PROMPT);
            CompilationResult missing = CompilationResult.fileError(
                    "gone.af", Diagnostic.withMessage(ErrorCode.E0005, "gone.af", null, "file not found: gone.af"));

            assertThat(ExitStatus.of(valid).code()).isZero();
            assertThat(ExitStatus.of(invalid).code()).isEqualTo(1);
            assertThat(ExitStatus.of(missing).code()).isEqualTo(2);
            assertThat(ExitStatus.of(List.of(valid, invalid))).isEqualTo(ExitStatus.ERRORS);
            assertThat(ExitStatus.of(List.of(missing, invalid, valid))).isEqualTo(ExitStatus.FILE_ERROR);
            assertThat(ExitStatus.of(List.of())).isEqualTo(ExitStatus.VALID);
        }

        @Test
        void parseFormat() {
            assertThat(ReportFormat.parse(" Json ")).isEqualTo(ReportFormat.JSON);
            assertThat(ReportFormat.parse("human")).isEqualTo(ReportFormat.HUMAN);
            assertThatThrownBy(() -> ReportFormat.parse("xml"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Unknown output format 'xml'; expected human or json");
        }
    }
}
