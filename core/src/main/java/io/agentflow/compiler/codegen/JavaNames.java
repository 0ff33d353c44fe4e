package io.agentflow.compiler.codegen;

import java.util.Locale;

/** Java identifiers and literals derived from DSL names and text. */
public final class JavaNames {

    private static final String CLASS_SUFFIX = "Workflow";

    private JavaNames() {}

    /**
     * Class name for a compiled file: the file name without directories and extension, in upper
     * camel case, followed by {@code Workflow} ({@code research.af} becomes
     * {@code ResearchWorkflow}, {@code code-review.af} becomes {@code CodeReviewWorkflow}).
     */
    public static String className(String fileId) {
        String name = fileId;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        int dot = name.indexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        StringBuilder result = new StringBuilder();
        for (String part : name.split("[^A-Za-z0-9]+")) {
            if (!part.isEmpty()) {
                result.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
            }
        }
        if (result.length() == 0 || !Character.isJavaIdentifierStart(result.charAt(0))) {
            result.insert(0, "Anonymous");
        }
        return result + CLASS_SUFFIX;
    }

    public static String flowMethod(String flow) {
        return "flow_" + identifier(flow);
    }

    /** {@code on tool-call} becomes {@code handler_on_tool_call}. */
    public static String handlerMethod(String timing, String event) {
        return "handler_" + identifier(timing) + "_" + identifier(event);
    }

    /** Replaces every character that cannot appear in a Java identifier with {@code _}. */
    public static String identifier(String name) {
        StringBuilder result = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            result.append(Character.isLetterOrDigit(c) || c == '_' ? c : '_');
        }
        return result.toString();
    }

    /** A Java string literal, quotes included; {@code null} becomes the {@code null} literal. */
    public static String literal(String value) {
        if (value == null) {
            return "null";
        }
        StringBuilder result = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"':
                    result.append("\\\"");
                    break;
                case '\\':
                    result.append("\\\\");
                    break;
                case '\n':
                    result.append("\\n");
                    break;
                case '\r':
                    result.append("\\r");
                    break;
                case '\t':
                    result.append("\\t");
                    break;
                default:
                    if (c < 0x20 || c == 0x7f) {
                        result.append(String.format(Locale.ROOT, "\\u%04x", (int) c));
                    } else {
                        result.append(c);
                    }
            }
        }
        return result.append('"').toString();
    }

    /** Text that is safe inside a {@code //} comment: no line breaks, no unicode escapes. */
    public static String commentText(String text) {
        return text.replace('\\', '/').replace('\r', ' ').replace('\n', ' ');
    }
}
