package io.agentflow.compiler.codegen;

import io.agentflow.compiler.ast.Expression;
import io.agentflow.compiler.ast.UnaryOperator;
import io.agentflow.compiler.diagnostics.Diagnostic;
import io.agentflow.compiler.diagnostics.ErrorCode;
import io.agentflow.compiler.error.CompilerException;
import io.agentflow.compiler.error.InternalCompilerException;
import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders expressions as Java expressions over {@code com.fasterxml.jackson.databind.JsonNode}
 * values. {@link #value} yields a {@code JsonNode}, {@link #condition} a Java {@code boolean}.
 * Variables are read through the {@code ctx} parameter of the enclosing method.
 *
 * <p>
 * One instance per generated method: it also hands out the method's temporary local names.
 */
final class ExpressionEmitter implements Expression.Visitor<String> {

    static final String CONTEXT = "ctx";

    private final String fileId;
    private final Deque<String> filterItems = new ArrayDeque<>();
    private int temporaries;

    ExpressionEmitter(String fileId) {
        this.fileId = fileId;
    }

    /** A local name unused in the current method, e.g. {@code outcome3}. */
    String fresh(String prefix) {
        return prefix + (++temporaries);
    }

    String value(Expression expression) {
        return expression == null ? "Values.NULL" : expression.accept(this);
    }

    /** Arguments as {@code List.of(...)}. */
    String arguments(List<Expression> arguments) {
        return arguments.stream().map(this::value).collect(Collectors.joining(", ", "List.of(", ")"));
    }

    /** A Java boolean for a condition; comparisons and logic avoid boxing through {@code Values.bool}. */
    String condition(Expression expression) {
        if (expression instanceof Expression.BinaryOp binary) {
            switch (binary.operator()) {
                case OR:
                    return "(" + condition(binary.left()) + " || " + condition(binary.right()) + ")";
                case AND:
                    return "(" + condition(binary.left()) + " && " + condition(binary.right()) + ")";
                case EQ:
                    return call("Values.eq", binary);
                case NOT_EQ:
                    return "!" + call("Values.eq", binary);
                case LT:
                    return "(" + call("Values.compare", binary) + " < 0)";
                case LT_EQ:
                    return "(" + call("Values.compare", binary) + " <= 0)";
                case GT:
                    return "(" + call("Values.compare", binary) + " > 0)";
                case GT_EQ:
                    return "(" + call("Values.compare", binary) + " >= 0)";
                case MATCHES:
                    return call("Values.normalizedEquals", binary);
                case CONTAINS:
                    return call("Values.contains", binary);
                default:
                    break;
            }
        }
        if (expression instanceof Expression.UnaryOp unary
                && unary.operator() == UnaryOperator.NOT) {
            return "!" + parenthesized(condition(unary.operand()));
        }
        if (expression instanceof Expression.Literal literal && literal.kind() == Expression.Literal.Kind.BOOLEAN) {
            return literal.value();
        }
        return "Values.truthy(" + value(expression) + ")";
    }

    private String call(String method, Expression.BinaryOp binary) {
        return method + "(" + value(binary.left()) + ", " + value(binary.right()) + ")";
    }

    private static String parenthesized(String code) {
        return code.startsWith("(") || code.startsWith("Values.") || code.equals("true") || code.equals("false")
                ? code
                : "(" + code + ")";
    }

    // ── Visitor ──

    @Override
    public String visitVarRef(Expression.VarRef expression) {
        return CONTEXT + ".get(" + JavaNames.literal(expression.name()) + ")";
    }

    @Override
    public String visitLiteral(Expression.Literal expression) {
        switch (expression.kind()) {
            case STRING:
                return "Values.text(" + JavaNames.literal(expression.value()) + ")";
            case NUMBER:
                return number(expression);
            case BOOLEAN:
                return "Values.bool(" + expression.value() + ")";
            case NULL:
                return "Values.NULL";
            default:
                throw internal(expression, "unknown literal kind " + expression.kind());
        }
    }

    private String number(Expression.Literal literal) {
        if (literal.isInteger()) {
            return "Values.number(" + new BigDecimal(literal.value()).longValueExact() + "L)";
        }
        double value;
        try {
            value = new BigDecimal(literal.value()).doubleValue();
        } catch (NumberFormatException e) {
            throw internal(literal, "malformed number literal '" + literal.value() + "'", e);
        }
        if (Double.isInfinite(value)) {
            return "Values.number(Double.POSITIVE_INFINITY)";
        }
        return "Values.number(" + value + ")";
    }

    @Override
    public String visitBinaryOp(Expression.BinaryOp expression) {
        switch (expression.operator()) {
            case ADD:
                return call("Values.add", expression);
            case SUBTRACT:
                return call("Values.subtract", expression);
            case MULTIPLY:
                return call("Values.multiply", expression);
            case DIVIDE:
                return call("Values.divide", expression);
            default:
                return "Values.bool(" + condition(expression) + ")";
        }
    }

    @Override
    public String visitUnaryOp(Expression.UnaryOp expression) {
        switch (expression.operator()) {
            case NOT:
                return "Values.bool(" + condition(expression) + ")";
            case NEGATE:
                return "Values.negate(" + value(expression.operand()) + ")";
            default:
                throw internal(expression, "unknown unary operator " + expression.operator());
        }
    }

    /** Chains of property reads collapse into one {@code Values.path} call. */
    @Override
    public String visitPropertyAccess(Expression.PropertyAccess expression) {
        List<String> path = new ArrayList<>();
        Expression root = expression;
        while (root instanceof Expression.PropertyAccess access) {
            path.add(0, access.property());
            root = access.target();
        }
        String base;
        if (root instanceof Expression.ImplicitProperty implicit) {
            path.add(0, implicit.property());
            base = currentItem(implicit);
        } else {
            base = value(root);
        }
        return "Values.path(" + base + ", "
                + path.stream().map(JavaNames::literal).collect(Collectors.joining(", ")) + ")";
    }

    @Override
    public String visitFunctionCall(Expression.FunctionCall expression) {
        String name = expression.qualifiedName()
                .orElseThrow(() -> internal(expression, "function callee is not a name"));
        return CONTEXT + ".call(" + JavaNames.literal(name) + ", " + arguments(expression.arguments()) + ")";
    }

    @Override
    public String visitListLiteral(Expression.ListLiteral expression) {
        return expression.items().stream().map(this::value).collect(Collectors.joining(", ", "Values.list(", ")"));
    }

    @Override
    public String visitObjectLiteral(Expression.ObjectLiteral expression) {
        return expression.entries().stream()
                .map(entry -> JavaNames.literal(entry.key()) + ", " + value(entry.value()))
                .collect(Collectors.joining(", ", "Values.object(", ")"));
    }

    @Override
    public String visitImplicitProperty(Expression.ImplicitProperty expression) {
        return "Values.path(" + currentItem(expression) + ", " + JavaNames.literal(expression.property()) + ")";
    }

    private String currentItem(Expression.ImplicitProperty expression) {
        String item = filterItems.peek();
        if (item == null) {
            throw internal(expression, "implicit property '." + expression.property() + "' outside of a filter");
        }
        return item;
    }

    /** {@code Values.filter(source, itemN -> condition)}; implicit properties read {@code itemN}. */
    @Override
    public String visitFilter(Expression.FilterExpr expression) {
        String source = value(expression.source());
        String item = fresh("item");
        filterItems.push(item);
        try {
            return "Values.filter(" + source + ", " + item + " -> " + condition(expression.condition()) + ")";
        } finally {
            filterItems.pop();
        }
    }

    private InternalCompilerException internal(Expression expression, String detail) {
        return internal(expression, detail, null);
    }

    private InternalCompilerException internal(Expression expression, String detail, Throwable cause) {
        Diagnostic diagnostic = Diagnostic.of(ErrorCode.E9999, fileId, expression.span(), Map.of("detail", detail));
        return cause == null
                ? new InternalCompilerException(diagnostic, CompilerException.Phase.GENERATE)
                : new InternalCompilerException(diagnostic, cause, CompilerException.Phase.GENERATE);
    }
}
