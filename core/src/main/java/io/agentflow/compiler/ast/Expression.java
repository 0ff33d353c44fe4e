package io.agentflow.compiler.ast;

import io.agentflow.compiler.source.SourceSpan;
import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Expression nodes. The set of variants is closed; analysis and generation dispatch through
 * {@link Visitor}.
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface Expression {

    /** Location in the DSL source, or {@code null} for synthesised nodes. */
    SourceSpan span();

    <R> R accept(Visitor<R> visitor);

    /** One method per expression variant. */
    interface Visitor<R> {

        R visitVarRef(VarRef expression);

        R visitLiteral(Literal expression);

        R visitBinaryOp(BinaryOp expression);

        R visitUnaryOp(UnaryOp expression);

        R visitPropertyAccess(PropertyAccess expression);

        R visitFunctionCall(FunctionCall expression);

        R visitListLiteral(ListLiteral expression);

        R visitObjectLiteral(ObjectLiteral expression);

        R visitImplicitProperty(ImplicitProperty expression);

        R visitFilter(FilterExpr expression);
    }

    // ── Variants ──

    /** A variable read. {@code $name} and a bare {@code name} both produce this node. */
    record VarRef(String name, SourceSpan span) implements Expression {
        public VarRef {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVarRef(this);
        }
    }

    /**
     * A constant. Numbers keep their source spelling; strings hold the unescaped value.
     *
     * @param kind  literal category
     * @param value source value, {@code null} only for {@link Kind#NULL}
     */
    record Literal(Kind kind, String value, SourceSpan span) implements Expression {

        /** Literal category. */
        public enum Kind {
            STRING,
            NUMBER,
            BOOLEAN,
            NULL
        }

        public Literal {
            Objects.requireNonNull(kind, "kind must not be null");
            if (kind != Kind.NULL) {
                Objects.requireNonNull(value, "value must not be null");
            }
        }

        public static Literal string(String value, SourceSpan span) {
            return new Literal(Kind.STRING, value, span);
        }

        /** {@code true} for number literals without fraction or exponent. */
        public boolean isInteger() {
            if (kind != Kind.NUMBER) {
                return false;
            }
            try {
                new BigDecimal(value).longValueExact();
                return value.indexOf('.') < 0 && value.indexOf('e') < 0 && value.indexOf('E') < 0;
            } catch (ArithmeticException | NumberFormatException e) {
                return false;
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    record BinaryOp(BinaryOperator operator, Expression left, Expression right, SourceSpan span)
            implements Expression {
        public BinaryOp {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinaryOp(this);
        }
    }

    record UnaryOp(UnaryOperator operator, Expression operand, SourceSpan span) implements Expression {
        public UnaryOp {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnaryOp(this);
        }
    }

    /** {@code target.property}. */
    record PropertyAccess(Expression target, String property, SourceSpan span) implements Expression {
        public PropertyAccess {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(property, "property must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPropertyAccess(this);
        }
    }

    /** {@code callee(arguments)}; callees are normally dotted library names such as {@code lib.convert}. */
    record FunctionCall(Expression callee, List<Expression> arguments, SourceSpan span) implements Expression {
        public FunctionCall {
            Objects.requireNonNull(callee, "callee must not be null");
            arguments = List.copyOf(arguments);
        }

        /** The dotted name of the callee, or empty when the callee is not a plain name. */
        public Optional<String> qualifiedName() {
            return dottedName(callee);
        }

        private static Optional<String> dottedName(Expression expression) {
            if (expression instanceof VarRef ref) {
                return Optional.of(ref.name());
            }
            if (expression instanceof PropertyAccess access) {
                return dottedName(access.target()).map(prefix -> prefix + "." + access.property());
            }
            return Optional.empty();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionCall(this);
        }
    }

    record ListLiteral(List<Expression> items, SourceSpan span) implements Expression {
        public ListLiteral {
            items = List.copyOf(items);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitListLiteral(this);
        }
    }

    record ObjectLiteral(List<Entry> entries, SourceSpan span) implements Expression {
        public ObjectLiteral {
            entries = List.copyOf(entries);
        }

        /** One {@code key: value} pair. */
        public record Entry(String key, Expression value) {
            public Entry {
                Objects.requireNonNull(key, "key must not be null");
                Objects.requireNonNull(value, "value must not be null");
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitObjectLiteral(this);
        }
    }

    /** {@code .name} inside a filter condition: a property of the element being tested. */
    record ImplicitProperty(String property, SourceSpan span) implements Expression {
        public ImplicitProperty {
            Objects.requireNonNull(property, "property must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitImplicitProperty(this);
        }
    }

    /** {@code filter source where condition}. */
    record FilterExpr(Expression source, Expression condition, SourceSpan span) implements Expression {
        public FilterExpr {
            Objects.requireNonNull(source, "source must not be null");
            Objects.requireNonNull(condition, "condition must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFilter(this);
        }
    }
}
