package org.finos.legend.querybuild.plan;

/**
 * A bound value. Rendered as a {@code ?} placeholder.
 *
 * @param value The value to bind (may be null)
 */
public record Parameter(Object value) implements Expression {

    public static Parameter of(Object value) {
        return new Parameter(value);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitParameter(this);
    }

    @Override
    public String toString() {
        return "?(" + value + ")";
    }
}
