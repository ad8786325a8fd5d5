package org.finos.legend.querybuild.compiler;

import org.finos.legend.querybuild.plan.BetweenExpression;
import org.finos.legend.querybuild.plan.ColumnReference;
import org.finos.legend.querybuild.plan.ComparisonExpression;
import org.finos.legend.querybuild.plan.ComparisonExpression.ComparisonOperator;
import org.finos.legend.querybuild.plan.Expression;
import org.finos.legend.querybuild.plan.InExpression;
import org.finos.legend.querybuild.plan.Parameter;
import org.finos.legend.querybuild.plan.SqlFunctionCall;
import org.finos.legend.querybuild.request.Operator;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Translates a filter operator and its string operand into a predicate over a
 * catalog-validated column.
 *
 * Operands always become bound parameters. With case-insensitive matching the
 * column is wrapped in {@code LOWER(...)} and the operand lower-cased, except
 * for the null checks and the array operators.
 *
 * Multi-valued operands are comma-separated: {@code IN} and {@code NOT_IN}
 * keep empty segments as empty strings, and {@code BETWEEN} needs exactly two
 * segments or produces no predicate at all.
 */
public final class OperatorTranslator {

    private static final String VALUE_SEPARATOR = ",";

    /**
     * @param column  The qualified column the predicate tests
     * @param op      The operator
     * @param value   The raw operand text
     * @param noCase  Compare case-insensitively
     * @return The predicate, or empty when the operand does not form one
     * @throws UnsupportedFeatureException for {@link Operator#UNKNOWN}
     */
    public Optional<Expression> translate(ColumnReference column, Operator op, String value, boolean noCase) {
        Objects.requireNonNull(column, "Column cannot be null");
        Objects.requireNonNull(op, "Operator cannot be null");
        String raw = value == null ? "" : value;

        boolean lowered = noCase && appliesCaseFolding(op);
        Expression field = lowered ? SqlFunctionCall.lower(column) : column;
        String operand = lowered ? raw.toLowerCase(Locale.ROOT) : raw;

        Expression predicate = switch (op) {
            case EQ -> compare(field, ComparisonOperator.EQUALS, operand);
            case NE -> compare(field, ComparisonOperator.NOT_EQUALS, operand);
            case GT -> compare(field, ComparisonOperator.GREATER_THAN, operand);
            case GE -> compare(field, ComparisonOperator.GREATER_THAN_OR_EQUALS, operand);
            case LT -> compare(field, ComparisonOperator.LESS_THAN, operand);
            case LE -> compare(field, ComparisonOperator.LESS_THAN_OR_EQUALS, operand);
            case LIKE, CONTAINS -> compare(field, ComparisonOperator.LIKE, "%" + operand + "%");
            case STARTS_WITH -> compare(field, ComparisonOperator.LIKE, operand + "%");
            case ENDS_WITH -> compare(field, ComparisonOperator.LIKE, "%" + operand);
            case NOT_LIKE -> compare(field, ComparisonOperator.NOT_LIKE, "%" + operand + "%");
            case IN -> InExpression.of(field, splitParameters(operand));
            case NOT_IN -> InExpression.notIn(field, splitParameters(operand));
            case BETWEEN -> between(field, operand);
            case IS_NULL -> ComparisonExpression.isNull(field);
            case NOT_NULL -> ComparisonExpression.isNotNull(field);
            case REGEXP -> compare(field, ComparisonOperator.REGEXP, operand);
            case NOT_REGEXP -> compare(field, ComparisonOperator.NOT_REGEXP, operand);
            case OVERLAP -> compare(field, ComparisonOperator.ARRAY_OVERLAP, operand);
            case ARRAY_CONTAINS -> compare(field, ComparisonOperator.ARRAY_CONTAINS, operand);
            case ARRAY_CONTAINED -> compare(field, ComparisonOperator.ARRAY_CONTAINED_BY, operand);
            case UNKNOWN -> throw new UnsupportedFeatureException("unsupported operator: " + op.label());
        };
        return Optional.ofNullable(predicate);
    }

    private static boolean appliesCaseFolding(Operator op) {
        return switch (op) {
            case IS_NULL, NOT_NULL, OVERLAP, ARRAY_CONTAINS, ARRAY_CONTAINED -> false;
            default -> true;
        };
    }

    private static Expression compare(Expression field, ComparisonOperator operator, String operand) {
        return ComparisonExpression.of(field, operator, Parameter.of(operand));
    }

    /**
     * @return The range predicate, or null unless there are exactly two bounds
     */
    private static Expression between(Expression field, String operand) {
        String[] bounds = operand.split(VALUE_SEPARATOR, -1);
        if (bounds.length != 2) {
            return null;
        }
        return new BetweenExpression(field, Parameter.of(bounds[0]), Parameter.of(bounds[1]));
    }

    private static List<Expression> splitParameters(String operand) {
        List<Expression> values = new ArrayList<>();
        for (String segment : operand.split(VALUE_SEPARATOR, -1)) {
            values.add(Parameter.of(segment));
        }
        return values;
    }
}
