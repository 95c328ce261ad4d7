package com.raditha.luaforge.evaluator;

import com.raditha.luaforge.ast.BinaryExpression;
import com.raditha.luaforge.ast.BinaryOperator;
import com.raditha.luaforge.ast.BooleanExpression;
import com.raditha.luaforge.ast.Expression;
import com.raditha.luaforge.ast.NilExpression;
import com.raditha.luaforge.ast.NumberExpression;
import com.raditha.luaforge.ast.ParentheseExpression;
import com.raditha.luaforge.ast.StringExpression;
import com.raditha.luaforge.ast.UnaryExpression;
import com.raditha.luaforge.ast.UnaryOperator;

import java.util.Optional;

/**
 * Writes evaluator values back as expressions.
 * <p>
 * Numbers without a literal form use their canonical expressions: {@code 0/0} for NaN,
 * {@code 1/0} for infinity, a unary minus for negative numbers (and negative zero).
 */
public final class ValueConverter {

    private ValueConverter() {
    }

    /**
     * The expression producing the value, or empty for unknown values, tables and functions.
     */
    public static Optional<Expression> toExpression(LuaValue value) {
        return switch (value.getKind()) {
            case NIL -> Optional.of(new NilExpression());
            case BOOLEAN -> Optional.of(new BooleanExpression(value.asBoolean()));
            case NUMBER -> Optional.of(numberExpression(value.asNumber()));
            case STRING -> Optional.of(StringExpression.of(value.asBytes()));
            default -> Optional.empty();
        };
    }

    public static Expression numberExpression(double value) {
        if (Double.isNaN(value)) {
            return new BinaryExpression(BinaryOperator.SLASH, new NumberExpression(0), new NumberExpression(0));
        }
        if (value == Double.POSITIVE_INFINITY) {
            return infinity();
        }
        if (value == Double.NEGATIVE_INFINITY) {
            return new UnaryExpression(UnaryOperator.MINUS, new ParentheseExpression(infinity()));
        }
        if (value < 0 || (value == 0 && 1 / value < 0)) {
            return new UnaryExpression(UnaryOperator.MINUS, new NumberExpression(-value));
        }
        return new NumberExpression(value);
    }

    private static Expression infinity() {
        return new BinaryExpression(BinaryOperator.SLASH, new NumberExpression(1), new NumberExpression(0));
    }

    /**
     * Whether the expression already is the canonical form of a constant, so that
     * folding it again would rebuild the same tree.
     */
    public static boolean isCanonicalForm(Expression expression) {
        if (expression instanceof UnaryExpression unary && unary.getOperator() == UnaryOperator.MINUS) {
            Expression operand = unary.getOperand();
            if (operand instanceof NumberExpression) {
                return true;
            }
            return operand instanceof ParentheseExpression p && isDivisionOf(p.getInner(), 1);
        }
        return isDivisionOf(expression, 1) || isDivisionOf(expression, 0);
    }

    private static boolean isDivisionOf(Expression expression, double numerator) {
        return expression instanceof BinaryExpression binary
                && binary.getOperator() == BinaryOperator.SLASH
                && binary.getLeft() instanceof NumberExpression left && left.getValue() == numerator
                && binary.getRight() instanceof NumberExpression right && right.getValue() == 0;
    }
}
