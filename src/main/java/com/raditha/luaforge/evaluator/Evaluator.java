package com.raditha.luaforge.evaluator;

import com.raditha.luaforge.ast.*;
import com.raditha.luaforge.model.LuaStrings;

import java.util.Arrays;
import java.util.Optional;

/**
 * Static evaluation of expressions.
 * <p>
 * Anything the evaluator cannot prove is reported as {@link LuaValue#UNKNOWN}. Calls,
 * field and index accesses are never evaluated because they may run metamethods.
 * Evaluation is bounded by a recursion limit; deeper expressions are unknown and
 * treated as having side effects.
 */
public class Evaluator {

    public static final int MAX_DEPTH = 256;

    public LuaValue evaluate(Expression expression) {
        return evaluate(expression, 0);
    }

    /**
     * Whether evaluating the expression could have an observable effect, including
     * raising a runtime error.
     */
    public boolean hasSideEffects(Expression expression) {
        return hasSideEffects(expression, 0);
    }

    /**
     * Whether the expression can produce more or fewer than one value when it is the
     * last of an expression list.
     */
    public static boolean canReturnMultipleValues(Expression expression) {
        return expression instanceof FunctionCallExpression
                || expression instanceof VariableArgumentsExpression;
    }

    // ================= evaluation =================

    private LuaValue evaluate(Expression expression, int depth) {
        if (depth > MAX_DEPTH) {
            return LuaValue.UNKNOWN;
        }
        if (expression instanceof NilExpression) {
            return LuaValue.NIL;
        } else if (expression instanceof BooleanExpression b) {
            return LuaValue.of(b.getValue());
        } else if (expression instanceof NumberExpression n) {
            return LuaValue.number(n.getValue());
        } else if (expression instanceof StringExpression s) {
            return LuaValue.string(s.getValue());
        } else if (expression instanceof FunctionExpression) {
            return LuaValue.FUNCTION;
        } else if (expression instanceof TableExpression) {
            return LuaValue.TABLE;
        } else if (expression instanceof ParentheseExpression p) {
            return evaluate(p.getInner(), depth + 1);
        } else if (expression instanceof TypeCastExpression cast) {
            return evaluate(cast.getExpression(), depth + 1);
        } else if (expression instanceof BinaryExpression binary) {
            return evaluateBinary(binary, depth + 1);
        } else if (expression instanceof UnaryExpression unary) {
            return evaluateUnary(unary, depth + 1);
        } else if (expression instanceof IfExpression ifExpression) {
            Expression selected = selectBranch(ifExpression, depth + 1);
            return selected == null ? LuaValue.UNKNOWN : evaluate(selected, depth + 1);
        } else if (expression instanceof InterpolatedStringExpression interpolated) {
            return evaluateInterpolated(interpolated);
        }
        return LuaValue.UNKNOWN;
    }

    /**
     * The result expression an if-expression statically selects, or null when a
     * condition on the way is unknown.
     */
    public Expression selectBranch(IfExpression expression) {
        return selectBranch(expression, 0);
    }

    private Expression selectBranch(IfExpression expression, int depth) {
        Optional<Boolean> condition = evaluate(expression.getCondition(), depth).truthiness();
        if (condition.isEmpty()) {
            return null;
        }
        if (condition.get()) {
            return expression.getResult();
        }
        for (ElseIfExpressionBranch branch : expression.getBranches()) {
            Optional<Boolean> branchCondition = evaluate(branch.getCondition(), depth).truthiness();
            if (branchCondition.isEmpty()) {
                return null;
            }
            if (branchCondition.get()) {
                return branch.getResult();
            }
        }
        return expression.getElseResult();
    }

    private LuaValue evaluateBinary(BinaryExpression expression, int depth) {
        BinaryOperator operator = expression.getOperator();
        LuaValue left = evaluate(expression.getLeft(), depth);
        if (operator == BinaryOperator.AND || operator == BinaryOperator.OR) {
            Optional<Boolean> truthy = left.truthiness();
            if (truthy.isEmpty()) {
                return LuaValue.UNKNOWN;
            }
            boolean keepLeft = operator == BinaryOperator.AND ? !truthy.get() : truthy.get();
            return keepLeft ? left : evaluate(expression.getRight(), depth);
        }
        if (left.isUnknown()) {
            return LuaValue.UNKNOWN;
        }
        LuaValue right = evaluate(expression.getRight(), depth);
        if (right.isUnknown()) {
            return LuaValue.UNKNOWN;
        }
        return switch (operator) {
            case EQUAL -> equal(left, right);
            case NOT_EQUAL -> negate(equal(left, right));
            case LOWER_THAN -> compare(left, right, c -> c < 0);
            case LOWER_OR_EQUAL -> compare(left, right, c -> c <= 0);
            case GREATER_THAN -> compare(left, right, c -> c > 0);
            case GREATER_OR_EQUAL -> compare(left, right, c -> c >= 0);
            case CONCAT -> concat(left, right);
            default -> arithmetic(operator, left, right);
        };
    }

    private static LuaValue equal(LuaValue left, LuaValue right) {
        if (left.getKind() != right.getKind()) {
            return LuaValue.FALSE;
        }
        return switch (left.getKind()) {
            case NIL -> LuaValue.TRUE;
            case BOOLEAN -> LuaValue.of(left.asBoolean() == right.asBoolean());
            case NUMBER -> LuaValue.of(left.asNumber() == right.asNumber());
            case STRING -> LuaValue.of(Arrays.equals(left.asBytes(), right.asBytes()));
            default -> LuaValue.UNKNOWN;
        };
    }

    private static LuaValue negate(LuaValue value) {
        return value.isUnknown() ? value : LuaValue.of(!value.asBoolean());
    }

    private interface ComparisonTest {
        boolean test(int comparison);
    }

    private static LuaValue compare(LuaValue left, LuaValue right, ComparisonTest test) {
        if (left.getKind() == LuaValue.Kind.NUMBER && right.getKind() == LuaValue.Kind.NUMBER) {
            double a = left.asNumber();
            double b = right.asNumber();
            if (Double.isNaN(a) || Double.isNaN(b)) {
                return LuaValue.FALSE;
            }
            return LuaValue.of(test.test(a < b ? -1 : a > b ? 1 : 0));
        }
        if (left.getKind() == LuaValue.Kind.STRING && right.getKind() == LuaValue.Kind.STRING) {
            return LuaValue.of(test.test(Arrays.compareUnsigned(left.asBytes(), right.asBytes())));
        }
        return LuaValue.UNKNOWN;
    }

    private static LuaValue concat(LuaValue left, LuaValue right) {
        Optional<byte[]> a = left.toStringBytes();
        Optional<byte[]> b = right.toStringBytes();
        if (a.isEmpty() || b.isEmpty()) {
            return LuaValue.UNKNOWN;
        }
        byte[] result = Arrays.copyOf(a.get(), a.get().length + b.get().length);
        System.arraycopy(b.get(), 0, result, a.get().length, b.get().length);
        return LuaValue.string(result);
    }

    private static LuaValue arithmetic(BinaryOperator operator, LuaValue left, LuaValue right) {
        Optional<Double> a = left.toNumber();
        Optional<Double> b = right.toNumber();
        if (a.isEmpty() || b.isEmpty()) {
            return LuaValue.UNKNOWN;
        }
        double x = a.get();
        double y = b.get();
        return switch (operator) {
            case PLUS -> LuaValue.number(x + y);
            case MINUS -> LuaValue.number(x - y);
            case ASTERISK -> LuaValue.number(x * y);
            case SLASH -> LuaValue.number(x / y);
            case DOUBLE_SLASH -> LuaValue.number(Math.floor(x / y));
            case PERCENT -> LuaValue.number(x - Math.floor(x / y) * y);
            case CARET -> LuaValue.number(Math.pow(x, y));
            default -> LuaValue.UNKNOWN;
        };
    }

    private LuaValue evaluateUnary(UnaryExpression expression, int depth) {
        LuaValue operand = evaluate(expression.getOperand(), depth);
        return switch (expression.getOperator()) {
            case NOT -> operand.truthiness().map(truthy -> LuaValue.of(!truthy)).orElse(LuaValue.UNKNOWN);
            case MINUS -> operand.toNumber().map(n -> LuaValue.number(-n)).orElse(LuaValue.UNKNOWN);
            case LENGTH -> operand.getKind() == LuaValue.Kind.STRING
                    ? LuaValue.number(operand.asBytes().length) : LuaValue.UNKNOWN;
        };
    }

    private static LuaValue evaluateInterpolated(InterpolatedStringExpression expression) {
        StringBuilder raw = new StringBuilder();
        for (InterpolationSegment segment : expression.getSegments()) {
            if (!segment.isText()) {
                return LuaValue.UNKNOWN;
            }
            raw.append(segment.getRawText());
        }
        return LuaValue.string(LuaStrings.unescape(raw.toString()));
    }

    // ================= side effects =================

    private boolean hasSideEffects(Expression expression, int depth) {
        if (depth > MAX_DEPTH) {
            return true;
        }
        if (expression instanceof NilExpression || expression instanceof BooleanExpression
                || expression instanceof NumberExpression || expression instanceof StringExpression
                || expression instanceof Identifier || expression instanceof FunctionExpression
                || expression instanceof VariableArgumentsExpression) {
            return false;
        } else if (expression instanceof TableExpression table) {
            for (TableEntry entry : table.getEntries()) {
                if (entry instanceof TableIndexEntry indexEntry && hasSideEffects(indexEntry.getKey(), depth + 1)) {
                    return true;
                }
                if (hasSideEffects(entry.getValue(), depth + 1)) {
                    return true;
                }
            }
            return false;
        } else if (expression instanceof ParentheseExpression p) {
            return hasSideEffects(p.getInner(), depth + 1);
        } else if (expression instanceof TypeCastExpression cast) {
            return hasSideEffects(cast.getExpression(), depth + 1);
        } else if (expression instanceof BinaryExpression binary) {
            return binaryHasSideEffects(binary, depth + 1);
        } else if (expression instanceof UnaryExpression unary) {
            if (hasSideEffects(unary.getOperand(), depth + 1)) {
                return true;
            }
            return unary.getOperator() != UnaryOperator.NOT && evaluate(unary, depth).isUnknown();
        } else if (expression instanceof IfExpression ifExpression) {
            if (hasSideEffects(ifExpression.getCondition(), depth + 1)) {
                return true;
            }
            Expression selected = selectBranch(ifExpression, depth + 1);
            if (selected != null) {
                return hasSideEffects(selected, depth + 1);
            }
            return true;
        } else if (expression instanceof InterpolatedStringExpression interpolated) {
            return interpolated.getSegments().stream().anyMatch(segment -> !segment.isText());
        }
        return true;
    }

    private boolean binaryHasSideEffects(BinaryExpression expression, int depth) {
        BinaryOperator operator = expression.getOperator();
        if (hasSideEffects(expression.getLeft(), depth)) {
            return true;
        }
        if (operator == BinaryOperator.AND || operator == BinaryOperator.OR) {
            Optional<Boolean> truthy = evaluate(expression.getLeft(), depth).truthiness();
            if (truthy.isPresent()) {
                boolean shortCircuits = operator == BinaryOperator.AND ? !truthy.get() : truthy.get();
                if (shortCircuits) {
                    return false;
                }
            }
            return hasSideEffects(expression.getRight(), depth);
        }
        if (hasSideEffects(expression.getRight(), depth)) {
            return true;
        }
        if (operator == BinaryOperator.EQUAL || operator == BinaryOperator.NOT_EQUAL) {
            return false;
        }
        return evaluate(expression, depth).isUnknown();
    }
}
