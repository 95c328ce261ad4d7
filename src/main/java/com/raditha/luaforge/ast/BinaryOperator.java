package com.raditha.luaforge.ast;

/**
 * Binary operators with their left and right binding priorities.
 */
public enum BinaryOperator {
    OR("or", 1, 1),
    AND("and", 2, 2),
    EQUAL("==", 3, 3),
    NOT_EQUAL("~=", 3, 3),
    LOWER_THAN("<", 3, 3),
    LOWER_OR_EQUAL("<=", 3, 3),
    GREATER_THAN(">", 3, 3),
    GREATER_OR_EQUAL(">=", 3, 3),
    CONCAT("..", 5, 4),
    PLUS("+", 6, 6),
    MINUS("-", 6, 6),
    ASTERISK("*", 7, 7),
    SLASH("/", 7, 7),
    DOUBLE_SLASH("//", 7, 7),
    PERCENT("%", 7, 7),
    CARET("^", 10, 9);

    /** Priority of unary operators, between multiplication and exponentiation */
    public static final int UNARY_PRIORITY = 8;

    private final String symbol;
    private final int leftPriority;
    private final int rightPriority;

    BinaryOperator(String symbol, int leftPriority, int rightPriority) {
        this.symbol = symbol;
        this.leftPriority = leftPriority;
        this.rightPriority = rightPriority;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getLeftPriority() {
        return leftPriority;
    }

    public int getRightPriority() {
        return rightPriority;
    }

    public boolean isRightAssociative() {
        return rightPriority < leftPriority;
    }

    public static BinaryOperator fromSymbol(String symbol) {
        for (BinaryOperator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return operator;
            }
        }
        return null;
    }
}
