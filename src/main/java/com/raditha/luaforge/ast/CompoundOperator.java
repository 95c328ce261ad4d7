package com.raditha.luaforge.ast;

/**
 * Operators of compound assignments such as {@code a += 1}.
 */
public enum CompoundOperator {
    PLUS("+=", BinaryOperator.PLUS),
    MINUS("-=", BinaryOperator.MINUS),
    ASTERISK("*=", BinaryOperator.ASTERISK),
    SLASH("/=", BinaryOperator.SLASH),
    DOUBLE_SLASH("//=", BinaryOperator.DOUBLE_SLASH),
    PERCENT("%=", BinaryOperator.PERCENT),
    CARET("^=", BinaryOperator.CARET),
    CONCAT("..=", BinaryOperator.CONCAT);

    private final String symbol;
    private final BinaryOperator binaryOperator;

    CompoundOperator(String symbol, BinaryOperator binaryOperator) {
        this.symbol = symbol;
        this.binaryOperator = binaryOperator;
    }

    public String getSymbol() {
        return symbol;
    }

    public BinaryOperator getBinaryOperator() {
        return binaryOperator;
    }

    public static CompoundOperator fromSymbol(String symbol) {
        for (CompoundOperator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return operator;
            }
        }
        return null;
    }
}
