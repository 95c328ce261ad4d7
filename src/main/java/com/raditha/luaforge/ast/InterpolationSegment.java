package com.raditha.luaforge.ast;

import java.util.List;

/**
 * A piece of an interpolated string: either literal text or an embedded expression.
 */
public class InterpolationSegment extends Node {

    private final String rawText;
    private Expression expression;

    private InterpolationSegment(String rawText, Expression expression) {
        this.rawText = rawText;
        this.expression = expression;
    }

    /**
     * Literal text, as written between backticks (escapes unprocessed).
     */
    public static InterpolationSegment text(String rawText) {
        return new InterpolationSegment(rawText, null);
    }

    public static InterpolationSegment value(Expression expression) {
        return new InterpolationSegment(null, expression);
    }

    public boolean isText() {
        return expression == null;
    }

    public String getRawText() {
        return rawText;
    }

    public Expression getExpression() {
        return expression;
    }

    public void setExpression(Expression expression) {
        if (this.expression == null) {
            throw new AstInvariantException("a text segment cannot hold an expression");
        }
        this.expression = expression;
    }

    @Override
    public List<Node> getChildren() {
        return children(expression);
    }

    @Override
    public InterpolationSegment copy() {
        return new InterpolationSegment(rawText, copyOrNull(expression));
    }
}
