package com.raditha.luaforge.ast;

import java.util.List;

/**
 * {@code elseif condition then result} inside an if expression.
 */
public class ElseIfExpressionBranch extends Node {

    private Expression condition;
    private Expression result;

    public ElseIfExpressionBranch(Expression condition, Expression result) {
        this.condition = condition;
        this.result = result;
    }

    public Expression getCondition() {
        return condition;
    }

    public void setCondition(Expression condition) {
        this.condition = condition;
    }

    public Expression getResult() {
        return result;
    }

    public void setResult(Expression result) {
        this.result = result;
    }

    @Override
    public List<Node> getChildren() {
        return children(condition, result);
    }

    @Override
    public ElseIfExpressionBranch copy() {
        return new ElseIfExpressionBranch(condition.copy(), result.copy());
    }
}
