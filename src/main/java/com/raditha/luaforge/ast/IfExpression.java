package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code if condition then result [elseif ...] else elseResult}
 */
public class IfExpression extends Expression {

    private Expression condition;
    private Expression result;
    private final List<ElseIfExpressionBranch> branches;
    private Expression elseResult;

    public IfExpression(Expression condition, Expression result, List<ElseIfExpressionBranch> branches,
            Expression elseResult) {
        this.condition = condition;
        this.result = result;
        this.branches = new ArrayList<>(branches);
        this.elseResult = elseResult;
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

    public List<ElseIfExpressionBranch> getBranches() {
        return branches;
    }

    public Expression getElseResult() {
        return elseResult;
    }

    public void setElseResult(Expression elseResult) {
        this.elseResult = elseResult;
    }

    @Override
    public Expression accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return children(condition, result, branches, elseResult);
    }

    @Override
    public IfExpression copy() {
        return new IfExpression(condition.copy(), result.copy(), copyAll(branches), elseResult.copy());
    }
}
