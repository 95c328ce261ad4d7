package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;
import com.raditha.luaforge.model.Token;

import java.util.List;

public class BinaryExpression extends Expression {

    private BinaryOperator operator;
    private Expression left;
    private Expression right;

    public BinaryExpression(BinaryOperator operator, Expression left, Expression right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public void setOperator(BinaryOperator operator) {
        this.operator = operator;
    }

    public Expression getLeft() {
        return left;
    }

    public void setLeft(Expression left) {
        this.left = left;
    }

    public Expression getRight() {
        return right;
    }

    public void setRight(Expression right) {
        this.right = right;
    }

    @Override
    public Token firstToken() {
        return left.firstToken();
    }

    @Override
    public Expression accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return children(left, right);
    }

    @Override
    public BinaryExpression copy() {
        return new BinaryExpression(operator, left.copy(), right.copy());
    }
}
