package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.List;

/**
 * {@code typeof(expression)}
 */
public class TypeofType extends TypeNode {

    private Expression expression;

    public TypeofType(Expression expression) {
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    public void setExpression(Expression expression) {
        this.expression = expression;
    }

    @Override
    public TypeNode accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return children(expression);
    }

    @Override
    public TypeofType copy() {
        return new TypeofType(expression.copy());
    }
}
