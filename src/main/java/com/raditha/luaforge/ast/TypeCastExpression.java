package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;
import com.raditha.luaforge.model.Token;

import java.util.List;

/**
 * {@code expression :: Type}
 */
public class TypeCastExpression extends Expression {

    private Expression expression;
    private TypeNode type;

    public TypeCastExpression(Expression expression, TypeNode type) {
        this.expression = expression;
        this.type = type;
    }

    public Expression getExpression() {
        return expression;
    }

    public void setExpression(Expression expression) {
        this.expression = expression;
    }

    public TypeNode getType() {
        return type;
    }

    public void setType(TypeNode type) {
        this.type = type;
    }

    @Override
    public Token firstToken() {
        return expression.firstToken();
    }

    @Override
    public Expression accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return children(expression, type);
    }

    @Override
    public TypeCastExpression copy() {
        return new TypeCastExpression(expression.copy(), type.copy());
    }
}
