package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.List;

public class FunctionExpression extends Expression {

    private FunctionBody body;

    public FunctionExpression(FunctionBody body) {
        this.body = body;
    }

    public FunctionBody getBody() {
        return body;
    }

    public void setBody(FunctionBody body) {
        this.body = body;
    }

    @Override
    public Expression accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return children(body);
    }

    @Override
    public FunctionExpression copy() {
        return new FunctionExpression(body.copy());
    }
}
