package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.List;

/**
 * {@code function a.b:c() end}
 */
public class FunctionStatement extends Statement {

    private FunctionName name;
    private FunctionBody body;

    public FunctionStatement(FunctionName name, FunctionBody body) {
        this.name = name;
        this.body = body;
    }

    public FunctionName getName() {
        return name;
    }

    public void setName(FunctionName name) {
        this.name = name;
    }

    public FunctionBody getBody() {
        return body;
    }

    public void setBody(FunctionBody body) {
        this.body = body;
    }

    @Override
    public Statement accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return children(name, body);
    }

    @Override
    public FunctionStatement copy() {
        return new FunctionStatement(name.copy(), body.copy());
    }
}
