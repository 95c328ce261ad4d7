package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.List;

/**
 * {@code local function name() end}. The name is in scope inside the body.
 */
public class LocalFunctionStatement extends Statement {

    private Identifier name;
    private FunctionBody body;

    public LocalFunctionStatement(Identifier name, FunctionBody body) {
        this.name = name;
        this.body = body;
    }

    public Identifier getName() {
        return name;
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
    public LocalFunctionStatement copy() {
        return new LocalFunctionStatement(name.copy(), body.copy());
    }
}
