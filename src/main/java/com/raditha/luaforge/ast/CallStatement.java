package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.List;

/**
 * A function call used as a statement.
 */
public class CallStatement extends Statement {

    private FunctionCallExpression call;

    public CallStatement(FunctionCallExpression call) {
        this.call = call;
    }

    public FunctionCallExpression getCall() {
        return call;
    }

    public void setCall(FunctionCallExpression call) {
        this.call = call;
    }

    @Override
    public Statement accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return children(call);
    }

    @Override
    public CallStatement copy() {
        return new CallStatement(call.copy());
    }
}
