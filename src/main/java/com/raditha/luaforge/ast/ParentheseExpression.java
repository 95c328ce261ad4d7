package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.List;

/**
 * A parenthesized expression. Parentheses truncate multiple results to one value.
 */
public class ParentheseExpression extends Expression {

    private Expression inner;

    public ParentheseExpression(Expression inner) {
        this.inner = inner;
    }

    public Expression getInner() {
        return inner;
    }

    public void setInner(Expression inner) {
        this.inner = inner;
    }

    @Override
    public Expression accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return children(inner);
    }

    @Override
    public ParentheseExpression copy() {
        return new ParentheseExpression(inner.copy());
    }
}
