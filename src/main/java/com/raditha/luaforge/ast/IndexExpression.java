package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;
import com.raditha.luaforge.model.Token;

import java.util.List;

/**
 * {@code prefix[index]}
 */
public class IndexExpression extends Expression {

    private Expression prefix;
    private Expression index;

    public IndexExpression(Expression prefix, Expression index) {
        this.prefix = prefix;
        this.index = index;
    }

    public Expression getPrefix() {
        return prefix;
    }

    public void setPrefix(Expression prefix) {
        this.prefix = prefix;
    }

    public Expression getIndex() {
        return index;
    }

    public void setIndex(Expression index) {
        this.index = index;
    }

    @Override
    public Token firstToken() {
        return prefix.firstToken();
    }

    @Override
    public Expression accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return children(prefix, index);
    }

    @Override
    public IndexExpression copy() {
        return new IndexExpression(prefix.copy(), index.copy());
    }
}
