package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;
import com.raditha.luaforge.model.Token;

import java.util.List;

/**
 * {@code prefix.field}
 */
public class FieldExpression extends Expression {

    private Expression prefix;
    private Identifier field;

    public FieldExpression(Expression prefix, Identifier field) {
        this.prefix = prefix;
        this.field = field;
    }

    public Expression getPrefix() {
        return prefix;
    }

    public void setPrefix(Expression prefix) {
        this.prefix = prefix;
    }

    public Identifier getField() {
        return field;
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
        return children(prefix, field);
    }

    @Override
    public FieldExpression copy() {
        return new FieldExpression(prefix.copy(), field.copy());
    }
}
