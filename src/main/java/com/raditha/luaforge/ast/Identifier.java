package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.List;

/**
 * A name. Used for variable references in expression position and for plain
 * names such as fields, methods and type names.
 */
public class Identifier extends Expression {

    private String name;

    public Identifier(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    @Override
    public Expression accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return List.of();
    }

    @Override
    public Identifier copy() {
        return new Identifier(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
