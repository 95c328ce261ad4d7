package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.List;

/**
 * Singleton types: {@code nil}, {@code true}, {@code false} and string literals.
 */
public class LiteralType extends TypeNode {

    private final String text;

    public LiteralType(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    @Override
    public TypeNode accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return List.of();
    }

    @Override
    public LiteralType copy() {
        return new LiteralType(text);
    }
}
