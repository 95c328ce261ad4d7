package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code (A, B, ...C)} in return or generic argument position.
 */
public class TypePack extends TypeNode {

    private final List<TypeNode> types;

    public TypePack(List<TypeNode> types) {
        this.types = new ArrayList<>(types);
    }

    public List<TypeNode> getTypes() {
        return types;
    }

    @Override
    public TypeNode accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return children(types);
    }

    @Override
    public TypePack copy() {
        return new TypePack(copyAll(types));
    }
}
