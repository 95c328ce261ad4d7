package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code A & B}
 */
public class IntersectionType extends TypeNode {

    private final List<TypeNode> types;
    private final boolean leadingSeparator;

    public IntersectionType(List<TypeNode> types, boolean leadingSeparator) {
        this.types = new ArrayList<>(types);
        this.leadingSeparator = leadingSeparator;
    }

    public List<TypeNode> getTypes() {
        return types;
    }

    /**
     * Whether the source placed a separator before the first member.
     */
    public boolean hasLeadingSeparator() {
        return leadingSeparator;
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
    public IntersectionType copy() {
        return new IntersectionType(copyAll(types), leadingSeparator);
    }
}
