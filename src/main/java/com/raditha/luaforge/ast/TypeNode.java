package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

/**
 * Base class of Luau type annotations.
 */
public abstract class TypeNode extends Node {

    public abstract TypeNode accept(ModifierVisitor visitor);

    @Override
    public abstract TypeNode copy();
}
