package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;
import com.raditha.luaforge.model.Token;

/**
 * Base class of expressions.
 */
public abstract class Expression extends Node {

    /**
     * Dispatch to the matching visit method and return the replacement for this expression.
     */
    public abstract Expression accept(ModifierVisitor visitor);

    @Override
    public abstract Expression copy();

    /**
     * The first source token of this expression, or null when it was synthesized.
     */
    public Token firstToken() {
        return getTokens().isEmpty() ? null : getTokens().get(0);
    }
}
