package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;
import com.raditha.luaforge.model.Token;

import java.util.function.UnaryOperator;

/**
 * Base class of statements. A statement may own the semicolon that followed it.
 */
public abstract class Statement extends Node {

    private Token semicolon;

    /**
     * Dispatch to the matching visit method.
     *
     * @return the replacement statement, or null to remove this statement from its block
     */
    public abstract Statement accept(ModifierVisitor visitor);

    @Override
    public abstract Statement copy();

    public Token getSemicolon() {
        return semicolon;
    }

    public void setSemicolon(Token semicolon) {
        this.semicolon = semicolon;
    }

    @Override
    public void mapTokens(UnaryOperator<Token> mapper) {
        super.mapTokens(mapper);
        if (semicolon != null) {
            semicolon = mapper.apply(semicolon);
        }
    }
}
