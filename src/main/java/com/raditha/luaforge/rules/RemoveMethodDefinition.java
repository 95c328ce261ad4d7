package com.raditha.luaforge.rules;

import com.raditha.luaforge.ast.Block;
import com.raditha.luaforge.ast.FunctionName;
import com.raditha.luaforge.ast.FunctionStatement;
import com.raditha.luaforge.ast.Statement;
import com.raditha.luaforge.ast.TypedIdentifier;
import com.raditha.luaforge.ast.visitor.ModifierVisitor;
import com.raditha.luaforge.model.Token;

import java.util.List;

/**
 * Turns method definitions {@code function a:b()} into {@code function a.b(self)}.
 */
public class RemoveMethodDefinition implements Rule {

    public static final String NAME = "remove_method_definition";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void process(Block block, RuleContext context) {
        new ModifierVisitor() {
            @Override
            public Statement visit(FunctionStatement statement) {
                super.visit(statement);
                FunctionName name = statement.getName();
                if (name.hasMethod()) {
                    name.getFields().add(name.getMethod());
                    name.setMethod(null);
                    List<Token> tokens = name.getTokens();
                    tokens.replaceAll(token -> token.is(":") ? token.withText(".") : token);
                    statement.getBody().getParameters().add(0, new TypedIdentifier("self"));
                }
                return statement;
            }
        }.visit(block);
    }
}
