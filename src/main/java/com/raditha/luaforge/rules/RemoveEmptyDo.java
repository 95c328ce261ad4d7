package com.raditha.luaforge.rules;

import com.raditha.luaforge.ast.Block;
import com.raditha.luaforge.ast.DoStatement;
import com.raditha.luaforge.ast.Statement;
import com.raditha.luaforge.ast.visitor.ModifierVisitor;

/**
 * Removes {@code do end} blocks with nothing inside, innermost first.
 */
public class RemoveEmptyDo implements Rule {

    public static final String NAME = "remove_empty_do";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void process(Block block, RuleContext context) {
        new ModifierVisitor() {
            @Override
            public Statement visit(DoStatement statement) {
                super.visit(statement);
                return statement.getBlock().isEmpty() ? null : statement;
            }
        }.visit(block);
    }
}
