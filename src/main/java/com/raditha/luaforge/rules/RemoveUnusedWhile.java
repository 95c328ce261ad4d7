package com.raditha.luaforge.rules;

import com.raditha.luaforge.ast.Block;
import com.raditha.luaforge.ast.Statement;
import com.raditha.luaforge.ast.WhileStatement;
import com.raditha.luaforge.ast.visitor.ModifierVisitor;
import com.raditha.luaforge.evaluator.Evaluator;

/**
 * Removes while loops whose condition is pure and always false.
 */
public class RemoveUnusedWhile implements Rule {

    public static final String NAME = "remove_unused_while";

    private final Evaluator evaluator = new Evaluator();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void process(Block block, RuleContext context) {
        new ModifierVisitor() {
            @Override
            public Statement visit(WhileStatement statement) {
                if (evaluator.evaluate(statement.getCondition()).isFalsy()
                        && !evaluator.hasSideEffects(statement.getCondition())) {
                    return null;
                }
                return super.visit(statement);
            }
        }.visit(block);
    }
}
