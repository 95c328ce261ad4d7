package com.raditha.luaforge.rules;

import com.raditha.luaforge.ast.Block;
import com.raditha.luaforge.ast.CompoundAssignStatement;
import com.raditha.luaforge.ast.Statement;
import com.raditha.luaforge.ast.visitor.ModifierVisitor;

/**
 * Rewrites compound assignments such as {@code a += 1} as plain assignments.
 */
public class RemoveCompoundAssignment implements Rule {

    public static final String NAME = "remove_compound_assignment";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void process(Block block, RuleContext context) {
        CompoundAssignmentDesugar desugar = new CompoundAssignmentDesugar();
        new ModifierVisitor() {
            @Override
            public Statement visit(CompoundAssignStatement statement) {
                super.visit(statement);
                return desugar.desugar(statement);
            }
        }.visit(block);
    }
}
