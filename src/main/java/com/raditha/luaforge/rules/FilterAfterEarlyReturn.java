package com.raditha.luaforge.rules;

import com.raditha.luaforge.ast.Block;
import com.raditha.luaforge.ast.DoStatement;
import com.raditha.luaforge.ast.ReturnStatement;
import com.raditha.luaforge.ast.Statement;
import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.List;

/**
 * Drops the statements following a do block that always returns.
 */
public class FilterAfterEarlyReturn implements Rule {

    public static final String NAME = "filter_after_early_return";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void process(Block block, RuleContext context) {
        new ModifierVisitor() {
            @Override
            public Block visit(Block current) {
                truncateAfterReturn(current);
                return super.visit(current);
            }
        }.visit(block);
    }

    private static void truncateAfterReturn(Block block) {
        List<Statement> statements = block.getStatements();
        for (int i = 0; i < statements.size(); i++) {
            if (alwaysReturns(statements.get(i))) {
                block.truncate(i + 1);
                return;
            }
        }
    }

    private static boolean alwaysReturns(Statement statement) {
        if (statement instanceof DoStatement doStatement) {
            Block inner = doStatement.getBlock();
            if (inner.getLastStatement() instanceof ReturnStatement) {
                return true;
            }
            List<Statement> statements = inner.getStatements();
            return !statements.isEmpty() && alwaysReturns(statements.get(statements.size() - 1))
                    && inner.getLastStatement() == null;
        }
        return false;
    }
}
