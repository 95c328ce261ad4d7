package com.raditha.luaforge.rules;

import com.raditha.luaforge.ast.Block;
import com.raditha.luaforge.ast.Expression;
import com.raditha.luaforge.ast.LocalAssignStatement;
import com.raditha.luaforge.ast.NilExpression;
import com.raditha.luaforge.ast.Statement;
import com.raditha.luaforge.ast.visitor.ModifierVisitor;
import com.raditha.luaforge.evaluator.Evaluator;

import java.util.List;

/**
 * Removes values from local declarations that do not change the result:
 * pure values past the last variable, and trailing {@code nil} values.
 */
public class RemoveNilDeclaration implements Rule {

    public static final String NAME = "remove_nil_declaration";

    private final Evaluator evaluator = new Evaluator();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void process(Block block, RuleContext context) {
        new ModifierVisitor() {
            @Override
            public Statement visit(LocalAssignStatement statement) {
                super.visit(statement);
                trim(statement);
                return statement;
            }
        }.visit(block);
    }

    private void trim(LocalAssignStatement statement) {
        int variables = statement.getVariables().size();
        List<Expression> values = statement.getValues();
        while (values.size() > variables && !evaluator.hasSideEffects(values.get(values.size() - 1))) {
            values.remove(values.size() - 1);
        }
        if (values.size() > variables) {
            return;
        }
        while (!values.isEmpty() && values.get(values.size() - 1) instanceof NilExpression) {
            int last = values.size() - 1;
            if (last > 0 && Evaluator.canReturnMultipleValues(values.get(last - 1))) {
                return;
            }
            values.remove(last);
        }
    }
}
