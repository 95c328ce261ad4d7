package com.raditha.luaforge.rules;

import com.raditha.luaforge.analysis.Binding;
import com.raditha.luaforge.analysis.ScopeAnalyzer;
import com.raditha.luaforge.analysis.ScopeResolution;
import com.raditha.luaforge.ast.*;
import com.raditha.luaforge.ast.visitor.ModifierVisitor;
import com.raditha.luaforge.evaluator.Evaluator;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes local variables and local functions that are never referenced.
 * <p>
 * A declaration whose variables are all unused disappears when its values are pure;
 * when some values are calls, only the calls are kept. Otherwise only unused
 * variables at the end of the declaration are dropped, so that every remaining
 * variable still receives the same value. Removing a declaration can leave other
 * locals unused, so the rule repeats until nothing changes.
 */
public class RemoveUnusedVariable implements Rule {

    public static final String NAME = "remove_unused_variable";

    private final Evaluator evaluator = new Evaluator();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void process(Block block, RuleContext context) {
        boolean changed = true;
        while (changed) {
            Remover remover = new Remover(ScopeAnalyzer.analyze(block));
            remover.visit(block);
            changed = remover.changed;
        }
    }

    private boolean isUnused(ScopeResolution resolution, Identifier declaration) {
        Binding binding = resolution.declaredBy(declaration);
        return binding != null && !binding.isReferenced();
    }

    private class Remover extends ModifierVisitor {

        private final ScopeResolution resolution;
        private boolean changed;

        Remover(ScopeResolution resolution) {
            this.resolution = resolution;
        }

        @Override
        public Statement visit(LocalFunctionStatement statement) {
            if (isUnused(resolution, statement.getName())) {
                changed = true;
                return null;
            }
            return super.visit(statement);
        }

        @Override
        public Statement visit(LocalAssignStatement statement) {
            super.visit(statement);
            List<TypedIdentifier> variables = statement.getVariables();
            if (variables.stream().anyMatch(variable -> "close".equals(variable.getAttribute()))) {
                return statement;
            }
            if (variables.stream().allMatch(variable -> isUnused(resolution, variable))) {
                return removeDeclaration(statement);
            }
            trimTrailingVariables(statement);
            return statement;
        }

        private Statement removeDeclaration(LocalAssignStatement statement) {
            List<Statement> calls = new ArrayList<>();
            for (Expression value : statement.getValues()) {
                if (!evaluator.hasSideEffects(value)) {
                    continue;
                }
                if (!(value instanceof FunctionCallExpression call)) {
                    return statement;
                }
                calls.add(new CallStatement(call));
            }
            changed = true;
            if (calls.isEmpty()) {
                return null;
            }
            if (calls.size() == 1) {
                return calls.get(0);
            }
            Block block = new Block();
            calls.forEach(block::append);
            return new DoStatement(block);
        }

        private void trimTrailingVariables(LocalAssignStatement statement) {
            List<TypedIdentifier> variables = statement.getVariables();
            List<Expression> values = statement.getValues();
            while (variables.size() > 1 && values.size() <= variables.size()
                    && isUnused(resolution, variables.get(variables.size() - 1))) {
                int last = variables.size() - 1;
                if (values.size() == variables.size()) {
                    if (evaluator.hasSideEffects(values.get(last))) {
                        return;
                    }
                    values.remove(last);
                }
                variables.remove(last);
                changed = true;
            }
        }
    }
}
