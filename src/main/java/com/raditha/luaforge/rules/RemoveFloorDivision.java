package com.raditha.luaforge.rules;

import com.raditha.luaforge.ast.*;
import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites {@code a // b} as {@code math.floor(a / b)}. Floor division compound
 * assignments are turned into plain assignments first.
 */
public class RemoveFloorDivision implements Rule {

    public static final String NAME = "remove_floor_division";

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
                if (statement.getOperator() != CompoundOperator.DOUBLE_SLASH) {
                    return super.visit(statement);
                }
                return desugar.desugar(statement).accept(this);
            }

            @Override
            public Expression visit(BinaryExpression expression) {
                super.visit(expression);
                if (expression.getOperator() != BinaryOperator.DOUBLE_SLASH) {
                    return expression;
                }
                BinaryExpression division = new BinaryExpression(BinaryOperator.SLASH,
                        expression.getLeft(), expression.getRight());
                if (expression.hasTokens()) {
                    division.addToken(expression.getTokens().get(0).withText("/"));
                }
                List<Expression> arguments = new ArrayList<>();
                arguments.add(division);
                return new FunctionCallExpression(
                        new FieldExpression(new Identifier("math"), new Identifier("floor")), null, arguments);
            }
        }.visit(block);
    }
}
