package com.raditha.luaforge.rules;

import com.raditha.luaforge.ast.*;
import com.raditha.luaforge.ast.visitor.ModifierVisitor;
import com.raditha.luaforge.evaluator.Evaluator;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites if-expressions with {@code and}/{@code or}. When the selected value may be
 * falsy it is boxed in a table: {@code (c and {a} or {b})[1]}.
 */
public class RemoveIfExpression implements Rule {

    public static final String NAME = "remove_if_expression";

    private final Evaluator evaluator = new Evaluator();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void process(Block block, RuleContext context) {
        new ModifierVisitor() {
            @Override
            public Expression visit(IfExpression expression) {
                super.visit(expression);
                return convert(expression.getCondition(), expression.getResult(),
                        expression.getBranches(), 0, expression.getElseResult());
            }
        }.visit(block);
    }

    private Expression convert(Expression condition, Expression result, List<ElseIfExpressionBranch> branches,
                               int next, Expression elseResult) {
        Expression otherwise = next < branches.size()
                ? convert(branches.get(next).getCondition(), branches.get(next).getResult(), branches, next + 1, elseResult)
                : elseResult;
        if (evaluator.evaluate(result).isTruthy()) {
            return new BinaryExpression(BinaryOperator.OR,
                    new BinaryExpression(BinaryOperator.AND, condition, result), otherwise);
        }
        Expression selection = new BinaryExpression(BinaryOperator.OR,
                new BinaryExpression(BinaryOperator.AND, condition, box(result)), box(otherwise));
        return new IndexExpression(new ParentheseExpression(selection), new NumberExpression("1"));
    }

    private static TableExpression box(Expression value) {
        List<TableEntry> entries = new ArrayList<>();
        entries.add(new TableValueEntry(value));
        return new TableExpression(entries);
    }
}
