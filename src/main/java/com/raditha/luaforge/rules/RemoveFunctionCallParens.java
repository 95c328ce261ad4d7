package com.raditha.luaforge.rules;

import com.raditha.luaforge.ast.*;
import com.raditha.luaforge.ast.visitor.ModifierVisitor;

/**
 * Writes calls with a single string or table argument without parentheses:
 * {@code f("x")} becomes {@code f "x"}.
 */
public class RemoveFunctionCallParens implements Rule {

    public static final String NAME = "remove_function_call_parens";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void process(Block block, RuleContext context) {
        new ModifierVisitor() {
            @Override
            public Expression visit(FunctionCallExpression expression) {
                super.visit(expression);
                if (expression.getArgumentStyle() != FunctionCallExpression.ArgumentStyle.PARENTHESES
                        || expression.getArguments().size() != 1 || !isSimpleCallee(expression.getPrefix())) {
                    return expression;
                }
                Expression argument = expression.getArguments().get(0);
                if (argument instanceof StringExpression) {
                    expression.setArgumentStyle(FunctionCallExpression.ArgumentStyle.STRING);
                } else if (argument instanceof TableExpression) {
                    expression.setArgumentStyle(FunctionCallExpression.ArgumentStyle.TABLE);
                } else {
                    return expression;
                }
                expression.getTokens().removeIf(token -> token.is("(") || token.is(")"));
                return expression;
            }
        }.visit(block);
    }

    private static boolean isSimpleCallee(Expression prefix) {
        return prefix instanceof Identifier || prefix instanceof FieldExpression
                || prefix instanceof IndexExpression || prefix instanceof FunctionCallExpression;
    }
}
