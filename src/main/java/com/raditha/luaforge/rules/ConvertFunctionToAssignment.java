package com.raditha.luaforge.rules;

import com.raditha.luaforge.ast.*;
import com.raditha.luaforge.ast.visitor.ModifierVisitor;
import com.raditha.luaforge.model.Token;
import com.raditha.luaforge.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites {@code function a.b() end} as {@code a.b = function() end}.
 * Method definitions and plain global names are left alone.
 */
public class ConvertFunctionToAssignment implements Rule {

    public static final String NAME = "convert_function_to_assignment";

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
                if (name.hasMethod() || name.getFields().isEmpty()) {
                    return statement;
                }
                return convert(statement);
            }
        }.visit(block);
    }

    private static Statement convert(FunctionStatement statement) {
        FunctionName name = statement.getName();
        Expression target = name.getRoot();
        for (Identifier field : name.getFields()) {
            target = new FieldExpression(target, field);
        }
        FunctionExpression function = new FunctionExpression(statement.getBody());
        function.setTokens(statement.getTokens());
        List<Expression> variables = new ArrayList<>();
        variables.add(target);
        List<Expression> values = new ArrayList<>();
        values.add(function);
        AssignStatement assign = new AssignStatement(variables, values);
        assign.addToken(Token.synthesized(TokenType.SYMBOL, "="));
        assign.setSemicolon(statement.getSemicolon());
        return assign;
    }
}
