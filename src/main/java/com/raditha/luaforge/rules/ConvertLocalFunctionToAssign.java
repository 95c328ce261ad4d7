package com.raditha.luaforge.rules;

import com.raditha.luaforge.analysis.Binding;
import com.raditha.luaforge.analysis.ScopeAnalyzer;
import com.raditha.luaforge.analysis.ScopeResolution;
import com.raditha.luaforge.ast.*;
import com.raditha.luaforge.ast.visitor.ModifierVisitor;
import com.raditha.luaforge.ast.visitor.NodeWalker;
import com.raditha.luaforge.model.Token;
import com.raditha.luaforge.model.TokenType;

import java.util.List;

/**
 * Rewrites {@code local function f() end} as {@code local f = function() end} when the
 * function does not refer to itself.
 */
public class ConvertLocalFunctionToAssign implements Rule {

    public static final String NAME = "convert_local_function_to_assign";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void process(Block block, RuleContext context) {
        ScopeResolution resolution = ScopeAnalyzer.analyze(block);
        new ModifierVisitor() {
            @Override
            public Statement visit(LocalFunctionStatement statement) {
                super.visit(statement);
                Binding binding = resolution.declaredBy(statement.getName());
                if (binding == null || isRecursive(binding, statement.getBody())) {
                    return statement;
                }
                return convert(statement);
            }
        }.visit(block);
    }

    private static boolean isRecursive(Binding binding, FunctionBody body) {
        for (Binding.Reference reference : binding.getReferences()) {
            if (NodeWalker.contains(body, reference.identifier())) {
                return true;
            }
        }
        return false;
    }

    private static Statement convert(LocalFunctionStatement statement) {
        Identifier name = statement.getName();
        TypedIdentifier variable = new TypedIdentifier(name.getName());
        variable.setTokens(name.getTokens());
        FunctionExpression function = new FunctionExpression(statement.getBody());
        List<Token> tokens = statement.getTokens();
        LocalAssignStatement assign = new LocalAssignStatement(List.of(variable), List.of(function));
        if (!tokens.isEmpty()) {
            assign.addToken(tokens.get(0));
            assign.addToken(Token.synthesized(TokenType.SYMBOL, "="));
        }
        if (tokens.size() > 1) {
            function.addToken(tokens.get(1));
        }
        assign.setSemicolon(statement.getSemicolon());
        return assign;
    }
}
