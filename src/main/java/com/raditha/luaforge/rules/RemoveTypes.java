package com.raditha.luaforge.rules;

import com.raditha.luaforge.ast.*;
import com.raditha.luaforge.ast.visitor.ModifierVisitor;
import com.raditha.luaforge.evaluator.Evaluator;

/**
 * Erases Luau type information: annotations, generic parameters, casts and type
 * declarations.
 */
public class RemoveTypes implements Rule {

    public static final String NAME = "remove_types";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void process(Block block, RuleContext context) {
        new ModifierVisitor() {
            @Override
            public Statement visit(TypeDeclarationStatement statement) {
                return null;
            }

            @Override
            public TypedIdentifier visit(TypedIdentifier identifier) {
                if (identifier.getType() != null) {
                    identifier.setType(null);
                    identifier.getTokens().removeIf(token -> token.is(":"));
                }
                return identifier;
            }

            @Override
            public FunctionBody visit(FunctionBody body) {
                body.getGenericParameters().clear();
                body.setVariadicType(null);
                body.setReturnType(null);
                body.getTokens().removeIf(token -> token.is(":") || token.is("<") || token.is(">"));
                return super.visit(body);
            }

            @Override
            public Expression visit(TypeCastExpression expression) {
                Expression inner = visitExpression(expression.getExpression());
                if (Evaluator.canReturnMultipleValues(inner)) {
                    return new ParentheseExpression(inner);
                }
                return inner;
            }
        }.visit(block);
    }
}
