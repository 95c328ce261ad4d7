package com.raditha.luaforge.rules;

import com.raditha.luaforge.ast.*;
import com.raditha.luaforge.ast.visitor.ModifierVisitor;
import com.raditha.luaforge.evaluator.Evaluator;
import com.raditha.luaforge.evaluator.LuaValue;
import com.raditha.luaforge.model.LuaStrings;
import com.raditha.luaforge.model.Token;
import com.raditha.luaforge.model.TokenType;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Rewrites {@code a["b"]} as {@code a.b} and {@code {["b"] = 1}} as {@code {b = 1}} when
 * the key is a string that is a valid identifier.
 */
public class ConvertIndexToField implements Rule {

    public static final String NAME = "convert_index_to_field";

    private final Evaluator evaluator = new Evaluator();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void process(Block block, RuleContext context) {
        new ModifierVisitor() {
            @Override
            public Expression visit(IndexExpression expression) {
                super.visit(expression);
                String name = fieldName(expression.getIndex());
                if (name == null) {
                    return expression;
                }
                List<Token> tokens = expression.getTokens();
                Identifier field = identifier(name, tokens.isEmpty() ? null : tokens.get(0));
                FieldExpression replacement = new FieldExpression(expression.getPrefix(), field);
                if (!tokens.isEmpty()) {
                    replacement.addToken(tokens.get(0).withText("."));
                }
                return replacement;
            }

            @Override
            public Expression visit(TableExpression expression) {
                super.visit(expression);
                List<TableEntry> entries = expression.getEntries();
                for (int i = 0; i < entries.size(); i++) {
                    if (entries.get(i) instanceof TableIndexEntry entry) {
                        String name = fieldName(entry.getKey());
                        if (name != null) {
                            List<Token> tokens = entry.getTokens();
                            Identifier field = identifier(name, tokens.isEmpty() ? null : tokens.get(0));
                            TableFieldEntry replacement = new TableFieldEntry(field, entry.getValue());
                            if (tokens.size() == 3) {
                                replacement.addToken(tokens.get(2));
                            }
                            entries.set(i, replacement);
                        }
                    }
                }
                return expression;
            }
        }.visit(block);
    }

    private String fieldName(Expression key) {
        LuaValue value = evaluator.evaluate(key);
        if (value.getKind() != LuaValue.Kind.STRING || evaluator.hasSideEffects(key)) {
            return null;
        }
        String name = new String(value.asBytes(), StandardCharsets.ISO_8859_1);
        return LuaStrings.isValidIdentifier(name) ? name : null;
    }

    private static Identifier identifier(String name, Token bracket) {
        Identifier identifier = new Identifier(name);
        if (bracket != null) {
            identifier.addToken(new Token(TokenType.NAME, name, List.of(), bracket.trailingTrivia(),
                    bracket.line(), bracket.column()));
        }
        return identifier;
    }
}
