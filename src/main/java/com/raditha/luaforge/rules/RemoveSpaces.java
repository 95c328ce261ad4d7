package com.raditha.luaforge.rules;

import com.raditha.luaforge.ast.Block;
import com.raditha.luaforge.ast.visitor.NodeWalker;
import com.raditha.luaforge.model.Token;
import com.raditha.luaforge.model.Trivia;
import com.raditha.luaforge.model.TriviaKind;

import java.util.List;

/**
 * Strips whitespace trivia from every token. Comments are left alone.
 */
public class RemoveSpaces implements Rule {

    public static final String NAME = "remove_spaces";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void process(Block block, RuleContext context) {
        NodeWalker.mapAllTokens(block, RemoveSpaces::strip);
    }

    private static Token strip(Token token) {
        return token.withLeadingTrivia(withoutWhitespace(token.leadingTrivia()))
                .withTrailingTrivia(withoutWhitespace(token.trailingTrivia()));
    }

    private static List<Trivia> withoutWhitespace(List<Trivia> trivia) {
        if (trivia.isEmpty()) {
            return trivia;
        }
        return trivia.stream().filter(t -> t.kind() != TriviaKind.WHITESPACE).toList();
    }
}
