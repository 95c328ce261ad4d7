package com.raditha.luaforge.rules;

import com.raditha.luaforge.ast.Block;
import com.raditha.luaforge.ast.Node;
import com.raditha.luaforge.ast.visitor.NodeWalker;
import com.raditha.luaforge.model.Token;
import com.raditha.luaforge.model.TokenType;
import com.raditha.luaforge.model.Trivia;
import com.raditha.luaforge.model.TriviaKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Adds a comment at the start or the end of every file.
 * Multi-line text is written as a long comment, anything else as a line comment.
 */
public class AppendTextComment implements Rule {

    public static final String NAME = "append_text_comment";

    public enum Location {
        START,
        END
    }

    private String text = "";
    private Location location = Location.START;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void configure(RuleProperties properties) throws RuleConfigurationException {
        this.text = properties.requireString("text");
        String value = properties.getString("location").orElse("start");
        try {
            this.location = Location.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw properties.invalid("location", "expected 'start' or 'end' but got '" + value + "'");
        }
        properties.requireNoneLeft();
    }

    @Override
    public void process(Block block, RuleContext context) {
        if (text.isEmpty()) {
            return;
        }
        Trivia comment = comment(text);
        if (location == Location.START) {
            prepend(block, comment);
        } else {
            append(block, comment);
        }
    }

    static Trivia comment(String text) {
        if (text.indexOf('\n') < 0) {
            return Trivia.lineComment("--" + text);
        }
        int level = 0;
        while (text.contains("]" + "=".repeat(level) + "]") || text.endsWith("]" + "=".repeat(level))) {
            level++;
        }
        String equals = "=".repeat(level);
        return Trivia.blockComment("--[" + equals + "[" + text + "]" + equals + "]");
    }

    private static void prepend(Block block, Trivia comment) {
        Token first = firstSourceToken(block);
        if (first == null) {
            append(block, comment);
            return;
        }
        List<Trivia> trivia = new ArrayList<>(first.leadingTrivia());
        int index = 0;
        if (!trivia.isEmpty() && trivia.get(0).kind() == TriviaKind.SHEBANG) {
            index = 1;
            if (trivia.size() > 1 && trivia.get(1).kind() == TriviaKind.WHITESPACE) {
                index = 2;
            }
        }
        trivia.add(index, comment);
        trivia.add(index + 1, Trivia.whitespace("\n"));
        Token replacement = first.withLeadingTrivia(trivia);
        if (first == block.getEndOfFile()) {
            block.setEndOfFile(replacement);
        } else {
            Node owner = NodeWalker.findOwner(block, first);
            owner.mapTokens(token -> token == first ? replacement : token);
        }
        int added = comment.lineCount() + 1;
        NodeWalker.mapAllTokens(block, token -> shift(token, added));
    }

    private static Token shift(Token token, int lines) {
        if (token.isSynthesized()) {
            return token;
        }
        return token.withLine(token.line() + lines);
    }

    private static void append(Block block, Trivia comment) {
        Token endOfFile = block.getEndOfFile();
        if (endOfFile == null) {
            endOfFile = Token.synthesized(TokenType.EOF, "");
        }
        List<Trivia> trivia = new ArrayList<>(endOfFile.leadingTrivia());
        int added = comment.lineCount();
        if (!trivia.isEmpty() || !block.isEmpty()) {
            trivia.add(Trivia.whitespace("\n"));
            added++;
        }
        trivia.add(comment);
        block.setEndOfFile(shift(endOfFile, added).withLeadingTrivia(trivia));
    }

    /**
     * The token appearing first in the source, including the end-of-file token of an empty file.
     */
    private static Token firstSourceToken(Block block) {
        Token[] first = new Token[1];
        NodeWalker.walk(block, node -> {
            for (Token token : node.getTokens()) {
                if (!token.isSynthesized() && (first[0] == null || before(token, first[0]))) {
                    first[0] = token;
                }
            }
        });
        Token endOfFile = block.getEndOfFile();
        if (first[0] == null && endOfFile != null && !endOfFile.isSynthesized()) {
            return endOfFile;
        }
        return first[0];
    }

    private static boolean before(Token token, Token other) {
        return token.line() < other.line() || token.line() == other.line() && token.column() < other.column();
    }

    @Override
    public Map<String, Object> serializeToProperties() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("text", text);
        if (location != Location.START) {
            properties.put("location", location.name().toLowerCase(Locale.ROOT));
        }
        return properties;
    }
}
