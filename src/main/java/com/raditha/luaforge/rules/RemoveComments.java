package com.raditha.luaforge.rules;

import com.raditha.luaforge.ast.Block;
import com.raditha.luaforge.ast.visitor.NodeWalker;
import com.raditha.luaforge.model.Token;
import com.raditha.luaforge.model.Trivia;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Strips comment trivia, except comments matching one of the {@code except} patterns.
 */
public class RemoveComments implements Rule {

    public static final String NAME = "remove_comments";

    private List<Pattern> except = List.of();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void configure(RuleProperties properties) throws RuleConfigurationException {
        List<Pattern> patterns = new ArrayList<>();
        for (String regex : properties.getStringList("except")) {
            try {
                patterns.add(Pattern.compile(regex));
            } catch (PatternSyntaxException e) {
                throw properties.invalid("except", "invalid pattern '" + regex + "': " + e.getDescription());
            }
        }
        properties.requireNoneLeft();
        this.except = List.copyOf(patterns);
    }

    @Override
    public void process(Block block, RuleContext context) {
        NodeWalker.mapAllTokens(block, this::strip);
    }

    private Token strip(Token token) {
        return token.withLeadingTrivia(filter(token.leadingTrivia()))
                .withTrailingTrivia(filter(token.trailingTrivia()));
    }

    private List<Trivia> filter(List<Trivia> trivia) {
        if (trivia.isEmpty()) {
            return trivia;
        }
        return trivia.stream().filter(this::keep).toList();
    }

    private boolean keep(Trivia trivia) {
        if (!trivia.kind().isComment()) {
            return true;
        }
        return except.stream().anyMatch(pattern -> pattern.matcher(trivia.text()).find());
    }

    @Override
    public Map<String, Object> serializeToProperties() {
        Map<String, Object> properties = new LinkedHashMap<>();
        if (!except.isEmpty()) {
            properties.put("except", except.stream().map(Pattern::pattern).toList());
        }
        return properties;
    }
}
