package com.raditha.luaforge.ast;

import com.raditha.luaforge.model.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Base class of every syntax tree node.
 * <p>
 * A node owns the tokens of its own keywords, punctuation and (for leaves) its
 * value, in source order. Children are never referenced through tokens, so a
 * subtree can be detached and attached elsewhere without dangling references.
 * Nodes created by rules usually own no tokens at all.
 */
public abstract class Node {

    private final List<Token> tokens = new ArrayList<>();

    /**
     * Live list of the tokens owned by this node.
     */
    public List<Token> getTokens() {
        return tokens;
    }

    public void setTokens(List<Token> newTokens) {
        tokens.clear();
        tokens.addAll(newTokens);
    }

    public void addToken(Token token) {
        tokens.add(token);
    }

    public boolean hasTokens() {
        return !tokens.isEmpty();
    }

    /**
     * Rewrite every token owned by this node (not its children).
     */
    public void mapTokens(UnaryOperator<Token> mapper) {
        tokens.replaceAll(mapper);
    }

    /**
     * Direct children in source order.
     */
    public abstract List<Node> getChildren();

    /**
     * Deep copy of this subtree. Copies own no tokens and are generated with default formatting.
     */
    public abstract Node copy();

    @SuppressWarnings("unchecked")
    protected static <T extends Node> List<T> copyAll(List<T> nodes) {
        List<T> copies = new ArrayList<>(nodes.size());
        for (T node : nodes) {
            copies.add((T) node.copy());
        }
        return copies;
    }

    @SuppressWarnings("unchecked")
    protected static <T extends Node> T copyOrNull(T node) {
        return node == null ? null : (T) node.copy();
    }

    protected static List<Node> children(Object... nodes) {
        List<Node> result = new ArrayList<>();
        for (Object node : nodes) {
            if (node instanceof Node n) {
                result.add(n);
            } else if (node instanceof List<?> list) {
                for (Object element : list) {
                    result.add((Node) element);
                }
            }
        }
        return result;
    }
}
