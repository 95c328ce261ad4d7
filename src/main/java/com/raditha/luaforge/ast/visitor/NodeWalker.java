package com.raditha.luaforge.ast.visitor;

import com.raditha.luaforge.ast.Node;
import com.raditha.luaforge.model.Token;

import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Read-only pre-order traversal over {@link Node#getChildren()}.
 */
public final class NodeWalker {

    private NodeWalker() {
    }

    public static void walk(Node node, Consumer<Node> action) {
        action.accept(node);
        for (Node child : node.getChildren()) {
            walk(child, action);
        }
    }

    /**
     * Rewrite every token in the subtree, including semicolons and the end-of-file token.
     */
    public static void mapAllTokens(Node root, UnaryOperator<Token> mapper) {
        walk(root, node -> node.mapTokens(mapper));
    }

    /**
     * The node in the subtree owning the given token instance, or null.
     */
    public static Node findOwner(Node root, Token token) {
        for (Token owned : root.getTokens()) {
            if (owned == token) {
                return root;
            }
        }
        for (Node child : root.getChildren()) {
            Node owner = findOwner(child, token);
            if (owner != null) {
                return owner;
            }
        }
        return null;
    }

    public static boolean contains(Node root, Node target) {
        if (root == target) {
            return true;
        }
        for (Node child : root.getChildren()) {
            if (contains(child, target)) {
                return true;
            }
        }
        return false;
    }
}
