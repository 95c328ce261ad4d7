package com.raditha.luaforge.rules;

import com.raditha.luaforge.ast.*;
import com.raditha.luaforge.model.Token;
import com.raditha.luaforge.model.TokenType;

import java.util.List;

/**
 * Moves the formatting of a replaced expression onto its replacement, so that the
 * line-preserving generator keeps the replacement where the original stood.
 */
final class TokenInheritance {

    private TokenInheritance() {
    }

    /**
     * Gives the replacement the leading trivia (and position) of the original's first
     * token. When the replacement is a single literal it also takes the trailing trivia
     * of the original's last token.
     */
    static <T extends Expression> T inherit(Expression original, T replacement) {
        Token first = original.firstToken();
        if (first == null) {
            return replacement;
        }
        Token last = lastToken(original);
        Expression target = leftmost(replacement);
        String text = leafText(target);
        if (text == null) {
            return replacement;
        }
        Token token = first.withType(tokenType(target), text);
        if (target == replacement && last != null) {
            token = token.withTrailingTrivia(last.trailingTrivia());
        }
        if (target instanceof UnaryExpression) {
            target.getTokens().add(0, token);
        } else {
            target.setTokens(List.of(token));
        }
        return replacement;
    }

    private static Expression leftmost(Expression expression) {
        Expression current = expression;
        while (current instanceof BinaryExpression binary) {
            current = binary.getLeft();
        }
        return current;
    }

    private static String leafText(Expression expression) {
        if (expression instanceof NumberExpression number) {
            return number.getRaw();
        } else if (expression instanceof StringExpression string) {
            return string.getSourceText();
        } else if (expression instanceof BooleanExpression bool) {
            return String.valueOf(bool.getValue());
        } else if (expression instanceof NilExpression) {
            return "nil";
        } else if (expression instanceof Identifier identifier) {
            return identifier.getName();
        } else if (expression instanceof UnaryExpression unary && !unary.hasTokens()) {
            return unary.getOperator().getSymbol();
        }
        return null;
    }

    private static TokenType tokenType(Expression expression) {
        if (expression instanceof NumberExpression) {
            return TokenType.NUMBER;
        } else if (expression instanceof StringExpression) {
            return TokenType.STRING;
        } else if (expression instanceof Identifier) {
            return TokenType.NAME;
        } else if (expression instanceof UnaryExpression unary) {
            return unary.getOperator() == UnaryOperator.NOT ? TokenType.KEYWORD : TokenType.SYMBOL;
        }
        return TokenType.KEYWORD;
    }

    /**
     * The last token of an expression in source order, when it can be found.
     */
    static Token lastToken(Expression expression) {
        if (expression instanceof BinaryExpression binary) {
            return lastToken(binary.getRight());
        } else if (expression instanceof UnaryExpression unary) {
            return lastToken(unary.getOperand());
        } else if (expression instanceof TypeCastExpression) {
            return null;
        } else if (expression instanceof IfExpression ifExpression) {
            return lastToken(ifExpression.getElseResult());
        } else if (expression instanceof FunctionCallExpression call
                && call.getArgumentStyle() != FunctionCallExpression.ArgumentStyle.PARENTHESES
                && call.getArguments().size() == 1) {
            return lastToken(call.getArguments().get(0));
        } else if (expression instanceof FieldExpression field) {
            return lastOwned(field.getField());
        } else if (expression instanceof FunctionExpression function) {
            return lastOwned(function.getBody());
        }
        return lastOwned(expression);
    }

    private static Token lastOwned(Node node) {
        return node.getTokens().isEmpty() ? null : node.getTokens().get(node.getTokens().size() - 1);
    }
}
