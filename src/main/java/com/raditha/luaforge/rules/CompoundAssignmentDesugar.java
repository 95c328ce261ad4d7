package com.raditha.luaforge.rules;

import com.raditha.luaforge.ast.*;
import com.raditha.luaforge.model.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites {@code a op= b} as {@code a = a op b}. Parts of the assigned expression that
 * could have side effects are evaluated once into temporary locals inside a do block.
 */
final class CompoundAssignmentDesugar {

    static final String TEMPORARY_PREFIX = "__LUAFORGE_VAR";

    private int temporaries;

    /**
     * Temporary names restart for every statement; each rewrite lives in its own do block.
     */
    Statement desugar(CompoundAssignStatement statement) {
        temporaries = 0;
        BinaryOperator operator = statement.getOperator().getBinaryOperator();
        Expression variable = statement.getVariable();
        Expression value = statement.getValue();
        List<LocalAssignStatement> locals = new ArrayList<>();
        Expression target = variable;
        if (variable instanceof FieldExpression field && !isDuplicable(field.getPrefix())) {
            Identifier prefix = temporary(field.getPrefix(), locals);
            target = new FieldExpression(prefix, field.getField());
        } else if (variable instanceof IndexExpression index
                && !(isDuplicable(index.getPrefix()) && isDuplicable(index.getIndex()))) {
            Expression prefix = isDuplicable(index.getPrefix()) ? index.getPrefix() : temporary(index.getPrefix(), locals);
            Expression key = isDuplicable(index.getIndex()) ? index.getIndex() : temporary(index.getIndex(), locals);
            target = new IndexExpression(prefix, key);
        }
        AssignStatement assign = new AssignStatement(List.of(target),
                List.of(new BinaryExpression(operator, target.copy(), value)));
        if (locals.isEmpty()) {
            List<Token> tokens = statement.getTokens();
            if (!tokens.isEmpty()) {
                assign.addToken(tokens.get(0).withText("="));
            }
            assign.setSemicolon(statement.getSemicolon());
            return assign;
        }
        Block block = new Block();
        locals.forEach(block::append);
        block.append(assign);
        DoStatement doStatement = new DoStatement(block);
        doStatement.setSemicolon(statement.getSemicolon());
        return doStatement;
    }

    private Identifier temporary(Expression value, List<LocalAssignStatement> locals) {
        String name = temporaries == 0 ? TEMPORARY_PREFIX : TEMPORARY_PREFIX + temporaries;
        temporaries++;
        locals.add(new LocalAssignStatement(List.of(new TypedIdentifier(name)), List.of(value)));
        return new Identifier(name);
    }

    private static boolean isDuplicable(Expression expression) {
        return expression instanceof Identifier || expression instanceof NumberExpression
                || expression instanceof StringExpression || expression instanceof BooleanExpression
                || expression instanceof NilExpression;
    }
}
