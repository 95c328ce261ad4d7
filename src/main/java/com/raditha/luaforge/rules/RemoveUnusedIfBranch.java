package com.raditha.luaforge.rules;

import com.raditha.luaforge.ast.*;
import com.raditha.luaforge.ast.visitor.ModifierVisitor;
import com.raditha.luaforge.evaluator.Evaluator;
import com.raditha.luaforge.model.Token;
import com.raditha.luaforge.model.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Removes branches of if statements and if-expressions whose condition is known.
 * <ul>
 *     <li>a branch that is always taken makes every following branch unreachable; when it
 *     is the first branch and its condition is pure the whole statement becomes a do block</li>
 *     <li>a branch that is never taken is removed when its condition is pure, otherwise
 *     only its body is emptied</li>
 *     <li>when no branch remains the else block becomes a do block, or the statement goes</li>
 * </ul>
 */
public class RemoveUnusedIfBranch implements Rule {

    public static final String NAME = "remove_unused_if_branch";

    private final Evaluator evaluator = new Evaluator();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void process(Block block, RuleContext context) {
        new BranchFilter().visit(block);
    }

    private Statement simplify(IfStatement statement) {
        List<IfBranch> kept = new ArrayList<>();
        Block elseBlock = statement.getElseBlock();
        for (IfBranch branch : statement.getBranches()) {
            Optional<Boolean> truthy = evaluator.evaluate(branch.getCondition()).truthiness();
            if (truthy.isEmpty()) {
                kept.add(branch);
                continue;
            }
            boolean pure = !evaluator.hasSideEffects(branch.getCondition());
            if (truthy.get()) {
                if (kept.isEmpty() && pure) {
                    return doBlock(branch.getBlock(), branch.getTokens(), statement);
                }
                kept.add(branch);
                elseBlock = null;
                break;
            }
            if (!pure) {
                branch.getBlock().clear();
                kept.add(branch);
            }
        }
        if (kept.isEmpty()) {
            if (elseBlock == null) {
                return null;
            }
            return doBlock(elseBlock, statement.getTokens(), statement);
        }
        if (kept.get(0) != statement.getBranches().get(0)) {
            promoteToIf(kept.get(0));
        }
        statement.getBranches().clear();
        statement.getBranches().addAll(kept);
        statement.setElseBlock(elseBlock);
        return statement;
    }

    private static void promoteToIf(IfBranch branch) {
        List<Token> tokens = branch.getTokens();
        if (!tokens.isEmpty() && tokens.get(0).is("elseif")) {
            tokens.set(0, tokens.get(0).withType(TokenType.KEYWORD, "if"));
        }
    }

    private static DoStatement doBlock(Block block, List<Token> openingTokens, IfStatement statement) {
        DoStatement doStatement = new DoStatement(block);
        List<Token> own = new ArrayList<>();
        if (!openingTokens.isEmpty()) {
            own.add(openingTokens.get(0).withType(TokenType.KEYWORD, "do"));
        }
        List<Token> statementTokens = statement.getTokens();
        if (!statementTokens.isEmpty() && statementTokens.get(statementTokens.size() - 1).is("end")) {
            own.add(statementTokens.get(statementTokens.size() - 1));
        }
        doStatement.setTokens(own);
        doStatement.setSemicolon(statement.getSemicolon());
        return doStatement;
    }

    private Expression simplify(IfExpression expression) {
        Optional<Boolean> truthy = evaluator.evaluate(expression.getCondition()).truthiness();
        boolean pure = !evaluator.hasSideEffects(expression.getCondition());
        if (truthy.isPresent() && pure) {
            if (truthy.get()) {
                return singleValue(expression.getResult());
            }
            if (expression.getBranches().isEmpty()) {
                return singleValue(expression.getElseResult());
            }
            ElseIfExpressionBranch next = expression.getBranches().remove(0);
            expression.setCondition(next.getCondition());
            expression.setResult(next.getResult());
            return simplify(expression);
        }
        List<ElseIfExpressionBranch> branches = expression.getBranches();
        for (int i = 0; i < branches.size(); i++) {
            ElseIfExpressionBranch branch = branches.get(i);
            Optional<Boolean> branchTruthy = evaluator.evaluate(branch.getCondition()).truthiness();
            if (branchTruthy.isEmpty() || evaluator.hasSideEffects(branch.getCondition())) {
                continue;
            }
            if (branchTruthy.get()) {
                expression.setElseResult(branch.getResult());
                branches.subList(i, branches.size()).clear();
                break;
            }
            branches.remove(i--);
        }
        return expression;
    }

    private static Expression singleValue(Expression expression) {
        if (Evaluator.canReturnMultipleValues(expression)) {
            return new ParentheseExpression(expression);
        }
        return expression;
    }

    private class BranchFilter extends ModifierVisitor {

        @Override
        public Statement visit(IfStatement statement) {
            super.visit(statement);
            return simplify(statement);
        }

        @Override
        public Expression visit(IfExpression expression) {
            super.visit(expression);
            return simplify(expression);
        }
    }
}
