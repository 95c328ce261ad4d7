package com.raditha.luaforge.rules;

import com.raditha.luaforge.ast.*;
import com.raditha.luaforge.ast.visitor.ModifierVisitor;
import com.raditha.luaforge.evaluator.Evaluator;
import com.raditha.luaforge.evaluator.LuaValue;
import com.raditha.luaforge.evaluator.ValueConverter;

import java.util.Optional;

/**
 * Constant folding. Operator, parenthesized and if-expressions whose value is known and
 * whose evaluation cannot have side effects are replaced by a literal. Folding runs
 * bottom-up, so partially constant expressions are reduced as far as possible.
 * <p>
 * An {@code and} / {@code or} whose left operand is pure and of known truthiness is
 * reduced to the operand it selects, even when that operand's value is unknown:
 * {@code true and x} becomes {@code x} and {@code false or f()} becomes {@code (f())}.
 */
public class ComputeExpression implements Rule {

    public static final String NAME = "compute_expression";

    private final Evaluator evaluator = new Evaluator();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void process(Block block, RuleContext context) {
        new Folder().visit(block);
    }

    private Expression fold(Expression expression) {
        if (ValueConverter.isCanonicalForm(expression)) {
            return expression;
        }
        LuaValue value = evaluator.evaluate(expression);
        if (!value.isLiteral() || evaluator.hasSideEffects(expression)) {
            return expression instanceof BinaryExpression binary ? shortCircuit(binary) : expression;
        }
        Optional<Expression> literal = ValueConverter.toExpression(value);
        return literal.map(replacement -> TokenInheritance.inherit(expression, replacement)).orElse(expression);
    }

    private Expression shortCircuit(BinaryExpression expression) {
        BinaryOperator operator = expression.getOperator();
        if (operator != BinaryOperator.AND && operator != BinaryOperator.OR) {
            return expression;
        }
        Expression left = expression.getLeft();
        if (evaluator.hasSideEffects(left)) {
            return expression;
        }
        Optional<Boolean> truthy = evaluator.evaluate(left).truthiness();
        if (truthy.isEmpty()) {
            return expression;
        }
        boolean selectsLeft = operator == BinaryOperator.AND ? !truthy.get() : truthy.get();
        Expression selected = selectsLeft ? left : expression.getRight();
        if (Evaluator.canReturnMultipleValues(selected)) {
            // the operator truncated the operand to a single value
            return new ParentheseExpression(selected);
        }
        return TokenInheritance.inherit(expression, selected);
    }

    private class Folder extends ModifierVisitor {

        @Override
        public Expression visit(BinaryExpression expression) {
            return fold(super.visit(expression));
        }

        @Override
        public Expression visit(UnaryExpression expression) {
            return fold(super.visit(expression));
        }

        @Override
        public Expression visit(ParentheseExpression expression) {
            return fold(super.visit(expression));
        }

        @Override
        public Expression visit(IfExpression expression) {
            return fold(super.visit(expression));
        }
    }
}
