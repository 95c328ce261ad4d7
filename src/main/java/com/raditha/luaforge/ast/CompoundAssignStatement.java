package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.List;

/**
 * {@code variable op= value}
 */
public class CompoundAssignStatement extends Statement {

    private final CompoundOperator operator;
    private Expression variable;
    private Expression value;

    public CompoundAssignStatement(CompoundOperator operator, Expression variable, Expression value) {
        this.operator = operator;
        this.variable = variable;
        this.value = value;
    }

    public CompoundOperator getOperator() {
        return operator;
    }

    public Expression getVariable() {
        return variable;
    }

    public void setVariable(Expression variable) {
        this.variable = variable;
    }

    public Expression getValue() {
        return value;
    }

    public void setValue(Expression value) {
        this.value = value;
    }

    @Override
    public Statement accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return children(variable, value);
    }

    @Override
    public CompoundAssignStatement copy() {
        return new CompoundAssignStatement(operator, variable.copy(), value.copy());
    }
}
