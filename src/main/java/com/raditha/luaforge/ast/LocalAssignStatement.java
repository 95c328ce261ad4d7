package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code local a, b = x, y}
 */
public class LocalAssignStatement extends Statement {

    private final List<TypedIdentifier> variables;
    private final List<Expression> values;

    public LocalAssignStatement(List<TypedIdentifier> variables, List<Expression> values) {
        this.variables = new ArrayList<>(variables);
        this.values = new ArrayList<>(values);
    }

    public List<TypedIdentifier> getVariables() {
        return variables;
    }

    public List<Expression> getValues() {
        return values;
    }

    @Override
    public Statement accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return children(variables, values);
    }

    @Override
    public LocalAssignStatement copy() {
        return new LocalAssignStatement(copyAll(variables), copyAll(values));
    }
}
