package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code a, b.c, d[e] = x, y, z}
 */
public class AssignStatement extends Statement {

    private final List<Expression> variables;
    private final List<Expression> values;

    public AssignStatement(List<Expression> variables, List<Expression> values) {
        this.variables = new ArrayList<>(variables);
        this.values = new ArrayList<>(values);
    }

    public List<Expression> getVariables() {
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
    public AssignStatement copy() {
        return new AssignStatement(copyAll(variables), copyAll(values));
    }
}
