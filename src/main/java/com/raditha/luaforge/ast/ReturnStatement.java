package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.ArrayList;
import java.util.List;

public class ReturnStatement extends LastStatement {

    private final List<Expression> values;

    public ReturnStatement(List<Expression> values) {
        this.values = new ArrayList<>(values);
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
        return children(values);
    }

    @Override
    public ReturnStatement copy() {
        return new ReturnStatement(copyAll(values));
    }
}
