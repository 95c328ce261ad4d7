package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * A backtick string with embedded expressions. Owns the opening and closing backticks.
 */
public class InterpolatedStringExpression extends Expression {

    private final List<InterpolationSegment> segments;

    public InterpolatedStringExpression(List<InterpolationSegment> segments) {
        this.segments = new ArrayList<>(segments);
    }

    public List<InterpolationSegment> getSegments() {
        return segments;
    }

    @Override
    public Expression accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return children(segments);
    }

    @Override
    public InterpolatedStringExpression copy() {
        return new InterpolatedStringExpression(copyAll(segments));
    }
}
