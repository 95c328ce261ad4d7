package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;
import com.raditha.luaforge.model.LuaNumbers;

import java.util.List;

/**
 * A numeral. The raw text is kept so hexadecimal or exponent forms are written back unchanged.
 */
public class NumberExpression extends Expression {

    private final String raw;
    private final double value;

    public NumberExpression(String raw) {
        this.raw = raw;
        this.value = LuaNumbers.parseLiteral(raw);
    }

    /**
     * Numeral for a finite, non-negative value.
     */
    public NumberExpression(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0 || 1 / value < 0) {
            throw new AstInvariantException("a numeral cannot represent " + value);
        }
        this.raw = LuaNumbers.toSource(value);
        this.value = value;
    }

    public String getRaw() {
        return raw;
    }

    public double getValue() {
        return value;
    }

    @Override
    public Expression accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return List.of();
    }

    @Override
    public NumberExpression copy() {
        return new NumberExpression(raw);
    }
}
