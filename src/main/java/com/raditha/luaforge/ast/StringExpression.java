package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;
import com.raditha.luaforge.model.LuaStrings;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * A string literal. Parsed literals keep their raw spelling (quotes, escapes, long brackets);
 * synthesized literals are quoted on output.
 */
public class StringExpression extends Expression {

    private final byte[] value;
    private final String raw;

    private StringExpression(byte[] value, String raw) {
        this.value = value;
        this.raw = raw;
    }

    public static StringExpression fromSource(String raw) {
        return new StringExpression(LuaStrings.decode(raw), raw);
    }

    public static StringExpression of(byte[] value) {
        return new StringExpression(value.clone(), null);
    }

    public static StringExpression of(String value) {
        return new StringExpression(value.getBytes(StandardCharsets.UTF_8), null);
    }

    public byte[] getValue() {
        return value.clone();
    }

    public String getRaw() {
        return raw;
    }

    /**
     * Text written by generators: the original spelling when known, a quoted literal otherwise.
     */
    public String getSourceText() {
        return raw != null ? raw : LuaStrings.quote(value);
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
    public StringExpression copy() {
        return new StringExpression(value.clone(), raw);
    }
}
