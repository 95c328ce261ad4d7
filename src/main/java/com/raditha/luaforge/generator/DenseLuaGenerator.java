package com.raditha.luaforge.generator;

import com.raditha.luaforge.model.Token;

/**
 * Writes as little whitespace as possible and breaks lines once they reach the column span.
 * Comments are not written.
 */
public class DenseLuaGenerator extends AbstractLuaGenerator {

    private final int columnSpan;
    private final StringBuilder out = new StringBuilder();
    private int lineLength;

    public DenseLuaGenerator(int columnSpan) {
        this.columnSpan = columnSpan;
    }

    public DenseLuaGenerator() {
        this(GeneratorParameters.DEFAULT_COLUMN_SPAN);
    }

    @Override
    protected void write(Token token, String text, Spacing spacing, boolean separate) {
        int width = lineLength + (separate ? 1 : 0) + text.length();
        if (lineLength > 0 && width > columnSpan && !text.equals("(") && !insideInterpolation()) {
            out.append('\n');
            lineLength = 0;
        } else if (separate) {
            append(" ");
        }
        append(text);
    }

    @Override
    protected void raw(String text) {
        append(text);
    }

    private void append(String text) {
        out.append(text);
        int newline = text.lastIndexOf('\n');
        lineLength = newline < 0 ? lineLength + text.length() : text.length() - newline - 1;
    }

    @Override
    protected void endOfFile(Token token) {
        // trailing trivia is dropped along with comments
    }

    @Override
    protected String result() {
        return out.toString();
    }
}
