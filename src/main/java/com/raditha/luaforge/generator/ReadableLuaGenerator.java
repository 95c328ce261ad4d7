package com.raditha.luaforge.generator;

import com.raditha.luaforge.ast.Block;
import com.raditha.luaforge.ast.Statement;
import com.raditha.luaforge.model.Token;

/**
 * One statement per line, indented by four spaces per nesting level, with spaces
 * around operators. Comments are not written.
 */
public class ReadableLuaGenerator extends AbstractLuaGenerator {

    private static final String INDENT = "    ";

    private final int columnSpan;
    private final StringBuilder out = new StringBuilder();
    private int indent;
    private int lineLength;
    private boolean lineStart = true;
    private boolean pendingSpace;

    public ReadableLuaGenerator(int columnSpan) {
        this.columnSpan = columnSpan;
    }

    public ReadableLuaGenerator() {
        this(GeneratorParameters.DEFAULT_COLUMN_SPAN);
    }

    @Override
    protected void beginStatement(Statement statement) {
        if (out.length() > 0) {
            newLine(indent);
        }
    }

    @Override
    protected void enterBlock() {
        indent++;
    }

    @Override
    protected void exitBlock(Block block) {
        indent--;
        if (!block.isEmpty()) {
            newLine(indent);
        }
    }

    @Override
    protected void write(Token token, String text, Spacing spacing, boolean separate) {
        boolean space = !lineStart && (separate
                || spacing == Spacing.SPACED
                || spacing == Spacing.LEADING
                || spacing == Spacing.OPEN && pendingSpace);
        int width = lineLength + (space ? 1 : 0) + text.length();
        if (!lineStart && width > columnSpan && !text.equals("(") && !insideInterpolation()
                && spacing != Spacing.ATTACHED && spacing != Spacing.COMMA) {
            newLine(indent + 1);
        } else if (space) {
            append(" ");
        }
        append(text);
        pendingSpace = spacing == Spacing.SPACED || spacing == Spacing.COMMA;
    }

    @Override
    protected void raw(String text) {
        append(text);
        pendingSpace = false;
    }

    private void newLine(int level) {
        out.append('\n');
        lineLength = 0;
        for (int i = 0; i < level; i++) {
            append(INDENT);
        }
        lineStart = true;
    }

    private void append(String text) {
        out.append(text);
        int newline = text.lastIndexOf('\n');
        lineLength = newline < 0 ? lineLength + text.length() : text.length() - newline - 1;
        lineStart = false;
    }

    @Override
    protected void endOfFile(Token token) {
        if (out.length() > 0) {
            out.append('\n');
        }
    }

    @Override
    protected String result() {
        return out.toString();
    }
}
