package com.raditha.luaforge.generator;

/**
 * Selected generator and its settings.
 *
 * @param kind       output strategy
 * @param columnSpan preferred maximum line width for the dense and readable generators
 */
public record GeneratorParameters(GeneratorKind kind, int columnSpan) {

    public static final int DEFAULT_COLUMN_SPAN = 80;

    public GeneratorParameters {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (columnSpan < 1) {
            throw new IllegalArgumentException("column_span must be >= 1");
        }
    }

    public GeneratorParameters(GeneratorKind kind) {
        this(kind, DEFAULT_COLUMN_SPAN);
    }

    public static GeneratorParameters retainLines() {
        return new GeneratorParameters(GeneratorKind.RETAIN_LINES);
    }

    public static GeneratorParameters dense() {
        return new GeneratorParameters(GeneratorKind.DENSE);
    }

    public static GeneratorParameters readable() {
        return new GeneratorParameters(GeneratorKind.READABLE);
    }

    /**
     * A fresh generator for one file.
     */
    public LuaGenerator createGenerator() {
        return switch (kind) {
            case DENSE -> new DenseLuaGenerator(columnSpan);
            case READABLE -> new ReadableLuaGenerator(columnSpan);
            case RETAIN_LINES -> new TokenBasedLuaGenerator();
        };
    }
}
