package com.raditha.luaforge.generator;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GeneratorParametersTest {

    @Test
    void testKindFromName() {
        assertEquals(GeneratorKind.DENSE, GeneratorKind.fromName("dense"));
        assertEquals(GeneratorKind.READABLE, GeneratorKind.fromName(" Readable "));
        assertEquals(GeneratorKind.RETAIN_LINES, GeneratorKind.fromName("retain-lines"));
        assertEquals(GeneratorKind.RETAIN_LINES, GeneratorKind.fromName("retain_lines"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> GeneratorKind.fromName("pretty"));
        assertTrue(e.getMessage().contains("pretty"));
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> new GeneratorParameters(null));
        assertThrows(IllegalArgumentException.class, () -> new GeneratorParameters(GeneratorKind.DENSE, 0));
        assertEquals(GeneratorParameters.DEFAULT_COLUMN_SPAN, GeneratorParameters.dense().columnSpan());
    }

    @Test
    void testCreateGenerator() {
        assertInstanceOf(DenseLuaGenerator.class, GeneratorParameters.dense().createGenerator());
        assertInstanceOf(ReadableLuaGenerator.class, GeneratorParameters.readable().createGenerator());
        assertInstanceOf(TokenBasedLuaGenerator.class, GeneratorParameters.retainLines().createGenerator());
        assertNotSame(GeneratorParameters.dense().createGenerator(), GeneratorParameters.dense().createGenerator());
    }
}
