package com.raditha.luaforge.analysis;

import com.raditha.luaforge.ast.Block;
import com.raditha.luaforge.parser.ParseException;
import com.raditha.luaforge.parser.Parser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ScopeAnalyzerTest {

    private static ScopeResolution analyze(String source) throws ParseException {
        Block block = Parser.parse(source);
        return ScopeAnalyzer.analyze(block);
    }

    private static Binding binding(ScopeResolution resolution, String name) {
        return resolution.getBindings().stream()
                .filter(b -> b.getName().equals(name))
                .findFirst()
                .orElseThrow();
    }

    @Test
    void testLocalsAndGlobals() throws ParseException {
        ScopeResolution resolution = analyze("local a = b\nprint(a)");
        assertEquals(1, resolution.getBindings().size());
        assertEquals(Set.of("b", "print"), resolution.getFreeNames());
        Binding a = binding(resolution, "a");
        assertEquals(Binding.Kind.LOCAL, a.getKind());
        assertEquals(1, a.getReferences().size());
        assertTrue(a.isRead());
        assertFalse(a.isWritten());
    }

    @Test
    void testInitializerSeesOuterBinding() throws ParseException {
        ScopeResolution resolution = analyze("local x = 1\ndo local x = x + 1 end");
        List<Binding> bindings = resolution.getBindings();
        assertEquals(2, bindings.size());
        assertEquals(1, bindings.get(0).getReferences().size());
        assertFalse(bindings.get(1).isReferenced());
    }

    @Test
    void testLocalFunctionIsVisibleInItsBody() throws ParseException {
        ScopeResolution resolution = analyze("local function f(n) return f(n - 1) end");
        Binding f = binding(resolution, "f");
        assertEquals(Binding.Kind.LOCAL_FUNCTION, f.getKind());
        assertTrue(f.isReferenced());
        assertEquals(Binding.Kind.PARAMETER, binding(resolution, "n").getKind());
        assertTrue(resolution.getFreeNames().isEmpty());
    }

    @Test
    void testLocalAssignmentIsNotVisibleInItsInitializer() throws ParseException {
        ScopeResolution resolution = analyze("local f = function() return f end");
        assertFalse(binding(resolution, "f").isReferenced());
        assertEquals(Set.of("f"), resolution.getFreeNames());
    }

    @Test
    void testWritesAndCompoundAssignments() throws ParseException {
        ScopeResolution resolution = analyze("local a\na = 1\nlocal b = 0\nb += 1");
        Binding a = binding(resolution, "a");
        assertTrue(a.isWritten());
        assertFalse(a.isRead());
        Binding b = binding(resolution, "b");
        assertTrue(b.isRead());
        assertTrue(b.isWritten());
    }

    @Test
    void testMethodsDeclareSelf() throws ParseException {
        ScopeResolution resolution = analyze("function t:m() return self end");
        assertEquals(Binding.Kind.SELF, binding(resolution, "self").getKind());
        assertEquals(Set.of("t"), resolution.getFreeNames());
    }

    @Test
    void testLoopVariables() throws ParseException {
        ScopeResolution resolution = analyze("for i = 1, n do print(i) end\nfor k, v in pairs(t) do end\nreturn i");
        assertEquals(Binding.Kind.FOR_VARIABLE, binding(resolution, "i").getKind());
        assertEquals(Binding.Kind.FOR_VARIABLE, binding(resolution, "v").getKind());
        assertTrue(resolution.getFreeNames().contains("i"));
        assertTrue(resolution.getFreeNames().contains("pairs"));
    }

    @Test
    void testRepeatConditionSeesBodyLocals() throws ParseException {
        ScopeResolution resolution = analyze("repeat local done = true until done");
        assertTrue(binding(resolution, "done").isReferenced());
        assertFalse(resolution.getFreeNames().contains("done"));
    }

    @Test
    void testRenameUpdatesDeclarationAndReferences() throws ParseException {
        Block block = Parser.parse("local long = 1\nreturn long");
        ScopeResolution resolution = ScopeAnalyzer.analyze(block);
        binding(resolution, "long").rename("s");
        assertEquals("s", binding(resolution, "long").getDeclaration().getName());
        ScopeResolution again = ScopeAnalyzer.analyze(block);
        assertEquals(1, binding(again, "s").getReferences().size());
    }

    @Test
    void testScopeTree() throws ParseException {
        ScopeResolution resolution = analyze("local a\ndo local b end\nlocal function f() end");
        Scope root = resolution.getRoot();
        assertNull(root.getParent());
        assertEquals(List.of("a", "f"), root.getBindings().stream().map(Binding::getName).toList());
        assertEquals(2, root.getChildren().size());
    }
}
