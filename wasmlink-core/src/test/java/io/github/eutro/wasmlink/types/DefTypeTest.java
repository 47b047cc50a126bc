package io.github.eutro.wasmlink.types;

import org.junit.jupiter.api.Test;

import static io.github.eutro.wasmlink.Types.*;
import static org.junit.jupiter.api.Assertions.*;

public class DefTypeTest {
    @Test
    void printsLeafTypes() {
        assertEquals("(func)", FUNC.toString());
        assertEquals("(func (param i32) (result i32))", I32_TO_I32.toString());
        assertEquals("(memory 1)", MEMORY.toString());
        assertEquals("(memory 1 2)", new DefType.Mem(new DefType.Limits(1, 2)).toString());
        assertEquals("(table 0 funcref)",
                new DefType.Table(new DefType.Limits(0, null), ValType.FUNCREF).toString());
        assertEquals("(global (mut i64))", new DefType.Global(true, ValType.I64).toString());
        assertEquals("(global i32)", GLOBAL.toString());
    }

    @Test
    void printsSortedEntries() {
        assertEquals("(instance (export \"a\" (func)) (export \"b\" (memory 1)))",
                instance("b", MEMORY, "a", FUNC).toString());
        assertEquals("(module (import \"q\\\"\" (instance)) (export \"x\" (func)))",
                module(instance("q\"", instance()), instance("x", FUNC)).toString());
    }

    @Test
    void equalityIgnoresDeclarationOrder() {
        assertEquals(instance("a", FUNC, "b", MEMORY), instance("b", MEMORY, "a", FUNC));
        assertEquals(instance("a", FUNC, "b", MEMORY).hashCode(), instance("b", MEMORY, "a", FUNC).hashCode());
        assertNotEquals(instance("a", FUNC), instance("a", MEMORY));
        assertEquals(
                module(instance("x", FUNC, "y", FUNC), instance()),
                module(instance("y", FUNC, "x", FUNC), instance())
        );
        assertNotEquals(module(instance("x", FUNC), instance()), module(instance(), instance("x", FUNC)));
    }

    @Test
    void keepsDeclarationOrder() {
        DefType.Module module = module(instance("z", FUNC, "a", MEMORY, "m", GLOBAL), instance());
        assertArrayEquals(new String[]{"z", "a", "m"}, module.getImports().keySet().toArray(new String[0]));
    }

    @Test
    void typesAreImmutable() {
        DefType.Instance inst = instance("a", FUNC);
        assertThrows(UnsupportedOperationException.class, () -> inst.getExports().put("b", FUNC));
        byte[] params = I32_TO_I32.getParams();
        params[0] = ValType.I64.getOpcode();
        assertArrayEquals(new byte[]{ValType.I32.getOpcode()}, I32_TO_I32.getParams());
    }

    @Test
    void rejectsInvalidTypeCodes() {
        assertThrows(IllegalArgumentException.class, () -> new DefType.Func(new byte[]{0x01}, new byte[0]));
        assertThrows(IllegalArgumentException.class,
                () -> new DefType.Table(new DefType.Limits(0, null), ValType.I32));
        assertEquals(ValType.F64, ValType.fromOpcode((byte) 0x7C));
        assertTrue(ValType.EXTERNREF.isReference());
        assertFalse(ValType.V128.isReference());
    }

    @Test
    void instanceBuilder() {
        DefType.Instance built = DefType.Instance.builder()
                .export("a", FUNC)
                .export("b", MEMORY)
                .build();
        assertEquals(instance("a", FUNC, "b", MEMORY), built);
        assertEquals(MEMORY, built.getExport("b"));
        assertNull(built.getExport("c"));
        assertThrows(IllegalArgumentException.class,
                () -> DefType.Instance.builder().export("a", FUNC).export("a", FUNC));
    }

    @Test
    void moduleViews() {
        DefType.Module module = module(instance("i", FUNC), instance("e", MEMORY));
        assertEquals(instance("i", FUNC), module.importsAsInstance());
        assertEquals(instance("e", MEMORY), module.exportsAsInstance());
        assertEquals(DefType.Kind.MODULE, module.getKind());
        assertEquals("module", DefType.Kind.MODULE.toString());
    }
}
