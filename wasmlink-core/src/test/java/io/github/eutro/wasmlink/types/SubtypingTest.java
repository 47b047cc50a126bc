package io.github.eutro.wasmlink.types;

import org.junit.jupiter.api.Test;

import static io.github.eutro.wasmlink.Types.*;
import static io.github.eutro.wasmlink.types.Subtyping.CONTRAVARIANT;
import static io.github.eutro.wasmlink.types.Subtyping.EXACT;
import static org.junit.jupiter.api.Assertions.*;

public class SubtypingTest {
    @Test
    void emptyInstances() {
        assertTrue(CONTRAVARIANT.isInstanceSubtype(instance(), instance()));
    }

    @Test
    void extraExportsAreIgnored() {
        assertTrue(CONTRAVARIANT.isInstanceSubtype(instance("", FUNC), instance()));
        assertFalse(CONTRAVARIANT.isInstanceSubtype(instance(), instance("", FUNC)));
    }

    @Test
    void nestedInstances() {
        assertTrue(CONTRAVARIANT.isInstanceSubtype(
                instance("", instance("e", FUNC)),
                instance("", instance())
        ));
        assertFalse(CONTRAVARIANT.isInstanceSubtype(
                instance("", instance()),
                instance("", instance("e", FUNC))
        ));
    }

    @Test
    void emptyModules() {
        assertTrue(CONTRAVARIANT.isModuleSubtype(DefType.Module.EMPTY, module(instance(), instance())));
    }

    @Test
    void needingFewerImportsIsSubtype() {
        DefType.Module noImports = module(instance(), instance());
        DefType.Module importsInstance = module(instance("", instance()), instance());
        assertTrue(CONTRAVARIANT.isModuleSubtype(noImports, importsInstance));
        assertFalse(CONTRAVARIANT.isModuleSubtype(importsInstance, noImports));
    }

    @Test
    void acceptingWeakerImportsIsSubtype() {
        DefType.Module weak = module(instance("", instance()), instance());
        DefType.Module rich = module(instance("", instance("e", FUNC)), instance());
        assertTrue(CONTRAVARIANT.isModuleSubtype(weak, rich));
        assertFalse(CONTRAVARIANT.isModuleSubtype(rich, weak));
    }

    @Test
    void moduleExportsAreCovariant() {
        DefType.Module more = module(instance(), instance("a", FUNC, "b", MEMORY));
        DefType.Module less = module(instance(), instance("a", FUNC));
        assertTrue(CONTRAVARIANT.isModuleSubtype(more, less));
        assertFalse(CONTRAVARIANT.isModuleSubtype(less, more));
    }

    @Test
    void leafTypesAreInvariant() {
        assertFalse(CONTRAVARIANT.isSubtype(FUNC, I32_TO_I32));
        assertFalse(CONTRAVARIANT.isSubtype(I32_TO_I32, FUNC));
        assertTrue(CONTRAVARIANT.isSubtype(I32_TO_I32,
                DefType.Func.of(new ValType[]{ValType.I32}, new ValType[]{ValType.I32})));
        assertFalse(CONTRAVARIANT.isSubtype(MEMORY, new DefType.Mem(new DefType.Limits(1, 2))));
        assertFalse(CONTRAVARIANT.isSubtype(GLOBAL, new DefType.Global(true, ValType.I32)));
    }

    @Test
    void kindsMustAgree() {
        assertFalse(CONTRAVARIANT.isInstanceSubtype(instance("a", FUNC), instance("a", MEMORY)));
        assertEquals("export \"a\" > expected memory, found func",
                CONTRAVARIANT.explainMismatch(instance("a", FUNC), instance("a", MEMORY)));
    }

    @Test
    void explainsMissingExports() {
        assertEquals("export \"libc\" > export \"malloc\": missing",
                CONTRAVARIANT.explainMismatch(
                        instance("libc", instance("memory", MEMORY)),
                        instance("libc", instance("memory", MEMORY, "malloc", FUNC))
                ));
        assertNull(CONTRAVARIANT.explainMismatch(instance("a", FUNC), instance()));
    }

    @Test
    void explainsImportMismatches() {
        assertEquals("import \"\": required, but not imported by the expected module",
                CONTRAVARIANT.explainMismatch(
                        module(instance("", instance()), instance()),
                        module(instance(), instance())
                ));
        assertEquals("import \"\": imported by the expected module, but not required",
                EXACT.explainMismatch(
                        module(instance(), instance()),
                        module(instance("", instance()), instance())
                ));
    }

    @Test
    void exactImportsMustMatchBothWays() {
        DefType.Module noImports = module(instance(), instance("a", FUNC));
        DefType.Module importsInstance = module(instance("", instance()), instance());
        assertFalse(EXACT.isModuleSubtype(noImports, importsInstance));
        assertTrue(EXACT.isModuleSubtype(importsInstance, importsInstance));

        DefType.Module weak = module(instance("", instance()), instance());
        DefType.Module rich = module(instance("", instance("e", FUNC)), instance());
        assertFalse(EXACT.isModuleSubtype(weak, rich));
        assertFalse(EXACT.isModuleSubtype(rich, weak));

        // exports are covariant either way
        assertTrue(EXACT.isModuleSubtype(
                module(instance("i", FUNC), instance("a", FUNC, "b", FUNC)),
                module(instance("i", FUNC), instance("a", FUNC))
        ));
    }

    @Test
    void assignableFromIsTheConverse() {
        assertTrue(instance().assignableFrom(instance("", FUNC)));
        assertFalse(instance("", FUNC).assignableFrom(instance()));
        assertTrue(FUNC.assignableFrom(FUNC));
        assertFalse(FUNC.assignableFrom(MEMORY));
    }

    @Test
    void versionedLibraryUpgrade() {
        DefType.Instance required = instance("libc-1.0.0", instance("memory", MEMORY, "malloc", I32_TO_I32));
        DefType.Instance minorUpgrade = instance("libc-1.0.0",
                instance("memory", MEMORY, "malloc", I32_TO_I32, "free", I32_TO_I32));
        DefType.Instance incompatible = instance("libc-1.0.0", instance("memory", MEMORY, "free", I32_TO_I32));
        assertTrue(CONTRAVARIANT.isInstanceSubtype(minorUpgrade, required));
        assertFalse(CONTRAVARIANT.isInstanceSubtype(incompatible, required));
    }
}
