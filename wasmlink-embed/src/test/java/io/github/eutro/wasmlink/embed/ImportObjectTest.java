package io.github.eutro.wasmlink.embed;

import io.github.eutro.wasmlink.types.DefType;
import io.github.eutro.wasmlink.validate.NamedType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static io.github.eutro.wasmlink.embed.LinkerTest.*;
import static org.junit.jupiter.api.Assertions.*;

public class ImportObjectTest {
    @Test
    void groupsFieldsByModule() {
        ImportObject imports = ImportObject.builder()
                .add("env", "memory", MEMORY)
                .add("wasi", "proc_exit", FREE)
                .add("env", "malloc", MALLOC)
                .build();
        assertEquals(Arrays.asList("env", "wasi"), Arrays.asList(imports.getModuleNames().toArray()));
        assertEquals(instance("memory", MEMORY, "malloc", MALLOC).getExports(), imports.getModule("env"));
        assertNull(imports.getModule("other"));

        List<NamedType> args = imports.toArgs();
        assertEquals(Arrays.asList(
                NamedType.of("env", instance("memory", MEMORY, "malloc", MALLOC)),
                NamedType.of("wasi", instance("proc_exit", FREE))
        ), args);
    }

    @Test
    void rejectsDuplicateFields() {
        ImportObject.Builder builder = ImportObject.builder().add("env", "f", FUNC);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> builder.add("env", "f", MALLOC));
        assertEquals("'env' already provides 'f'", e.getMessage());
        builder.add("other", "f", MALLOC);
    }

    @Test
    void isImmutable() {
        ImportObject.Builder builder = ImportObject.builder().add("env", "f", FUNC);
        ImportObject imports = builder.build();
        builder.add("env", "g", FUNC);
        assertEquals(1, imports.getModule("env").size());
        assertThrows(UnsupportedOperationException.class,
                () -> imports.getModule("env").put("h", FUNC));
    }

    @Test
    void linkerRejectsRedefinedModules() {
        ImportObject imports = ImportObject.builder().add("env", "f", FUNC).build();
        Linker linker = new Linker().define("env", DefType.Instance.EMPTY);
        assertThrows(IllegalArgumentException.class, () -> linker.defineAll(imports));
    }
}
