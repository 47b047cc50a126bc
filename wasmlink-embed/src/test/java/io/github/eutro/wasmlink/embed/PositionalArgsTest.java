package io.github.eutro.wasmlink.embed;

import io.github.eutro.wasmlink.types.DefType;
import io.github.eutro.wasmlink.validate.NamedType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static io.github.eutro.wasmlink.embed.LinkerTest.*;
import static org.junit.jupiter.api.Assertions.*;

public class PositionalArgsTest {
    @Test
    void zipsWithImportsInDeclarationOrder() {
        DefType.Module module = new DefType.Module(
                instance("z", FUNC, "a", MEMORY).getExports(),
                Collections.emptyMap()
        );
        assertEquals(Arrays.asList(
                NamedType.of("z", MALLOC),
                NamedType.of("a", MEMORY)
        ), PositionalArgs.toNamed(module, Arrays.asList(MALLOC, MEMORY)));
    }

    @Test
    void lengthsMustMatch() {
        assertThrows(IllegalArgumentException.class,
                () -> PositionalArgs.toNamed(DefType.Module.EMPTY, Collections.singletonList(FUNC)));
        assertTrue(PositionalArgs.toNamed(DefType.Module.EMPTY, Collections.emptyList()).isEmpty());
    }
}
