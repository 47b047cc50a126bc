package io.github.eutro.wasmlink.embed;

import io.github.eutro.wasmlink.types.DefType;
import io.github.eutro.wasmlink.validate.NamedType;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Translates positional instantiation arguments to named ones.
 */
public final class PositionalArgs {
    private PositionalArgs() {
    }

    /**
     * Name positional arguments after the imports of a module, in the order the module declares them.
     *
     * @param module The type of the module.
     * @param args   The arguments, one for each import.
     * @return The named arguments.
     * @throws IllegalArgumentException If the number of arguments is not the number of imports.
     */
    public static @NotNull List<NamedType> toNamed(@NotNull DefType.Module module, @NotNull List<? extends DefType> args) {
        if (module.getImports().size() != args.size()) {
            throw new IllegalArgumentException(String.format("Import lengths mismatch, got: %d, expected: %s",
                    args.size(),
                    module.getImports().keySet()));
        }
        List<NamedType> named = new ArrayList<>(args.size());
        Iterator<? extends DefType> it = args.iterator();
        for (String name : module.getImports().keySet()) {
            named.add(NamedType.of(name, it.next()));
        }
        return named;
    }
}
