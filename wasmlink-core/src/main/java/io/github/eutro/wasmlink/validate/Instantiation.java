package io.github.eutro.wasmlink.validate;

import io.github.eutro.wasmlink.types.DefType;
import io.github.eutro.wasmlink.types.Subtyping;
import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks named arguments against the imports of a module, yielding the type of the resulting instance.
 * <p>
 * Arguments are matched to imports by name alone: their order is irrelevant, and arguments
 * that match no import are ignored.
 */
public final class Instantiation {
    private Instantiation() {
    }

    /**
     * Check an instantiation of a module.
     *
     * @param module    The type of the module to instantiate.
     * @param args      The named arguments.
     * @param subtyping The subtyping relation arguments must satisfy.
     * @return The type of the instance, exactly the exports of the module.
     * @throws ValidationException If an argument name is repeated, an import has no argument,
     *                             or an argument is not a subtype of its import.
     */
    public static @NotNull DefType.Instance instantiate(
            @NotNull DefType.Module module,
            @NotNull List<NamedType> args,
            @NotNull Subtyping subtyping
    ) {
        Map<String, DefType> byName = collect(args);
        for (Map.Entry<String, DefType> entry : module.getImports().entrySet()) {
            DefType arg = byName.get(entry.getKey());
            if (arg == null) {
                throw new ValidationException(ErrorKind.MISSING_IMPORT,
                        "No argument for import \"" + entry.getKey() + "\": " + entry.getValue());
            }
            String mismatch = subtyping.explainMismatch(arg, entry.getValue());
            if (mismatch != null) {
                throw new ValidationException(ErrorKind.SUBTYPE_ERROR,
                        "Argument \"" + entry.getKey() + "\" does not match its import: " + mismatch);
            }
        }
        return module.exportsAsInstance();
    }

    /**
     * Bundle named definitions into an instance.
     *
     * @param args The named definitions.
     * @return The type of the instance, exporting each definition by its name.
     * @throws ValidationException If a name is repeated.
     */
    public static @NotNull DefType.Instance tuple(@NotNull List<NamedType> args) {
        return new DefType.Instance(collect(args));
    }

    private static Map<String, DefType> collect(List<NamedType> args) {
        Map<String, DefType> byName = new LinkedHashMap<>();
        for (NamedType arg : args) {
            if (byName.put(arg.name, arg.type) != null) {
                throw new ValidationException(ErrorKind.DUPLICATE_ARG_NAME, "Duplicate argument \"" + arg.name + "\"");
            }
        }
        return byName;
    }
}
