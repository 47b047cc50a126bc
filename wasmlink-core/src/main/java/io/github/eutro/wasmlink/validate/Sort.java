package io.github.eutro.wasmlink.validate;

import io.github.eutro.wasmlink.types.DefType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;

/**
 * The index spaces of a module: that of type definitions, and one for each {@link DefType.Kind kind}.
 */
public enum Sort {
    /**
     * Type definitions, and outer aliases of them.
     */
    TYPE(null),
    /**
     * Functions.
     */
    FUNC(DefType.Kind.FUNC),
    /**
     * Tables.
     */
    TABLE(DefType.Kind.TABLE),
    /**
     * Memories.
     */
    MEMORY(DefType.Kind.MEMORY),
    /**
     * Globals.
     */
    GLOBAL(DefType.Kind.GLOBAL),
    /**
     * Instances, whether imported, instantiated or bundled.
     */
    INSTANCE(DefType.Kind.INSTANCE),
    /**
     * Modules, whether imported, nested or aliased from an enclosing module.
     */
    MODULE(DefType.Kind.MODULE),
    ;

    private final @Nullable DefType.Kind kind;

    Sort(@Nullable DefType.Kind kind) {
        this.kind = kind;
    }

    /**
     * Get the sort of the index space definitions of the given kind live in.
     *
     * @param kind The kind.
     * @return The sort.
     */
    public static @NotNull Sort of(@NotNull DefType.Kind kind) {
        switch (kind) {
            case FUNC:
                return FUNC;
            case TABLE:
                return TABLE;
            case MEMORY:
                return MEMORY;
            case GLOBAL:
                return GLOBAL;
            case INSTANCE:
                return INSTANCE;
            case MODULE:
                return MODULE;
            default:
                throw new AssertionError();
        }
    }

    /**
     * Get the kind of definition in this index space, or null for {@link #TYPE}.
     *
     * @return The kind.
     */
    public @Nullable DefType.Kind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
