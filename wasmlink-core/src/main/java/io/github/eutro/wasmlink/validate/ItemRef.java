package io.github.eutro.wasmlink.validate;

import io.github.eutro.wasmlink.types.DefType;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A reference to a definition by kind and index, such as {@code (func 0)}.
 */
public final class ItemRef {
    /**
     * The kind of definition.
     */
    public final @NotNull DefType.Kind kind;
    /**
     * The index in the kind's index space.
     */
    public final int index;

    /**
     * Construct a reference.
     *
     * @param kind  The kind of definition.
     * @param index The index in the kind's space.
     */
    public ItemRef(@NotNull DefType.Kind kind, int index) {
        this.kind = Objects.requireNonNull(kind);
        this.index = index;
    }

    /**
     * Resolve the reference in a scope.
     *
     * @param scope The scope.
     * @return The type of the referenced definition.
     * @throws ValidationException If the index is not bound.
     */
    public @NotNull DefType resolve(@NotNull Scope scope) {
        return scope.resolve(kind, index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ItemRef itemRef = (ItemRef) o;
        return index == itemRef.index && kind == itemRef.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, index);
    }

    @Override
    public String toString() {
        return "(" + kind + " " + index + ")";
    }
}
