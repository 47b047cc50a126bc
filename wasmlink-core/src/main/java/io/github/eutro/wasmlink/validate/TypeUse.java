package io.github.eutro.wasmlink.validate;

import io.github.eutro.wasmlink.types.DefType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A use of a type, either written out inline or referring to a type definition by index.
 */
public final class TypeUse {
    private final @Nullable DefType inline;
    private final int index;

    private TypeUse(@Nullable DefType inline, int index) {
        this.inline = inline;
        this.index = index;
    }

    /**
     * Use a type written out inline.
     *
     * @param type The type.
     * @return The type use.
     */
    public static TypeUse of(@NotNull DefType type) {
        return new TypeUse(Objects.requireNonNull(type), -1);
    }

    /**
     * Use the type defined at an index of the type index space.
     *
     * @param index The type index.
     * @return The type use.
     */
    public static TypeUse index(int index) {
        return new TypeUse(null, index);
    }

    /**
     * Resolve the used type in a scope.
     *
     * @param scope The scope.
     * @return The type.
     * @throws ValidationException If the type index is not bound.
     */
    public @NotNull DefType resolve(@NotNull Scope scope) {
        return inline != null ? inline : scope.resolveType(index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TypeUse typeUse = (TypeUse) o;
        return index == typeUse.index && Objects.equals(inline, typeUse.inline);
    }

    @Override
    public int hashCode() {
        return Objects.hash(inline, index);
    }

    @Override
    public String toString() {
        return inline != null ? inline.toString() : "(type " + index + ")";
    }
}
