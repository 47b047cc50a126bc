package io.github.eutro.wasmlink.validate;

import io.github.eutro.wasmlink.types.DefType;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A name paired with a type, such as a resolved instantiation argument.
 */
public final class NamedType {
    /**
     * The name.
     */
    public final @NotNull String name;
    /**
     * The type.
     */
    public final @NotNull DefType type;

    private NamedType(@NotNull String name, @NotNull DefType type) {
        this.name = Objects.requireNonNull(name);
        this.type = Objects.requireNonNull(type);
    }

    /**
     * Pair a name with a type.
     *
     * @param name The name.
     * @param type The type.
     * @return The pair.
     */
    public static NamedType of(@NotNull String name, @NotNull DefType type) {
        return new NamedType(name, type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NamedType that = (NamedType) o;
        return name.equals(that.name) && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return "\"" + name + "\" " + type;
    }
}
