package io.github.eutro.wasmlink.validate;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * An append-only sequence of validated definitions, addressed by position.
 * <p>
 * An index is only bound once the definition at it has been declared, so a definition
 * can only ever reference those declared before it.
 *
 * @param <T> The type of the definitions.
 */
public final class IndexSpace<T> {
    private final Sort sort;
    private final List<T> entries = new ArrayList<>();

    /**
     * Construct an empty index space.
     *
     * @param sort The sort of definitions in the space, for error messages.
     */
    public IndexSpace(@NotNull Sort sort) {
        this.sort = sort;
    }

    /**
     * Append a definition.
     *
     * @param def The definition.
     * @return The index of the definition.
     */
    public int declare(@NotNull T def) {
        entries.add(def);
        return entries.size() - 1;
    }

    /**
     * Resolve an index, among the definitions declared so far.
     *
     * @param index The index.
     * @return The definition at the index.
     * @throws ValidationException If the index is not bound.
     */
    public @NotNull T resolve(int index) {
        return resolve(index, entries.size());
    }

    /**
     * Resolve an index among the first {@code limit} definitions only.
     *
     * @param index The index.
     * @param limit The number of definitions visible.
     * @return The definition at the index.
     * @throws ValidationException If the index is not below the limit.
     */
    public @NotNull T resolve(int index, int limit) {
        if (index < 0 || index >= limit) {
            throw new ValidationException(ErrorKind.UNBOUND_INDEX,
                    String.format("%s index %s out of bounds, %d defined",
                            sort, Integer.toUnsignedString(index), limit));
        }
        return entries.get(index);
    }

    /**
     * Get the number of definitions declared so far.
     *
     * @return The length of the space.
     */
    public int size() {
        return entries.size();
    }

    /**
     * Get the sort of definitions in this space.
     *
     * @return The sort.
     */
    public @NotNull Sort getSort() {
        return sort;
    }
}
