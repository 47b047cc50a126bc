package io.github.eutro.wasmlink.validate;

import io.github.eutro.wasmlink.types.DefType;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The index spaces, imports and exports of a single module being validated.
 * <p>
 * A scope may have a parent, the lexically enclosing module, which is only read from to resolve
 * outer aliases. Of the parent, only the definitions that were declared when this scope was
 * created are visible.
 * <p>
 * Scopes are not thread-safe. A parent must not be modified while its child is being validated
 * on another thread.
 */
public final class Scope {
    /**
     * The lifecycle of a scope.
     */
    public enum State {
        /**
         * Created, but no definitions consumed yet.
         */
        EMPTY,
        /**
         * Definitions are being consumed.
         */
        ACCUMULATING,
        /**
         * All definitions were consumed successfully; the module type is fixed.
         */
        FROZEN,
        /**
         * A definition failed to validate.
         */
        FAILED,
    }

    private final @Nullable Scope parent;
    private final int @NotNull [] parentLimits;
    private final int depth;

    private final Map<Sort, IndexSpace<DefType>> spaces = new EnumMap<>(Sort.class);
    private final Map<String, DefType> imports = new LinkedHashMap<>();
    private final Map<String, Map<String, DefType>> elaboratedImports = new LinkedHashMap<>();
    private final Map<String, DefType> exports = new LinkedHashMap<>();
    private State state = State.EMPTY;
    private DefType.Module type;

    private Scope(@Nullable Scope parent) {
        this.parent = parent;
        this.depth = parent == null ? 0 : parent.depth + 1;
        this.parentLimits = new int[Sort.values().length];
        for (Sort sort : Sort.values()) {
            spaces.put(sort, new IndexSpace<>(sort));
            if (parent != null) parentLimits[sort.ordinal()] = parent.size(sort);
        }
    }

    /**
     * Create a scope for a top-level module, with no enclosing module.
     *
     * @return The new scope.
     */
    @Contract(pure = true)
    public static @NotNull Scope root() {
        return new Scope(null);
    }

    /**
     * Create a scope for a module nested in this one, at this point of this module's definitions.
     *
     * @return The new scope.
     */
    public @NotNull Scope child() {
        return new Scope(this);
    }

    /**
     * Get the enclosing scope.
     *
     * @return The parent, or null for a top-level scope.
     */
    public @Nullable Scope getParent() {
        return parent;
    }

    /**
     * Get the number of scopes that enclose this one.
     *
     * @return The depth; 0 for a top-level scope.
     */
    public int getDepth() {
        return depth;
    }

    /**
     * Get the current state of the scope.
     *
     * @return The state.
     */
    public @NotNull State getState() {
        return state;
    }

    /**
     * Get the number of definitions declared so far in the given index space.
     *
     * @param sort The index space.
     * @return The length of the space.
     */
    public int size(@NotNull Sort sort) {
        return spaces.get(sort).size();
    }

    /**
     * Append a definition to its kind's index space.
     *
     * @param def The definition.
     * @return The index of the definition.
     */
    public int declare(@NotNull DefType def) {
        return declare(Sort.of(def.getKind()), def);
    }

    /**
     * Append a type definition to the type index space.
     *
     * @param def The type.
     * @return The type index.
     */
    public int declareType(@NotNull DefType def) {
        return declare(Sort.TYPE, def);
    }

    private int declare(Sort sort, DefType def) {
        ensureAccumulating();
        return spaces.get(sort).declare(def);
    }

    /**
     * Resolve a definition of the given kind.
     *
     * @param kind  The kind of definition.
     * @param index The index in the kind's space.
     * @return The type of the definition.
     * @throws ValidationException If the index is not (yet) bound.
     */
    public @NotNull DefType resolve(@NotNull DefType.Kind kind, int index) {
        return resolve(Sort.of(kind), index);
    }

    /**
     * Resolve a definition in the given index space.
     *
     * @param sort  The index space.
     * @param index The index in it.
     * @return The type of the definition.
     * @throws ValidationException If the index is not (yet) bound.
     */
    public @NotNull DefType resolve(@NotNull Sort sort, int index) {
        return spaces.get(sort).resolve(index);
    }

    /**
     * Resolve a type definition.
     *
     * @param index The type index.
     * @return The type.
     * @throws ValidationException If the index is not (yet) bound.
     */
    public @NotNull DefType resolveType(int index) {
        return resolve(Sort.TYPE, index);
    }

    /**
     * Declare an import, appending it to its kind's index space.
     *
     * @param name The name of the import.
     * @param type The type of the import.
     * @return The index of the import in its kind's space.
     * @throws ValidationException If the module already has an import with that name.
     */
    public int declareImport(@NotNull String name, @NotNull DefType type) {
        ensureAccumulating();
        if (imports.containsKey(name)) {
            throw new ValidationException(ErrorKind.DUPLICATE_NAME, "Duplicate import \"" + name + "\"");
        }
        imports.put(name, type);
        return declare(type);
    }

    /**
     * Declare a two-level import, appending it to its kind's index space.
     * <p>
     * All two-level imports with the same module name are elaborated into a single
     * instance import of that name, which exports each field.
     *
     * @param module The module name of the import.
     * @param field  The field name of the import.
     * @param type   The type of the import.
     * @return The index of the import in its kind's space.
     * @throws ValidationException If the module name is taken by a single-level import,
     *                             or the field was already imported from that module.
     */
    public int declareImport(@NotNull String module, @NotNull String field, @NotNull DefType type) {
        ensureAccumulating();
        Map<String, DefType> fields = elaboratedImports.get(module);
        if (fields == null) {
            if (imports.containsKey(module)) {
                throw new ValidationException(ErrorKind.DUPLICATE_NAME, "Duplicate import \"" + module + "\"");
            }
            fields = new LinkedHashMap<>();
            elaboratedImports.put(module, fields);
        } else if (fields.containsKey(field)) {
            throw new ValidationException(ErrorKind.DUPLICATE_NAME,
                    "Duplicate import \"" + module + "\" \"" + field + "\"");
        }
        fields.put(field, type);
        // replacing keeps the position of the first import from the module
        imports.put(module, new DefType.Instance(fields));
        return declare(type);
    }

    /**
     * Declare an export. Exports are not added to any index space.
     *
     * @param name The name of the export.
     * @param type The type of the export.
     * @throws ValidationException If the module already has an export with that name.
     */
    public void declareExport(@NotNull String name, @NotNull DefType type) {
        ensureAccumulating();
        if (exports.containsKey(name)) {
            throw new ValidationException(ErrorKind.DUPLICATE_NAME, "Duplicate export \"" + name + "\"");
        }
        exports.put(name, type);
    }

    /**
     * Resolve a definition of an enclosing scope, as visible at the point this scope's module was declared.
     *
     * @param count The number of enclosing scopes to skip; 0 is the immediately enclosing scope.
     * @param sort  The index space.
     * @param index The index in the enclosing scope's space.
     * @return The type of the definition.
     * @throws ValidationException If there are not enough enclosing scopes, or the index is not bound.
     */
    public @NotNull DefType resolveOuter(int count, @NotNull Sort sort, int index) {
        if (count < 0) {
            throw new ValidationException(ErrorKind.ALIAS_DEPTH_ERROR,
                    "Outer alias count " + Integer.toUnsignedString(count) + " exceeds nesting depth " + depth);
        }
        Scope below = this;
        for (int i = 0; i < count && below.parent != null; i++) {
            below = below.parent;
        }
        if (below.parent == null) {
            throw new ValidationException(ErrorKind.ALIAS_DEPTH_ERROR,
                    "Outer alias count " + count + " exceeds nesting depth " + depth);
        }
        return below.parent.spaces.get(sort).resolve(index, below.parentLimits[sort.ordinal()]);
    }

    /**
     * Mark the start of the validation of the scope's definitions.
     */
    void begin() {
        if (state != State.EMPTY) throw new IllegalStateException("Scope already used: " + state);
        state = State.ACCUMULATING;
    }

    /**
     * Mark the scope as failed. It can no longer be modified or frozen.
     */
    void fail() {
        state = State.FAILED;
    }

    /**
     * Freeze the scope, ending its definitions.
     *
     * @return The type of the module.
     */
    @NotNull DefType.Module freeze() {
        if (state == State.EMPTY) state = State.ACCUMULATING;
        ensureAccumulating();
        state = State.FROZEN;
        return type = new DefType.Module(imports, exports);
    }

    /**
     * Get the type of the module, once the scope is frozen.
     *
     * @return The module type.
     * @throws IllegalStateException If the scope is not frozen.
     */
    public @NotNull DefType.Module getType() {
        if (state != State.FROZEN) throw new IllegalStateException("Scope is not frozen: " + state);
        return type;
    }

    private void ensureAccumulating() {
        if (state == State.EMPTY) {
            state = State.ACCUMULATING;
        } else if (state != State.ACCUMULATING) {
            throw new IllegalStateException("Scope is " + state);
        }
    }
}
