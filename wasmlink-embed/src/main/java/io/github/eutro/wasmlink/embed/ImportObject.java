package io.github.eutro.wasmlink.embed;

import io.github.eutro.wasmlink.types.DefType;
import io.github.eutro.wasmlink.validate.NamedType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A two-level import object, mapping module names to fields to types, as a JavaScript host provides.
 * <p>
 * Each module name becomes a single instance-typed argument, exporting its fields. This matches
 * modules whose two-level imports were elaborated into instance imports.
 */
public final class ImportObject {
    private final Map<String, Map<String, DefType>> modules;

    private ImportObject(Map<String, Map<String, DefType>> modules) {
        Map<String, Map<String, DefType>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, DefType>> entry : modules.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(entry.getValue())));
        }
        this.modules = Collections.unmodifiableMap(copy);
    }

    /**
     * Start building an import object.
     *
     * @return The builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Get the fields provided for a module name.
     *
     * @param module The module name.
     * @return The fields, or null if the module name is not provided.
     */
    public @Nullable Map<String, DefType> getModule(@NotNull String module) {
        return modules.get(module);
    }

    /**
     * Get the module names provided.
     *
     * @return The module names, in the order they were added.
     */
    public @NotNull Set<String> getModuleNames() {
        return modules.keySet();
    }

    /**
     * Translate the import object to named arguments, one instance per module name.
     *
     * @return The arguments.
     */
    public @NotNull List<NamedType> toArgs() {
        List<NamedType> args = new ArrayList<>(modules.size());
        for (Map.Entry<String, Map<String, DefType>> entry : modules.entrySet()) {
            args.add(NamedType.of(entry.getKey(), new DefType.Instance(entry.getValue())));
        }
        return args;
    }

    /**
     * A builder for {@link ImportObject}s.
     */
    public static final class Builder {
        private final Map<String, Map<String, DefType>> modules = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Provide a field of a module.
         *
         * @param module The module name.
         * @param field  The field name.
         * @param type   The type of the provided value.
         * @return This builder, for convenience.
         * @throws IllegalArgumentException If the field was already provided.
         */
        public Builder add(@NotNull String module, @NotNull String field, @NotNull DefType type) {
            Map<String, DefType> fields = modules.computeIfAbsent(module, $ -> new LinkedHashMap<>());
            if (fields.putIfAbsent(field, Objects.requireNonNull(type)) != null) {
                throw new IllegalArgumentException(String.format("'%s' already provides '%s'", module, field));
            }
            return this;
        }

        /**
         * Build the import object.
         *
         * @return The import object.
         */
        public ImportObject build() {
            return new ImportObject(modules);
        }
    }
}
