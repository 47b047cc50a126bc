package io.github.eutro.wasmlink.types;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The type of a definition that can be imported, exported or aliased:
 * a function, table, memory, global, instance or module.
 * <p>
 * Function, table, memory and global types are the types of the core format, and are
 * only ever compared by equality. Instance and module types are structural maps from names
 * to types, and should be compared through {@link Subtyping}, as the order of their entries
 * is irrelevant to validity.
 * <p>
 * All implementations are immutable.
 */
public interface DefType {
    /**
     * Return whether this type is assignable from (is a supertype of) the other, by
     * {@link Subtyping#CONTRAVARIANT the default subtyping relation}.
     * <p>
     * This formally returns {@code this >= other}, for the subtyping relation {@code >=}.
     *
     * @param other The other type.
     * @return Whether this type matches (is a supertype of) other.
     */
    default boolean assignableFrom(@NotNull DefType other) {
        return Subtyping.CONTRAVARIANT.isSubtype(other, this);
    }

    /**
     * Get the kind of type this is.
     *
     * @return The kind.
     */
    @NotNull
    Kind getKind();

    /**
     * A function type, consisting of parameter and result types.
     */
    final class Func implements DefType {
        private final byte @NotNull [] params;
        private final byte @NotNull [] results;

        /**
         * Construct a function type with the given parameter and result types, as binary type codes.
         *
         * @param params  The parameter types.
         * @param results The result types.
         * @throws IllegalArgumentException If any of the codes is not a {@link ValType}.
         */
        public Func(byte @NotNull [] params, byte @NotNull [] results) {
            this.params = params.clone();
            this.results = results.clone();
            for (byte param : this.params) ValType.fromOpcode(param);
            for (byte result : this.results) ValType.fromOpcode(result);
        }

        /**
         * Create a function type from parameter and result value types.
         *
         * @param params  The parameter types.
         * @param results The result types.
         * @return The function type.
         */
        public static Func of(ValType @NotNull [] params, ValType @NotNull [] results) {
            return new Func(opcodes(params), opcodes(results));
        }

        private static byte[] opcodes(ValType[] types) {
            byte[] bytes = new byte[types.length];
            for (int i = 0; i < types.length; i++) {
                bytes[i] = types[i].getOpcode();
            }
            return bytes;
        }

        /**
         * Get the parameter types of the function.
         *
         * @return A copy of the parameter type codes.
         */
        public byte @NotNull [] getParams() {
            return params.clone();
        }

        /**
         * Get the result types of the function.
         *
         * @return A copy of the result type codes.
         */
        public byte @NotNull [] getResults() {
            return results.clone();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Func func = (Func) o;
            return Arrays.equals(params, func.params) && Arrays.equals(results, func.results);
        }

        @Override
        public int hashCode() {
            int result = Arrays.hashCode(params);
            result = 31 * result + Arrays.hashCode(results);
            return result;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(func");
            if (params.length != 0) {
                sb.append(" (param");
                for (byte param : params) sb.append(' ').append(ValType.fromOpcode(param));
                sb.append(')');
            }
            if (results.length != 0) {
                sb.append(" (result");
                for (byte result : results) sb.append(' ').append(ValType.fromOpcode(result));
                sb.append(')');
            }
            return sb.append(')').toString();
        }

        /**
         * {@inheritDoc}
         *
         * @return {@link Kind#FUNC}
         */
        @Override
        public @NotNull Kind getKind() {
            return Kind.FUNC;
        }
    }

    /**
     * A table type, consisting of limits and an element type.
     */
    final class Table implements DefType {
        /**
         * The limits of the table.
         */
        @NotNull
        public final Limits limits;
        /**
         * The type of elements of the table.
         */
        @NotNull
        public final ValType elementType;

        /**
         * Construct a table with the given limits and element type.
         *
         * @param limits      The limits.
         * @param elementType The element type, which must be a reference type.
         */
        public Table(@NotNull Limits limits, @NotNull ValType elementType) {
            if (!elementType.isReference()) {
                throw new IllegalArgumentException("Table element type must be a reference type, got " + elementType);
            }
            this.limits = limits;
            this.elementType = elementType;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Table table = (Table) o;
            return elementType == table.elementType && limits.equals(table.limits);
        }

        @Override
        public int hashCode() {
            return Objects.hash(limits, elementType);
        }

        @Override
        public String toString() {
            return "(table " + limits + " " + elementType + ")";
        }

        /**
         * {@inheritDoc}
         *
         * @return {@link Kind#TABLE}
         */
        @Override
        public @NotNull Kind getKind() {
            return Kind.TABLE;
        }
    }

    /**
     * A memory type, consisting of limits.
     */
    final class Mem implements DefType {
        /**
         * The limits of the memory, in pages.
         */
        @NotNull
        public final Limits limits;

        /**
         * Construct a memory type with the given limits.
         *
         * @param limits The limits.
         */
        public Mem(@NotNull Limits limits) {
            this.limits = limits;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Mem mem = (Mem) o;
            return limits.equals(mem.limits);
        }

        @Override
        public int hashCode() {
            return Objects.hash(limits);
        }

        @Override
        public String toString() {
            return "(memory " + limits + ")";
        }

        /**
         * {@inheritDoc}
         *
         * @return {@link Kind#MEMORY}
         */
        @Override
        public @NotNull Kind getKind() {
            return Kind.MEMORY;
        }
    }

    /**
     * A global type, consisting of a mutability and a value type.
     */
    final class Global implements DefType {
        /**
         * The mutability of the global, whether it can be assigned to.
         */
        public final boolean isMut;
        /**
         * The value type of the global.
         */
        @NotNull
        public final ValType type;

        /**
         * Construct a global type with the given mutability and value type.
         *
         * @param isMut The mutability.
         * @param type  The value type.
         */
        public Global(boolean isMut, @NotNull ValType type) {
            this.isMut = isMut;
            this.type = type;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Global global = (Global) o;
            return isMut == global.isMut && type == global.type;
        }

        @Override
        public int hashCode() {
            return Objects.hash(isMut, type);
        }

        @Override
        public String toString() {
            return isMut ? "(global (mut " + type + "))" : "(global " + type + ")";
        }

        /**
         * {@inheritDoc}
         *
         * @return {@link Kind#GLOBAL}
         */
        @Override
        public @NotNull Kind getKind() {
            return Kind.GLOBAL;
        }
    }

    /**
     * An instance type: a map from export names to their types.
     * <p>
     * Instances have no identity; two instance types with the same exports are equal,
     * regardless of the order in which those exports were declared.
     */
    final class Instance implements DefType {
        /**
         * The instance type with no exports.
         */
        public static final Instance EMPTY = new Instance(Collections.emptyMap());

        private final Map<String, DefType> exports;

        /**
         * Construct an instance type with the given exports.
         * <p>
         * The iteration order of the map is kept as the declaration order of the exports.
         *
         * @param exports The exports.
         */
        public Instance(@NotNull Map<String, ? extends DefType> exports) {
            this.exports = Collections.unmodifiableMap(new LinkedHashMap<>(exports));
        }

        /**
         * Start building an instance type.
         *
         * @return The builder.
         */
        public static Builder builder() {
            return new Builder();
        }

        /**
         * Get the exports of this instance type, in declaration order.
         *
         * @return An unmodifiable view of the exports.
         */
        public @NotNull Map<String, DefType> getExports() {
            return exports;
        }

        /**
         * Get the type of a named export.
         *
         * @param name The name of the export.
         * @return The type of the export, or null if there is no such export.
         */
        public @Nullable DefType getExport(String name) {
            return exports.get(name);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return exports.equals(((Instance) o).exports);
        }

        @Override
        public int hashCode() {
            return exports.hashCode();
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(instance");
            TypePrinter.appendEntries(sb, "export", exports);
            return sb.append(')').toString();
        }

        /**
         * {@inheritDoc}
         *
         * @return {@link Kind#INSTANCE}
         */
        @Override
        public @NotNull Kind getKind() {
            return Kind.INSTANCE;
        }

        /**
         * A builder for instance types, keeping exports in the order they were added.
         */
        public static final class Builder {
            private final Map<String, DefType> exports = new LinkedHashMap<>();

            private Builder() {
            }

            /**
             * Add an export.
             *
             * @param name The name of the export.
             * @param type The type of the export.
             * @return This builder, for convenience.
             * @throws IllegalArgumentException If an export with the name was already added.
             */
            public Builder export(@NotNull String name, @NotNull DefType type) {
                if (exports.putIfAbsent(name, type) != null) {
                    throw new IllegalArgumentException("Duplicate export \"" + name + "\"");
                }
                return this;
            }

            /**
             * Build the instance type.
             *
             * @return The instance type.
             */
            public Instance build() {
                return new Instance(exports);
            }
        }
    }

    /**
     * A module type: the types of the imports the module requires, and of the exports
     * an instance of it provides.
     */
    final class Module implements DefType {
        /**
         * The module type with no imports and no exports.
         */
        public static final Module EMPTY = new Module(Collections.emptyMap(), Collections.emptyMap());

        private final Map<String, DefType> imports;
        private final Map<String, DefType> exports;

        /**
         * Construct a module type with the given imports and exports.
         * <p>
         * The iteration order of the maps is kept as the declaration order of the imports and exports.
         *
         * @param imports The imports.
         * @param exports The exports.
         */
        public Module(@NotNull Map<String, ? extends DefType> imports, @NotNull Map<String, ? extends DefType> exports) {
            this.imports = Collections.unmodifiableMap(new LinkedHashMap<>(imports));
            this.exports = Collections.unmodifiableMap(new LinkedHashMap<>(exports));
        }

        /**
         * Get the imports of this module type, in declaration order.
         *
         * @return An unmodifiable view of the imports.
         */
        public @NotNull Map<String, DefType> getImports() {
            return imports;
        }

        /**
         * Get the exports of this module type, in declaration order.
         *
         * @return An unmodifiable view of the exports.
         */
        public @NotNull Map<String, DefType> getExports() {
            return exports;
        }

        /**
         * Get the imports of this module, read as an instance type.
         *
         * @return The import instance type.
         */
        public @NotNull Instance importsAsInstance() {
            return new Instance(imports);
        }

        /**
         * Get the type of the instances this module produces when instantiated.
         *
         * @return The export instance type.
         */
        public @NotNull Instance exportsAsInstance() {
            return new Instance(exports);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Module module = (Module) o;
            return imports.equals(module.imports) && exports.equals(module.exports);
        }

        @Override
        public int hashCode() {
            return 31 * imports.hashCode() + exports.hashCode();
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(module");
            TypePrinter.appendEntries(sb, "import", imports);
            TypePrinter.appendEntries(sb, "export", exports);
            return sb.append(')').toString();
        }

        /**
         * {@inheritDoc}
         *
         * @return {@link Kind#MODULE}
         */
        @Override
        public @NotNull Kind getKind() {
            return Kind.MODULE;
        }
    }

    /**
     * A set of limits, a minimum and (possibly) a maximum.
     * <p>
     * These should be considered unsigned.
     */
    final class Limits {
        /**
         * The minimum value.
         */
        public final int min;
        /**
         * The maximum value, or null if unbounded.
         */
        public final @Nullable Integer max;

        /**
         * Construct a set of limits with the given minimum and maximum.
         *
         * @param min The minimum.
         * @param max The maximum.
         */
        public Limits(int min, @Nullable Integer max) {
            this.min = min;
            this.max = max;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Limits limits = (Limits) o;
            return min == limits.min && Objects.equals(max, limits.max);
        }

        @Override
        public int hashCode() {
            return Objects.hash(min, max);
        }

        @Override
        public String toString() {
            return max == null
                    ? Integer.toUnsignedString(min)
                    : Integer.toUnsignedString(min) + " " + Integer.toUnsignedString(max);
        }
    }

    /**
     * The kinds of definitions, each of which has its own index space.
     */
    enum Kind {
        FUNC,
        TABLE,
        MEMORY,
        GLOBAL,
        INSTANCE,
        MODULE,
        ;

        @Override
        public String toString() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
