package io.github.eutro.wasmlink.validate;

import io.github.eutro.wasmlink.types.DefType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A single definition of a module, as produced by a decoder.
 * <p>
 * Definitions are consumed strictly in order by a {@link ModuleValidator}, and may only reference
 * definitions that precede them.
 *
 * @see Visitor
 */
public abstract class Definition {
    Definition() {
    }

    /**
     * Call the method of the visitor corresponding to this definition.
     *
     * @param visitor The visitor.
     * @param <R>     The result type of the visitor.
     * @return The result of the visitor.
     */
    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * A visitor over the different definitions.
     *
     * @param <R> The result type.
     */
    public interface Visitor<R> {
        /**
         * Visit a type definition.
         *
         * @param def The definition.
         * @return The result of the visitor.
         */
        R visitType(TypeDef def);

        /**
         * Visit an import.
         *
         * @param def The definition.
         * @return The result of the visitor.
         */
        R visitImport(Import def);

        /**
         * Visit a core function, table, memory or global.
         *
         * @param def The definition.
         * @return The result of the visitor.
         */
        R visitCore(Core def);

        /**
         * Visit a nested module.
         *
         * @param def The definition.
         * @return The result of the visitor.
         */
        R visitModule(ModuleDef def);

        /**
         * Visit an instantiation of a module.
         *
         * @param def The definition.
         * @return The result of the visitor.
         */
        R visitInstantiate(Instantiate def);

        /**
         * Visit an instance bundled from existing definitions.
         *
         * @param def The definition.
         * @return The result of the visitor.
         */
        R visitTuple(Tuple def);

        /**
         * Visit an alias of an instance export.
         *
         * @param def The definition.
         * @return The result of the visitor.
         */
        R visitAliasExport(AliasExport def);

        /**
         * Visit an alias of a definition of an enclosing module.
         *
         * @param def The definition.
         * @return The result of the visitor.
         */
        R visitAliasOuter(AliasOuter def);

        /**
         * Visit an export.
         *
         * @param def The definition.
         * @return The result of the visitor.
         */
        R visitExport(Export def);
    }

    /**
     * Define a type, appending it to the type index space.
     *
     * @param type The type.
     * @return The definition.
     */
    public static TypeDef type(@NotNull DefType type) {
        return new TypeDef(type);
    }

    /**
     * Import a definition by a single name.
     *
     * @param name The name of the import.
     * @param type The type of the import.
     * @return The definition.
     */
    public static Import importing(@NotNull String name, @NotNull TypeUse type) {
        return new Import(name, null, type);
    }

    /**
     * Import a definition by a module and field name, as in the core format.
     *
     * @param module The module name.
     * @param field  The field name.
     * @param type   The type of the import.
     * @return The definition.
     */
    public static Import importing(@NotNull String module, @NotNull String field, @NotNull TypeUse type) {
        return new Import(module, Objects.requireNonNull(field), type);
    }

    /**
     * Define a core function, table, memory or global in the module itself.
     *
     * @param type The type of the definition.
     * @return The definition.
     */
    public static Core core(@NotNull TypeUse type) {
        return new Core(type);
    }

    /**
     * Define a nested module.
     *
     * @param definitions The definitions of the module.
     * @return The definition.
     */
    public static ModuleDef module(Definition... definitions) {
        return new ModuleDef(Arrays.asList(definitions));
    }

    /**
     * Define a nested module.
     *
     * @param definitions The definitions of the module.
     * @return The definition.
     */
    public static ModuleDef module(@NotNull List<? extends Definition> definitions) {
        return new ModuleDef(definitions);
    }

    /**
     * Define an instance by instantiating a module.
     *
     * @param module The index of the module.
     * @param args   The named arguments.
     * @return The definition.
     */
    public static Instantiate instantiate(int module, Arg... args) {
        return new Instantiate(module, Arrays.asList(args));
    }

    /**
     * Define an instance by bundling existing definitions.
     *
     * @param args The named exports of the instance.
     * @return The definition.
     */
    public static Tuple tuple(Arg... args) {
        return new Tuple(Arrays.asList(args));
    }

    /**
     * Alias an export of an instance.
     *
     * @param instance The index of the instance.
     * @param name     The name of the export.
     * @param kind     The expected kind of the export.
     * @return The definition.
     */
    public static AliasExport aliasExport(int instance, @NotNull String name, @NotNull DefType.Kind kind) {
        return new AliasExport(instance, name, kind);
    }

    /**
     * Alias a definition of an enclosing module.
     *
     * @param count The number of enclosing modules to skip; 0 is the immediately enclosing module.
     * @param sort  The index space of the definition, {@link Sort#TYPE} or {@link Sort#MODULE}.
     * @param index The index of the definition in the enclosing module.
     * @return The definition.
     */
    public static AliasOuter aliasOuter(int count, @NotNull Sort sort, int index) {
        return new AliasOuter(count, sort, index);
    }

    /**
     * Export a definition.
     *
     * @param name  The name of the export.
     * @param kind  The kind of definition.
     * @param index The index of the definition.
     * @return The definition.
     */
    public static Export export(@NotNull String name, @NotNull DefType.Kind kind, int index) {
        return new Export(name, new ItemRef(kind, index));
    }

    /**
     * A type definition.
     */
    public static final class TypeDef extends Definition {
        /**
         * The defined type.
         */
        public final @NotNull DefType type;

        TypeDef(@NotNull DefType type) {
            this.type = Objects.requireNonNull(type);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitType(this);
        }

        @Override
        public String toString() {
            return "(type " + type + ")";
        }
    }

    /**
     * An import, by a single name or by a module and field name.
     */
    public static final class Import extends Definition {
        /**
         * The name of the import, or the module name of a two-level import.
         */
        public final @NotNull String name;
        /**
         * The field name of a two-level import, or null for a single-level one.
         */
        public final @Nullable String field;
        /**
         * The type of the imported definition.
         */
        public final @NotNull TypeUse type;

        Import(@NotNull String name, @Nullable String field, @NotNull TypeUse type) {
            this.name = Objects.requireNonNull(name);
            this.field = field;
            this.type = Objects.requireNonNull(type);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitImport(this);
        }

        @Override
        public String toString() {
            return "(import \"" + name + "\"" + (field == null ? "" : " \"" + field + "\"") + " " + type + ")";
        }
    }

    /**
     * A function, table, memory or global defined by the core format, in the module itself.
     * <p>
     * Its body is validated elsewhere; only its type matters here.
     */
    public static final class Core extends Definition {
        /**
         * The type of the definition; its kind must not be instance or module.
         */
        public final @NotNull TypeUse type;

        Core(@NotNull TypeUse type) {
            this.type = Objects.requireNonNull(type);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCore(this);
        }

        @Override
        public String toString() {
            return "(core " + type + ")";
        }
    }

    /**
     * A nested module.
     */
    public static final class ModuleDef extends Definition {
        /**
         * The definitions of the module, in order.
         */
        public final @NotNull List<Definition> definitions;

        ModuleDef(@NotNull List<? extends Definition> definitions) {
            this.definitions = Collections.unmodifiableList(new ArrayList<>(definitions));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitModule(this);
        }

        @Override
        public String toString() {
            return "(module <" + definitions.size() + " definitions>)";
        }
    }

    /**
     * An instance created by instantiating a module with named arguments.
     */
    public static final class Instantiate extends Definition {
        /**
         * The index of the module to instantiate.
         */
        public final int module;
        /**
         * The named arguments, matched against the imports of the module.
         */
        public final @NotNull List<Arg> args;

        Instantiate(int module, @NotNull List<Arg> args) {
            this.module = module;
            this.args = Collections.unmodifiableList(new ArrayList<>(args));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInstantiate(this);
        }

        @Override
        public String toString() {
            return "(instance (instantiate " + module + " " + args + "))";
        }
    }

    /**
     * An instance created by bundling existing definitions as its exports.
     */
    public static final class Tuple extends Definition {
        /**
         * The named exports of the instance.
         */
        public final @NotNull List<Arg> args;

        Tuple(@NotNull List<Arg> args) {
            this.args = Collections.unmodifiableList(new ArrayList<>(args));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTuple(this);
        }

        @Override
        public String toString() {
            return "(instance " + args + ")";
        }
    }

    /**
     * An alias of an export of an instance in the same module.
     */
    public static final class AliasExport extends Definition {
        /**
         * The index of the instance.
         */
        public final int instance;
        /**
         * The name of the export.
         */
        public final @NotNull String name;
        /**
         * The kind the export is expected to have.
         */
        public final @NotNull DefType.Kind kind;

        AliasExport(int instance, @NotNull String name, @NotNull DefType.Kind kind) {
            this.instance = instance;
            this.name = Objects.requireNonNull(name);
            this.kind = Objects.requireNonNull(kind);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAliasExport(this);
        }

        @Override
        public String toString() {
            return "(alias " + instance + " \"" + name + "\" (" + kind + "))";
        }
    }

    /**
     * An alias of a definition of an enclosing module.
     */
    public static final class AliasOuter extends Definition {
        /**
         * The number of enclosing modules to skip; 0 is the immediately enclosing module.
         */
        public final int count;
        /**
         * The index space of the definition, {@link Sort#TYPE} or {@link Sort#MODULE}.
         */
        public final @NotNull Sort sort;
        /**
         * The index of the definition in the enclosing module.
         */
        public final int index;

        AliasOuter(int count, @NotNull Sort sort, int index) {
            this.count = count;
            this.sort = Objects.requireNonNull(sort);
            this.index = index;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAliasOuter(this);
        }

        @Override
        public String toString() {
            return "(alias outer " + count + " " + index + " (" + sort + "))";
        }
    }

    /**
     * An export of a definition of the module.
     */
    public static final class Export extends Definition {
        /**
         * The name of the export.
         */
        public final @NotNull String name;
        /**
         * The exported definition.
         */
        public final @NotNull ItemRef ref;

        Export(@NotNull String name, @NotNull ItemRef ref) {
            this.name = Objects.requireNonNull(name);
            this.ref = Objects.requireNonNull(ref);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitExport(this);
        }

        @Override
        public String toString() {
            return "(export \"" + name + "\" " + ref + ")";
        }
    }

    /**
     * A named reference, an argument of an instantiation or an export of an instance tuple.
     */
    public static final class Arg {
        /**
         * The name of the argument or export.
         */
        public final @NotNull String name;
        /**
         * The referenced definition.
         */
        public final @NotNull ItemRef ref;

        private Arg(@NotNull String name, @NotNull ItemRef ref) {
            this.name = Objects.requireNonNull(name);
            this.ref = Objects.requireNonNull(ref);
        }

        /**
         * Create a named reference.
         *
         * @param name  The name.
         * @param kind  The kind of definition.
         * @param index The index of the definition.
         * @return The named reference.
         */
        public static Arg of(@NotNull String name, @NotNull DefType.Kind kind, int index) {
            return new Arg(name, new ItemRef(kind, index));
        }

        @Override
        public String toString() {
            return "(\"" + name + "\" " + ref + ")";
        }
    }
}
