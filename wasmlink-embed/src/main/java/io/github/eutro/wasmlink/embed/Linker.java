package io.github.eutro.wasmlink.embed;

import io.github.eutro.wasmlink.events.EventSupplier;
import io.github.eutro.wasmlink.types.DefType;
import io.github.eutro.wasmlink.types.Subtyping;
import io.github.eutro.wasmlink.validate.Instantiation;
import io.github.eutro.wasmlink.validate.NamedType;
import io.github.eutro.wasmlink.validate.ValidationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.CancellationException;

/**
 * A registry of host-provided definitions, by name, which instantiates modules by passing
 * every definition as a named argument.
 * <p>
 * Arguments are matched to the imports of a module by name, so modules may import
 * any subset of the definitions, and with weaker types than those provided.
 */
public class Linker extends EventSupplier<LinkerEvent> {
    private static final Logger LOGGER = LoggerFactory.getLogger(Linker.class);

    private final Map<String, DefType> definitions = new LinkedHashMap<>();
    private final Subtyping subtyping;
    private boolean allowShadowing = false;

    /**
     * Construct a linker with {@link Subtyping#CONTRAVARIANT contravariant} imports.
     */
    public Linker() {
        this(Subtyping.CONTRAVARIANT);
    }

    /**
     * Construct a linker with the given subtyping relation.
     *
     * @param subtyping The subtyping relation arguments must satisfy.
     */
    public Linker(@NotNull Subtyping subtyping) {
        super(LinkerEvent.class);
        this.subtyping = subtyping;
    }

    /**
     * Set whether definitions may be replaced by later ones of the same name. By default, they may not.
     *
     * @param allowShadowing Whether to allow shadowing.
     * @return This linker, for convenience.
     */
    public Linker setAllowShadowing(boolean allowShadowing) {
        this.allowShadowing = allowShadowing;
        return this;
    }

    /**
     * Provide a definition.
     *
     * @param name The name of the definition.
     * @param type The type of the definition.
     * @return This linker, for convenience.
     * @throws IllegalArgumentException If the name is already defined and shadowing is not allowed.
     */
    public Linker define(@NotNull String name, @NotNull DefType type) {
        Objects.requireNonNull(type);
        if (!allowShadowing && definitions.containsKey(name)) {
            throw new IllegalArgumentException(String.format("'%s' is already defined", name));
        }
        definitions.put(name, type);
        return this;
    }

    /**
     * Provide an instance.
     *
     * @param name    The name of the instance.
     * @param exports The exports of the instance.
     * @return This linker, for convenience.
     * @throws IllegalArgumentException If the name is already defined and shadowing is not allowed.
     */
    public Linker defineInstance(@NotNull String name, @NotNull Map<String, ? extends DefType> exports) {
        return define(name, new DefType.Instance(exports));
    }

    /**
     * Provide an instance for each module name of an import object.
     *
     * @param importObject The import object.
     * @return This linker, for convenience.
     * @throws IllegalArgumentException If a module name is already defined and shadowing is not allowed.
     */
    public Linker defineAll(@NotNull ImportObject importObject) {
        for (NamedType arg : importObject.toArgs()) {
            define(arg.name, arg.type);
        }
        return this;
    }

    /**
     * Get a definition.
     *
     * @param name The name of the definition.
     * @return The type of the definition, or null if it is not defined.
     */
    public @Nullable DefType get(@NotNull String name) {
        return definitions.get(name);
    }

    /**
     * Check an instantiation of a module with the definitions of this linker.
     *
     * @param module The type of the module.
     * @return The type of the resulting instance.
     * @throws ValidationException      If the definitions do not satisfy the imports of the module.
     * @throws CancellationException    If a listener cancelled the {@link InstantiateEvent}.
     * @throws IllegalArgumentException If a listener left an argument without a type.
     */
    public @NotNull DefType.Instance instantiate(@NotNull DefType.Module module) {
        InstantiateEvent event = dispatch(new InstantiateEvent(module, new LinkedHashMap<>(definitions)));
        if (event.isCancelled()) {
            LOGGER.debug("Instantiation of {} cancelled: {}", module, event.getCancelReason());
            throw new CancellationException("Instantiation cancelled: " + event.getCancelReason());
        }
        List<NamedType> args = new ArrayList<>(event.args.size());
        for (Map.Entry<String, DefType> entry : event.args.entrySet()) {
            if (entry.getValue() == null) {
                throw new IllegalArgumentException(String.format("Argument '%s' has no type", entry.getKey()));
            }
            args.add(NamedType.of(entry.getKey(), entry.getValue()));
        }
        DefType.Instance instance = Instantiation.instantiate(module, args, subtyping);
        LOGGER.debug("Instantiated module with {} imports from {} definitions",
                module.getImports().size(), args.size());
        return instance;
    }

    /**
     * Check an instantiation of a module with the definitions of this linker,
     * and define the resulting instance.
     * <p>
     * This can be used to link a chain of libraries, each importing the previous ones.
     *
     * @param name   The name to define the instance as.
     * @param module The type of the module.
     * @return The type of the resulting instance.
     * @throws ValidationException      If the definitions do not satisfy the imports of the module.
     * @throws IllegalArgumentException If the name is already defined and shadowing is not allowed.
     */
    public @NotNull DefType.Instance instantiateAndDefine(@NotNull String name, @NotNull DefType.Module module) {
        DefType.Instance instance = instantiate(module);
        define(name, instance);
        return instance;
    }

    /**
     * Check an instantiation of a module with positional arguments, in the order the module declares its imports.
     *
     * @param module The type of the module.
     * @param args   The arguments.
     * @return The type of the resulting instance.
     * @throws IllegalArgumentException If the number of arguments is not the number of imports.
     * @throws ValidationException      If the arguments do not satisfy the imports of the module.
     */
    public @NotNull DefType.Instance instantiate(@NotNull DefType.Module module, @NotNull List<? extends DefType> args) {
        return Instantiation.instantiate(module, PositionalArgs.toNamed(module, args), subtyping);
    }

    /**
     * Check an instantiation of a module with a two-level import object.
     *
     * @param module       The type of the module.
     * @param importObject The import object.
     * @return The type of the resulting instance.
     * @throws ValidationException If the import object does not satisfy the imports of the module.
     */
    public @NotNull DefType.Instance instantiate(@NotNull DefType.Module module, @NotNull ImportObject importObject) {
        return Instantiation.instantiate(module, importObject.toArgs(), subtyping);
    }
}
