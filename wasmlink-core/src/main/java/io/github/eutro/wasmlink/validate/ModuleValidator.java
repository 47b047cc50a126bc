package io.github.eutro.wasmlink.validate;

import io.github.eutro.wasmlink.events.DefinitionValidatedEvent;
import io.github.eutro.wasmlink.events.EventSupplier;
import io.github.eutro.wasmlink.events.ModuleValidatedEvent;
import io.github.eutro.wasmlink.events.ValidationEvent;
import io.github.eutro.wasmlink.types.DefType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Validates modules: sequences of definitions, possibly containing nested modules, each
 * validated in a single forward pass.
 * <p>
 * Each definition may only reference definitions that precede it, so validation is all-or-nothing,
 * and stops at the first error, which is thrown as a {@link ValidationException}.
 * <p>
 * Listeners for {@link ValidationEvent}s can be registered on the validator to observe validation.
 */
public class ModuleValidator extends EventSupplier<ValidationEvent> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ModuleValidator.class);

    private final ValidatorOptions options;

    /**
     * Construct a validator with the {@link ValidatorOptions#DEFAULT default options}.
     */
    public ModuleValidator() {
        this(ValidatorOptions.DEFAULT);
    }

    /**
     * Construct a validator with the given options.
     *
     * @param options The options.
     */
    public ModuleValidator(@NotNull ValidatorOptions options) {
        super(ValidationEvent.class);
        this.options = options;
    }

    /**
     * Get the options of this validator.
     *
     * @return The options.
     */
    public @NotNull ValidatorOptions getOptions() {
        return options;
    }

    /**
     * Validate a top-level module.
     *
     * @param definitions The definitions of the module.
     * @return The type of the module.
     * @throws ValidationException If the module is invalid.
     */
    public @NotNull DefType.Module validateModule(@NotNull List<? extends Definition> definitions) {
        return validateModule(definitions, null);
    }

    /**
     * Validate a module nested in the given scope.
     * <p>
     * Outer aliases of the module can refer to the definitions of the parent as they are now.
     * The parent is not modified.
     *
     * @param definitions The definitions of the module.
     * @param parent      The scope of the enclosing module, or null for a top-level module.
     * @return The type of the module.
     * @throws ValidationException If the module is invalid.
     */
    public @NotNull DefType.Module validateModule(
            @NotNull List<? extends Definition> definitions,
            @Nullable Scope parent
    ) {
        return validateIn(parent == null ? Scope.root() : parent.child(), definitions);
    }

    /**
     * Validate independent top-level modules concurrently.
     * <p>
     * If any of the modules are invalid, the exception of the first of them is thrown,
     * with the exceptions of the others {@link Throwable#addSuppressed(Throwable) suppressed}.
     * If a validation fails with anything else, the remaining validations are cancelled and an
     * {@link IllegalStateException} is thrown, suppressing the first validation error seen until then.
     *
     * @param modules  The definitions of each module.
     * @param executor The executor to validate the modules on.
     * @return The types of the modules, in the same order.
     * @throws ValidationException  If any of the modules is invalid.
     * @throws IllegalStateException If a validation fails unexpectedly, or the thread is interrupted.
     */
    public @NotNull List<DefType.Module> validateAll(
            @NotNull List<? extends List<? extends Definition>> modules,
            @NotNull ExecutorService executor
    ) {
        List<Future<DefType.Module>> futures = new ArrayList<>();
        for (List<? extends Definition> definitions : modules) {
            futures.add(executor.submit(() -> validateModule(definitions)));
        }

        List<DefType.Module> types = new ArrayList<>();
        ValidationException failure = null;
        for (int i = 0; i < futures.size(); i++) {
            try {
                types.add(futures.get(i).get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (!(cause instanceof ValidationException)) {
                    cancelAll(futures);
                    IllegalStateException unexpected =
                            new IllegalStateException("Validation of module " + i + " failed unexpectedly", cause);
                    if (failure != null) unexpected.addSuppressed(failure);
                    throw unexpected;
                }
                LOGGER.debug("Module {} of {} is invalid", i, futures.size(), cause);
                if (failure == null) {
                    failure = (ValidationException) cause;
                } else {
                    failure.addSuppressed(cause);
                }
                types.add(null);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelAll(futures);
                IllegalStateException interrupted = new IllegalStateException("Interrupted while validating modules", e);
                if (failure != null) interrupted.addSuppressed(failure);
                throw interrupted;
            }
        }
        if (failure != null) throw failure;
        return types;
    }

    /**
     * Check whether an instance type is a subtype of another, by the subtyping relation of this validator.
     *
     * @param sub The candidate subtype.
     * @param sup The candidate supertype.
     * @return Whether sub is a subtype of sup.
     */
    public boolean checkInstanceSubtype(@NotNull DefType.Instance sub, @NotNull DefType.Instance sup) {
        return options.getSubtyping().isInstanceSubtype(sub, sup);
    }

    /**
     * Check whether a module type is a subtype of another, by the subtyping relation of this validator.
     *
     * @param sub The candidate subtype.
     * @param sup The candidate supertype.
     * @return Whether sub is a subtype of sup.
     */
    public boolean checkModuleSubtype(@NotNull DefType.Module sub, @NotNull DefType.Module sup) {
        return options.getSubtyping().isModuleSubtype(sub, sup);
    }

    /**
     * Check an instantiation of a module with named arguments.
     *
     * @param module The type of the module.
     * @param args   The named arguments.
     * @return The type of the resulting instance.
     * @throws ValidationException If the arguments do not satisfy the imports of the module.
     * @see Instantiation#instantiate(DefType.Module, List, io.github.eutro.wasmlink.types.Subtyping)
     */
    public @NotNull DefType.Instance instantiate(@NotNull DefType.Module module, @NotNull List<NamedType> args) {
        return Instantiation.instantiate(module, args, options.getSubtyping());
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> future : futures) future.cancel(true);
    }

    private DefType.Module validateIn(Scope scope, List<? extends Definition> definitions) {
        scope.begin();
        DefinitionValidator validator = new DefinitionValidator(scope);
        int position = 0;
        try {
            for (Definition definition : definitions) {
                Integer index;
                try {
                    index = definition.accept(validator);
                } catch (ValidationException e) {
                    throw e.at(position);
                }
                LOGGER.trace("Validated {} at depth {}, position {}", definition, scope.getDepth(), position);
                if (hasListeners(DefinitionValidatedEvent.class)) {
                    dispatch(new DefinitionValidatedEvent(scope.getDepth(), position, definition, index));
                }
                position++;
            }
        } catch (ValidationException e) {
            scope.fail();
            throw e;
        }
        DefType.Module type = scope.freeze();
        LOGGER.debug("Validated module of {} definitions at depth {}: {} imports, {} exports",
                position, scope.getDepth(), type.getImports().size(), type.getExports().size());
        dispatch(new ModuleValidatedEvent(scope.getDepth(), type));
        return type;
    }

    private class DefinitionValidator implements Definition.Visitor<Integer> {
        private final Scope scope;

        DefinitionValidator(Scope scope) {
            this.scope = scope;
        }

        @Override
        public Integer visitType(Definition.TypeDef def) {
            return scope.declareType(def.type);
        }

        @Override
        public Integer visitImport(Definition.Import def) {
            DefType type = def.type.resolve(scope);
            if (def.field == null) return scope.declareImport(def.name, type);
            if (!options.allowsTwoLevelImports()) {
                throw new ValidationException(ErrorKind.KIND_MISMATCH,
                        "Two-level import \"" + def.name + "\" \"" + def.field + "\" is not allowed");
            }
            return scope.declareImport(def.name, def.field, type);
        }

        @Override
        public Integer visitCore(Definition.Core def) {
            DefType type = def.type.resolve(scope);
            switch (type.getKind()) {
                case INSTANCE:
                case MODULE:
                    throw new ValidationException(ErrorKind.KIND_MISMATCH,
                            "Core definitions must be functions, tables, memories or globals, not " + type.getKind());
                default:
                    return scope.declare(type);
            }
        }

        @Override
        public Integer visitModule(Definition.ModuleDef def) {
            return scope.declare(validateIn(scope.child(), def.definitions));
        }

        @Override
        public Integer visitInstantiate(Definition.Instantiate def) {
            DefType.Module module = (DefType.Module) scope.resolve(DefType.Kind.MODULE, def.module);
            DefType.Instance instance = Instantiation.instantiate(module, resolveArgs(def.args), options.getSubtyping());
            LOGGER.debug("Instantiated module {} at depth {} with {} arguments",
                    def.module, scope.getDepth(), def.args.size());
            return scope.declare(instance);
        }

        @Override
        public Integer visitTuple(Definition.Tuple def) {
            return scope.declare(Instantiation.tuple(resolveArgs(def.args)));
        }

        @Override
        public Integer visitAliasExport(Definition.AliasExport def) {
            return AliasResolver.aliasExport(scope, def.instance, def.name, def.kind);
        }

        @Override
        public Integer visitAliasOuter(Definition.AliasOuter def) {
            return AliasResolver.aliasOuter(scope, def.count, def.sort, def.index);
        }

        @Override
        public Integer visitExport(Definition.Export def) {
            scope.declareExport(def.name, def.ref.resolve(scope));
            return null;
        }

        private List<NamedType> resolveArgs(List<Definition.Arg> args) {
            List<NamedType> resolved = new ArrayList<>(args.size());
            for (Definition.Arg arg : args) {
                resolved.add(NamedType.of(arg.name, arg.ref.resolve(scope)));
            }
            return resolved;
        }
    }
}
