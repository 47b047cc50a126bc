package io.github.eutro.wasmlink.validate;

import io.github.eutro.wasmlink.types.DefType;
import org.jetbrains.annotations.NotNull;

/**
 * Resolves aliases, injecting definitions of instances or of enclosing modules into a scope's index spaces.
 */
public final class AliasResolver {
    private AliasResolver() {
    }

    /**
     * Alias an export of an instance of the scope.
     * <p>
     * The export is looked up in the type the instance was given when it was defined.
     *
     * @param scope    The scope.
     * @param instance The index of the instance.
     * @param name     The name of the export.
     * @param kind     The expected kind of the export.
     * @return The index of the alias in the kind's index space.
     * @throws ValidationException If the instance index is unbound, the export does not exist,
     *                             or it is not of the expected kind.
     */
    public static int aliasExport(@NotNull Scope scope, int instance, @NotNull String name, @NotNull DefType.Kind kind) {
        DefType.Instance instanceType = (DefType.Instance) scope.resolve(DefType.Kind.INSTANCE, instance);
        DefType export = instanceType.getExport(name);
        if (export == null) {
            throw new ValidationException(ErrorKind.UNBOUND_EXPORT,
                    "Instance " + instance + " has no export \"" + name + "\"");
        }
        if (export.getKind() != kind) {
            throw new ValidationException(ErrorKind.KIND_MISMATCH,
                    "Export \"" + name + "\" of instance " + instance + " is a " + export.getKind() + ", not a " + kind);
        }
        return scope.declare(export);
    }

    /**
     * Alias a type or module of an enclosing module.
     * <p>
     * Only definitions that preceded the declaration of the nested module are visible.
     *
     * @param scope The scope.
     * @param count The number of enclosing modules to skip; 0 is the immediately enclosing module.
     * @param sort  The index space, which must be {@link Sort#TYPE} or {@link Sort#MODULE}.
     * @param index The index in the enclosing module's space.
     * @return The index of the alias in the scope's space of the same sort.
     * @throws ValidationException If the sort is not a type or module, there are not enough
     *                             enclosing modules, or the index is unbound.
     */
    public static int aliasOuter(@NotNull Scope scope, int count, @NotNull Sort sort, int index) {
        if (sort != Sort.TYPE && sort != Sort.MODULE) {
            throw new ValidationException(ErrorKind.KIND_MISMATCH,
                    "Outer aliases may only refer to types and modules, not " + sort);
        }
        DefType aliased = scope.resolveOuter(count, sort, index);
        return sort == Sort.TYPE ? scope.declareType(aliased) : scope.declare(aliased);
    }
}
