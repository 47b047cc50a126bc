package io.github.eutro.wasmlink.types;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * The structural subtyping relation between definition types.
 * <p>
 * Function, table, memory and global types are only subtypes of themselves.
 * An instance type {@code e1} is a subtype of {@code e2} if every export of {@code e2} is
 * present in {@code e1}, with a type that is a subtype of the one {@code e2} declares;
 * {@code e1} may have any number of additional exports.
 * A module type {@code (i1, e1)} is a subtype of {@code (i2, e2)} if {@code e1 <= e2}, as instances,
 * and the imports match by the import variance of the relation, one of the constants of this enum.
 * <p>
 * Both relations are reflexive and transitive, in either variance.
 */
public enum Subtyping {
    /**
     * Imports are contravariant: {@code (i1, e1) <= (i2, e2)} requires {@code i2 <= i1}, read as instance types.
     * <p>
     * A module that requires fewer, or weaker, imports is thus a subtype of one that requires more.
     */
    CONTRAVARIANT,
    /**
     * Imports are invariant: {@code (i1, e1) <= (i2, e2)} requires both {@code i2 <= i1} and {@code i1 <= i2}.
     * <p>
     * This is a strictly stronger relation than {@link #CONTRAVARIANT}.
     */
    EXACT,
    ;

    /**
     * Get whether {@code sub <= sup}.
     *
     * @param sub The candidate subtype.
     * @param sup The candidate supertype.
     * @return Whether sub is a subtype of sup.
     */
    @Contract(pure = true)
    public boolean isSubtype(@NotNull DefType sub, @NotNull DefType sup) {
        return explainMismatch(sub, sup) == null;
    }

    /**
     * Get whether the instance type {@code sub} is a subtype of {@code sup}.
     *
     * @param sub The candidate subtype.
     * @param sup The candidate supertype.
     * @return Whether sub is a subtype of sup.
     */
    @Contract(pure = true)
    public boolean isInstanceSubtype(@NotNull DefType.Instance sub, @NotNull DefType.Instance sup) {
        return isSubtype(sub, sup);
    }

    /**
     * Get whether the module type {@code sub} is a subtype of {@code sup}.
     *
     * @param sub The candidate subtype.
     * @param sup The candidate supertype.
     * @return Whether sub is a subtype of sup.
     */
    @Contract(pure = true)
    public boolean isModuleSubtype(@NotNull DefType.Module sub, @NotNull DefType.Module sup) {
        return isSubtype(sub, sup);
    }

    /**
     * Describe why {@code sub} is not a subtype of {@code sup}.
     * <p>
     * The description is the path through nested imports and exports to the first mismatch found,
     * such as {@code export "libc" > export "malloc": missing}.
     *
     * @param sub The candidate subtype.
     * @param sup The candidate supertype.
     * @return The description of the mismatch, or null if sub is a subtype of sup.
     */
    @Contract(pure = true)
    public @Nullable String explainMismatch(@NotNull DefType sub, @NotNull DefType sup) {
        if (sub == sup) return null;
        if (sub.getKind() != sup.getKind()) {
            return "expected " + sup.getKind() + ", found " + sub.getKind();
        }
        switch (sup.getKind()) {
            case INSTANCE:
                return exportsMismatch(
                        ((DefType.Instance) sub).getExports(),
                        ((DefType.Instance) sup).getExports()
                );
            case MODULE: {
                DefType.Module subModule = (DefType.Module) sub;
                DefType.Module supModule = (DefType.Module) sup;
                String mismatch = importsMismatch(subModule.getImports(), supModule.getImports());
                if (mismatch != null) return mismatch;
                return exportsMismatch(subModule.getExports(), supModule.getExports());
            }
            default:
                return sub.equals(sup) ? null : "expected " + sup + ", found " + sub;
        }
    }

    @Nullable
    private String exportsMismatch(Map<String, DefType> sub, Map<String, DefType> sup) {
        for (Map.Entry<String, DefType> entry : sup.entrySet()) {
            String where = "export " + TypePrinter.quote(entry.getKey());
            DefType subType = sub.get(entry.getKey());
            if (subType == null) return where + ": missing";
            String mismatch = explainMismatch(subType, entry.getValue());
            if (mismatch != null) return where + " > " + mismatch;
        }
        return null;
    }

    @Nullable
    private String importsMismatch(Map<String, DefType> sub, Map<String, DefType> sup) {
        // every import of the subtype must be satisfiable by whatever satisfies the supertype's
        for (Map.Entry<String, DefType> entry : sub.entrySet()) {
            String where = "import " + TypePrinter.quote(entry.getKey());
            DefType supType = sup.get(entry.getKey());
            if (supType == null) return where + ": required, but not imported by the expected module";
            String mismatch = explainMismatch(supType, entry.getValue());
            if (mismatch != null) return where + " > " + mismatch;
        }
        if (this == EXACT) {
            for (Map.Entry<String, DefType> entry : sup.entrySet()) {
                String where = "import " + TypePrinter.quote(entry.getKey());
                DefType subType = sub.get(entry.getKey());
                if (subType == null) return where + ": imported by the expected module, but not required";
                String mismatch = explainMismatch(subType, entry.getValue());
                if (mismatch != null) return where + " > " + mismatch;
            }
        }
        return null;
    }
}
