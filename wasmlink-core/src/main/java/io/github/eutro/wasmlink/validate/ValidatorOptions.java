package io.github.eutro.wasmlink.validate;

import io.github.eutro.wasmlink.types.Subtyping;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Options for a {@link ModuleValidator}. Instances should typically be created with {@link #builder()}.
 */
public final class ValidatorOptions {
    /**
     * The default options: contravariant imports, and two-level imports accepted.
     */
    public static final ValidatorOptions DEFAULT = builder().build();

    private final Subtyping subtyping;
    private final boolean twoLevelImports;

    private ValidatorOptions(Builder builder) {
        this.subtyping = builder.subtyping;
        this.twoLevelImports = builder.twoLevelImports;
    }

    /**
     * Start a {@link Builder} for options.
     *
     * @return The new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Get the subtyping relation used to match instantiation arguments against imports.
     *
     * @return The subtyping relation.
     */
    public @NotNull Subtyping getSubtyping() {
        return subtyping;
    }

    /**
     * Get whether two-level imports are accepted, and elaborated into instance imports.
     *
     * @return Whether two-level imports are accepted.
     */
    public boolean allowsTwoLevelImports() {
        return twoLevelImports;
    }

    /**
     * A builder for {@link ValidatorOptions}.
     */
    public static final class Builder {
        private Subtyping subtyping = Subtyping.CONTRAVARIANT;
        private boolean twoLevelImports = true;

        private Builder() {
        }

        /**
         * Set the subtyping relation. By default, imports are {@link Subtyping#CONTRAVARIANT contravariant}.
         *
         * @param subtyping The subtyping relation.
         * @return This builder, for convenience.
         */
        public Builder setSubtyping(@NotNull Subtyping subtyping) {
            this.subtyping = Objects.requireNonNull(subtyping);
            return this;
        }

        /**
         * Set whether two-level imports are accepted. By default, they are.
         * <p>
         * If they are not, any two-level import fails with {@link ErrorKind#KIND_MISMATCH}.
         *
         * @param twoLevelImports Whether two-level imports are accepted.
         * @return This builder, for convenience.
         */
        public Builder setTwoLevelImports(boolean twoLevelImports) {
            this.twoLevelImports = twoLevelImports;
            return this;
        }

        /**
         * Build the options.
         *
         * @return The options.
         */
        public ValidatorOptions build() {
            return new ValidatorOptions(this);
        }
    }
}
