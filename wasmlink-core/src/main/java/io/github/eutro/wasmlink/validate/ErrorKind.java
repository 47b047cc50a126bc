package io.github.eutro.wasmlink.validate;

/**
 * The kinds of validation error. All of them are fatal to the module being validated.
 */
public enum ErrorKind {
    /**
     * Two imports, or two exports, of a module share a name.
     */
    DUPLICATE_NAME,
    /**
     * A definition references an index not (yet) present in the relevant index space.
     */
    UNBOUND_INDEX,
    /**
     * An alias names an export that the instance does not have.
     */
    UNBOUND_EXPORT,
    /**
     * A reference resolves to a definition of the wrong kind.
     */
    KIND_MISMATCH,
    /**
     * An instantiation argument's type is not a subtype of the declared import type.
     */
    SUBTYPE_ERROR,
    /**
     * An instantiation provides no argument for an import of the module.
     */
    MISSING_IMPORT,
    /**
     * An instantiation or instance tuple repeats an argument name.
     */
    DUPLICATE_ARG_NAME,
    /**
     * An outer alias reaches out further than there are enclosing modules.
     */
    ALIAS_DEPTH_ERROR,
}
