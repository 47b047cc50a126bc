/**
 * Structural types of definitions, and the subtyping relation between them.
 */
package io.github.eutro.wasmlink.types;
