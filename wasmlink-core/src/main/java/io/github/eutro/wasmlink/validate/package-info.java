/**
 * Validation of modules that import, export, alias and instantiate modules and instances.
 * <p>
 * The main entrypoint is {@link io.github.eutro.wasmlink.validate.ModuleValidator}, which consumes
 * the {@link io.github.eutro.wasmlink.validate.Definition}s of a module and yields its
 * {@link io.github.eutro.wasmlink.types.DefType.Module type}.
 */
package io.github.eutro.wasmlink.validate;
