package io.github.eutro.wasmlink.events;

import io.github.eutro.wasmlink.validate.ModuleValidator;

/**
 * An event fired during the validation of a module.
 *
 * @see ModuleValidator
 */
public interface ValidationEvent {
}
