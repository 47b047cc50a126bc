/**
 * Events fired during validation and linking.
 * <p>
 * Each event family has a root type, {@link io.github.eutro.wasmlink.events.ValidationEvent} for
 * the validator, and an {@link io.github.eutro.wasmlink.events.EventSupplier} fires the family to
 * listeners of any of its types.
 */
package io.github.eutro.wasmlink.events;
