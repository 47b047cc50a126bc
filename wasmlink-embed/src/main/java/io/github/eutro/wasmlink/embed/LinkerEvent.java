package io.github.eutro.wasmlink.embed;

/**
 * An event fired by a {@link Linker}.
 */
public interface LinkerEvent {
}
