/**
 * Instantiation of validated module types by a host, from named, two-level or positional arguments.
 */
package io.github.eutro.wasmlink.embed;
