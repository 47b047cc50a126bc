package io.github.eutro.wasmlink.events;

import io.github.eutro.wasmlink.validate.Definition;
import io.github.eutro.wasmlink.validate.ModuleValidator;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Fired when a definition has been validated and recorded in its module's scope.
 *
 * @see ModuleValidator
 */
public class DefinitionValidatedEvent implements ValidationEvent {
    /**
     * The number of modules enclosing the module of the definition.
     */
    public final int depth;
    /**
     * The position of the definition in its module.
     */
    public final int position;
    /**
     * The definition.
     */
    @NotNull
    public final Definition definition;
    /**
     * The index the definition was assigned in its index space, or null for exports,
     * which are not added to any index space.
     */
    @Nullable
    public final Integer index;

    /**
     * Construct a new definition validated event.
     *
     * @param depth      The nesting depth of the module.
     * @param position   The position of the definition.
     * @param definition The definition.
     * @param index      The assigned index, if any.
     */
    public DefinitionValidatedEvent(int depth, int position, @NotNull Definition definition, @Nullable Integer index) {
        this.depth = depth;
        this.position = position;
        this.definition = definition;
        this.index = index;
    }
}
