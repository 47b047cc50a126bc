package io.github.eutro.wasmlink.events;

import io.github.eutro.wasmlink.types.DefType;
import io.github.eutro.wasmlink.validate.ModuleValidator;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when all the definitions of a module, top-level or nested, have been validated.
 *
 * @see ModuleValidator
 */
public class ModuleValidatedEvent implements ValidationEvent {
    /**
     * The number of modules enclosing the module.
     */
    public final int depth;
    /**
     * The type of the module.
     */
    @NotNull
    public final DefType.Module type;

    /**
     * Construct a new module validated event.
     *
     * @param depth The nesting depth of the module.
     * @param type  The type of the module.
     */
    public ModuleValidatedEvent(int depth, @NotNull DefType.Module type) {
        this.depth = depth;
        this.type = type;
    }
}
