package io.github.eutro.wasmlink.embed;

import io.github.eutro.wasmlink.events.CancellableEvent;
import io.github.eutro.wasmlink.types.DefType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.Objects;

/**
 * Fired by a {@link Linker} before it checks an instantiation.
 * <p>
 * Listeners may add to, or remove from, the arguments that will be passed.
 * Cancelling the event vetoes the instantiation: the linker performs no check and
 * throws a {@link java.util.concurrent.CancellationException} with the reason instead.
 */
public class InstantiateEvent implements LinkerEvent, CancellableEvent {
    /**
     * The type of the module being instantiated.
     */
    @NotNull
    public final DefType.Module module;
    /**
     * The arguments that will be passed, by name. This map is mutable.
     */
    @NotNull
    public final Map<String, DefType> args;
    private String cancelReason;

    /**
     * Construct a new instantiate event.
     *
     * @param module The module being instantiated.
     * @param args   The mutable arguments.
     */
    public InstantiateEvent(@NotNull DefType.Module module, @NotNull Map<String, DefType> args) {
        this.module = module;
        this.args = args;
    }

    @Override
    public @Nullable String getCancelReason() {
        return cancelReason;
    }

    @Override
    public void cancel(@NotNull String reason) {
        if (cancelReason == null) cancelReason = Objects.requireNonNull(reason);
    }
}
