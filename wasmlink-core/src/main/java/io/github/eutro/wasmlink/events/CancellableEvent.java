package io.github.eutro.wasmlink.events;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * An event whose listeners can veto the action it announces.
 * <p>
 * Once cancelled, the event is not passed to any further listeners, and the supplier
 * that dispatched it abandons the action, reporting the reason given.
 */
public interface CancellableEvent {
    /**
     * Get why the event was cancelled.
     *
     * @return The reason, or null if the event has not been cancelled.
     */
    @Nullable String getCancelReason();

    /**
     * Cancel the event. Only the first reason given is kept.
     *
     * @param reason Why the action should not happen.
     */
    void cancel(@NotNull String reason);

    /**
     * Get whether the event has been cancelled.
     *
     * @return Whether the event has been cancelled.
     */
    default boolean isCancelled() {
        return getCancelReason() != null;
    }
}
