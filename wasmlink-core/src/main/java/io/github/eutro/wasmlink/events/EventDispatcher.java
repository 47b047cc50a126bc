package io.github.eutro.wasmlink.events;

import org.jetbrains.annotations.NotNull;

import java.util.function.Consumer;

/**
 * Something that fires events of a family rooted at {@code S}, such as {@link ValidationEvent}.
 * <p>
 * A listener registered for a type receives every event of that type or of its subtypes,
 * so listening to the root type observes the whole family.
 *
 * @param <S> The root type of the events fired.
 */
public interface EventDispatcher<S> {
    /**
     * Register a listener for events of the given type and its subtypes.
     *
     * @param eventClass The event type, {@code S} or one of its subtypes.
     * @param listener   The listener.
     * @param <T>        The event type.
     */
    <T extends S> void listen(@NotNull Class<T> eventClass, @NotNull Consumer<? super T> listener);

    /**
     * Remove a listener registered with {@link #listen(Class, Consumer)}.
     *
     * @param eventClass The event type it was registered for.
     * @param listener   The listener.
     * @param <T>        The event type.
     * @return Whether the listener was registered.
     */
    <T extends S> boolean unlisten(@NotNull Class<T> eventClass, @NotNull Consumer<? super T> listener);
}
