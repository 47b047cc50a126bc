package io.github.eutro.wasmlink.events;

import org.jetbrains.annotations.NotNull;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fires events of the family rooted at {@code S} to the listeners registered for them.
 * <p>
 * An event reaches the listeners of its own class first, then those of its supertypes within the family,
 * nearest first, each in registration order. Dispatch of a {@link CancellableEvent} stops as soon
 * as it is cancelled.
 * <p>
 * Listeners may be added and events dispatched from any thread; listeners run on the dispatching thread.
 *
 * @param <S> The root type of the events fired.
 */
public class EventSupplier<S> implements EventDispatcher<S> {
    private final Class<S> rootType;
    private final Map<Class<?>, List<Consumer<?>>> listeners = new ConcurrentHashMap<>();
    private final Map<Class<?>, List<Class<?>>> lineages = new ConcurrentHashMap<>();

    /**
     * Construct a supplier of events rooted at the given type.
     *
     * @param rootType The root event type.
     */
    protected EventSupplier(@NotNull Class<S> rootType) {
        this.rootType = Objects.requireNonNull(rootType);
    }

    @Override
    public <T extends S> void listen(@NotNull Class<T> eventClass, @NotNull Consumer<? super T> listener) {
        listeners.computeIfAbsent(eventClass, $ -> new CopyOnWriteArrayList<>())
                .add(Objects.requireNonNull(listener));
    }

    @Override
    public <T extends S> boolean unlisten(@NotNull Class<T> eventClass, @NotNull Consumer<? super T> listener) {
        List<Consumer<?>> registered = listeners.get(eventClass);
        return registered != null && registered.remove(listener);
    }

    /**
     * Get whether any listener would receive an event of the given class, so that
     * building the event can be skipped if not.
     *
     * @param eventClass The class of the event.
     * @return Whether there are listeners.
     */
    public boolean hasListeners(@NotNull Class<? extends S> eventClass) {
        for (Class<?> type : lineage(eventClass)) {
            List<Consumer<?>> registered = listeners.get(type);
            if (registered != null && !registered.isEmpty()) return true;
        }
        return false;
    }

    /**
     * Fire an event to the listeners of its class and of its supertypes.
     *
     * @param event The event.
     * @param <T>   The type of the event.
     * @return The event, as the listeners left it.
     */
    public <T extends S> T dispatch(@NotNull T event) {
        for (Class<?> type : lineage(event.getClass())) {
            List<Consumer<?>> registered = listeners.get(type);
            if (registered == null) continue;
            for (Consumer<?> listener : registered) {
                if (isCancelled(event)) return event;
                @SuppressWarnings("unchecked")
                Consumer<Object> consumer = (Consumer<Object>) listener;
                consumer.accept(event);
            }
        }
        return event;
    }

    private static boolean isCancelled(Object event) {
        return event instanceof CancellableEvent && ((CancellableEvent) event).isCancelled();
    }

    // the class and its supertypes that are still in the event family, nearest first
    private List<Class<?>> lineage(Class<?> eventClass) {
        return lineages.computeIfAbsent(eventClass, start -> {
            List<Class<?>> lineage = new ArrayList<>();
            Deque<Class<?>> queue = new ArrayDeque<>();
            queue.add(start);
            while (!queue.isEmpty()) {
                Class<?> type = queue.poll();
                if (!rootType.isAssignableFrom(type) || lineage.contains(type)) continue;
                lineage.add(type);
                if (type.getSuperclass() != null) queue.add(type.getSuperclass());
                Collections.addAll(queue, type.getInterfaces());
            }
            return Collections.unmodifiableList(lineage);
        });
    }
}
