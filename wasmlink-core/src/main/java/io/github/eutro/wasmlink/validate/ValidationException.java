package io.github.eutro.wasmlink.validate;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Thrown when a definition sequence fails to validate.
 * <p>
 * The exception carries the {@link ErrorKind kind} of error, and the location of the failing definition:
 * the positions of the definitions enclosing it, from the outermost module inwards.
 */
public class ValidationException extends RuntimeException {
    private final ErrorKind kind;
    private final Deque<Integer> path = new ArrayDeque<>();

    /**
     * Construct a validation exception of the given kind.
     *
     * @param kind    The kind of error.
     * @param message The detail message.
     */
    public ValidationException(@NotNull ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Get the kind of error.
     *
     * @return The error kind.
     */
    public @NotNull ErrorKind getKind() {
        return kind;
    }

    /**
     * Get the location of the failing definition.
     * <p>
     * For example, {@code [3, 0]} is definition 0 of the module defined by definition 3
     * of the top-level module. The path is empty if the error was not raised by a definition,
     * such as for a host instantiation.
     *
     * @return The definition positions, outermost first.
     */
    public @NotNull List<Integer> getPath() {
        return new ArrayList<>(path);
    }

    /**
     * Record that the error occurred within the definition at the given position of the enclosing sequence.
     *
     * @param position The position.
     * @return This exception, for rethrowing.
     */
    ValidationException at(int position) {
        path.addFirst(position);
        return this;
    }

    @Override
    public String getMessage() {
        String message = super.getMessage();
        if (path.isEmpty()) return kind + ": " + message;
        return kind + " at definition " + path + ": " + message;
    }
}
