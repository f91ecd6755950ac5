package io.errorchain.core.error;

import io.errorchain.core.chain.ErrorChain;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Helpers over plain {@link Throwable}s, for code that does not need a full {@link ErrorChain}.
 *
 * <p>
 * {@link #is} and {@link #find} follow {@link Throwable#getCause()} links, and for a chain node
 * also its parent. {@link ErrorChain#is} and {@link ErrorChain#find} share the same walk.
 */
public final class Errors {

    private Errors() {}

    /**
     * Decorates {@code err} with a message.
     *
     * @return {@code null} if {@code err} is null, {@code err} itself if {@code message} is null or
     *         empty, otherwise a {@link WrappedError} reading {@code "<err>: <message>"} that
     *         unwraps to {@code err}
     */
    public static Throwable wrapMessage(Throwable err, String message) {
        if (err == null) {
            return null;
        }
        if (message == null || message.isEmpty()) {
            return err;
        }
        return new WrappedError(describe(err) + ": " + message, err);
    }

    /**
     * Decorates {@code err} with a message and the text of a cause. Only {@code err} is unwrapped
     * to; the cause contributes text.
     *
     * <ul>
     *   <li>{@code err} null: {@code null}
     *   <li>{@code cause} null: same as {@link #wrapMessage}
     *   <li>{@code message} empty: {@code "<err>: <cause>"}
     *   <li>otherwise: {@code "<err>: <message>: <cause>"}
     * </ul>
     */
    public static Throwable wrapWithCause(Throwable err, Throwable cause, String message) {
        if (err == null) {
            return null;
        }
        if (cause == null) {
            return wrapMessage(err, message);
        }
        if (message == null || message.isEmpty()) {
            return new WrappedError(describe(err) + ": " + describe(cause), err);
        }
        return new WrappedError(describe(err) + ": " + message + ": " + describe(cause), err);
    }

    /**
     * Returns {@code true} if {@code target} is {@code err} or is reachable from it. Comparison is
     * by reference. Two nulls are considered equal.
     */
    public static boolean is(Throwable err, Throwable target) {
        if (err == null || target == null) {
            return err == target;
        }
        return walk(err, current -> current == target).isPresent();
    }

    /** Finds the first error of the given type reachable from {@code err}. */
    public static <T extends Throwable> Optional<T> find(Throwable err, Class<T> type) {
        return walk(err, type::isInstance).map(type::cast);
    }

    /**
     * Depth-first walk over everything reachable from {@code err}. A chain node is followed into
     * its cause before its parent; any other throwable into {@link Throwable#getCause()}. Each
     * error is visited once, so cause cycles, including ones that loop back into a chain, end the
     * walk.
     */
    private static Optional<Throwable> walk(Throwable err, Predicate<Throwable> match) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Throwable> pending = new ArrayDeque<>();
        if (err != null) {
            pending.push(err);
        }
        while (!pending.isEmpty()) {
            Throwable current = pending.pop();
            if (!seen.add(current)) {
                continue;
            }
            if (match.test(current)) {
                return Optional.of(current);
            }
            if (current instanceof ErrorChain chain) {
                if (chain.unwrap() != null) {
                    pending.push(chain.unwrap());
                }
                if (chain.cause() != null) {
                    pending.push(chain.cause());
                }
            } else if (current.getCause() != null) {
                pending.push(current.getCause());
            }
        }
        return Optional.empty();
    }

    /**
     * The display text of an error: its message, or {@link Throwable#toString()} when it has none.
     * An {@link ErrorChain} describes itself with its rendered form.
     */
    public static String describe(Throwable err) {
        if (err == null) {
            return "null";
        }
        String message = err.getMessage();
        return message != null ? message : err.toString();
    }
}
