package io.errorchain.core.chain;

import io.errorchain.core.error.Errors;
import java.io.Serializable;
import java.util.Objects;

/**
 * The cause edge of an {@link ErrorChain} node: the independent error explaining why the node
 * exists.
 *
 * <p>
 * Implementations are a sealed hierarchy. A {@link Chained} cause is itself a chain and renders
 * and matches through its own ancestry; a {@link Foreign} cause is any other {@link Throwable} and
 * terminates the chain-aware walk, falling back to its native message and {@code getCause()} links.
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface Cause extends Serializable {

    /**
     * Classifies an error as a chained or foreign cause.
     *
     * @param error the causing error
     * @return the cause variant, or {@code null} if {@code error} is null
     */
    static Cause of(Throwable error) {
        if (error == null) {
            return null;
        }
        if (error instanceof ErrorChain chain) {
            return new Chained(chain);
        }
        return new Foreign(error);
    }

    /** The underlying error. */
    Throwable error();

    /** Text appended after {@code " < "} when the owning node is rendered. */
    String render();

    /** Returns {@code true} if {@code target} is this cause or one of its ancestors or causes. */
    boolean matches(Throwable target);

    // ── Implementations ──

    /** A cause that is itself an error chain. */
    record Chained(ErrorChain chain) implements Cause {
        public Chained {
            Objects.requireNonNull(chain, "chain must not be null");
        }

        @Override
        public Throwable error() {
            return chain;
        }

        @Override
        public String render() {
            return chain.render();
        }

        @Override
        public boolean matches(Throwable target) {
            return chain.is(target);
        }
    }

    /** A cause of any other throwable type. */
    record Foreign(Throwable error) implements Cause {
        public Foreign {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public String render() {
            return Errors.describe(error);
        }

        @Override
        public boolean matches(Throwable target) {
            return Errors.is(error, target);
        }
    }
}
