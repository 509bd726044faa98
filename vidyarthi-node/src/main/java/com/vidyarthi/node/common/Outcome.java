package com.vidyarthi.node.common;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Result of an operation that must never throw into application code.
 *
 * <ul>
 *   <li>{@link Ok} - the operation did what was asked.</li>
 *   <li>{@link Degraded} - the operation failed but produced a safe fallback value
 *       (plaintext left in place, empty map, throwaway key).</li>
 *   <li>{@link Failed} - the operation failed and there is no meaningful value.</li>
 * </ul>
 *
 * @param <T> value type
 */
public sealed interface Outcome<T> permits Outcome.Ok, Outcome.Degraded, Outcome.Failed {

    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static Outcome<Void> done() {
        return new Ok<>(null);
    }

    static <T> Outcome<T> degraded(T fallback, String reason, Throwable cause) {
        return new Degraded<>(fallback, reason, cause);
    }

    static <T> Outcome<T> failed(String reason) {
        return new Failed<>(reason, null);
    }

    static <T> Outcome<T> failed(String reason, Throwable cause) {
        return new Failed<>(reason, cause);
    }

    /**
     * True only for {@link Ok}.
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * The value for {@link Ok}, the fallback for {@link Degraded}, {@code other} for {@link Failed}.
     */
    default T orElse(T other) {
        if (this instanceof Ok<T> ok) {
            return ok.value();
        }
        if (this instanceof Degraded<T> degraded) {
            return degraded.fallback();
        }
        return other;
    }

    /**
     * The failure reason, empty for {@link Ok}.
     */
    default Optional<String> reason() {
        if (this instanceof Degraded<T> degraded) {
            return Optional.of(degraded.message());
        }
        if (this instanceof Failed<T> failed) {
            return Optional.of(failed.message());
        }
        return Optional.empty();
    }

    default <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        if (this instanceof Ok<T> ok) {
            return new Ok<>(mapper.apply(ok.value()));
        }
        if (this instanceof Degraded<T> degraded) {
            return new Degraded<>(mapper.apply(degraded.fallback()), degraded.message(), degraded.cause());
        }
        Failed<T> failed = (Failed<T>) this;
        return new Failed<>(failed.message(), failed.cause());
    }

    record Ok<T>(T value) implements Outcome<T> {}

    record Degraded<T>(T fallback, String message, Throwable cause) implements Outcome<T> {
        public Degraded {
            Objects.requireNonNull(message, "Message cannot be null");
        }
    }

    record Failed<T>(String message, Throwable cause) implements Outcome<T> {
        public Failed {
            Objects.requireNonNull(message, "Message cannot be null");
        }
    }
}
