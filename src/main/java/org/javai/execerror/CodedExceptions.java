package org.javai.execerror;

import java.util.Objects;
import java.util.Optional;

/**
 * Factories and combinators for {@link CodedException}.
 *
 * <p>Every method returns {@code Optional.empty()} when there is no failure, and
 * every method accepting a {@link Throwable} treats {@code null} as no failure.
 * A failure is never represented by an exception with an empty message: building
 * one from an empty message yields {@code Optional.empty()}.
 */
public final class CodedExceptions {

    private CodedExceptions() {
        // Utility class
    }

    /**
     * Creates a failure with the given code and message.
     *
     * @return the failure, or empty if {@code message} is null or empty
     */
    public static Optional<CodedException> of(ErrorCode code, String message) {
        Objects.requireNonNull(code, "code must not be null");
        if (message == null || message.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new CodedException(code, message));
    }

    /**
     * Creates a failure that carries only a code. Its message is the code's
     * debug form, e.g. {@code "Error 4: Insufficient gas"}.
     */
    public static CodedException of(ErrorCode code) {
        Objects.requireNonNull(code, "code must not be null");
        return new CodedException(code, code.toString());
    }

    /**
     * Creates a failure with a formatted message.
     *
     * @see String#format(String, Object...)
     */
    public static Optional<CodedException> format(ErrorCode code, String format, Object... args) {
        Objects.requireNonNull(format, "format must not be null");
        return of(code, String.format(format, args));
    }

    /**
     * Creates a {@link ErrorCode#GENERIC} failure with a formatted message.
     */
    public static Optional<CodedException> format(String format, Object... args) {
        return format(ErrorCode.GENERIC, format, args);
    }

    /**
     * Converts any throwable to a coded failure.
     *
     * <ul>
     *   <li>{@code null} converts to empty.</li>
     *   <li>A {@link CodedException} is returned as is.</li>
     *   <li>Another {@link Coded} throwable keeps its code and message.</li>
     *   <li>Anything else becomes {@link ErrorCode#GENERIC} with its message.</li>
     * </ul>
     * A throwable without a message converts to empty.
     */
    public static Optional<CodedException> from(Throwable throwable) {
        if (throwable == null) {
            return Optional.empty();
        }
        if (throwable instanceof CodedException coded) {
            return Optional.of(coded);
        }
        if (throwable instanceof Coded coded) {
            return of(coded.errorCode(), throwable.getMessage());
        }
        return of(ErrorCode.GENERIC, throwable.getMessage());
    }

    /**
     * Adds context in front of a failure's message while keeping its code.
     * The result's message is {@code prefix + ": " + message}.
     *
     * @return the wrapped failure, or empty if {@code throwable} converts to empty
     */
    public static Optional<CodedException> wrap(Throwable throwable, String prefix) {
        Objects.requireNonNull(prefix, "prefix must not be null");
        return from(throwable).flatMap(e -> of(e.errorCode(), prefix + ": " + e.getMessage()));
    }

    /**
     * Returns the code of the converted failure, if there is one.
     */
    public static Optional<ErrorCode> codeOf(Throwable throwable) {
        return from(throwable).map(CodedException::errorCode);
    }

    /**
     * Compares two failures after conversion. Two absent failures are equal; an
     * absent failure never equals a present one; present failures are equal when
     * code and message are both equal.
     */
    public static boolean equal(Throwable a, Throwable b) {
        Optional<CodedException> left = from(a);
        Optional<CodedException> right = from(b);
        if (left.isEmpty() || right.isEmpty()) {
            return left.isEmpty() && right.isEmpty();
        }
        return left.get().errorCode().equals(right.get().errorCode())
                && left.get().getMessage().equals(right.get().getMessage());
    }
}
