package org.javai.execerror;

import java.util.Objects;

/**
 * One execution failure: an {@link ErrorCode} and a non-empty message.
 *
 * <p>Instances are created through {@link CodedExceptions}, which returns
 * {@code Optional.empty()} instead of an instance whenever there is no failure.
 * {@link #getMessage()} is the message as given; {@link #toString()} adds the
 * numeric code for logs.
 *
 * <p>No stack trace is recorded. A failure describes what went wrong in the
 * executed code, not where in the engine it was noticed.
 */
public final class CodedException extends RuntimeException implements Coded {

    private static final long serialVersionUID = 1L;

    private final ErrorCode code;

    CodedException(ErrorCode code, String message) {
        super(message, null, false, false);
        this.code = Objects.requireNonNull(code, "code must not be null");
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be empty");
        }
    }

    @Override
    public ErrorCode errorCode() {
        return code;
    }

    @Override
    public String toString() {
        return "Error " + Integer.toUnsignedString(code.value()) + ": " + getMessage();
    }
}
