package org.javai.execerror.boundary;

import org.javai.execerror.ErrorCode;

/**
 * Chooses an error code for an exception that does not carry one.
 * Implementations should be deterministic.
 */
@FunctionalInterface
public interface ErrorCodeClassifier {

    /**
     * Classifies an exception.
     *
     * @param operation The operation that was being performed
     * @param throwable The exception that occurred
     * @return The code to attach, {@link ErrorCode#GENERIC} if nothing fits
     */
    ErrorCode classify(String operation, Throwable throwable);

    /**
     * A classifier that assigns {@link ErrorCode#GENERIC} to everything.
     */
    static ErrorCodeClassifier generic() {
        return (operation, throwable) -> ErrorCode.GENERIC;
    }
}
