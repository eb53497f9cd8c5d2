package org.javai.execerror;

import java.util.Optional;

/**
 * Exposes the failure of an execution context, if one occurred.
 */
public interface FailureProvider {

    /**
     * Returns the failure that occurred, or empty if execution has not failed.
     */
    Optional<CodedException> failure();

    default boolean hasFailed() {
        return failure().isPresent();
    }

    /**
     * Throws the held failure, if any.
     *
     * @throws CodedException the failure returned by {@link #failure()}
     */
    default void throwIfFailed() {
        Optional<CodedException> failure = failure();
        if (failure.isPresent()) {
            throw failure.get();
        }
    }
}
