package org.javai.execerror;

/**
 * Accepts failures as they are raised during execution.
 */
@FunctionalInterface
public interface FailureSink {

    /**
     * Accepts a failure. {@code null} means no failure and is accepted as well.
     */
    void push(Throwable failure);
}
