package org.javai.execerror.ops;

import org.javai.execerror.CodedException;

/**
 * Reports execution failures to operators.
 * Implementations might write structured logs or raise alerts.
 */
@FunctionalInterface
public interface FailureReporter {

    /**
     * Reports a failure raised by the named operation.
     *
     * @param operation The operation that failed (e.g. "CALL", "Transfer.apply")
     * @param failure The failure, already wrapped with the operation name
     */
    void report(String operation, CodedException failure);

    /**
     * A reporter that does nothing.
     */
    static FailureReporter noOp() {
        return (operation, failure) -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     */
    static FailureReporter composite(FailureReporter... reporters) {
        return CompositeFailureReporter.of(reporters);
    }
}
