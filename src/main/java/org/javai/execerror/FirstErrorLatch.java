package org.javai.execerror;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Keeps the first failure pushed to it and ignores the rest until {@link #reset()}.
 *
 * <p>In an execution trace the first failure is the root cause; later ones are
 * usually its consequences (a stack underflow after an aborted call, for instance)
 * and must not replace it.
 *
 * <p>Not thread-safe. A latch belongs to one sequential run; parallel branches
 * need a latch each.
 *
 * <pre>{@code
 * FirstErrorLatch latch = new FirstErrorLatch();
 * latch.push(null);                                  // still empty
 * latch.push(gasExhausted);                          // latched
 * latch.push(stackOverflow);                         // ignored
 * latch.failure();                                   // Optional[gasExhausted]
 * latch.reset();                                     // empty again
 * }</pre>
 */
public final class FirstErrorLatch implements FailureSink, FailureProvider {

    private static final Logger log = LoggerFactory.getLogger(FirstErrorLatch.class);

    private CodedException recorded;

    @Override
    public void push(Throwable failure) {
        if (recorded != null) {
            if (failure != null && log.isDebugEnabled()) {
                log.debug("Discarding {} after first failure {}", failure, recorded);
            }
            return;
        }
        CodedExceptions.from(failure).ifPresent(e -> recorded = e);
    }

    @Override
    public Optional<CodedException> failure() {
        return Optional.ofNullable(recorded);
    }

    /**
     * Discards the recorded failure so the latch can serve another run.
     */
    public void reset() {
        recorded = null;
    }

    @Override
    public String toString() {
        return recorded == null ? "FirstErrorLatch[empty]" : "FirstErrorLatch[" + recorded + "]";
    }
}
