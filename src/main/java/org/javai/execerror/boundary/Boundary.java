package org.javai.execerror.boundary;

import org.javai.execerror.Coded;
import org.javai.execerror.CodedException;
import org.javai.execerror.CodedExceptions;
import org.javai.execerror.ErrorCode;
import org.javai.execerror.FailureSink;
import org.javai.execerror.ops.FailureReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Runs sub-operations of an execution and turns the exceptions they throw into
 * coded failures pushed to a {@link FailureSink}.
 *
 * <p>A captured exception keeps its own code when it is {@link Coded}; otherwise
 * the {@link ErrorCodeClassifier} picks one. The failure is wrapped with the
 * operation name, so a top-level caller sees e.g. {@code "CALL: Insufficient gas"}
 * with the code still {@link ErrorCode#INSUFFICIENT_GAS}.
 *
 * <p>{@link Error}s are not caught; they mean the host is in trouble, not the
 * executed code.
 *
 * <pre>{@code
 * FirstErrorLatch latch = new FirstErrorLatch();
 * Boundary boundary = Boundary.of(latch, new DefaultErrorCodeClassifier(), new Log4jFailureReporter());
 *
 * boundary.run("SSTORE", () -> storage.put(key, value));
 * Optional<byte[]> out = boundary.call("CALL", () -> callee.invoke(input));
 *
 * latch.failure().ifPresent(f -> ...);
 * }</pre>
 */
public final class Boundary {

    private static final Logger log = LoggerFactory.getLogger(Boundary.class);

    private static final ErrorCodeClassifier DEFAULT_CLASSIFIER = new DefaultErrorCodeClassifier();

    private final FailureSink sink;
    private final ErrorCodeClassifier classifier;
    private final FailureReporter reporter;

    /**
     * Creates a Boundary with the default classifier and no reporting.
     */
    public static Boundary into(FailureSink sink) {
        return new Boundary(sink, DEFAULT_CLASSIFIER, FailureReporter.noOp());
    }

    public static Boundary of(FailureSink sink, ErrorCodeClassifier classifier, FailureReporter reporter) {
        return new Boundary(sink, classifier, reporter);
    }

    public Boundary(FailureSink sink, ErrorCodeClassifier classifier, FailureReporter reporter) {
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * Runs work that produces a value.
     *
     * @param operation The operation name, used as message prefix and for reporting
     * @param work The work to execute
     * @return the value, or empty if the work failed or returned null
     */
    public <T> Optional<T> call(String operation, ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        try {
            return Optional.ofNullable(work.get());
        } catch (Exception e) {
            capture(operation, e);
            return Optional.empty();
        }
    }

    /**
     * Runs work that produces no value.
     *
     * @return true if the work completed, false if it failed
     */
    public boolean run(String operation, ThrowingRunnable<? extends Exception> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        try {
            work.run();
            return true;
        } catch (Exception e) {
            capture(operation, e);
            return false;
        }
    }

    private void capture(String operation, Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        CodedException failure = CodedExceptions.wrap(toCoded(operation, e), operation).orElseThrow();
        log.debug("Operation [{}] failed: {}", operation, failure);

        sink.push(failure);
        reporter.report(operation, failure);
    }

    private CodedException toCoded(String operation, Exception e) {
        if (e instanceof CodedException coded) {
            return coded;
        }
        ErrorCode code = e instanceof Coded coded
                ? coded.errorCode()
                : classifier.classify(operation, e);
        // An exception without a message still has to produce a failure
        String message = e.getMessage() == null || e.getMessage().isEmpty()
                ? e.getClass().getName()
                : e.getMessage();
        return CodedExceptions.of(code, message).orElseThrow();
    }
}
