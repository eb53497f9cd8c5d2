package org.javai.execerror.ops;

import org.javai.execerror.CodedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * A {@link FailureReporter} that delegates to multiple reporters.
 *
 * <p>Every reporter receives every failure. A reporter that throws is logged with
 * its stack trace and skipped; the remaining reporters still run.
 */
public final class CompositeFailureReporter implements FailureReporter {

	private static final Logger log = LoggerFactory.getLogger(CompositeFailureReporter.class);

	private final List<FailureReporter> reporters;

	private CompositeFailureReporter(List<FailureReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	/**
	 * Creates a composite from the given reporters.
	 *
	 * @throws NullPointerException if any reporter is null
	 */
	public static CompositeFailureReporter of(FailureReporter... reporters) {
		return new CompositeFailureReporter(Arrays.asList(reporters));
	}

	/**
	 * Creates a composite from a snapshot of the given collection.
	 *
	 * @throws NullPointerException if any reporter is null
	 */
	public static CompositeFailureReporter of(Collection<? extends FailureReporter> reporters) {
		Objects.requireNonNull(reporters, "reporters must not be null");
		return new CompositeFailureReporter(new ArrayList<>(reporters));
	}

	@Override
	public void report(String operation, CodedException failure) {
		for (FailureReporter reporter : reporters) {
			try {
				reporter.report(operation, failure);
			} catch (RuntimeException e) {
				log.warn("FailureReporter {} failed for operation [{}]",
						reporter.getClass().getName(), operation, e);
			}
		}
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}
}
