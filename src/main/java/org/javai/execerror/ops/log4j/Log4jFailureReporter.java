package org.javai.execerror.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.execerror.CodedException;
import org.javai.execerror.ErrorCode;
import org.javai.execerror.ops.FailureReporter;
import org.javai.execerror.ops.ReporterConfig;

/**
 * Reports failures using Log4j2.
 *
 * <p>The level follows the error code:
 * <ul>
 *   <li>{@link ErrorCode#GENERIC} → ERROR, the failure was never classified</li>
 *   <li>{@link ErrorCode#EXECUTION_REVERTED} → INFO, the contract reverted on purpose</li>
 *   <li>anything else → WARN</li>
 * </ul>
 *
 * <p>Every entry carries the {@code EXEC_FAILURE} marker.
 */
public class Log4jFailureReporter implements FailureReporter {

	public static final String LOGGER_PROPERTY = "execerror.reporter.logger";
	public static final String LOGGER_ENV = "EXECERROR_REPORTER_LOGGER";
	static final String DEFAULT_LOGGER_NAME = "org.javai.execerror.FailureReporter";

	static final Marker FAILURE_MARKER = MarkerManager.getMarker("EXEC_FAILURE");

	private final Logger logger;

	/**
	 * Creates a reporter whose logger name comes from {@value #LOGGER_PROPERTY} or
	 * {@value #LOGGER_ENV}, or {@value #DEFAULT_LOGGER_NAME} if neither is set.
	 */
	public Log4jFailureReporter() {
		this(ReporterConfig.resolve(LOGGER_PROPERTY, LOGGER_ENV, DEFAULT_LOGGER_NAME));
	}

	public Log4jFailureReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jFailureReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(String operation, CodedException failure) {
		ErrorCode code = failure.errorCode();
		logger.atLevel(levelFor(code))
			.withMarker(FAILURE_MARKER)
			.log("Failure in operation [{}]: {} | code={}, description={}",
				operation,
				failure.getMessage(),
				code.unsignedValue(),
				code.description());
	}

	String loggerName() {
		return logger.getName();
	}

	static Level levelFor(ErrorCode code) {
		if (ErrorCode.GENERIC.equals(code)) {
			return Level.ERROR;
		}
		if (ErrorCode.EXECUTION_REVERTED.equals(code)) {
			return Level.INFO;
		}
		return Level.WARN;
	}
}
