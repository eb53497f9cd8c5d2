package org.javai.execerror.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;
import org.javai.execerror.CodedExceptions;
import org.javai.execerror.ErrorCode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class Log4jFailureReporterTest {

    private static final String LOGGER_NAME = "org.javai.execerror.test.Log4jFailureReporterTest";

    static final class CapturingAppender extends AbstractAppender {
        final List<LogEvent> events = new ArrayList<>();

        CapturingAppender() {
            super("capture", null, null, true, Property.EMPTY_ARRAY);
        }

        @Override
        public void append(LogEvent event) {
            events.add(event.toImmutable());
        }
    }

    private CapturingAppender appender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        LoggerContext context = (LoggerContext) LogManager.getContext(false);
        logger = context.getLogger(LOGGER_NAME);
        appender = new CapturingAppender();
        appender.start();
        logger.addAppender(appender);
        logger.setLevel(Level.ALL);
    }

    @AfterEach
    void tearDown() {
        logger.removeAppender(appender);
        appender.stop();
        System.clearProperty(Log4jFailureReporter.LOGGER_PROPERTY);
    }

    @Test
    void report_logsOperationCodeAndMessageWithMarker() {
        new Log4jFailureReporter(LOGGER_NAME).report("CALL",
                CodedExceptions.of(ErrorCode.INSUFFICIENT_GAS, "CALL: gas exhausted").orElseThrow());

        assertThat(appender.events).hasSize(1);
        LogEvent event = appender.events.get(0);
        assertThat(event.getLevel()).isEqualTo(Level.WARN);
        assertThat(event.getMarker()).isEqualTo(Log4jFailureReporter.FAILURE_MARKER);
        assertThat(event.getMessage().getFormattedMessage())
                .isEqualTo("Failure in operation [CALL]: CALL: gas exhausted | code=4, description=Insufficient gas");
    }

    @Test
    void report_revertIsInfo() {
        new Log4jFailureReporter(LOGGER_NAME).report("tx",
                CodedExceptions.of(ErrorCode.EXECUTION_REVERTED, "tx: revert").orElseThrow());

        assertThat(appender.events).extracting(LogEvent::getLevel).containsExactly(Level.INFO);
    }

    @Test
    void levelFor_selectsByCode() {
        assertThat(Log4jFailureReporter.levelFor(ErrorCode.GENERIC)).isEqualTo(Level.ERROR);
        assertThat(Log4jFailureReporter.levelFor(ErrorCode.EXECUTION_REVERTED)).isEqualTo(Level.INFO);
        assertThat(Log4jFailureReporter.levelFor(ErrorCode.EXECUTION_ABORTED)).isEqualTo(Level.WARN);
        assertThat(Log4jFailureReporter.levelFor(ErrorCode.of(99))).isEqualTo(Level.WARN);
    }

    @Test
    void defaultConstructor_usesConfiguredLoggerName() {
        assertThat(new Log4jFailureReporter().loggerName())
                .isEqualTo(Log4jFailureReporter.DEFAULT_LOGGER_NAME);

        System.setProperty(Log4jFailureReporter.LOGGER_PROPERTY, "vm.failures");

        assertThat(new Log4jFailureReporter().loggerName()).isEqualTo("vm.failures");
    }
}
