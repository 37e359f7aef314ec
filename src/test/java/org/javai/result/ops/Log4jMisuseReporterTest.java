package org.javai.result.ops;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.config.Property;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class Log4jMisuseReporterTest {

    private static final String LOGGER_NAME = "org.javai.result.test.Misuse";

    private LoggerContext context;
    private CapturingAppender appender;

    @BeforeEach
    void setUp() {
        context = (LoggerContext) LogManager.getContext(false);
        Configuration config = context.getConfiguration();
        appender = new CapturingAppender();
        appender.start();
        config.addAppender(appender);
        LoggerConfig loggerConfig = new LoggerConfig(LOGGER_NAME, Level.ALL, false);
        loggerConfig.addAppender(appender, null, null);
        config.addLogger(LOGGER_NAME, loggerConfig);
        context.updateLoggers();
    }

    @AfterEach
    void tearDown() {
        Configuration config = context.getConfiguration();
        config.removeLogger(LOGGER_NAME);
        appender.stop();
        context.updateLoggers();
    }

    @Test
    void report_logsWarnWithMisuseMarker() {
        Log4jMisuseReporter reporter = new Log4jMisuseReporter(LOGGER_NAME);
        Misuse misuse = new Misuse("unwrapErr", "Called unwrapErr on an Ok value", "java.lang.Integer",
                "worker-3", Instant.parse("2024-05-01T12:00:00Z"));

        reporter.report(misuse);

        assertThat(appender.events).hasSize(1);
        LogEvent event = appender.events.get(0);
        assertThat(event.getLevel()).isEqualTo(Level.WARN);
        assertThat(event.getMarker()).isNotNull();
        assertThat(event.getMarker().getName()).isEqualTo("RESULT_MISUSE");
        assertThat(event.getMessage().getFormattedMessage())
                .contains("[unwrapErr]")
                .contains("[worker-3]")
                .contains("Called unwrapErr on an Ok value")
                .contains("payloadType=java.lang.Integer");
    }

    @Test
    void constructor_blankLoggerName_throws() {
        assertThatThrownBy(() -> new Log4jMisuseReporter(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static final class CapturingAppender extends AbstractAppender {

        private final List<LogEvent> events = new ArrayList<>();

        private CapturingAppender() {
            super("Capturing", null, null, true, Property.EMPTY_ARRAY);
        }

        @Override
        public void append(LogEvent event) {
            events.add(event.toImmutable());
        }
    }
}
