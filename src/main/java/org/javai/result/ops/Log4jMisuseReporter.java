package org.javai.result.ops;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;

import java.util.Objects;

/**
 * Reports misuse failures using Log4j2.
 *
 * <p>Every misuse is logged at WARN with the {@code RESULT_MISUSE} marker, so log pipelines
 * can route API misuse separately from ordinary application errors. The logger name defaults to
 * {@link OpsConfig#misuseLoggerName()}.
 */
public class Log4jMisuseReporter implements MisuseReporter {

	static final Marker MISUSE_MARKER = MarkerManager.getMarker("RESULT_MISUSE");

	private final Logger logger;

	public Log4jMisuseReporter() {
		this(LogManager.getLogger(OpsConfig.misuseLoggerName()));
	}

	public Log4jMisuseReporter(String loggerName) {
		this(LogManager.getLogger(requireName(loggerName)));
	}

	public Log4jMisuseReporter(Logger logger) {
		this.logger = Objects.requireNonNull(logger, "logger must not be null");
	}

	private static String requireName(String loggerName) {
		if (loggerName == null || loggerName.isBlank()) {
			throw new IllegalArgumentException("loggerName must not be blank");
		}
		return loggerName;
	}

	@Override
	public void report(Misuse misuse) {
		logger.atWarn()
			.withMarker(MISUSE_MARKER)
			.log("Result misuse in [{}] on thread [{}]: {} | payloadType={}, occurredAt={}",
				misuse.operation(),
				misuse.threadName(),
				misuse.message(),
				misuse.payloadType(),
				misuse.occurredAt());
	}
}
