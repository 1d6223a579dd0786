package org.javai.retrrry.report.log4j;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.retrrry.Outcome;
import org.javai.retrrry.report.RetryReporter;

/**
 * Reports retry events using Log4j2.
 *
 * <p>Retries are logged at INFO with the {@code RETRY} marker, give-ups at WARN with the
 * {@code RETRY_EXHAUSTED} marker. A give-up on a failure carries the failure's throwable.
 */
public class Log4jRetryReporter implements RetryReporter {

	static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");

	private final Logger logger;

	/**
	 * Creates a Log4jRetryReporter using the default logger name.
	 */
	public Log4jRetryReporter() {
		this(LogManager.getLogger("org.javai.retrrry.Retrier"));
	}

	/**
	 * Creates a Log4jRetryReporter with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jRetryReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jRetryReporter with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jRetryReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void reportRetryAttempt(String operation, Outcome<?> outcome, long elapsedMillis, long waitMillis) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Attempt {} of operation [{}] rejected after {} ms, retrying in {} ms. {}",
				outcome.attemptNumber(),
				operation,
				elapsedMillis,
				waitMillis,
				describe(outcome));
	}

	@Override
	public void reportGiveUp(String operation, Outcome<?> outcome, long elapsedMillis) {
		logger.atWarn()
			.withMarker(RETRY_EXHAUSTED_MARKER)
			.withThrowable(outcome instanceof Outcome.Fail<?> fail ? fail.failure().exception() : null)
			.log("Giving up on operation [{}] after {} attempts and {} ms. {}",
				operation,
				outcome.attemptNumber(),
				elapsedMillis,
				describe(outcome));
	}

	private static String describe(Outcome<?> outcome) {
		if (outcome instanceof Outcome.Fail<?> fail) {
			String message = fail.failure().message();
			return "Failure: " + fail.failure().type() + (message != null ? ": " + message : "");
		}
		return "Result: " + ((Outcome.Ok<?>) outcome).value();
	}
}
