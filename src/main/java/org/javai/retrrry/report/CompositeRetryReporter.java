package org.javai.retrrry.report;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.retrrry.Outcome;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * A {@link RetryReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. If a reporter throws, the error is logged
 * and the remaining reporters still run.
 *
 * <p>Example usage:
 * <pre>{@code
 * RetryReporter reporter = CompositeRetryReporter.of(
 *     new Log4jRetryReporter(),
 *     new MetricsRetryReporter("myapp")
 * );
 * }</pre>
 */
public final class CompositeRetryReporter implements RetryReporter {

	private static final Logger LOGGER = LogManager.getLogger(CompositeRetryReporter.class);

	private final List<RetryReporter> reporters;

	private CompositeRetryReporter(List<RetryReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	/**
	 * Creates a composite reporter from the given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeRetryReporter of(RetryReporter... reporters) {
		return new CompositeRetryReporter(Arrays.asList(reporters));
	}

	/**
	 * Creates a composite reporter from a collection of reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeRetryReporter of(Collection<? extends RetryReporter> reporters) {
		return new CompositeRetryReporter(new ArrayList<>(reporters));
	}

	@Override
	public void reportRetryAttempt(String operation, Outcome<?> outcome, long elapsedMillis, long waitMillis) {
		for (RetryReporter reporter : reporters) {
			try {
				reporter.reportRetryAttempt(operation, outcome, elapsedMillis, waitMillis);
			} catch (RuntimeException e) {
				logReporterError("reportRetryAttempt", reporter, e);
			}
		}
	}

	@Override
	public void reportGiveUp(String operation, Outcome<?> outcome, long elapsedMillis) {
		for (RetryReporter reporter : reporters) {
			try {
				reporter.reportGiveUp(operation, outcome, elapsedMillis);
			} catch (RuntimeException e) {
				logReporterError("reportGiveUp", reporter, e);
			}
		}
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	private static void logReporterError(String method, RetryReporter reporter, RuntimeException e) {
		LOGGER.warn("RetryReporter.{} failed for {}", method, reporter.getClass().getName(), e);
	}
}
