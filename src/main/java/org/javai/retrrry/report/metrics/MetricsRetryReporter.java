package org.javai.retrrry.report.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.retrrry.Outcome;
import org.javai.retrrry.report.RetryReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reports retry events as JSON-lines metrics via SLF4J.
 *
 * <p>Each event is one JSON object, serialized with Jackson, suitable for metrics aggregation.
 * The tracking key is the operation name, prefixed with the configured namespace if any.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"retry_attempt","timestamp":"2024-01-20T10:30:00Z","trackingKey":"myapp.fetchUser","attemptNumber":2,"elapsedMs":120,"delayMs":400,"outcome":"failure","failureType":"java.io.IOException"}
 * }</pre>
 */
public class MetricsRetryReporter implements RetryReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.retrrry.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;
	private static final ObjectMapper MAPPER = new ObjectMapper();

	private final String namespace;
	private final Logger logger;
	private final Clock clock;

	/**
	 * Creates a MetricsRetryReporter with no namespace and the default logger.
	 */
	public MetricsRetryReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsRetryReporter with the specified namespace and default logger.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsRetryReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsRetryReporter with the specified namespace and custom logger name.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 * @param loggerName the logger name
	 */
	public MetricsRetryReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName), Clock.systemUTC());
	}

	/**
	 * Package-private for testing.
	 */
	MetricsRetryReporter(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.clock = clock;
	}

	@Override
	public void reportRetryAttempt(String operation, Outcome<?> outcome, long elapsedMillis, long waitMillis) {
		Map<String, Object> event = baseEvent("retry_attempt", operation, outcome, elapsedMillis);
		event.put("delayMs", waitMillis);
		emit(event);
	}

	@Override
	public void reportGiveUp(String operation, Outcome<?> outcome, long elapsedMillis) {
		emit(baseEvent("retry_exhausted", operation, outcome, elapsedMillis));
	}

	String buildTrackingKey(String operation) {
		if (namespace == null) {
			return operation;
		}
		return namespace + "." + operation;
	}

	private Map<String, Object> baseEvent(String eventType, String operation, Outcome<?> outcome, long elapsedMillis) {
		Map<String, Object> event = new LinkedHashMap<>();
		event.put("eventType", eventType);
		event.put("timestamp", ISO_FORMATTER.format(clock.instant()));
		event.put("trackingKey", buildTrackingKey(operation));
		event.put("attemptNumber", outcome.attemptNumber());
		event.put("elapsedMs", elapsedMillis);
		if (outcome instanceof Outcome.Fail<?> fail) {
			event.put("outcome", "failure");
			event.put("failureType", fail.failure().type());
			event.put("fingerprint", fail.failure().fingerprint());
		} else {
			event.put("outcome", "rejected_result");
		}
		return event;
	}

	private void emit(Map<String, Object> event) {
		try {
			logger.info(MAPPER.writeValueAsString(event));
		} catch (JsonProcessingException e) {
			logger.warn("Could not serialize retry event {}", event.get("eventType"), e);
		}
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
