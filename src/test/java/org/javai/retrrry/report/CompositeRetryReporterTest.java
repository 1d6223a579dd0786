package org.javai.retrrry.report;

import org.apache.logging.log4j.Level;
import org.javai.retrrry.Outcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CompositeRetryReporterTest {

	private CapturingAppender appender;

	@BeforeEach
	void setUp() {
		appender = CapturingAppender.attachTo(CompositeRetryReporter.class.getName());
	}

	@AfterEach
	void tearDown() {
		appender.detach();
	}

	@Test
	void reportRetryAttempt_fansOutToAllReporters() {
		List<String> first = new ArrayList<>();
		List<String> second = new ArrayList<>();
		RetryReporter composite = RetryReporter.composite(
				(operation, outcome, elapsedMillis, waitMillis) -> first.add(operation + ":" + waitMillis),
				(operation, outcome, elapsedMillis, waitMillis) -> second.add(operation + ":" + waitMillis));

		composite.reportRetryAttempt("fetch", Outcome.fail(1, new IOException()), 10, 200);

		assertThat(first).containsExactly("fetch:200");
		assertThat(second).containsExactly("fetch:200");
	}

	@Test
	void reportGiveUp_fansOutToAllReporters() {
		List<Integer> attempts = new ArrayList<>();
		RetryReporter recording = new RetryReporter() {
			@Override
			public void reportRetryAttempt(String operation, Outcome<?> outcome, long elapsedMillis, long waitMillis) {
			}

			@Override
			public void reportGiveUp(String operation, Outcome<?> outcome, long elapsedMillis) {
				attempts.add(outcome.attemptNumber());
			}
		};

		CompositeRetryReporter.of(List.of(recording, recording)).reportGiveUp("fetch", Outcome.ok(3, null), 50);

		assertThat(attempts).containsExactly(3, 3);
	}

	@Test
	void failingReporter_isLoggedAndOthersStillRun() {
		List<String> reached = new ArrayList<>();
		RetryReporter failing = (operation, outcome, elapsedMillis, waitMillis) -> {
			throw new IllegalStateException("reporter down");
		};
		RetryReporter composite = CompositeRetryReporter.of(
				failing,
				(operation, outcome, elapsedMillis, waitMillis) -> reached.add(operation));

		composite.reportRetryAttempt("fetch", Outcome.ok(1, null), 0, 0);

		assertThat(reached).containsExactly("fetch");
		assertThat(appender.events()).singleElement().satisfies(event -> {
			assertThat(event.getLevel()).isEqualTo(Level.WARN);
			assertThat(event.getMessage().getFormattedMessage()).startsWith("RetryReporter.reportRetryAttempt failed for ");
			assertThat(event.getThrown()).isInstanceOf(IllegalStateException.class).hasMessage("reporter down");
		});
	}

	@Test
	void size_countsReporters() {
		assertThat(CompositeRetryReporter.of().size()).isZero();
		assertThat(CompositeRetryReporter.of(RetryReporter.noOp(), RetryReporter.noOp()).size()).isEqualTo(2);
	}

	@Test
	void noOp_acceptsEveryEvent() {
		RetryReporter reporter = RetryReporter.noOp();

		assertThatCode(() -> {
			reporter.reportRetryAttempt("fetch", Outcome.ok(1, null), 0, 0);
			reporter.reportGiveUp("fetch", Outcome.ok(1, null), 0);
		}).doesNotThrowAnyException();
	}
}
