package org.javai.springai.evolution.evaluation;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.List;
import org.apache.logging.log4j.Level;
import org.javai.springai.evolution.agent.AgentTrace;
import org.javai.springai.evolution.population.Candidate;
import org.javai.springai.evolution.population.EvaluationResult;
import org.javai.springai.evolution.scenario.CheckOutcome;
import org.javai.springai.evolution.scenario.Scenario;
import org.javai.springai.evolution.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.Test;

class RolloutLoggerTest {

	private static final Candidate CANDIDATE = Candidate.seed("Always verify the customer's identity.");
	private static final Scenario SCENARIO = new Scenario("refund", "return ORD-1", trace -> CheckOutcome.pass());

	@Test
	void logRolloutResultEmitsInfoEvent() {
		try (LogCaptorAppender appender = LogCaptorAppender.create(DefaultCandidateEvaluator.class, Level.INFO)) {
			RolloutLogger logger = new RolloutLogger(DefaultCandidateEvaluator.class);
			EvaluationResult result = new EvaluationResult(CANDIDATE.id(), "refund", true, 0.75,
					new AgentTrace("return ORD-1", List.of("lookup_order"), "refund approved"), Duration.ofMillis(120));

			logger.logRolloutResult(CANDIDATE, SCENARIO, result);

			assertThat(appender.events())
					.singleElement()
					.satisfies(event -> {
						assertThat(event.getLevel()).isEqualTo(Level.INFO);
						assertThat(event.getMessage().getFormattedMessage())
								.contains("scenario='refund'")
								.contains("score=0.7500")
								.contains("120 ms");
					});
		}
	}

	@Test
	void logRolloutFailureEmitsWarningEvent() {
		try (LogCaptorAppender appender = LogCaptorAppender.create(DefaultCandidateEvaluator.class, Level.WARN)) {
			RolloutLogger logger = new RolloutLogger(DefaultCandidateEvaluator.class);

			logger.logRolloutFailure(CANDIDATE, SCENARIO, "timed out after 200 ms", Duration.ofMillis(201), null);

			assertThat(appender.messagesAt(Level.WARN))
					.singleElement()
					.satisfies(message -> assertThat(message)
							.contains("failed after 201 ms")
							.contains("timed out after 200 ms"));
		}
	}

	@Test
	void debugSkipsWhenLevelHigher() {
		try (LogCaptorAppender appender = LogCaptorAppender.create(DefaultCandidateEvaluator.class, Level.INFO)) {
			new RolloutLogger(DefaultCandidateEvaluator.class).debug("scheduled {} rollouts", 3);

			assertThat(appender.events()).isEmpty();
		}
	}

	@Test
	void shortIdKeepsFirstEightCharacters() {
		assertThat(RolloutLogger.shortId("0123456789abcdef")).isEqualTo("01234567");
		assertThat(RolloutLogger.shortId("abc")).isEqualTo("abc");
	}
}
