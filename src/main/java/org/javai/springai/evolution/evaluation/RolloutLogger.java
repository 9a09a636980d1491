package org.javai.springai.evolution.evaluation;

import java.time.Duration;
import java.util.Locale;
import org.javai.springai.evolution.population.Candidate;
import org.javai.springai.evolution.population.EvaluationResult;
import org.javai.springai.evolution.scenario.Scenario;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs individual rollouts: INFO for completed ones, WARN for failed or timed-out ones.
 */
public class RolloutLogger {

	private final Logger logger;

	public RolloutLogger(Class<?> owner) {
		this.logger = LoggerFactory.getLogger(owner);
	}

	public void logRolloutResult(Candidate candidate, Scenario scenario, EvaluationResult result) {
		if (!logger.isInfoEnabled()) {
			return;
		}
		logger.info(
				"candidate={} gen={} scenario='{}' passed={} score={} tools={} {} ms (instruction='{}')",
				shortId(candidate.id()),
				candidate.generation(),
				scenario.scenarioId(),
				result.passed(),
				formatScore(result.score()),
				result.trace().toolCalls(),
				toMillis(result.duration()),
				summarize(candidate.instructionText())
		);
	}

	public void logRolloutFailure(Candidate candidate, Scenario scenario, String reason, Duration duration,
			Throwable error) {
		if (!logger.isWarnEnabled()) {
			return;
		}
		if (error != null) {
			logger.warn(
					"candidate={} gen={} scenario='{}' failed after {} ms (input='{}'): {}",
					shortId(candidate.id()),
					candidate.generation(),
					scenario.scenarioId(),
					toMillis(duration),
					summarize(scenario.input()),
					reason,
					error
			);
		}
		else {
			logger.warn(
					"candidate={} gen={} scenario='{}' failed after {} ms (input='{}'): {}",
					shortId(candidate.id()),
					candidate.generation(),
					scenario.scenarioId(),
					toMillis(duration),
					summarize(scenario.input()),
					reason
			);
		}
	}

	public void debug(String format, Object... args) {
		if (!logger.isDebugEnabled()) {
			return;
		}
		logger.debug(format, args);
	}

	static String shortId(String id) {
		if (id == null) {
			return "n/a";
		}
		return id.length() <= 8 ? id : id.substring(0, 8);
	}

	private long toMillis(Duration duration) {
		return duration == null ? -1 : duration.toMillis();
	}

	private String formatScore(double value) {
		if (Double.isNaN(value)) {
			return "n/a";
		}
		return String.format(Locale.ROOT, "%.4f", value);
	}

	private String summarize(String text) {
		if (text == null || text.isBlank()) {
			return "";
		}
		String normalized = text.replaceAll("\\s+", " ").trim();
		int maxLength = 64;
		return normalized.length() <= maxLength ? normalized : normalized.substring(0, maxLength - 3) + "...";
	}
}
