package org.javai.springai.evolution.population;

import java.time.Duration;
import java.util.Objects;
import org.javai.springai.evolution.agent.AgentTrace;

/**
 * Outcome of running one candidate against one scenario.
 *
 * @param candidateId the candidate that was evaluated
 * @param scenarioId the scenario it was evaluated against
 * @param passed whether the scenario's checker accepted the trace
 * @param score checker score in [0.0, 1.0]
 * @param trace what the agent did; consumed by the reflector
 * @param duration wall-clock time of the rollout
 */
public record EvaluationResult(
		String candidateId,
		String scenarioId,
		boolean passed,
		double score,
		AgentTrace trace,
		Duration duration
) {

	public EvaluationResult {
		Objects.requireNonNull(candidateId, "candidateId must not be null");
		Objects.requireNonNull(scenarioId, "scenarioId must not be null");
		Objects.requireNonNull(trace, "trace must not be null");
		if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
			throw new IllegalArgumentException("score must be within [0.0, 1.0]");
		}
		duration = duration != null ? duration : Duration.ZERO;
	}

	/**
	 * Result for a rollout whose execution failed or timed out.
	 */
	public static EvaluationResult executionFailure(String candidateId, String scenarioId, AgentTrace trace,
			Duration duration) {
		return new EvaluationResult(candidateId, scenarioId, false, 0.0, trace, duration);
	}
}
