package org.javai.springai.evolution.evaluation;

import java.util.List;
import java.util.Objects;
import org.javai.springai.evolution.population.Candidate;
import org.javai.springai.evolution.population.EvaluationResult;

/**
 * Results of evaluating one candidate against a set of scenarios.
 *
 * @param candidate the evaluated candidate
 * @param results completed results, in the order the scenarios were requested
 * @param truncated true when the rollout budget ran out before every requested scenario ran
 * @param rolloutsReserved budget units reserved by this evaluation
 */
public record EvaluationBatch(
		Candidate candidate,
		List<EvaluationResult> results,
		boolean truncated,
		int rolloutsReserved
) {

	public EvaluationBatch {
		Objects.requireNonNull(candidate, "candidate must not be null");
		results = results != null ? List.copyOf(results) : List.of();
		if (rolloutsReserved < 0) {
			throw new IllegalArgumentException("rolloutsReserved must be >= 0");
		}
	}

	public List<EvaluationResult> failures() {
		return results.stream().filter(result -> !result.passed()).toList();
	}

	public long passedCount() {
		return results.stream().filter(EvaluationResult::passed).count();
	}
}
