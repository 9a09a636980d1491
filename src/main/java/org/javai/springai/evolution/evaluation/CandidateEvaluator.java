package org.javai.springai.evolution.evaluation;

import java.util.List;
import org.javai.springai.evolution.population.Candidate;

/**
 * Scores candidates by running them against scenarios of the suite.
 *
 * <p>Every completed rollout is recorded in the population store before the call returns.
 * Execution failures and timeouts are recorded as failing results, never thrown.</p>
 */
public interface CandidateEvaluator {

	/**
	 * Evaluate the candidate against the whole suite.
	 */
	EvaluationBatch evaluate(Candidate candidate);

	/**
	 * Evaluate the candidate against the given scenarios, reusing results that already exist.
	 *
	 * @param scenarioIds non-empty list of ids from the suite
	 */
	default EvaluationBatch evaluate(Candidate candidate, List<String> scenarioIds) {
		return evaluate(candidate, scenarioIds, ReevaluationMode.REUSE_EXISTING);
	}

	EvaluationBatch evaluate(Candidate candidate, List<String> scenarioIds, ReevaluationMode mode);

	/**
	 * Evaluate several candidates against the whole suite, running their rollouts concurrently.
	 * Budget is reserved in list order, so earlier candidates are served first when it runs out.
	 */
	List<EvaluationBatch> evaluateAll(List<Candidate> candidates);
}
