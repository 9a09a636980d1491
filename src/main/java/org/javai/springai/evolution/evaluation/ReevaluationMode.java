package org.javai.springai.evolution.evaluation;

/**
 * What to do when a (candidate, scenario) pair already has a recorded result.
 */
public enum ReevaluationMode {

	/**
	 * Return the stored result. No rollout, no budget.
	 */
	REUSE_EXISTING,

	/**
	 * Run the scenario again and replace the stored result under the reservation that produced
	 * it. No new budget is consumed.
	 */
	OVERWRITE,

	/**
	 * Run the scenario again, reserve a new rollout and replace the stored result.
	 */
	FRESH_RESERVATION
}
