package org.javai.springai.evolution.population;

import java.util.List;

/**
 * Aggregate metrics a candidate is compared on. Higher is better for every objective.
 */
public enum Objective {

	/** Fraction of evaluated scenarios that passed. */
	PASS_RATE {
		@Override
		double aggregate(List<EvaluationResult> results) {
			return (double) results.stream().filter(EvaluationResult::passed).count() / results.size();
		}
	},

	/** Mean checker score. */
	MEAN_SCORE {
		@Override
		double aggregate(List<EvaluationResult> results) {
			return results.stream().mapToDouble(EvaluationResult::score).average().orElse(0.0);
		}
	},

	/** Lowest checker score. */
	WORST_CASE_SCORE {
		@Override
		double aggregate(List<EvaluationResult> results) {
			return results.stream().mapToDouble(EvaluationResult::score).min().orElse(0.0);
		}
	};

	/**
	 * @param results a non-empty list of results for one candidate
	 */
	abstract double aggregate(List<EvaluationResult> results);
}
