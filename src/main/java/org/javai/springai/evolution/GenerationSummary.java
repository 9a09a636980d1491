package org.javai.springai.evolution;

/**
 * What happened in one generation of a run.
 *
 * @param generation 1-based generation number
 * @param parentsSelected parents chosen by the selector
 * @param deadEnds parents whose reflection or evolution failed
 * @param childrenProduced children recorded in the population
 * @param childrenFullyEvaluated children evaluated on every scenario
 * @param bestPassRate best pass rate on the frontier after the generation
 * @param frontierSize number of frontier candidates after the generation
 * @param frontierImproved whether the frontier reached a point it had not covered before
 * @param rolloutsConsumed budget consumed so far in the run
 */
public record GenerationSummary(
		int generation,
		int parentsSelected,
		int deadEnds,
		int childrenProduced,
		int childrenFullyEvaluated,
		double bestPassRate,
		int frontierSize,
		boolean frontierImproved,
		int rolloutsConsumed
) {}
