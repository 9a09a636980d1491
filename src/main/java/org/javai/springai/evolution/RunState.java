package org.javai.springai.evolution;

/**
 * States of an evolution run.
 *
 * <p>{@code INIT → SEEDING → GENERATING → } one of the terminal states. Terminal states other
 * than {@link #FAILED} come with the best candidate found, so callers must look at the state to
 * know whether the target was met. A run whose budget runs out while the seed is still being
 * evaluated ends {@link #EXHAUSTED} with the seed and its partial scores.</p>
 */
public enum RunState {
	INIT,
	SEEDING,
	GENERATING,

	/** A candidate reached the target pass rate. */
	CONVERGED,

	/** The frontier did not improve for the configured number of consecutive generations. */
	STAGNATED,

	/** The configured maximum number of generations ran without convergence. */
	GENERATION_LIMIT,

	/** The rollout budget ran out before convergence. */
	EXHAUSTED,

	/** An unrecoverable error stopped the run. */
	FAILED;

	public boolean isTerminal() {
		return this != INIT && this != SEEDING && this != GENERATING;
	}
}
