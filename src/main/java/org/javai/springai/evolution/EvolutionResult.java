package org.javai.springai.evolution;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.springai.evolution.population.Candidate;
import org.javai.springai.evolution.population.PopulationStore;
import org.javai.springai.evolution.population.ScoreVector;

/**
 * Outcome of an evolution run.
 *
 * <p>Always check {@link #state()}: {@link RunState#EXHAUSTED}, {@link RunState#STAGNATED} and
 * {@link RunState#GENERATION_LIMIT} also return the best candidate found, while
 * {@link RunState#FAILED} returns none and carries an error message instead. When no candidate
 * completed a full evaluation the seed is returned, scored on the scenarios it did run.</p>
 *
 * @param state terminal state of the run
 * @param bestCandidate best candidate by the primary objective, or the seed when none was fully
 *                      evaluated; null only when the run failed
 * @param scoreVector scores of the best candidate
 * @param lineage steps from the seed to the best candidate, seed first
 * @param frontier Pareto frontier at the end of the run
 * @param generations per-generation summaries, in order
 * @param rolloutsConsumed budget consumed by the run
 * @param maxRollouts the run's budget
 * @param lastConsistentGeneration last generation that completed without error; 0 when only the
 *                                 seed was evaluated
 * @param errorMessage why the run failed; null unless {@code state == FAILED}
 * @param population every candidate and result of the run, for audit
 * @param startedAt when the run started
 * @param finishedAt when the run reached its terminal state
 */
public record EvolutionResult(
		RunState state,
		Candidate bestCandidate,
		ScoreVector scoreVector,
		List<LineageStep> lineage,
		List<Candidate> frontier,
		List<GenerationSummary> generations,
		int rolloutsConsumed,
		int maxRollouts,
		int lastConsistentGeneration,
		String errorMessage,
		PopulationStore population,
		Instant startedAt,
		Instant finishedAt
) {

	public EvolutionResult {
		Objects.requireNonNull(state, "state must not be null");
		if (!state.isTerminal()) {
			throw new IllegalArgumentException("state must be terminal, was " + state);
		}
		scoreVector = scoreVector != null ? scoreVector : ScoreVector.empty();
		lineage = lineage != null ? List.copyOf(lineage) : List.of();
		frontier = frontier != null ? List.copyOf(frontier) : List.of();
		generations = generations != null ? List.copyOf(generations) : List.of();
	}

	/**
	 * True only when a candidate met the convergence target.
	 */
	public boolean succeeded() {
		return state == RunState.CONVERGED;
	}

	public Optional<Candidate> best() {
		return Optional.ofNullable(bestCandidate);
	}

	/**
	 * Instruction text of the best candidate, or null when the run failed.
	 */
	public String bestInstructionText() {
		return bestCandidate != null ? bestCandidate.instructionText() : null;
	}

	public int generationsRun() {
		return generations.size();
	}
}
