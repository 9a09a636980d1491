package org.javai.springai.evolution.selection;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.springai.evolution.population.Candidate;
import org.javai.springai.evolution.population.Objective;
import org.javai.springai.evolution.population.PopulationStore;
import org.javai.springai.evolution.population.ScoreVector;

/**
 * Multi-objective selection over a {@link PopulationStore}.
 *
 * <p>Only candidates evaluated on every required scenario take part; candidates cut short by
 * the budget stay in the store but are never compared. The frontier is recomputed on every
 * call.</p>
 *
 * <h2>Ordering</h2>
 * <p>Within a tier candidates are ordered by lower generation, then by more recorded rollouts
 * (re-evaluations included, since every eligible candidate covers the same scenarios), then by
 * recording order. When a tier holds fewer candidates than requested the next tier
 * (the frontier of what remains after removing earlier tiers) fills the gap.</p>
 */
public class ParetoSelector {

	private final List<Objective> objectives;
	private final List<String> requiredScenarioIds;

	/**
	 * @param objectives the objectives to compare on, in priority order for tie-breaking
	 * @param requiredScenarioIds scenarios a candidate must have results for to be eligible
	 */
	public ParetoSelector(List<Objective> objectives, Collection<String> requiredScenarioIds) {
		if (objectives == null || objectives.isEmpty()) {
			throw new IllegalArgumentException("objectives must not be empty");
		}
		Objects.requireNonNull(requiredScenarioIds, "requiredScenarioIds must not be null");
		this.objectives = List.copyOf(objectives);
		this.requiredScenarioIds = List.copyOf(requiredScenarioIds);
	}

	/**
	 * True iff {@code a} is at least as good as {@code b} on every objective and strictly
	 * better on at least one.
	 */
	public boolean dominates(ScoreVector a, ScoreVector b) {
		boolean strictlyBetter = false;
		for (Objective objective : objectives) {
			double left = a.get(objective);
			double right = b.get(objective);
			if (left < right) {
				return false;
			}
			if (left > right) {
				strictlyBetter = true;
			}
		}
		return strictlyBetter;
	}

	/**
	 * True iff {@code a} is at least as good as {@code b} on every objective.
	 */
	public boolean weaklyDominates(ScoreVector a, ScoreVector b) {
		for (Objective objective : objectives) {
			if (a.get(objective) < b.get(objective)) {
				return false;
			}
		}
		return true;
	}

	public List<Candidate> eligible(PopulationStore population) {
		return population.candidates().stream()
				.filter(candidate -> population.isFullyEvaluated(candidate.id(), requiredScenarioIds))
				.toList();
	}

	/**
	 * Non-dominated eligible candidates, in tie-break order.
	 */
	public List<Candidate> frontier(PopulationStore population) {
		List<List<Candidate>> tiers = tiers(population);
		return tiers.isEmpty() ? List.of() : tiers.get(0);
	}

	/**
	 * Eligible candidates split into successive non-dominated tiers, each in tie-break order.
	 */
	public List<List<Candidate>> tiers(PopulationStore population) {
		Map<String, ScoreVector> scores = scoresOf(population);
		List<Candidate> remaining = new ArrayList<>(eligible(population));
		List<List<Candidate>> tiers = new ArrayList<>();
		Comparator<Candidate> order = tieBreak(population);

		while (!remaining.isEmpty()) {
			List<Candidate> tier = new ArrayList<>();
			for (Candidate candidate : remaining) {
				ScoreVector score = scores.get(candidate.id());
				boolean dominated = remaining.stream()
						.anyMatch(other -> other != candidate && dominates(scores.get(other.id()), score));
				if (!dominated) {
					tier.add(candidate);
				}
			}
			remaining.removeAll(tier);
			tier.sort(order);
			tiers.add(List.copyOf(tier));
		}
		return tiers;
	}

	/**
	 * Choose up to {@code k} parents: frontier first, backfilled from lower tiers.
	 */
	public List<Candidate> selectParents(PopulationStore population, int k) {
		if (k < 1) {
			throw new IllegalArgumentException("k must be >= 1");
		}
		List<Candidate> selected = new ArrayList<>();
		for (List<Candidate> tier : tiers(population)) {
			for (Candidate candidate : tier) {
				if (selected.size() == k) {
					return selected;
				}
				selected.add(candidate);
			}
		}
		return selected;
	}

	/**
	 * Best frontier candidate by the primary objective; ties go to the other objectives in
	 * order, then to the tie-break order.
	 */
	public Optional<Candidate> best(PopulationStore population, Objective primary) {
		Objects.requireNonNull(primary, "primary must not be null");
		List<Candidate> frontier = frontier(population);
		if (frontier.isEmpty()) {
			return Optional.empty();
		}
		Map<String, ScoreVector> scores = scoresOf(population);
		Comparator<Candidate> byScore = Comparator.comparingDouble(
				(Candidate candidate) -> scores.get(candidate.id()).get(primary)).reversed();
		for (Objective objective : objectives) {
			if (objective != primary) {
				byScore = byScore.thenComparing(Comparator.comparingDouble(
						(Candidate candidate) -> scores.get(candidate.id()).get(objective)).reversed());
			}
		}
		return frontier.stream().sorted(byScore.thenComparing(tieBreak(population))).findFirst();
	}

	/**
	 * True when some vector of {@code current} is not weakly dominated by any vector of
	 * {@code previous}, i.e. the frontier reached a point it had not covered before.
	 */
	public boolean improves(Collection<ScoreVector> previous, Collection<ScoreVector> current) {
		for (ScoreVector candidate : current) {
			boolean covered = previous.stream().anyMatch(old -> weaklyDominates(old, candidate));
			if (!covered) {
				return true;
			}
		}
		return false;
	}

	public List<ScoreVector> frontierScores(PopulationStore population) {
		return frontier(population).stream().map(candidate -> population.scoreVector(candidate.id())).toList();
	}

	public List<Objective> objectives() {
		return objectives;
	}

	private Map<String, ScoreVector> scoresOf(PopulationStore population) {
		Map<String, ScoreVector> scores = new HashMap<>();
		for (Candidate candidate : population.candidates()) {
			scores.put(candidate.id(), population.scoreVector(candidate.id()));
		}
		return scores;
	}

	private static Comparator<Candidate> tieBreak(PopulationStore population) {
		return Comparator.comparingInt(Candidate::generation)
				.thenComparing(Comparator.comparingInt(
						(Candidate candidate) -> population.rolloutsRecorded(candidate.id())).reversed())
				.thenComparingInt(candidate -> population.recordingIndex(candidate.id()));
	}
}
