package org.javai.springai.evolution.selection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.javai.springai.evolution.agent.AgentTrace;
import org.javai.springai.evolution.population.Candidate;
import org.javai.springai.evolution.population.EvaluationResult;
import org.javai.springai.evolution.population.Objective;
import org.javai.springai.evolution.population.PopulationStore;
import org.javai.springai.evolution.population.ScoreVector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ParetoSelectorTest {

	private static final List<String> SCENARIOS = List.of("s1", "s2", "s3");

	private final PopulationStore store = new PopulationStore();
	private final ParetoSelector selector = new ParetoSelector(
			List.of(Objective.PASS_RATE, Objective.MEAN_SCORE, Objective.WORST_CASE_SCORE), SCENARIOS);

	@AfterEach
	void closeStore() {
		store.close();
	}

	@Test
	void dominanceRequiresStrictImprovementSomewhere() {
		Candidate a = evaluated(Candidate.seed("a"), 1.0, 0.5, 0.5);
		Candidate b = evaluated(Candidate.seed("b"), 1.0, 0.5, 0.0);
		Candidate twin = evaluated(Candidate.seed("twin"), 1.0, 0.5, 0.5);

		assertThat(selector.dominates(scores(a), scores(b))).isTrue();
		assertThat(selector.dominates(scores(b), scores(a))).isFalse();
		assertThat(selector.dominates(scores(a), scores(twin))).isFalse();
		assertThat(selector.weaklyDominates(scores(a), scores(twin))).isTrue();
	}

	@Test
	void frontierHoldsNonDominatedEligibleCandidates() {
		Candidate seed = evaluated(Candidate.seed("seed"), 0.0, 0.0, 0.0);
		Candidate left = evaluated(Candidate.mutationOf(seed, "left"), 1.0, 1.0, 0.0);
		Candidate right = evaluated(Candidate.mutationOf(seed, "right"), 0.5, 0.5, 0.5);
		Candidate partial = store.addCandidate(Candidate.mutationOf(seed, "partial"));
		record(partial, "s1", true, 1.0);

		assertThat(selector.eligible(store)).containsExactly(seed, left, right);
		assertThat(selector.frontier(store)).containsExactlyInAnyOrder(left, right);
		assertThat(selector.frontier(store)).doesNotContain(partial);
	}

	@Test
	void tieBreakPrefersLowerGenerationThenRecordingOrder() {
		Candidate seed = evaluated(Candidate.seed("seed"), 1.0, 0.5, 0.5);
		Candidate first = evaluated(Candidate.mutationOf(seed, "first"), 1.0, 0.5, 0.5);
		Candidate second = evaluated(Candidate.mutationOf(seed, "second"), 1.0, 0.5, 0.5);

		assertThat(selector.frontier(store)).containsExactly(seed, first, second);
		assertThat(selector.selectParents(store, 2)).containsExactly(seed, first);
	}

	@Test
	void reEvaluatedCandidateRanksAboveEquallyScoredPeer() {
		Candidate seed = evaluated(Candidate.seed("seed"), 0.0, 0.0, 0.0);
		Candidate first = evaluated(Candidate.mutationOf(seed, "first"), 1.0, 0.5, 0.5);
		Candidate retested = evaluated(Candidate.mutationOf(seed, "retested"), 1.0, 0.5, 0.5);
		store.recordResult(new EvaluationResult(retested.id(), "s2", false, 0.5,
				new AgentTrace("s2", List.of(), ""), Duration.ZERO), true);

		assertThat(store.rolloutsRecorded(retested.id())).isEqualTo(4);
		assertThat(store.rolloutsRecorded(first.id())).isEqualTo(3);
		assertThat(selector.frontier(store)).containsExactly(retested, first);
		assertThat(selector.selectParents(store, 1)).containsExactly(retested);
	}

	@Test
	void backfillsFromNextTierWhenFrontierIsSmall() {
		Candidate best = evaluated(Candidate.seed("best"), 1.0, 1.0, 1.0);
		Candidate middle = evaluated(Candidate.seed("middle"), 0.5, 0.5, 0.5);
		Candidate worst = evaluated(Candidate.seed("worst"), 0.0, 0.0, 0.0);

		assertThat(selector.tiers(store)).containsExactly(List.of(best), List.of(middle), List.of(worst));
		assertThat(selector.selectParents(store, 2)).containsExactly(best, middle);
		assertThat(selector.selectParents(store, 10)).containsExactly(best, middle, worst);
	}

	@Test
	void selectParentsRejectsNonPositiveCount() {
		assertThatThrownBy(() -> selector.selectParents(store, 0)).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void bestUsesPrimaryObjectiveThenOthers() {
		Candidate highPass = evaluated(Candidate.seed("pass"), 1.0, 1.0, 0.0);
		Candidate highScore = evaluated(Candidate.seed("score"), 0.9, 0.9, 0.9);

		assertThat(selector.best(store, Objective.PASS_RATE)).contains(highPass);
		assertThat(selector.best(store, Objective.WORST_CASE_SCORE)).contains(highScore);
	}

	@Test
	void bestIsEmptyWithoutEligibleCandidates() {
		store.addCandidate(Candidate.seed("unevaluated"));

		assertThat(selector.best(store, Objective.PASS_RATE)).isEmpty();
		assertThat(selector.frontier(store)).isEmpty();
	}

	@Test
	void improvementMeansANewlyCoveredPoint() {
		Candidate seed = evaluated(Candidate.seed("seed"), 0.5, 0.5, 0.5);
		List<ScoreVector> before = selector.frontierScores(store);

		evaluated(Candidate.mutationOf(seed, "same"), 0.5, 0.5, 0.5);
		assertThat(selector.improves(before, selector.frontierScores(store))).isFalse();

		evaluated(Candidate.mutationOf(seed, "better"), 1.0, 0.5, 0.5);
		assertThat(selector.improves(before, selector.frontierScores(store))).isTrue();
	}

	@Test
	void frontierIsExactlyTheNonDominatedSetForRandomPopulations() {
		Random random = new Random(7);
		for (int round = 0; round < 25; round++) {
			try (PopulationStore population = new PopulationStore()) {
				List<Candidate> all = new ArrayList<>();
				for (int i = 0; i < 12; i++) {
					Candidate candidate = population.addCandidate(Candidate.seed("c" + i));
					for (String scenario : SCENARIOS) {
						boolean passed = random.nextBoolean();
						double score = passed ? 1.0 : random.nextInt(4) / 4.0;
						population.recordResult(new EvaluationResult(candidate.id(), scenario, passed, score,
								new AgentTrace(scenario, List.of(), ""), Duration.ZERO));
					}
					all.add(candidate);
				}

				List<Candidate> frontier = selector.frontier(population);

				for (Candidate member : frontier) {
					assertThat(all).noneMatch(other -> selector.dominates(
							population.scoreVector(other.id()), population.scoreVector(member.id())));
				}
				for (Candidate outsider : all) {
					if (!frontier.contains(outsider)) {
						assertThat(all).anyMatch(other -> selector.dominates(
								population.scoreVector(other.id()), population.scoreVector(outsider.id())));
					}
				}
				List<Candidate> tiered = selector.tiers(population).stream().flatMap(List::stream).toList();
				assertThat(tiered).containsExactlyInAnyOrderElementsOf(all);
			}
		}
	}

	/**
	 * Record one result per scenario with the given scores; a score of 1.0 counts as a pass.
	 */
	private Candidate evaluated(Candidate candidate, double... scores) {
		store.addCandidate(candidate);
		for (int i = 0; i < SCENARIOS.size(); i++) {
			record(candidate, SCENARIOS.get(i), scores[i] == 1.0, scores[i]);
		}
		return candidate;
	}

	private void record(Candidate candidate, String scenarioId, boolean passed, double score) {
		store.recordResult(new EvaluationResult(candidate.id(), scenarioId, passed, score,
				new AgentTrace(scenarioId, List.of(), ""), Duration.ZERO));
	}

	private ScoreVector scores(Candidate candidate) {
		return store.scoreVector(candidate.id());
	}
}
