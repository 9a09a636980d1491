package org.javai.springai.evolution.evaluation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.javai.springai.evolution.agent.AgentTrace;
import org.javai.springai.evolution.budget.RolloutBudget;
import org.javai.springai.evolution.population.Candidate;
import org.javai.springai.evolution.population.EvaluationResult;
import org.javai.springai.evolution.population.PopulationStore;
import org.javai.springai.evolution.scenario.ExpectationChecker;
import org.javai.springai.evolution.scenario.Scenario;
import org.javai.springai.evolution.scenario.ScenarioSuite;
import org.javai.springai.evolution.testsupport.RecordingAgentExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class DefaultCandidateEvaluatorTest {

	private static final ScenarioSuite SUITE = ScenarioSuite.of(
			new Scenario("refund", "return ORD-1", ExpectationChecker.outputContaining("refund")),
			new Scenario("identity", "who am I", ExpectationChecker.outputContaining("verify")),
			new Scenario("polite", "hello", ExpectationChecker.outputContaining("thank you")));

	private final PopulationStore store = new PopulationStore();
	private DefaultCandidateEvaluator evaluator;

	@AfterEach
	void tearDown() {
		if (evaluator != null) {
			evaluator.close();
		}
		store.close();
	}

	@Test
	void evaluatesEveryScenarioAndRecordsResults() {
		RecordingAgentExecutor agent = RecordingAgentExecutor.echoingInstruction();
		RolloutBudget budget = new RolloutBudget(10);
		evaluator = new DefaultCandidateEvaluator(SUITE, agent, budget, store, 2, Duration.ofSeconds(5));
		Candidate seed = store.addCandidate(Candidate.seed("Always offer a refund and say thank you."));

		EvaluationBatch batch = evaluator.evaluate(seed);

		assertThat(batch.truncated()).isFalse();
		assertThat(batch.rolloutsReserved()).isEqualTo(3);
		assertThat(batch.results()).extracting(EvaluationResult::scenarioId)
				.containsExactly("refund", "identity", "polite");
		assertThat(batch.passedCount()).isEqualTo(2);
		assertThat(batch.failures()).extracting(EvaluationResult::scenarioId).containsExactly("identity");
		assertThat(store.results(seed.id())).hasSize(3);
		assertThat(budget.consumed()).isEqualTo(3);
		assertThat(agent.invocations()).isEqualTo(3);
	}

	@Test
	void reevaluationReusesExistingResultsWithoutConsumingBudget() {
		RecordingAgentExecutor agent = RecordingAgentExecutor.echoingInstruction();
		RolloutBudget budget = new RolloutBudget(10);
		evaluator = new DefaultCandidateEvaluator(SUITE, agent, budget, store, 2, Duration.ofSeconds(5));
		Candidate seed = store.addCandidate(Candidate.seed("refund"));

		EvaluationBatch first = evaluator.evaluate(seed);
		EvaluationBatch second = evaluator.evaluate(seed, SUITE.scenarioIds());

		assertThat(second.results()).isEqualTo(first.results());
		assertThat(second.rolloutsReserved()).isZero();
		assertThat(budget.consumed()).isEqualTo(3);
		assertThat(agent.invocations()).isEqualTo(3);
		assertThat(store.results(seed.id())).hasSize(3);
	}

	@Test
	void overwriteReplacesResultUnderOriginalReservation() {
		RecordingAgentExecutor agent = RecordingAgentExecutor.echoingInstruction();
		RolloutBudget budget = new RolloutBudget(10);
		evaluator = new DefaultCandidateEvaluator(SUITE, agent, budget, store, 2, Duration.ofSeconds(5));
		Candidate seed = store.addCandidate(Candidate.seed("refund"));
		evaluator.evaluate(seed);

		EvaluationBatch again = evaluator.evaluate(seed, List.of("refund"), ReevaluationMode.OVERWRITE);

		assertThat(again.rolloutsReserved()).isZero();
		assertThat(agent.invocations()).isEqualTo(4);
		assertThat(budget.consumed()).isEqualTo(3);
		assertThat(store.results(seed.id())).hasSize(3);
		assertThat(store.resultCount()).isEqualTo(3);
	}

	@Test
	void freshReservationChargesBudgetForReplacement() {
		RecordingAgentExecutor agent = RecordingAgentExecutor.echoingInstruction();
		RolloutBudget budget = new RolloutBudget(10);
		evaluator = new DefaultCandidateEvaluator(SUITE, agent, budget, store, 2, Duration.ofSeconds(5));
		Candidate seed = store.addCandidate(Candidate.seed("refund"));
		evaluator.evaluate(seed);

		EvaluationBatch again = evaluator.evaluate(seed, List.of("refund", "polite"), ReevaluationMode.FRESH_RESERVATION);

		assertThat(again.rolloutsReserved()).isEqualTo(2);
		assertThat(budget.consumed()).isEqualTo(5);
		assertThat(store.results(seed.id())).hasSize(3);
	}

	@Test
	void stopsSchedulingWhenBudgetRunsOut() {
		RecordingAgentExecutor agent = RecordingAgentExecutor.echoingInstruction();
		RolloutBudget budget = new RolloutBudget(2);
		evaluator = new DefaultCandidateEvaluator(SUITE, agent, budget, store, 4, Duration.ofSeconds(5));
		Candidate seed = store.addCandidate(Candidate.seed("refund"));

		EvaluationBatch batch = evaluator.evaluate(seed);

		assertThat(batch.truncated()).isTrue();
		assertThat(batch.results()).hasSize(2);
		assertThat(budget.isExhausted()).isTrue();
		assertThat(agent.invocations()).isEqualTo(2);
		assertThat(store.isFullyEvaluated(seed.id(), SUITE.scenarioIds())).isFalse();
	}

	@Test
	void evaluateAllServesCandidatesInListOrder() {
		RecordingAgentExecutor agent = RecordingAgentExecutor.echoingInstruction();
		RolloutBudget budget = new RolloutBudget(4);
		evaluator = new DefaultCandidateEvaluator(SUITE, agent, budget, store, 4, Duration.ofSeconds(5));
		Candidate seed = store.addCandidate(Candidate.seed("seed"));
		Candidate first = store.addCandidate(Candidate.mutationOf(seed, "first"));
		Candidate second = store.addCandidate(Candidate.mutationOf(seed, "second"));

		List<EvaluationBatch> batches = evaluator.evaluateAll(List.of(first, second));

		assertThat(batches.get(0).truncated()).isFalse();
		assertThat(batches.get(0).results()).hasSize(3);
		assertThat(batches.get(1).truncated()).isTrue();
		assertThat(batches.get(1).results()).hasSize(1);
		assertThat(budget.consumed()).isEqualTo(4);
	}

	@Test
	void agentExceptionBecomesFailingResult() {
		RecordingAgentExecutor agent = new RecordingAgentExecutor((instruction, input) -> {
			if (input.equals("who am I")) {
				throw new IllegalStateException("tool backend down");
			}
			return new AgentTrace(input, List.of(), "refund verify thank you");
		});
		RolloutBudget budget = new RolloutBudget(10);
		evaluator = new DefaultCandidateEvaluator(SUITE, agent, budget, store, 2, Duration.ofSeconds(5));
		Candidate seed = store.addCandidate(Candidate.seed("anything"));

		EvaluationBatch batch = evaluator.evaluate(seed);

		EvaluationResult failed = store.result(seed.id(), "identity").orElseThrow();
		assertThat(failed.passed()).isFalse();
		assertThat(failed.score()).isZero();
		assertThat(failed.trace().failure()).contains("tool backend down");
		assertThat(batch.passedCount()).isEqualTo(2);
		assertThat(budget.consumed()).isEqualTo(3);
	}

	@Test
	void timedOutRolloutIsFailedAndConsumesBudget() {
		CountDownLatch never = new CountDownLatch(1);
		RecordingAgentExecutor agent = new RecordingAgentExecutor((instruction, input) -> {
			if (input.equals("hello")) {
				never.await(30, TimeUnit.SECONDS);
			}
			return new AgentTrace(input, List.of(), "refund verify thank you");
		});
		RolloutBudget budget = new RolloutBudget(10);
		evaluator = new DefaultCandidateEvaluator(SUITE, agent, budget, store, 3, Duration.ofMillis(200));
		Candidate seed = store.addCandidate(Candidate.seed("anything"));

		evaluator.evaluate(seed);

		EvaluationResult timedOut = store.result(seed.id(), "polite").orElseThrow();
		assertThat(timedOut.passed()).isFalse();
		assertThat(timedOut.trace().failure()).contains("timed out");
		assertThat(budget.consumed()).isEqualTo(3);
	}

	@Test
	void checkerExceptionBecomesFailingResultWithTrace() {
		ScenarioSuite suite = ScenarioSuite.of(new Scenario("broken", "input", trace -> {
			throw new IllegalArgumentException("bad rubric");
		}));
		RecordingAgentExecutor agent = RecordingAgentExecutor.echoingInstruction();
		evaluator = new DefaultCandidateEvaluator(suite, agent, new RolloutBudget(5), store, 1, Duration.ofSeconds(5));
		Candidate seed = store.addCandidate(Candidate.seed("instruction"));

		evaluator.evaluate(seed);

		EvaluationResult result = store.result(seed.id(), "broken").orElseThrow();
		assertThat(result.passed()).isFalse();
		assertThat(result.trace().finalOutput()).isEqualTo("instruction");
		assertThat(result.trace().failure()).contains("bad rubric");
	}

	@Test
	void respectsConcurrencyLimit() {
		RecordingAgentExecutor agent = new RecordingAgentExecutor((instruction, input) -> {
			Thread.sleep(50);
			return new AgentTrace(input, List.of(), instruction);
		});
		evaluator = new DefaultCandidateEvaluator(SUITE, agent, new RolloutBudget(30), store, 2, Duration.ofSeconds(5));
		Candidate seed = store.addCandidate(Candidate.seed("seed"));
		List<Candidate> children = List.of(
				store.addCandidate(Candidate.mutationOf(seed, "a")),
				store.addCandidate(Candidate.mutationOf(seed, "b")),
				store.addCandidate(Candidate.mutationOf(seed, "c")));

		evaluator.evaluateAll(children);

		assertThat(agent.invocations()).isEqualTo(9);
		assertThat(agent.maxConcurrent()).isLessThanOrEqualTo(2);
	}

	@Test
	void rejectsUnknownScenarioAndUnrecordedCandidate() {
		evaluator = new DefaultCandidateEvaluator(SUITE, RecordingAgentExecutor.echoingInstruction(),
				new RolloutBudget(5), store, 1, Duration.ofSeconds(5));
		Candidate recorded = store.addCandidate(Candidate.seed("seed"));

		assertThatThrownBy(() -> evaluator.evaluate(recorded, List.of("nope")))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> evaluator.evaluate(Candidate.seed("stray")))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("must be recorded");
	}
}
