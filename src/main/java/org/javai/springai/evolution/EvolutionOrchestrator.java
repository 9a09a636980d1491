package org.javai.springai.evolution;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import org.javai.springai.evolution.agent.AgentExecutor;
import org.javai.springai.evolution.budget.RolloutBudget;
import org.javai.springai.evolution.evaluation.DefaultCandidateEvaluator;
import org.javai.springai.evolution.evaluation.EvaluationBatch;
import org.javai.springai.evolution.generation.GenerationException;
import org.javai.springai.evolution.generation.TextGenerator;
import org.javai.springai.evolution.mutation.Evolver;
import org.javai.springai.evolution.mutation.LlmEvolver;
import org.javai.springai.evolution.mutation.MutationException;
import org.javai.springai.evolution.population.Candidate;
import org.javai.springai.evolution.population.EvaluationResult;
import org.javai.springai.evolution.population.PopulationStore;
import org.javai.springai.evolution.population.ScoreVector;
import org.javai.springai.evolution.reflection.Diagnosis;
import org.javai.springai.evolution.reflection.LlmReflector;
import org.javai.springai.evolution.reflection.ReflectionException;
import org.javai.springai.evolution.reflection.Reflector;
import org.javai.springai.evolution.scenario.ScenarioSuite;
import org.javai.springai.evolution.selection.ParetoSelector;

/**
 * Drives the evolution loop: evaluate the seed, then repeatedly select parents, reflect on their
 * failures, evolve children and evaluate them until the run converges, stagnates, hits the
 * generation limit or exhausts its rollout budget.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * EvolutionOrchestrator orchestrator = EvolutionOrchestrator.builder()
 *         .scenarioSuite(suite)
 *         .agentExecutor(agent)
 *         .textGenerator(new ChatClientTextGenerator(chatClient))
 *         .config(EvolutionConfig.withMaxRollouts(150))
 *         .build();
 *
 * EvolutionResult result = orchestrator.run("You are a support agent...");
 * if (result.succeeded()) {
 *     deploy(result.bestInstructionText());
 * }
 * }</pre>
 *
 * <p>Each call to {@link #run(String)} uses a fresh population store and budget. A reflection or
 * evolution failure only makes the affected parent a dead end for that generation; failures of
 * the store or broken invariants end the run as {@link RunState#FAILED}.</p>
 */
public class EvolutionOrchestrator {

	private final ScenarioSuite suite;
	private final AgentExecutor agentExecutor;
	private final TextGenerator textGenerator;
	private final Reflector reflector;
	private final Evolver evolver;
	private final EvolutionConfig config;
	private final Supplier<PopulationStore> populationStoreFactory;
	private final EvolutionLogger logger = new EvolutionLogger(EvolutionOrchestrator.class);

	private volatile RunState state = RunState.INIT;

	private EvolutionOrchestrator(Builder builder) {
		this.suite = builder.suite;
		this.agentExecutor = builder.agentExecutor;
		this.textGenerator = builder.textGenerator;
		this.reflector = builder.reflector;
		this.evolver = builder.evolver;
		this.config = builder.config;
		this.populationStoreFactory = builder.populationStoreFactory;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * State of the current or most recent run.
	 */
	public RunState state() {
		return state;
	}

	/**
	 * Evolve the given seed instruction.
	 *
	 * @throws InvalidConfigurationException if the seed is blank or a required collaborator or
	 *                                       the configuration is missing
	 */
	public EvolutionResult run(String seedInstructionText) {
		state = RunState.INIT;
		validate(seedInstructionText);
		Reflector runReflector = reflector != null
				? reflector
				: new LlmReflector(textGenerator, suite, config.maxFailuresInReflection());
		Evolver runEvolver = evolver != null
				? evolver
				: new LlmEvolver(textGenerator, config.protectedMarkers(), config.maxMarkerRetries());

		Run run = new Run(runReflector, runEvolver);
		try (PopulationStore store = run.store; DefaultCandidateEvaluator evaluator = run.evaluator) {
			EvolutionResult result = run.execute(seedInstructionText);
			state = result.state();
			return result;
		}
	}

	private void validate(String seedInstructionText) {
		if (seedInstructionText == null || seedInstructionText.isBlank()) {
			throw new InvalidConfigurationException("seed instruction text must not be blank");
		}
		if (config == null) {
			throw new InvalidConfigurationException("config must be provided");
		}
		if (suite == null) {
			throw new InvalidConfigurationException("scenario suite must be provided");
		}
		if (agentExecutor == null) {
			throw new InvalidConfigurationException("agent executor must be provided");
		}
		if (textGenerator == null && (reflector == null || evolver == null)) {
			throw new InvalidConfigurationException(
					"a text generator is required unless both a reflector and an evolver are provided");
		}
	}

	/**
	 * State of one run.
	 */
	private final class Run {

		private final Reflector reflector;
		private final Evolver evolver;
		private final RolloutBudget budget;
		private final PopulationStore store;
		private final DefaultCandidateEvaluator evaluator;
		private final ParetoSelector selector;
		private final List<GenerationSummary> history = new ArrayList<>();
		private final Instant startedAt = Instant.now();
		private Candidate seed;
		private int lastConsistentGeneration;
		private int stagnantGenerations;

		private Run(Reflector reflector, Evolver evolver) {
			this.reflector = reflector;
			this.evolver = evolver;
			this.budget = new RolloutBudget(config.maxRollouts());
			this.store = Objects.requireNonNull(populationStoreFactory.get(), "population store must not be null");
			this.evaluator = new DefaultCandidateEvaluator(suite, agentExecutor, budget, store,
					config.evaluationConcurrency(), config.scenarioTimeout());
			this.selector = new ParetoSelector(config.objectives(), suite.scenarioIds());
		}

		private EvolutionResult execute(String seedInstructionText) {
			try {
				state = RunState.SEEDING;
				seed = store.addCandidate(Candidate.seed(seedInstructionText));
				EvaluationBatch seedBatch = evaluator.evaluate(seed);
				logger.logSeedEvaluated(seed, seedBatch, store.scoreVector(seed.id()));
				if (seedBatch.truncated()) {
					return finish(RunState.EXHAUSTED);
				}
				if (hasConverged()) {
					return finish(RunState.CONVERGED);
				}

				state = RunState.GENERATING;
				int generation = 0;
				while (true) {
					if (budget.isExhausted()) {
						return finish(RunState.EXHAUSTED);
					}
					generation++;
					RunState outcome = runGeneration(generation);
					if (outcome != null) {
						return finish(outcome);
					}
				}
			}
			catch (RuntimeException e) {
				logger.logRunFailed(lastConsistentGeneration, e);
				return failed(e);
			}
		}

		/**
		 * @return the terminal state the generation led to, or null to keep going
		 */
		private RunState runGeneration(int generation) {
			List<ScoreVector> frontierBefore = selector.frontierScores(store);
			List<Candidate> parents = selector.selectParents(store, config.parentsPerGeneration());
			if (parents.isEmpty()) {
				throw new IllegalStateException("No fully evaluated candidate to select parents from");
			}
			logger.logGenerationStarted(generation, parents.size(), budget.remaining());

			List<Candidate> children = new ArrayList<>();
			int parentsWithFailures = 0;
			int deadEnds = 0;
			for (Candidate parent : parents) {
				List<EvaluationResult> failures = store.failingResults(parent.id());
				if (failures.isEmpty()) {
					continue;
				}
				parentsWithFailures++;
				try {
					Diagnosis diagnosis = reflector.reflect(parent, failures);
					for (Candidate child : evolver.evolve(parent, diagnosis, config.childrenPerGeneration())) {
						store.addCandidate(child, diagnosis);
						logger.logChildRecorded(child);
						children.add(child);
					}
				}
				catch (ReflectionException | MutationException | GenerationException e) {
					deadEnds++;
					logger.logDeadEnd(generation, parent, e);
				}
			}

			if (parentsWithFailures == 0) {
				logger.debug("generation #{}: no selected parent has failures left", generation);
				return RunState.CONVERGED;
			}

			List<EvaluationBatch> batches = children.isEmpty() ? List.of() : evaluator.evaluateAll(children);
			int fullyEvaluated = (int) batches.stream()
					.filter(batch -> store.isFullyEvaluated(batch.candidate().id(), suite.scenarioIds()))
					.count();

			List<ScoreVector> frontierAfter = selector.frontierScores(store);
			boolean improved = selector.improves(frontierBefore, frontierAfter);
			stagnantGenerations = improved ? 0 : stagnantGenerations + 1;

			GenerationSummary summary = new GenerationSummary(generation, parents.size(), deadEnds,
					children.size(), fullyEvaluated, bestPassRate(), frontierAfter.size(), improved,
					budget.consumed());
			history.add(summary);
			lastConsistentGeneration = generation;
			logger.logGenerationCompleted(summary);

			if (hasConverged()) {
				return RunState.CONVERGED;
			}
			if (budget.isExhausted()) {
				return RunState.EXHAUSTED;
			}
			if (stagnantGenerations >= config.stagnationGenerations()) {
				return RunState.STAGNATED;
			}
			if (generation >= config.maxGenerations()) {
				return RunState.GENERATION_LIMIT;
			}
			return null;
		}

		private boolean hasConverged() {
			return bestPassRate() >= config.convergenceTargetPassRate();
		}

		private double bestPassRate() {
			return selector.eligible(store).stream()
					.mapToDouble(candidate -> store.scoreVector(candidate.id()).passRate())
					.max()
					.orElse(0.0);
		}

		private EvolutionResult finish(RunState terminal) {
			// with nothing fully evaluated the seed is returned with its partial scores
			Candidate best = selector.best(store, config.primaryObjective()).orElse(seed);
			List<LineageStep> lineage = new ArrayList<>();
			if (best != null) {
				for (Candidate step : store.lineage(best.id())) {
					lineage.add(new LineageStep(step, store.diagnosisFor(step.id()).orElse(null),
							store.scoreVector(step.id())));
				}
			}
			EvolutionResult result = new EvolutionResult(
					terminal,
					best,
					best != null ? store.scoreVector(best.id()) : ScoreVector.empty(),
					lineage,
					selector.frontier(store),
					history,
					budget.consumed(),
					budget.maxRollouts(),
					lastConsistentGeneration,
					null,
					store,
					startedAt,
					Instant.now());
			logger.logTermination(result);
			return result;
		}

		private EvolutionResult failed(RuntimeException cause) {
			String message = cause.getMessage() != null ? cause.getMessage() : cause.toString();
			return new EvolutionResult(
					RunState.FAILED,
					null,
					ScoreVector.empty(),
					List.of(),
					List.of(),
					history,
					budget.consumed(),
					budget.maxRollouts(),
					lastConsistentGeneration,
					message,
					store,
					startedAt,
					Instant.now());
		}
	}

	/**
	 * Builder for {@link EvolutionOrchestrator}. Missing collaborators are reported by
	 * {@link EvolutionOrchestrator#run(String)}.
	 */
	public static class Builder {
		private ScenarioSuite suite;
		private AgentExecutor agentExecutor;
		private TextGenerator textGenerator;
		private Reflector reflector;
		private Evolver evolver;
		private EvolutionConfig config;
		private Supplier<PopulationStore> populationStoreFactory = PopulationStore::new;

		private Builder() {}

		public Builder scenarioSuite(ScenarioSuite suite) {
			this.suite = suite;
			return this;
		}

		public Builder agentExecutor(AgentExecutor agentExecutor) {
			this.agentExecutor = agentExecutor;
			return this;
		}

		/**
		 * Language model used by the default reflector and evolver.
		 */
		public Builder textGenerator(TextGenerator textGenerator) {
			this.textGenerator = textGenerator;
			return this;
		}

		public Builder reflector(Reflector reflector) {
			this.reflector = reflector;
			return this;
		}

		public Builder evolver(Evolver evolver) {
			this.evolver = evolver;
			return this;
		}

		public Builder config(EvolutionConfig config) {
			this.config = config;
			return this;
		}

		public Builder populationStoreFactory(Supplier<PopulationStore> populationStoreFactory) {
			this.populationStoreFactory = Objects.requireNonNull(populationStoreFactory,
					"populationStoreFactory must not be null");
			return this;
		}

		public EvolutionOrchestrator build() {
			return new EvolutionOrchestrator(this);
		}
	}
}
