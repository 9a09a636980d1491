package org.javai.springai.evolution;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.javai.springai.evolution.population.Objective;

/**
 * Settings for one evolution run.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * EvolutionConfig config = EvolutionConfig.builder()
 *         .maxRollouts(200)
 *         .childrenPerGeneration(3)
 *         .protectedMarkers(Set.of("{customer_name}"))
 *         .build();
 * }</pre>
 *
 * @param maxRollouts ceiling on scenario executions over the whole run (required, positive)
 * @param convergenceTargetPassRate pass rate at which the run converges, in (0, 1]
 * @param stagnationGenerations consecutive generations without frontier improvement before stopping
 * @param childrenPerGeneration children requested from the evolver per parent
 * @param parentsPerGeneration parents selected per generation
 * @param evaluationConcurrency rollouts executed in parallel
 * @param scenarioTimeout limit for a single rollout; a timed-out rollout counts as failed
 * @param maxGenerations upper bound on generations; {@link Integer#MAX_VALUE} for none
 * @param maxFailuresInReflection failing traces shown to the reflector
 * @param maxMarkerRetries regenerations allowed when a child drops a protected marker
 * @param protectedMarkers literal placeholders children must keep
 * @param objectives objectives compared by the selector, in tie-break priority
 * @param primaryObjective objective used to pick the single best candidate
 */
public record EvolutionConfig(
		int maxRollouts,
		double convergenceTargetPassRate,
		int stagnationGenerations,
		int childrenPerGeneration,
		int parentsPerGeneration,
		int evaluationConcurrency,
		Duration scenarioTimeout,
		int maxGenerations,
		int maxFailuresInReflection,
		int maxMarkerRetries,
		Set<String> protectedMarkers,
		List<Objective> objectives,
		Objective primaryObjective
) {

	public static final double DEFAULT_TARGET_PASS_RATE = 1.0;
	public static final int DEFAULT_STAGNATION_GENERATIONS = 3;
	public static final int DEFAULT_CHILDREN_PER_GENERATION = 2;
	public static final int DEFAULT_PARENTS_PER_GENERATION = 1;
	public static final int DEFAULT_EVALUATION_CONCURRENCY = 4;
	public static final Duration DEFAULT_SCENARIO_TIMEOUT = Duration.ofSeconds(60);
	public static final int DEFAULT_MAX_FAILURES_IN_REFLECTION = 3;
	public static final int DEFAULT_MAX_MARKER_RETRIES = 3;
	public static final List<Objective> DEFAULT_OBJECTIVES =
			List.of(Objective.PASS_RATE, Objective.MEAN_SCORE, Objective.WORST_CASE_SCORE);

	public EvolutionConfig {
		if (maxRollouts <= 0) {
			throw new InvalidConfigurationException("maxRollouts must be positive");
		}
		if (Double.isNaN(convergenceTargetPassRate) || convergenceTargetPassRate <= 0.0 || convergenceTargetPassRate > 1.0) {
			throw new InvalidConfigurationException("convergenceTargetPassRate must be within (0, 1]");
		}
		requirePositive(stagnationGenerations, "stagnationGenerations");
		requirePositive(childrenPerGeneration, "childrenPerGeneration");
		requirePositive(parentsPerGeneration, "parentsPerGeneration");
		requirePositive(evaluationConcurrency, "evaluationConcurrency");
		requirePositive(maxGenerations, "maxGenerations");
		requirePositive(maxFailuresInReflection, "maxFailuresInReflection");
		if (maxMarkerRetries < 0) {
			throw new InvalidConfigurationException("maxMarkerRetries must be >= 0");
		}
		if (scenarioTimeout == null || scenarioTimeout.isZero() || scenarioTimeout.isNegative()) {
			throw new InvalidConfigurationException("scenarioTimeout must be positive");
		}
		protectedMarkers = protectedMarkers != null ? Set.copyOf(protectedMarkers) : Set.of();
		objectives = objectives != null && !objectives.isEmpty()
				? List.copyOf(new LinkedHashSet<>(objectives))
				: DEFAULT_OBJECTIVES;
		primaryObjective = primaryObjective != null ? primaryObjective : objectives.get(0);
		if (!objectives.contains(primaryObjective)) {
			throw new InvalidConfigurationException("primaryObjective " + primaryObjective + " is not among the objectives");
		}
	}

	/**
	 * Defaults for everything except the budget.
	 */
	public static EvolutionConfig withMaxRollouts(int maxRollouts) {
		return builder().maxRollouts(maxRollouts).build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public boolean hasGenerationLimit() {
		return maxGenerations != Integer.MAX_VALUE;
	}

	private static void requirePositive(int value, String name) {
		if (value < 1) {
			throw new InvalidConfigurationException(name + " must be >= 1");
		}
	}

	/**
	 * Builder for {@link EvolutionConfig}.
	 */
	public static class Builder {
		private int maxRollouts;
		private double convergenceTargetPassRate = DEFAULT_TARGET_PASS_RATE;
		private int stagnationGenerations = DEFAULT_STAGNATION_GENERATIONS;
		private int childrenPerGeneration = DEFAULT_CHILDREN_PER_GENERATION;
		private int parentsPerGeneration = DEFAULT_PARENTS_PER_GENERATION;
		private int evaluationConcurrency = DEFAULT_EVALUATION_CONCURRENCY;
		private Duration scenarioTimeout = DEFAULT_SCENARIO_TIMEOUT;
		private int maxGenerations = Integer.MAX_VALUE;
		private int maxFailuresInReflection = DEFAULT_MAX_FAILURES_IN_REFLECTION;
		private int maxMarkerRetries = DEFAULT_MAX_MARKER_RETRIES;
		private Set<String> protectedMarkers = Set.of();
		private List<Objective> objectives = DEFAULT_OBJECTIVES;
		private Objective primaryObjective;

		private Builder() {}

		public Builder maxRollouts(int maxRollouts) {
			this.maxRollouts = maxRollouts;
			return this;
		}

		public Builder convergenceTargetPassRate(double convergenceTargetPassRate) {
			this.convergenceTargetPassRate = convergenceTargetPassRate;
			return this;
		}

		public Builder stagnationGenerations(int stagnationGenerations) {
			this.stagnationGenerations = stagnationGenerations;
			return this;
		}

		public Builder childrenPerGeneration(int childrenPerGeneration) {
			this.childrenPerGeneration = childrenPerGeneration;
			return this;
		}

		public Builder parentsPerGeneration(int parentsPerGeneration) {
			this.parentsPerGeneration = parentsPerGeneration;
			return this;
		}

		public Builder evaluationConcurrency(int evaluationConcurrency) {
			this.evaluationConcurrency = evaluationConcurrency;
			return this;
		}

		public Builder scenarioTimeout(Duration scenarioTimeout) {
			this.scenarioTimeout = scenarioTimeout;
			return this;
		}

		public Builder maxGenerations(int maxGenerations) {
			this.maxGenerations = maxGenerations;
			return this;
		}

		public Builder maxFailuresInReflection(int maxFailuresInReflection) {
			this.maxFailuresInReflection = maxFailuresInReflection;
			return this;
		}

		public Builder maxMarkerRetries(int maxMarkerRetries) {
			this.maxMarkerRetries = maxMarkerRetries;
			return this;
		}

		public Builder protectedMarkers(Set<String> protectedMarkers) {
			this.protectedMarkers = protectedMarkers;
			return this;
		}

		public Builder objectives(List<Objective> objectives) {
			this.objectives = objectives;
			return this;
		}

		public Builder primaryObjective(Objective primaryObjective) {
			this.primaryObjective = primaryObjective;
			return this;
		}

		public EvolutionConfig build() {
			return new EvolutionConfig(
					maxRollouts,
					convergenceTargetPassRate,
					stagnationGenerations,
					childrenPerGeneration,
					parentsPerGeneration,
					evaluationConcurrency,
					scenarioTimeout,
					maxGenerations,
					maxFailuresInReflection,
					maxMarkerRetries,
					protectedMarkers,
					objectives,
					primaryObjective
			);
		}
	}
}
