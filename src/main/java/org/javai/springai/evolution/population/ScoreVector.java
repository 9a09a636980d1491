package org.javai.springai.evolution.population;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Per-objective aggregate of a candidate's evaluation results.
 *
 * <p>Never stored; always recomputed from the results so it cannot go stale.</p>
 *
 * @param values one value per {@link Objective}; empty when the candidate has no results
 * @param evaluationCount number of results the values were computed from
 * @param passedCount number of those results that passed
 */
public record ScoreVector(
		Map<Objective, Double> values,
		int evaluationCount,
		int passedCount
) {

	private static final ScoreVector EMPTY = new ScoreVector(Map.of(), 0, 0);

	public ScoreVector {
		EnumMap<Objective, Double> copy = new EnumMap<>(Objective.class);
		if (values != null) {
			copy.putAll(values);
		}
		values = Collections.unmodifiableMap(copy);
	}

	public static ScoreVector empty() {
		return EMPTY;
	}

	public static ScoreVector of(List<EvaluationResult> results) {
		if (results == null || results.isEmpty()) {
			return EMPTY;
		}
		EnumMap<Objective, Double> values = new EnumMap<>(Objective.class);
		for (Objective objective : Objective.values()) {
			values.put(objective, objective.aggregate(results));
		}
		int passed = (int) results.stream().filter(EvaluationResult::passed).count();
		return new ScoreVector(values, results.size(), passed);
	}

	/**
	 * @return the value for the objective, or 0.0 when the vector is empty
	 */
	public double get(Objective objective) {
		return values.getOrDefault(objective, 0.0);
	}

	public double passRate() {
		return get(Objective.PASS_RATE);
	}

	public boolean isEmpty() {
		return evaluationCount == 0;
	}

	@Override
	public String toString() {
		if (isEmpty()) {
			return "{}";
		}
		return values.entrySet().stream()
				.map(e -> e.getKey().name().toLowerCase(Locale.ROOT) + "=" + String.format(Locale.ROOT, "%.4f", e.getValue()))
				.collect(Collectors.joining(", ", "{", "}"));
	}
}
