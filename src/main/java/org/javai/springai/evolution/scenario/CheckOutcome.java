package org.javai.springai.evolution.scenario;

/**
 * Verdict of a {@link ScenarioChecker} for one trace.
 *
 * @param passed whether the scenario is considered solved
 * @param score quality in [0.0, 1.0]; out-of-range values are clamped
 */
public record CheckOutcome(boolean passed, double score) {

	public CheckOutcome {
		if (Double.isNaN(score)) {
			throw new IllegalArgumentException("score must not be NaN");
		}
		score = Math.max(0.0, Math.min(1.0, score));
	}

	public static CheckOutcome pass() {
		return new CheckOutcome(true, 1.0);
	}

	public static CheckOutcome fail() {
		return new CheckOutcome(false, 0.0);
	}
}
