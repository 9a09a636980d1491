package org.javai.springai.evolution.scenario;

import java.util.Objects;

/**
 * A single labelled test case used to score candidate instructions.
 *
 * @param scenarioId unique, stable identifier within a suite
 * @param input what the agent under test is given
 * @param expectedBehavior human-readable description of the desired behaviour; shown to the
 *                         reflector when the scenario fails (may be empty)
 * @param checker decides pass/fail/score from the agent's trace
 */
public record Scenario(
		String scenarioId,
		String input,
		String expectedBehavior,
		ScenarioChecker checker
) {

	public Scenario {
		if (scenarioId == null || scenarioId.isBlank()) {
			throw new InvalidSuiteException("scenarioId must not be blank");
		}
		Objects.requireNonNull(input, "input must not be null");
		Objects.requireNonNull(checker, "checker must not be null");
		expectedBehavior = expectedBehavior != null ? expectedBehavior : "";
	}

	public Scenario(String scenarioId, String input, ScenarioChecker checker) {
		this(scenarioId, input, "", checker);
	}
}
