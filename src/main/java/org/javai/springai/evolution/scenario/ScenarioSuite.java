package org.javai.springai.evolution.scenario;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, ordered collection of scenarios that all candidates of a run are scored against.
 *
 * <p>The suite never changes during a run, so scores from different generations stay
 * comparable.</p>
 */
public final class ScenarioSuite {

	private final Map<String, Scenario> scenarios;

	private ScenarioSuite(Map<String, Scenario> scenarios) {
		this.scenarios = Collections.unmodifiableMap(scenarios);
	}

	/**
	 * Create a suite from the given scenarios, preserving their order.
	 *
	 * @throws InvalidSuiteException if the list is empty or contains duplicate ids
	 */
	public static ScenarioSuite of(List<Scenario> scenarios) {
		if (scenarios == null || scenarios.isEmpty()) {
			throw new InvalidSuiteException("Scenario suite must contain at least one scenario");
		}
		Map<String, Scenario> byId = new LinkedHashMap<>();
		for (Scenario scenario : scenarios) {
			if (scenario == null) {
				throw new InvalidSuiteException("Scenario suite must not contain null entries");
			}
			if (byId.putIfAbsent(scenario.scenarioId(), scenario) != null) {
				throw new InvalidSuiteException("Duplicate scenario id: " + scenario.scenarioId());
			}
		}
		return new ScenarioSuite(byId);
	}

	public static ScenarioSuite of(Scenario... scenarios) {
		return of(scenarios == null ? List.of() : Arrays.asList(scenarios));
	}

	public List<Scenario> scenarios() {
		return List.copyOf(scenarios.values());
	}

	public List<String> scenarioIds() {
		return new ArrayList<>(scenarios.keySet());
	}

	public Optional<Scenario> find(String scenarioId) {
		return Optional.ofNullable(scenarios.get(scenarioId));
	}

	/**
	 * @throws IllegalArgumentException if the id is not part of this suite
	 */
	public Scenario get(String scenarioId) {
		Scenario scenario = scenarios.get(scenarioId);
		if (scenario == null) {
			throw new IllegalArgumentException("Unknown scenario id: " + scenarioId);
		}
		return scenario;
	}

	public boolean contains(String scenarioId) {
		return scenarios.containsKey(scenarioId);
	}

	public int size() {
		return scenarios.size();
	}

	@Override
	public String toString() {
		return "ScenarioSuite" + scenarios.keySet();
	}
}
