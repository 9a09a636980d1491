package org.javai.springai.evolution;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.javai.springai.evolution.population.Objective;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads an {@link EvolutionConfig} from YAML. Keys may sit at the top level or under an
 * {@code evolution} mapping; anything not given keeps its default.
 *
 * <pre>{@code
 * evolution:
 *   max_rollouts: 200
 *   convergence_target_pass_rate: 0.9
 *   children_per_generation: 3
 *   scenario_timeout: 30          # seconds, or an ISO-8601 duration such as PT1M
 *   protected_markers: ["{customer_name}"]
 *   objectives: [pass_rate, worst_case_score]
 * }</pre>
 *
 * <p>Unknown keys are rejected so that a misspelt setting does not silently fall back to its
 * default.</p>
 */
public class EvolutionConfigLoader {

	private static final Set<String> KNOWN_KEYS = Set.of(
			"max_rollouts",
			"convergence_target_pass_rate",
			"stagnation_generations",
			"children_per_generation",
			"parents_per_generation",
			"evaluation_concurrency",
			"scenario_timeout",
			"max_generations",
			"max_failures_in_reflection",
			"max_marker_retries",
			"protected_markers",
			"objectives",
			"primary_objective"
	);

	private final Yaml yaml = new Yaml();

	public EvolutionConfig load(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return load(reader);
		} catch (InvalidConfigurationException e) {
			throw e;
		} catch (Exception e) {
			throw new InvalidConfigurationException("Failed to load evolution config from path: " + path, e);
		}
	}

	public EvolutionConfig load(InputStream inputStream) {
		try {
			Map<String, Object> data = yaml.load(inputStream);
			return buildConfig(data);
		} catch (InvalidConfigurationException e) {
			throw e;
		} catch (Exception e) {
			throw new InvalidConfigurationException("Failed to load evolution config from input stream", e);
		}
	}

	public EvolutionConfig load(Reader reader) {
		try {
			Map<String, Object> data = yaml.load(reader);
			return buildConfig(data);
		} catch (InvalidConfigurationException e) {
			throw e;
		} catch (Exception e) {
			throw new InvalidConfigurationException("Failed to load evolution config from reader", e);
		}
	}

	public EvolutionConfig loadString(String yamlContent) {
		try {
			Map<String, Object> data = yaml.load(yamlContent);
			return buildConfig(data);
		} catch (InvalidConfigurationException e) {
			throw e;
		} catch (Exception e) {
			throw new InvalidConfigurationException("Failed to load evolution config from string", e);
		}
	}

	@SuppressWarnings("unchecked")
	private EvolutionConfig buildConfig(Map<String, Object> data) {
		if (data == null) {
			throw new InvalidConfigurationException("Evolution config document is empty");
		}
		if (data.get("evolution") instanceof Map) {
			data = (Map<String, Object>) data.get("evolution");
		}
		for (String key : data.keySet()) {
			if (!KNOWN_KEYS.contains(key)) {
				throw new InvalidConfigurationException("Unknown evolution config key: " + key);
			}
		}
		if (!data.containsKey("max_rollouts")) {
			throw new InvalidConfigurationException("Missing required 'max_rollouts'");
		}

		EvolutionConfig.Builder builder = EvolutionConfig.builder()
				.maxRollouts(toInt(data, "max_rollouts"));
		if (data.containsKey("convergence_target_pass_rate")) {
			builder.convergenceTargetPassRate(toDouble(data, "convergence_target_pass_rate"));
		}
		if (data.containsKey("stagnation_generations")) {
			builder.stagnationGenerations(toInt(data, "stagnation_generations"));
		}
		if (data.containsKey("children_per_generation")) {
			builder.childrenPerGeneration(toInt(data, "children_per_generation"));
		}
		if (data.containsKey("parents_per_generation")) {
			builder.parentsPerGeneration(toInt(data, "parents_per_generation"));
		}
		if (data.containsKey("evaluation_concurrency")) {
			builder.evaluationConcurrency(toInt(data, "evaluation_concurrency"));
		}
		if (data.containsKey("scenario_timeout")) {
			builder.scenarioTimeout(toDuration(data.get("scenario_timeout")));
		}
		if (data.containsKey("max_generations")) {
			builder.maxGenerations(toInt(data, "max_generations"));
		}
		if (data.containsKey("max_failures_in_reflection")) {
			builder.maxFailuresInReflection(toInt(data, "max_failures_in_reflection"));
		}
		if (data.containsKey("max_marker_retries")) {
			builder.maxMarkerRetries(toInt(data, "max_marker_retries"));
		}
		if (data.containsKey("protected_markers")) {
			builder.protectedMarkers(new LinkedHashSet<>(toStringList(data.get("protected_markers"))));
		}
		if (data.containsKey("objectives")) {
			List<Objective> objectives = new ArrayList<>();
			for (String name : toStringList(data.get("objectives"))) {
				objectives.add(toObjective(name));
			}
			builder.objectives(objectives);
		}
		if (data.containsKey("primary_objective")) {
			builder.primaryObjective(toObjective(String.valueOf(data.get("primary_objective"))));
		}
		return builder.build();
	}

	private int toInt(Map<String, Object> data, String key) {
		Object value = data.get(key);
		if (value instanceof Integer i) {
			return i;
		}
		if (value instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue())) {
			if (n.doubleValue() < Integer.MIN_VALUE || n.doubleValue() > Integer.MAX_VALUE) {
				throw new InvalidConfigurationException("'" + key + "' is out of range: " + value);
			}
			return n.intValue();
		}
		throw new InvalidConfigurationException("'" + key + "' must be an integer, got: " + value);
	}

	private double toDouble(Map<String, Object> data, String key) {
		Object value = data.get(key);
		if (value instanceof Number n) {
			return n.doubleValue();
		}
		throw new InvalidConfigurationException("'" + key + "' must be a number, got: " + value);
	}

	private Duration toDuration(Object value) {
		if (value instanceof Number n) {
			return Duration.ofMillis(Math.round(n.doubleValue() * 1000));
		}
		try {
			return Duration.parse(String.valueOf(value));
		} catch (DateTimeParseException e) {
			throw new InvalidConfigurationException("'scenario_timeout' must be seconds or an ISO-8601 duration, got: "
					+ value, e);
		}
	}

	private Objective toObjective(String name) {
		try {
			return Objective.valueOf(name.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new InvalidConfigurationException("Unknown objective: " + name, e);
		}
	}

	@SuppressWarnings("unchecked")
	private List<String> toStringList(Object obj) {
		if (obj == null) {
			return List.of();
		}
		if (obj instanceof List) {
			return ((List<Object>) obj).stream().map(String::valueOf).toList();
		}
		return List.of(String.valueOf(obj));
	}
}
