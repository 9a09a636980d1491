package org.javai.springai.evolution.scenario;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads a {@link ScenarioSuite} with {@link ExpectationChecker}s from YAML.
 *
 * <pre>{@code
 * scenarios:
 *   - id: refund-valid
 *     input: "I'd like to return order ORD-12345"
 *     expected_behavior: "Verify identity before approving"
 *     expect:
 *       output_contains: ["refund"]
 *       output_excludes: ["cannot help"]
 *       tools: ["verify_customer_identity"]
 * }</pre>
 */
public class ScenarioSuiteLoader {

	private final Yaml yaml = new Yaml();

	public ScenarioSuite load(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return load(reader);
		} catch (InvalidSuiteException e) {
			throw e;
		} catch (Exception e) {
			throw new InvalidSuiteException("Failed to load scenario suite from path: " + path, e);
		}
	}

	public ScenarioSuite load(InputStream inputStream) {
		try {
			Map<String, Object> data = yaml.load(inputStream);
			return buildSuite(data);
		} catch (InvalidSuiteException e) {
			throw e;
		} catch (Exception e) {
			throw new InvalidSuiteException("Failed to load scenario suite from input stream", e);
		}
	}

	public ScenarioSuite load(Reader reader) {
		try {
			Map<String, Object> data = yaml.load(reader);
			return buildSuite(data);
		} catch (InvalidSuiteException e) {
			throw e;
		} catch (Exception e) {
			throw new InvalidSuiteException("Failed to load scenario suite from reader", e);
		}
	}

	public ScenarioSuite loadString(String yamlContent) {
		try {
			Map<String, Object> data = yaml.load(yamlContent);
			return buildSuite(data);
		} catch (InvalidSuiteException e) {
			throw e;
		} catch (Exception e) {
			throw new InvalidSuiteException("Failed to load scenario suite from string", e);
		}
	}

	@SuppressWarnings("unchecked")
	private ScenarioSuite buildSuite(Map<String, Object> data) {
		if (data == null) {
			throw new InvalidSuiteException("Scenario document is empty");
		}
		Object scenariosObj = data.get("scenarios");
		if (!(scenariosObj instanceof List)) {
			throw new InvalidSuiteException("Missing required 'scenarios' list");
		}
		List<Scenario> scenarios = new ArrayList<>();
		for (Object entry : (List<Object>) scenariosObj) {
			if (!(entry instanceof Map)) {
				throw new InvalidSuiteException("Each scenario must be a mapping, got: " + entry);
			}
			scenarios.add(buildScenario((Map<String, Object>) entry));
		}
		return ScenarioSuite.of(scenarios);
	}

	@SuppressWarnings("unchecked")
	private Scenario buildScenario(Map<String, Object> scenarioData) {
		String id = toString(scenarioData.get("id"));
		String input = toString(scenarioData.get("input"));
		if (input == null) {
			throw new InvalidSuiteException("Scenario '" + id + "' is missing 'input'");
		}
		String expectedBehavior = toString(scenarioData.get("expected_behavior"));

		Map<String, Object> expect = (Map<String, Object>) scenarioData.get("expect");
		ExpectationChecker checker = expect == null
				? new ExpectationChecker(List.of(), List.of(), List.of())
				: new ExpectationChecker(
						toStringList(expect.get("output_contains")),
						toStringList(expect.get("output_excludes")),
						toStringList(expect.get("tools")));

		return new Scenario(id, input, expectedBehavior, checker);
	}

	private String toString(Object obj) {
		if (obj == null) {
			return null;
		}
		return obj instanceof String ? (String) obj : String.valueOf(obj);
	}

	@SuppressWarnings("unchecked")
	private List<String> toStringList(Object obj) {
		if (obj == null) {
			return List.of();
		}
		if (obj instanceof List) {
			return ((List<Object>) obj).stream().map(this::toString).toList();
		}
		return List.of(toString(obj));
	}
}
