package org.javai.springai.evolution.reflection;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.springai.evolution.agent.AgentTrace;
import org.javai.springai.evolution.generation.TextGenerator;
import org.javai.springai.evolution.population.Candidate;
import org.javai.springai.evolution.population.EvaluationResult;
import org.javai.springai.evolution.scenario.ScenarioSuite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Reflector} that asks a language model to diagnose failing scenarios.
 *
 * <p>The prompt shows the current instruction and up to {@code maxFailuresInPrompt} failing
 * traces, and asks for a {@code ROOT CAUSES:} section and a {@code FIXES:} section of bullets.
 * The parser tolerates markdown decoration, numbering and missing headers. A failed or blank
 * generation is retried once.</p>
 */
public class LlmReflector implements Reflector {

	public static final int DEFAULT_MAX_FAILURES_IN_PROMPT = 3;

	private static final Logger logger = LoggerFactory.getLogger(LlmReflector.class);
	private static final Pattern BULLET = Pattern.compile("^(?:[-*•+]|\\d+[.)])\\s+(.*)$");
	private static final Pattern HEADER = Pattern.compile("^[#*_\\s]*([A-Za-z ]+?)[*_\\s]*:[*_\\s]*(.*)$");
	private static final Pattern MARKDOWN_HEADING = Pattern.compile("^#+\\s*([A-Za-z ]+?)[\\s#]*$");
	private static final int MAX_ATTEMPTS = 2;
	private static final int MAX_OUTPUT_CHARS = 600;

	private final TextGenerator generator;
	private final ScenarioSuite suite;
	private final int maxFailuresInPrompt;

	public LlmReflector(TextGenerator generator, ScenarioSuite suite) {
		this(generator, suite, DEFAULT_MAX_FAILURES_IN_PROMPT);
	}

	/**
	 * @param generator the language model capability
	 * @param suite used to look up each failing scenario's expected behaviour; may be null
	 * @param maxFailuresInPrompt how many failing traces to include in the prompt
	 */
	public LlmReflector(TextGenerator generator, ScenarioSuite suite, int maxFailuresInPrompt) {
		this.generator = Objects.requireNonNull(generator, "generator must not be null");
		this.suite = suite;
		if (maxFailuresInPrompt < 1) {
			throw new IllegalArgumentException("maxFailuresInPrompt must be >= 1");
		}
		this.maxFailuresInPrompt = maxFailuresInPrompt;
	}

	@Override
	public Diagnosis reflect(Candidate candidate, List<EvaluationResult> failingResults) {
		Objects.requireNonNull(candidate, "candidate must not be null");
		if (failingResults == null || failingResults.isEmpty()) {
			throw new NoFailuresException(candidate.id());
		}
		for (EvaluationResult result : failingResults) {
			if (result.passed()) {
				throw new IllegalArgumentException("Result for scenario " + result.scenarioId() + " passed");
			}
			if (!candidate.id().equals(result.candidateId())) {
				throw new IllegalArgumentException("Result for scenario " + result.scenarioId()
						+ " belongs to candidate " + result.candidateId());
			}
		}

		String prompt = buildReflectionPrompt(candidate, failingResults);
		logger.debug("Reflecting on {} failures of candidate {}", failingResults.size(), candidate.id());

		RuntimeException lastFailure = null;
		for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
			try {
				String response = generator.generate(prompt);
				if (response == null || response.isBlank()) {
					lastFailure = new ReflectionException("Reflection returned an empty response");
					logger.debug("Reflection attempt {} returned an empty response", attempt);
					continue;
				}
				Diagnosis diagnosis = parse(response);
				logger.debug("Reflection produced {} root causes and {} fixes",
						diagnosis.rootCauses().size(), diagnosis.fixes().size());
				return diagnosis;
			}
			catch (RuntimeException e) {
				lastFailure = e;
				logger.debug("Reflection attempt {} failed: {}", attempt, e.getMessage());
			}
		}
		throw new ReflectionException("Reflection failed for candidate " + candidate.id() + " after "
				+ MAX_ATTEMPTS + " attempts", lastFailure);
	}

	String buildReflectionPrompt(Candidate candidate, List<EvaluationResult> failingResults) {
		StringBuilder failures = new StringBuilder();
		List<EvaluationResult> shown = failingResults.subList(0, Math.min(maxFailuresInPrompt, failingResults.size()));
		for (EvaluationResult result : shown) {
			AgentTrace trace = result.trace();
			failures.append("- Scenario: ").append(result.scenarioId()).append('\n');
			failures.append("  Input: ").append(oneLine(trace.input())).append('\n');
			failures.append("  Expected: ").append(expectedBehavior(result.scenarioId())).append('\n');
			failures.append("  Tools used: ").append(trace.toolCalls().isEmpty() ? "none" : String.join(", ", trace.toolCalls())).append('\n');
			failures.append("  Agent output: ").append(truncate(oneLine(trace.finalOutput()))).append('\n');
			failures.append("  Score: ").append(String.format(Locale.ROOT, "%.2f", result.score())).append('\n');
			if (trace.failed()) {
				failures.append("  Failure: ").append(oneLine(trace.failure())).append('\n');
			}
		}
		if (failingResults.size() > shown.size()) {
			failures.append("(").append(failingResults.size() - shown.size()).append(" more failing scenarios omitted)\n");
		}

		return String.format(
				"""
				You are an expert at analyzing why an AI agent's instructions lead to failures.

				Current instructions:
				%s

				Failing scenarios:
				%s
				Identify what is missing from or wrong in the instructions. Answer in exactly two sections:

				ROOT CAUSES:
				- one bullet per missing or incorrect instruction

				FIXES:
				- one bullet per concrete change to the instruction text

				Keep each section to at most three bullets.
				""",
				candidate.instructionText(),
				failures
		);
	}

	/**
	 * Parse a model response into a diagnosis. Lines before any recognised header, or all lines
	 * when there are no headers, are treated as fixes.
	 */
	static Diagnosis parse(String response) {
		List<String> rootCauses = new ArrayList<>();
		List<String> fixes = new ArrayList<>();
		List<String> current = fixes;

		for (String rawLine : response.split("\\R")) {
			String line = rawLine.strip();
			if (line.isEmpty() || line.startsWith("```")) {
				continue;
			}
			Matcher heading = MARKDOWN_HEADING.matcher(line);
			if (heading.matches()) {
				List<String> section = sectionFor(heading.group(1).strip().toLowerCase(Locale.ROOT), rootCauses, fixes);
				if (section != null) {
					current = section;
					continue;
				}
			}
			Matcher header = HEADER.matcher(line);
			if (header.matches() && !BULLET.matcher(line).matches()) {
				String name = header.group(1).strip().toLowerCase(Locale.ROOT);
				List<String> section = sectionFor(name, rootCauses, fixes);
				if (section != null) {
					current = section;
					addItem(current, header.group(2));
					continue;
				}
			}
			Matcher bullet = BULLET.matcher(line);
			addItem(current, bullet.matches() ? bullet.group(1) : line);
		}

		if (rootCauses.isEmpty() && fixes.isEmpty()) {
			fixes.add(response.strip());
		}
		return new Diagnosis(rootCauses, fixes, response);
	}

	private static List<String> sectionFor(String name, List<String> rootCauses, List<String> fixes) {
		if (name.contains("cause") || name.contains("problem")) {
			return rootCauses;
		}
		if (name.startsWith("fix") || name.contains("fixes") || name.contains("improvement")) {
			return fixes;
		}
		return null;
	}

	private static void addItem(List<String> section, String text) {
		if (text == null) {
			return;
		}
		String cleaned = text.replaceAll("^[*_`]+|[*_`]+$", "").strip();
		if (!cleaned.isEmpty()) {
			section.add(cleaned);
		}
	}

	private String expectedBehavior(String scenarioId) {
		if (suite == null) {
			return "N/A";
		}
		return suite.find(scenarioId)
				.map(scenario -> scenario.expectedBehavior().isBlank() ? "N/A" : oneLine(scenario.expectedBehavior()))
				.orElse("N/A");
	}

	private static String oneLine(String text) {
		return text == null ? "" : text.replaceAll("\\s+", " ").trim();
	}

	private static String truncate(String text) {
		return text.length() <= MAX_OUTPUT_CHARS ? text : text.substring(0, MAX_OUTPUT_CHARS - 3) + "...";
	}
}
