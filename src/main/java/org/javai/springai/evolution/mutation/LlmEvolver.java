package org.javai.springai.evolution.mutation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.javai.springai.evolution.generation.TextGenerator;
import org.javai.springai.evolution.population.Candidate;
import org.javai.springai.evolution.reflection.Diagnosis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Uses a language model to rewrite a candidate's instruction according to a diagnosis.
 *
 * <p>Each child is requested with a different focus (accuracy, safety, conciseness) so that
 * siblings explore different rewrites. A child is rejected when:</p>
 * <ul>
 *   <li>its text equals the parent's or an earlier sibling's (ignoring whitespace): the request
 *       is rephrased once, then the child fails with {@link DegenerateMutationException};</li>
 *   <li>it drops a protected marker present in the parent: regenerated up to
 *       {@code maxMarkerRetries} times, then given up;</li>
 *   <li>the model call fails or returns nothing: retried once.</li>
 * </ul>
 */
public class LlmEvolver implements Evolver {

	public static final int DEFAULT_MAX_MARKER_RETRIES = 3;

	private static final Logger logger = LoggerFactory.getLogger(LlmEvolver.class);

	/**
	 * Focus given to successive children. Each type steers the rewrite in one direction.
	 */
	private static final List<String> VARIATION_TYPES = List.of(
			"accuracy-focused",
			"safety-focused",
			"conciseness-focused"
	);

	private final TextGenerator generator;
	private final Set<String> protectedMarkers;
	private final int maxMarkerRetries;

	public LlmEvolver(TextGenerator generator) {
		this(generator, Set.of(), DEFAULT_MAX_MARKER_RETRIES);
	}

	/**
	 * @param generator the language model capability
	 * @param protectedMarkers literal markers (e.g. {@code {customer_name}}) that children must keep
	 * @param maxMarkerRetries regenerations allowed per child after dropping a protected marker
	 */
	public LlmEvolver(TextGenerator generator, Set<String> protectedMarkers, int maxMarkerRetries) {
		this.generator = Objects.requireNonNull(generator, "generator must not be null");
		this.protectedMarkers = protectedMarkers != null ? Set.copyOf(protectedMarkers) : Set.of();
		if (maxMarkerRetries < 0) {
			throw new IllegalArgumentException("maxMarkerRetries must be >= 0");
		}
		this.maxMarkerRetries = maxMarkerRetries;
	}

	@Override
	public List<Candidate> evolve(Candidate candidate, Diagnosis diagnosis, int numChildren) {
		Objects.requireNonNull(candidate, "candidate must not be null");
		Objects.requireNonNull(diagnosis, "diagnosis must not be null");
		if (numChildren < 1) {
			throw new IllegalArgumentException("numChildren must be >= 1");
		}

		Set<String> seen = new HashSet<>();
		seen.add(normalize(candidate.instructionText()));
		List<String> requiredMarkers = protectedMarkers.stream()
				.filter(marker -> candidate.instructionText().contains(marker))
				.sorted()
				.toList();

		List<Candidate> children = new ArrayList<>();
		MutationException lastFailure = null;
		for (int slot = 0; slot < numChildren; slot++) {
			String variationType = VARIATION_TYPES.get(slot % VARIATION_TYPES.size());
			try {
				String text = generateChild(candidate, diagnosis, variationType, requiredMarkers, seen);
				seen.add(normalize(text));
				children.add(Candidate.mutationOf(candidate, text));
				logger.debug("Generated {} child of candidate {}", variationType, candidate.id());
			}
			catch (MutationException e) {
				lastFailure = e;
				logger.warn("Could not generate {} child of candidate {}: {}", variationType, candidate.id(),
						e.getMessage());
			}
		}

		if (children.isEmpty()) {
			throw lastFailure;
		}
		if (children.size() < numChildren) {
			logger.debug("Generated {} of {} requested children for candidate {}", children.size(), numChildren,
					candidate.id());
		}
		return children;
	}

	private String generateChild(Candidate parent, Diagnosis diagnosis, String variationType,
			List<String> requiredMarkers, Set<String> seen) {
		boolean rephrased = false;
		boolean generationRetried = false;
		int markerRejections = 0;

		while (true) {
			String prompt = rephrased
					? buildRephrasedPrompt(parent, diagnosis, variationType, requiredMarkers)
					: buildEvolutionPrompt(parent, diagnosis, variationType, requiredMarkers);

			String text;
			try {
				text = clean(generator.generate(prompt));
			}
			catch (RuntimeException e) {
				if (generationRetried) {
					throw new MutationException("Evolution call failed for candidate " + parent.id(), e);
				}
				generationRetried = true;
				logger.debug("Evolution call failed, retrying: {}", e.getMessage());
				continue;
			}
			if (text.isEmpty()) {
				if (generationRetried) {
					throw new MutationException("Evolution returned an empty instruction for candidate " + parent.id());
				}
				generationRetried = true;
				continue;
			}

			if (seen.contains(normalize(text))) {
				if (rephrased) {
					throw new DegenerateMutationException(parent.id());
				}
				rephrased = true;
				logger.debug("Evolution repeated an existing instruction, rephrasing request");
				continue;
			}

			List<String> missing = requiredMarkers.stream().filter(marker -> !text.contains(marker)).toList();
			if (!missing.isEmpty()) {
				markerRejections++;
				if (markerRejections > maxMarkerRetries) {
					throw new MutationException("Evolution kept dropping protected markers " + missing
							+ " for candidate " + parent.id());
				}
				logger.debug("Evolution dropped protected markers {}, regenerating ({}/{})", missing,
						markerRejections, maxMarkerRetries);
				continue;
			}
			return text;
		}
	}

	String buildEvolutionPrompt(Candidate parent, Diagnosis diagnosis, String variationType,
			List<String> requiredMarkers) {
		return String.format(
				"""
				You are an expert at evolving AI agent instructions to fix failures.

				Current instructions:
				%s

				Feedback on what is failing:
				%s

				Write an improved, %s version of the instructions that:
				1. Keeps all the good parts of the current instructions
				2. Adds the specific improvements identified in the feedback
				3. Maintains clarity and structure
				%s
				IMPORTANT: Return ONLY the new instructions, with no other text or explanation.
				""",
				parent.instructionText(),
				renderFeedback(diagnosis),
				variationType,
				renderMarkerRule(requiredMarkers)
		);
	}

	String buildRephrasedPrompt(Candidate parent, Diagnosis diagnosis, String variationType,
			List<String> requiredMarkers) {
		return String.format(
				"""
				The instructions below produce failures and must be rewritten. Returning them unchanged is
				not acceptable: your answer must differ from them.

				Instructions to rewrite:
				%s

				Problems to address:
				%s

				Produce a %s rewrite that resolves every problem listed.
				%s
				Return ONLY the rewritten instructions.
				""",
				parent.instructionText(),
				renderFeedback(diagnosis),
				variationType,
				renderMarkerRule(requiredMarkers)
		);
	}

	private String renderFeedback(Diagnosis diagnosis) {
		if (diagnosis.isEmpty()) {
			return "- No specific feedback; improve clarity and completeness.";
		}
		StringBuilder sb = new StringBuilder();
		if (!diagnosis.rootCauses().isEmpty()) {
			sb.append("Root causes:\n");
			diagnosis.rootCauses().forEach(cause -> sb.append("- ").append(cause).append('\n'));
		}
		if (!diagnosis.fixes().isEmpty()) {
			sb.append("Suggested fixes:\n");
			diagnosis.fixes().forEach(fix -> sb.append("- ").append(fix).append('\n'));
		}
		return sb.toString().strip();
	}

	private String renderMarkerRule(List<String> requiredMarkers) {
		if (requiredMarkers.isEmpty()) {
			return "";
		}
		return "Keep these placeholders exactly as written: " + String.join(", ", new LinkedHashSet<>(requiredMarkers)) + "\n";
	}

	/**
	 * Strip surrounding whitespace and markdown code fences.
	 */
	static String clean(String response) {
		if (response == null) {
			return "";
		}
		String text = response.strip();
		if (text.startsWith("```")) {
			int firstNewline = text.indexOf('\n');
			if (firstNewline < 0) {
				// single-line fence: keep whatever sits between the backticks
				text = text.substring(3);
				int closing = text.indexOf("```");
				return (closing < 0 ? text : text.substring(0, closing)).strip();
			}
			text = text.substring(firstNewline + 1);
			if (text.stripTrailing().endsWith("```")) {
				text = text.stripTrailing();
				text = text.substring(0, text.length() - 3);
			}
		}
		return text.strip();
	}

	private static String normalize(String text) {
		return text.replaceAll("\\s+", " ").strip();
	}
}
