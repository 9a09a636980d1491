package org.javai.springai.evolution.reflection;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured explanation of why a candidate failed, produced by a {@link Reflector}.
 *
 * @param rootCauses likely causes, phrased as missing or incorrect instructions
 * @param fixes concrete textual changes to the instruction
 * @param rawText the unparsed model response, kept for audit
 */
public record Diagnosis(
		List<String> rootCauses,
		List<String> fixes,
		String rawText
) {

	public Diagnosis {
		rootCauses = rootCauses != null ? List.copyOf(rootCauses) : List.of();
		fixes = fixes != null ? List.copyOf(fixes) : List.of();
		rawText = rawText != null ? rawText : "";
	}

	/**
	 * All findings: root causes followed by fixes.
	 */
	public List<String> findings() {
		List<String> findings = new ArrayList<>(rootCauses);
		findings.addAll(fixes);
		return List.copyOf(findings);
	}

	public boolean isEmpty() {
		return rootCauses.isEmpty() && fixes.isEmpty();
	}
}
