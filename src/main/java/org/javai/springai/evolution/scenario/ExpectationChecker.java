package org.javai.springai.evolution.scenario;

import java.util.List;
import java.util.Locale;
import org.javai.springai.evolution.agent.AgentTrace;

/**
 * Declarative {@link ScenarioChecker} built from simple expectations about a trace.
 *
 * <p>Each phrase and tool is one rule. The score is the fraction of rules satisfied and the
 * scenario passes only when every rule holds. Phrase matching is case-insensitive. A trace
 * that records an execution failure never passes.</p>
 *
 * @param outputContains phrases the final output must contain
 * @param outputExcludes phrases the final output must not contain
 * @param requiredTools tool names the agent must have called
 */
public record ExpectationChecker(
		List<String> outputContains,
		List<String> outputExcludes,
		List<String> requiredTools
) implements ScenarioChecker {

	public ExpectationChecker {
		outputContains = outputContains != null ? List.copyOf(outputContains) : List.of();
		outputExcludes = outputExcludes != null ? List.copyOf(outputExcludes) : List.of();
		requiredTools = requiredTools != null ? List.copyOf(requiredTools) : List.of();
	}

	public static ExpectationChecker outputContaining(String... phrases) {
		return new ExpectationChecker(List.of(phrases), List.of(), List.of());
	}

	@Override
	public CheckOutcome check(AgentTrace trace) {
		if (trace == null || trace.failed()) {
			return CheckOutcome.fail();
		}
		int rules = outputContains.size() + outputExcludes.size() + requiredTools.size();
		if (rules == 0) {
			return CheckOutcome.pass();
		}

		String output = trace.finalOutput().toLowerCase(Locale.ROOT);
		int satisfied = 0;
		for (String phrase : outputContains) {
			if (output.contains(phrase.toLowerCase(Locale.ROOT))) {
				satisfied++;
			}
		}
		for (String phrase : outputExcludes) {
			if (!output.contains(phrase.toLowerCase(Locale.ROOT))) {
				satisfied++;
			}
		}
		for (String tool : requiredTools) {
			if (trace.toolCalls().contains(tool)) {
				satisfied++;
			}
		}
		return new CheckOutcome(satisfied == rules, (double) satisfied / rules);
	}
}
