package org.javai.springai.evolution.agent;

import java.util.List;
import java.util.Map;

/**
 * Record of what the agent did for one scenario rollout.
 *
 * <p>The evolution core treats traces as opaque: only scenario checkers and the reflector
 * look inside them.</p>
 *
 * @param input the scenario input handed to the agent
 * @param toolCalls names of the tools the agent invoked, in call order
 * @param finalOutput the agent's final answer (may be empty, never null)
 * @param failure description of an execution failure or timeout; null when the rollout completed
 * @param attributes free-form details supplied by the agent runtime
 */
public record AgentTrace(
		String input,
		List<String> toolCalls,
		String finalOutput,
		String failure,
		Map<String, Object> attributes
) {

	public AgentTrace {
		input = input != null ? input : "";
		toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
		finalOutput = finalOutput != null ? finalOutput : "";
		attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
	}

	public AgentTrace(String input, List<String> toolCalls, String finalOutput) {
		this(input, toolCalls, finalOutput, null, Map.of());
	}

	/**
	 * Trace for a rollout that threw or timed out before producing an answer.
	 */
	public static AgentTrace executionFailure(String input, String reason) {
		return new AgentTrace(input, List.of(), "", reason != null ? reason : "execution failed", Map.of());
	}

	public boolean failed() {
		return failure != null;
	}
}
