package org.javai.springai.evolution.agent;

/**
 * Runs an agent configured with a candidate instruction against one scenario input.
 *
 * <p>Implementations wrap a real agent runtime. Calls are I/O bound and may block; the
 * evaluator invokes them concurrently, so implementations must be thread-safe.</p>
 */
@FunctionalInterface
public interface AgentExecutor {

	/**
	 * Execute the agent once.
	 *
	 * @param instructionText the instruction (system prompt) under evaluation
	 * @param scenarioInput what the agent is given for this scenario
	 * @return the trace of the run
	 * @throws Exception any failure of the underlying runtime; recorded as a failed rollout
	 */
	AgentTrace execute(String instructionText, String scenarioInput) throws Exception;
}
