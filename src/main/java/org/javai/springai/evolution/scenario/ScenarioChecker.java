package org.javai.springai.evolution.scenario;

import org.javai.springai.evolution.agent.AgentTrace;

/**
 * Decides pass/fail and a score for a scenario from the agent's trace.
 */
@FunctionalInterface
public interface ScenarioChecker {

	CheckOutcome check(AgentTrace trace);
}
