package org.javai.springai.evolution.budget;

/**
 * Lifecycle of a {@link RolloutBudget}. {@link #EXHAUSTED} is terminal.
 */
public enum BudgetState {
	ACTIVE,
	EXHAUSTED
}
