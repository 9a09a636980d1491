package org.javai.springai.evolution.budget;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hard ceiling on the number of scenario executions (rollouts) in one run.
 *
 * <p>All consumption goes through {@link #reserve(int)}, an atomic check-and-increment that is
 * safe to call from concurrent evaluation tasks. {@code consumed()} never exceeds
 * {@code maxRollouts()}.</p>
 *
 * <p>The budget is {@link BudgetState#EXHAUSTED} once nothing remains; since consumption
 * only grows it never becomes active again.</p>
 */
public final class RolloutBudget {

	private final int maxRollouts;
	private final AtomicInteger consumed = new AtomicInteger();

	public RolloutBudget(int maxRollouts) {
		if (maxRollouts <= 0) {
			throw new IllegalArgumentException("maxRollouts must be positive");
		}
		this.maxRollouts = maxRollouts;
	}

	/**
	 * Reserve {@code n} rollouts.
	 *
	 * @param n number of rollouts to reserve (must be positive)
	 * @return true if reserved; false, with no change, if {@code n} exceeds what remains
	 */
	public boolean reserve(int n) {
		if (n <= 0) {
			throw new IllegalArgumentException("n must be positive");
		}
		while (true) {
			int current = consumed.get();
			if (n > maxRollouts - current) {
				return false;
			}
			if (consumed.compareAndSet(current, current + n)) {
				return true;
			}
		}
	}

	public int remaining() {
		return maxRollouts - consumed.get();
	}

	public int consumed() {
		return consumed.get();
	}

	public int maxRollouts() {
		return maxRollouts;
	}

	public BudgetState state() {
		return remaining() == 0 ? BudgetState.EXHAUSTED : BudgetState.ACTIVE;
	}

	public boolean isExhausted() {
		return state() == BudgetState.EXHAUSTED;
	}

	@Override
	public String toString() {
		return "RolloutBudget[consumed=" + consumed.get() + ", max=" + maxRollouts + ", state=" + state() + "]";
	}
}
