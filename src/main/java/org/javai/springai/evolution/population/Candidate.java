package org.javai.springai.evolution.population;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * One version of the instruction text under optimization.
 *
 * <p>Candidates are immutable. Evolution always produces a new candidate that references its
 * parent; the instruction text of an existing candidate never changes.</p>
 *
 * @param id unique identifier assigned at creation
 * @param instructionText the full instruction text
 * @param parentIds ids of the candidates this one was derived from, in order; empty for the seed
 * @param generation depth from the seed (seed = 0)
 * @param creationReason whether this is the seed or a mutation
 */
public record Candidate(
		String id,
		String instructionText,
		List<String> parentIds,
		int generation,
		CreationReason creationReason
) {

	public Candidate {
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("id must not be blank");
		}
		Objects.requireNonNull(instructionText, "instructionText must not be null");
		Objects.requireNonNull(creationReason, "creationReason must not be null");
		if (generation < 0) {
			throw new IllegalArgumentException("generation must be >= 0");
		}
		parentIds = parentIds != null ? List.copyOf(new LinkedHashSet<>(parentIds)) : List.of();
		if (creationReason == CreationReason.SEED && (generation != 0 || !parentIds.isEmpty())) {
			throw new IllegalArgumentException("a seed candidate has generation 0 and no parents");
		}
		if (creationReason == CreationReason.MUTATION && (generation == 0 || parentIds.isEmpty())) {
			throw new IllegalArgumentException("a mutation needs at least one parent and generation >= 1");
		}
	}

	public static Candidate seed(String instructionText) {
		return new Candidate(newId(), instructionText, List.of(), 0, CreationReason.SEED);
	}

	/**
	 * Create a child of {@code parent} carrying the given instruction text.
	 */
	public static Candidate mutationOf(Candidate parent, String instructionText) {
		Objects.requireNonNull(parent, "parent must not be null");
		return new Candidate(newId(), instructionText, List.of(parent.id()), parent.generation() + 1,
				CreationReason.MUTATION);
	}

	public boolean isSeed() {
		return creationReason == CreationReason.SEED;
	}

	private static String newId() {
		return UUID.randomUUID().toString();
	}
}
