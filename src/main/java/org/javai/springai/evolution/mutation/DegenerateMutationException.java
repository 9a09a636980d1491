package org.javai.springai.evolution.mutation;

/**
 * Thrown when the model returns the parent's instruction (or a sibling's) unchanged, even
 * after a rephrased request.
 */
public class DegenerateMutationException extends MutationException {

	public DegenerateMutationException(String candidateId) {
		super("Mutation of candidate " + candidateId + " returned an unchanged instruction");
	}
}
