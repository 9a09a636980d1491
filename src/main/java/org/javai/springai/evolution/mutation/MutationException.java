package org.javai.springai.evolution.mutation;

/**
 * Thrown when the evolver could not produce an acceptable child.
 */
public class MutationException extends RuntimeException {

	public MutationException(String message) {
		super(message);
	}

	public MutationException(String message, Throwable cause) {
		super(message, cause);
	}
}
