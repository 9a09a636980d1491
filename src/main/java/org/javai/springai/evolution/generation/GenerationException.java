package org.javai.springai.evolution.generation;

/**
 * Thrown when the language model could not produce a usable response.
 */
public class GenerationException extends RuntimeException {

	public GenerationException(String message) {
		super(message);
	}

	public GenerationException(String message, Throwable cause) {
		super(message, cause);
	}
}
