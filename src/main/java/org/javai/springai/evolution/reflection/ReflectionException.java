package org.javai.springai.evolution.reflection;

/**
 * Thrown when the reflector could not obtain a diagnosis, even after retrying.
 */
public class ReflectionException extends RuntimeException {

	public ReflectionException(String message) {
		super(message);
	}

	public ReflectionException(String message, Throwable cause) {
		super(message, cause);
	}
}
