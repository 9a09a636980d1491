package org.javai.springai.evolution.scenario;

/**
 * Thrown when a scenario suite cannot be used: empty, duplicate ids, or malformed source.
 */
public class InvalidSuiteException extends RuntimeException {

	public InvalidSuiteException(String message) {
		super(message);
	}

	public InvalidSuiteException(String message, Throwable cause) {
		super(message, cause);
	}
}
