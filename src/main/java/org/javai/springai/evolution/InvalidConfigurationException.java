package org.javai.springai.evolution;

/**
 * Thrown before a run starts when its inputs cannot be used. Never retried.
 */
public class InvalidConfigurationException extends RuntimeException {

	public InvalidConfigurationException(String message) {
		super(message);
	}

	public InvalidConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
