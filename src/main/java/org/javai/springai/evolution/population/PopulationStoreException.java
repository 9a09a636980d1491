package org.javai.springai.evolution.population;

/**
 * Thrown when the population store cannot accept a write: duplicate or dangling records,
 * broken lineage, or a closed store. Always fatal for the run.
 */
public class PopulationStoreException extends RuntimeException {

	public PopulationStoreException(String message) {
		super(message);
	}

	public PopulationStoreException(String message, Throwable cause) {
		super(message, cause);
	}
}
