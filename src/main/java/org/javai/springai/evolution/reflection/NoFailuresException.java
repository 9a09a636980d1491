package org.javai.springai.evolution.reflection;

/**
 * Thrown when reflection is requested for a candidate without failing results.
 */
public class NoFailuresException extends RuntimeException {

	public NoFailuresException(String candidateId) {
		super("Candidate " + candidateId + " has no failing results to reflect on");
	}
}
