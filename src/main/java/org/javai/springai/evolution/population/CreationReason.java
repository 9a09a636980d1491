package org.javai.springai.evolution.population;

/**
 * Why a candidate exists: it is the caller's starting instruction or a search-produced variant.
 */
public enum CreationReason {
	SEED,
	MUTATION
}
