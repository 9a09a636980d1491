package org.javai.springai.evolution.generation;

/**
 * Free-form text generation capability used by the reflector and the evolver.
 *
 * <p>Implementations may be non-deterministic. They signal failure by throwing
 * {@link GenerationException} (or any other runtime exception).</p>
 */
@FunctionalInterface
public interface TextGenerator {

	String generate(String prompt);
}
