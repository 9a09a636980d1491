package org.javai.springai.evolution.mutation;

import java.util.List;
import org.javai.springai.evolution.population.Candidate;
import org.javai.springai.evolution.reflection.Diagnosis;

/**
 * Produces mutated children of a candidate, guided by a diagnosis of its failures.
 */
public interface Evolver {

	default List<Candidate> evolve(Candidate candidate, Diagnosis diagnosis) {
		return evolve(candidate, diagnosis, 1);
	}

	/**
	 * @param candidate the parent
	 * @param diagnosis why the parent failed
	 * @param numChildren how many children to attempt (at least 1)
	 * @return between 1 and {@code numChildren} children, each with the parent as sole parent,
	 *         generation one deeper and instruction text different from the parent's
	 * @throws DegenerateMutationException if no child could be produced because the model kept
	 *                                     returning the parent's text
	 * @throws MutationException if no child could be produced for any other reason
	 */
	List<Candidate> evolve(Candidate candidate, Diagnosis diagnosis, int numChildren);
}
