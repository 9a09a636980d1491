package org.javai.springai.evolution.reflection;

import java.util.List;
import org.javai.springai.evolution.population.Candidate;
import org.javai.springai.evolution.population.EvaluationResult;

/**
 * Explains why a candidate failed some of its scenarios.
 *
 * <p>Implementations backed by a language model are not deterministic; callers should rely on
 * the structure of the returned {@link Diagnosis}, not its text.</p>
 */
public interface Reflector {

	/**
	 * @param candidate the candidate whose failures are analysed
	 * @param failingResults the candidate's results with {@code passed == false}
	 * @return diagnosis of the failures
	 * @throws NoFailuresException if {@code failingResults} is empty
	 * @throws ReflectionException if no diagnosis could be produced
	 */
	Diagnosis reflect(Candidate candidate, List<EvaluationResult> failingResults);
}
