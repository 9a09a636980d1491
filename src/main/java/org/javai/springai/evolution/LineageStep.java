package org.javai.springai.evolution;

import java.util.Objects;
import org.javai.springai.evolution.population.Candidate;
import org.javai.springai.evolution.population.ScoreVector;
import org.javai.springai.evolution.reflection.Diagnosis;

/**
 * One step on the path from the seed to a candidate.
 *
 * @param candidate the candidate at this step
 * @param diagnosis the diagnosis its parent received and this candidate was evolved from;
 *                  null for the seed
 * @param scoreVector the candidate's scores at the end of the run
 */
public record LineageStep(
		Candidate candidate,
		Diagnosis diagnosis,
		ScoreVector scoreVector
) {

	public LineageStep {
		Objects.requireNonNull(candidate, "candidate must not be null");
		scoreVector = scoreVector != null ? scoreVector : ScoreVector.empty();
	}

	public String instructionText() {
		return candidate.instructionText();
	}
}
