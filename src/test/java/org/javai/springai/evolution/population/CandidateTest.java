package org.javai.springai.evolution.population;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.javai.springai.evolution.agent.AgentTrace;
import org.junit.jupiter.api.Test;

class CandidateTest {

	@Test
	void seedHasNoParentsAndGenerationZero() {
		Candidate seed = Candidate.seed("Be helpful.");

		assertThat(seed.isSeed()).isTrue();
		assertThat(seed.parentIds()).isEmpty();
		assertThat(seed.generation()).isZero();
		assertThat(seed.creationReason()).isEqualTo(CreationReason.SEED);
	}

	@Test
	void mutationReferencesParentOneGenerationDeeper() {
		Candidate seed = Candidate.seed("Be helpful.");
		Candidate child = Candidate.mutationOf(seed, "Be helpful. Verify identity.");

		assertThat(child.id()).isNotEqualTo(seed.id());
		assertThat(child.parentIds()).containsExactly(seed.id());
		assertThat(child.generation()).isEqualTo(1);
		assertThat(child.creationReason()).isEqualTo(CreationReason.MUTATION);
	}

	@Test
	void parentIdsAreDeduplicatedInOrder() {
		Candidate candidate = new Candidate("c", "text", List.of("p2", "p1", "p2"), 1, CreationReason.MUTATION);

		assertThat(candidate.parentIds()).containsExactly("p2", "p1");
	}

	@Test
	void rejectsInconsistentLineageFields() {
		assertThatThrownBy(() -> new Candidate("c", "text", List.of("p"), 0, CreationReason.SEED))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new Candidate("c", "text", List.of(), 1, CreationReason.MUTATION))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new Candidate("c", "text", List.of(), -1, CreationReason.SEED))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void evaluationResultRejectsOutOfRangeScore() {
		assertThatThrownBy(() -> new EvaluationResult("c", "s", true, 1.5,
				AgentTrace.executionFailure("in", "x"), null))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
