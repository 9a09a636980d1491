package org.javai.springai.evolution.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.javai.springai.evolution.EvolutionResult;
import org.javai.springai.evolution.GenerationSummary;
import org.javai.springai.evolution.LineageStep;
import org.javai.springai.evolution.population.Candidate;
import org.javai.springai.evolution.population.Objective;
import org.javai.springai.evolution.population.ScoreVector;
import org.javai.springai.evolution.reflection.Diagnosis;

/**
 * Renders an {@link EvolutionResult} as a plain-text summary or as a JSON document.
 *
 * <p>Both renderings are returned as strings; where they are written is up to the caller.</p>
 */
public class EvolutionReportGenerator {

	private final ObjectMapper mapper;

	public EvolutionReportGenerator() {
		this.mapper = new ObjectMapper()
				.registerModule(new JavaTimeModule())
				.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
	}

	/**
	 * Human-readable summary: outcome, best instruction, per-generation progress and lineage.
	 */
	public String toText(EvolutionResult result) {
		Objects.requireNonNull(result, "result must not be null");
		StringBuilder sb = new StringBuilder();
		sb.append("EVOLUTION RUN\n");
		sb.append("=============\n\n");
		sb.append("State: ").append(result.state()).append("\n");
		sb.append("Generations: ").append(result.generationsRun()).append("\n");
		sb.append("Rollouts: ").append(result.rolloutsConsumed()).append(" of ").append(result.maxRollouts()).append("\n");
		if (result.startedAt() != null && result.finishedAt() != null) {
			sb.append("Duration: ").append(Duration.between(result.startedAt(), result.finishedAt()).toMillis())
					.append(" ms\n");
		}
		if (result.errorMessage() != null) {
			sb.append("Error: ").append(result.errorMessage())
					.append(" (last consistent generation ").append(result.lastConsistentGeneration()).append(")\n");
		}

		result.best().ifPresent(best -> {
			sb.append("\nBEST INSTRUCTION\n");
			sb.append("----------------\n");
			sb.append(best.instructionText()).append("\n\n");
			sb.append("Scores: ").append(formatScores(result.scoreVector())).append("\n");
		});

		if (!result.generations().isEmpty()) {
			sb.append("\nGENERATIONS\n");
			sb.append("-----------\n");
			for (GenerationSummary generation : result.generations()) {
				sb.append(String.format(Locale.ROOT, "#%d parents=%d children=%d evaluated=%d deadEnds=%d bestPassRate=%s frontier=%d%s rollouts=%d%n",
						generation.generation(),
						generation.parentsSelected(),
						generation.childrenProduced(),
						generation.childrenFullyEvaluated(),
						generation.deadEnds(),
						formatPercent(generation.bestPassRate()),
						generation.frontierSize(),
						generation.frontierImproved() ? " (improved)" : "",
						generation.rolloutsConsumed()));
			}
		}

		if (!result.lineage().isEmpty()) {
			sb.append("\nLINEAGE\n");
			sb.append("-------\n");
			for (LineageStep step : result.lineage()) {
				sb.append("gen ").append(step.candidate().generation())
						.append(" [").append(shortId(step.candidate().id())).append("] ")
						.append(formatScores(step.scoreVector())).append("\n");
				sb.append("  ").append(snippet(step.instructionText())).append("\n");
				if (step.diagnosis() != null) {
					for (String cause : step.diagnosis().rootCauses()) {
						sb.append("  cause: ").append(cause).append("\n");
					}
					for (String fix : step.diagnosis().fixes()) {
						sb.append("  fix: ").append(fix).append("\n");
					}
				}
			}
		}

		if (!result.frontier().isEmpty()) {
			sb.append("\nFRONTIER\n");
			sb.append("--------\n");
			for (Candidate candidate : result.frontier()) {
				sb.append("[").append(shortId(candidate.id())).append("] gen ").append(candidate.generation());
				if (result.population() != null) {
					sb.append(" ").append(formatScores(result.population().scoreVector(candidate.id())));
				}
				sb.append("\n");
			}
		}
		return sb.toString();
	}

	/**
	 * Pretty-printed JSON document describing the run.
	 */
	public String toJson(EvolutionResult result) {
		Objects.requireNonNull(result, "result must not be null");
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJsonTree(result));
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to render evolution report", e);
		}
	}

	ObjectNode toJsonTree(EvolutionResult result) {
		ObjectNode json = mapper.createObjectNode();
		json.put("state", result.state().name());
		json.put("succeeded", result.succeeded());
		json.put("generationsRun", result.generationsRun());
		json.put("rolloutsConsumed", result.rolloutsConsumed());
		json.put("maxRollouts", result.maxRollouts());
		json.put("lastConsistentGeneration", result.lastConsistentGeneration());
		if (result.errorMessage() != null) {
			json.put("errorMessage", result.errorMessage());
		}
		json.set("startedAt", mapper.valueToTree(result.startedAt()));
		json.set("finishedAt", mapper.valueToTree(result.finishedAt()));

		if (result.bestCandidate() != null) {
			ObjectNode best = candidateToJson(result.bestCandidate());
			best.set("scores", scoresToJson(result.scoreVector()));
			json.set("best", best);
		} else {
			json.putNull("best");
		}

		ArrayNode generations = json.putArray("generations");
		for (GenerationSummary generation : result.generations()) {
			generations.add(mapper.valueToTree(generation));
		}

		ArrayNode lineage = json.putArray("lineage");
		for (LineageStep step : result.lineage()) {
			ObjectNode node = candidateToJson(step.candidate());
			node.set("scores", scoresToJson(step.scoreVector()));
			if (step.diagnosis() != null) {
				node.set("diagnosis", diagnosisToJson(step.diagnosis()));
			}
			lineage.add(node);
		}

		ArrayNode frontier = json.putArray("frontier");
		for (Candidate candidate : result.frontier()) {
			ObjectNode node = candidateToJson(candidate);
			if (result.population() != null) {
				node.set("scores", scoresToJson(result.population().scoreVector(candidate.id())));
			}
			frontier.add(node);
		}
		return json;
	}

	private ObjectNode candidateToJson(Candidate candidate) {
		ObjectNode node = mapper.createObjectNode();
		node.put("id", candidate.id());
		node.put("generation", candidate.generation());
		node.put("creationReason", candidate.creationReason().name());
		ArrayNode parents = node.putArray("parentIds");
		candidate.parentIds().forEach(parents::add);
		node.put("instructionText", candidate.instructionText());
		return node;
	}

	private ObjectNode scoresToJson(ScoreVector scores) {
		ObjectNode node = mapper.createObjectNode();
		node.put("evaluationCount", scores.evaluationCount());
		node.put("passedCount", scores.passedCount());
		for (var entry : scores.values().entrySet()) {
			node.put(entry.getKey().name(), entry.getValue());
		}
		return node;
	}

	private ObjectNode diagnosisToJson(Diagnosis diagnosis) {
		ObjectNode node = mapper.createObjectNode();
		ArrayNode causes = node.putArray("rootCauses");
		diagnosis.rootCauses().forEach(causes::add);
		ArrayNode fixes = node.putArray("fixes");
		diagnosis.fixes().forEach(fixes::add);
		return node;
	}

	private String formatScores(ScoreVector scores) {
		if (scores.isEmpty()) {
			return "(not evaluated)";
		}
		StringBuilder sb = new StringBuilder();
		List<Objective> objectives = List.copyOf(scores.values().keySet());
		for (int i = 0; i < objectives.size(); i++) {
			if (i > 0) {
				sb.append(", ");
			}
			Objective objective = objectives.get(i);
			sb.append(objective.name().toLowerCase(Locale.ROOT)).append("=").append(formatPercent(scores.get(objective)));
		}
		sb.append(" over ").append(scores.evaluationCount()).append(" scenarios");
		return sb.toString();
	}

	private String formatPercent(double value) {
		return String.format(Locale.ROOT, "%.2f%%", value * 100);
	}

	private String shortId(String id) {
		return id.length() <= 8 ? id : id.substring(0, 8);
	}

	private String snippet(String text) {
		String normalized = text.replaceAll("\\s+", " ").trim();
		int maxLength = 96;
		return normalized.length() <= maxLength ? normalized : normalized.substring(0, maxLength - 3) + "...";
	}
}
