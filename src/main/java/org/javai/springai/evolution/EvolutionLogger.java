package org.javai.springai.evolution;

import java.util.Locale;
import org.javai.springai.evolution.evaluation.EvaluationBatch;
import org.javai.springai.evolution.population.Candidate;
import org.javai.springai.evolution.population.ScoreVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Run-level log events of an evolution run.
 */
public class EvolutionLogger {

	private final Logger logger;

	public EvolutionLogger(Class<?> owner) {
		this.logger = LoggerFactory.getLogger(owner);
	}

	public void logSeedEvaluated(Candidate seed, EvaluationBatch batch, ScoreVector score) {
		if (!logger.isInfoEnabled()) {
			return;
		}
		logger.info(
				"seed={} evaluated on {} scenarios truncated={} passRate={} scores={} (instruction='{}')",
				shortId(seed.id()),
				batch.results().size(),
				batch.truncated(),
				formatScore(score.passRate()),
				score,
				summarize(seed.instructionText())
		);
	}

	public void logGenerationStarted(int generation, int parents, int remainingRollouts) {
		if (!logger.isInfoEnabled()) {
			return;
		}
		logger.info("generation #{} started with {} parent(s), {} rollouts left", generation, parents,
				remainingRollouts);
	}

	public void logDeadEnd(int generation, Candidate parent, RuntimeException cause) {
		if (!logger.isWarnEnabled()) {
			return;
		}
		logger.warn(
				"generation #{} parent={} is a dead end (instruction='{}'): {}",
				generation,
				shortId(parent.id()),
				summarize(parent.instructionText()),
				cause.toString()
		);
	}

	public void logChildRecorded(Candidate child) {
		if (!logger.isDebugEnabled()) {
			return;
		}
		logger.debug("child={} of parent={} gen={} (instruction='{}')",
				shortId(child.id()),
				shortId(child.parentIds().get(0)),
				child.generation(),
				summarize(child.instructionText()));
	}

	public void logGenerationCompleted(GenerationSummary summary) {
		if (!logger.isInfoEnabled()) {
			return;
		}
		logger.info(
				"generation #{} done: children={} evaluated={} deadEnds={} bestPassRate={} frontier={} improved={} rollouts={}",
				summary.generation(),
				summary.childrenProduced(),
				summary.childrenFullyEvaluated(),
				summary.deadEnds(),
				formatScore(summary.bestPassRate()),
				summary.frontierSize(),
				summary.frontierImproved(),
				summary.rolloutsConsumed()
		);
	}

	public void logTermination(EvolutionResult result) {
		if (!logger.isInfoEnabled()) {
			return;
		}
		logger.info(
				"run finished state={} generations={} rollouts={}/{} best={} passRate={} (instruction='{}')",
				result.state(),
				result.generationsRun(),
				result.rolloutsConsumed(),
				result.maxRollouts(),
				result.best().map(candidate -> shortId(candidate.id())).orElse("n/a"),
				formatScore(result.scoreVector().passRate()),
				summarize(result.bestInstructionText())
		);
	}

	public void logRunFailed(int lastConsistentGeneration, RuntimeException cause) {
		logger.error("run failed after generation #{}: {}", lastConsistentGeneration, cause.toString(), cause);
	}

	/**
	 * Flexible debug logging using SLF4J's {} placeholders.
	 */
	public void debug(String format, Object... args) {
		if (!logger.isDebugEnabled()) {
			return;
		}
		logger.debug(format, args);
	}

	static String shortId(String id) {
		if (id == null) {
			return "n/a";
		}
		return id.length() <= 8 ? id : id.substring(0, 8);
	}

	private String formatScore(double value) {
		if (Double.isNaN(value)) {
			return "n/a";
		}
		return String.format(Locale.ROOT, "%.4f", value);
	}

	private String summarize(String text) {
		if (text == null || text.isBlank()) {
			return "";
		}
		String normalized = text.replaceAll("\\s+", " ").trim();
		int maxLength = 64;
		return normalized.length() <= maxLength ? normalized : normalized.substring(0, maxLength - 3) + "...";
	}
}
