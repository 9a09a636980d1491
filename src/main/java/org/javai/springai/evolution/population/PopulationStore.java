package org.javai.springai.evolution.population;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import org.javai.springai.evolution.reflection.Diagnosis;

/**
 * Append-only record of every candidate and evaluation result produced during one run.
 *
 * <h2>Concurrency</h2>
 * <p>All writes are queued to a single writer thread, so concurrent evaluation tasks never race
 * on the store. Each write blocks its caller until the writer has applied it. Reads never
 * block: they see immutable snapshots that the writer swaps in.</p>
 *
 * <h2>Records</h2>
 * <ul>
 *   <li>Candidates are never removed or replaced.</li>
 *   <li>There is at most one result per (candidate, scenario). Replacing a result requires an
 *       explicit overwrite and swaps in a new immutable record.</li>
 *   <li>Lineage is checked on insert: parents must already be recorded and a child's generation
 *       must be one more than its deepest parent.</li>
 * </ul>
 *
 * <p>{@link #close()} stops the writer. The contents stay readable afterwards.</p>
 */
public class PopulationStore implements AutoCloseable {

	private final ExecutorService writer;
	private final Map<String, Candidate> candidates = new ConcurrentHashMap<>();
	private final List<String> recordingOrder = new CopyOnWriteArrayList<>();
	private final Map<String, Map<String, EvaluationResult>> results = new ConcurrentHashMap<>();
	private final Map<String, Diagnosis> diagnoses = new ConcurrentHashMap<>();
	private final AtomicInteger resultCount = new AtomicInteger();
	private final Map<String, Integer> rolloutsRecorded = new ConcurrentHashMap<>();

	public PopulationStore() {
		this.writer = Executors.newSingleThreadExecutor(runnable -> {
			Thread thread = new Thread(runnable, "population-writer");
			thread.setDaemon(true);
			return thread;
		});
	}

	/**
	 * Record a new candidate.
	 *
	 * @throws PopulationStoreException if the id is taken, a parent is unknown or the generation
	 *                                  does not follow from the parents
	 */
	public Candidate addCandidate(Candidate candidate) {
		return addCandidate(candidate, null);
	}

	/**
	 * Record a new candidate together with the diagnosis that produced it.
	 */
	public Candidate addCandidate(Candidate candidate, Diagnosis origin) {
		Objects.requireNonNull(candidate, "candidate must not be null");
		return write(() -> {
			if (candidates.containsKey(candidate.id())) {
				throw new PopulationStoreException("Candidate already recorded: " + candidate.id());
			}
			verifyLineage(candidate);
			candidates.put(candidate.id(), candidate);
			results.put(candidate.id(), Map.of());
			rolloutsRecorded.put(candidate.id(), 0);
			if (origin != null) {
				diagnoses.put(candidate.id(), origin);
			}
			recordingOrder.add(candidate.id());
			return candidate;
		});
	}

	/**
	 * Record a result for a (candidate, scenario) pair that has none yet.
	 *
	 * @throws PopulationStoreException if the candidate is unknown or a result already exists
	 */
	public EvaluationResult recordResult(EvaluationResult result) {
		return recordResult(result, false);
	}

	/**
	 * Record a result, replacing an existing one for the same pair when {@code overwrite} is set.
	 */
	public EvaluationResult recordResult(EvaluationResult result, boolean overwrite) {
		Objects.requireNonNull(result, "result must not be null");
		return write(() -> {
			Map<String, EvaluationResult> current = results.get(result.candidateId());
			if (current == null) {
				throw new PopulationStoreException("Result for unknown candidate: " + result.candidateId());
			}
			boolean exists = current.containsKey(result.scenarioId());
			if (exists && !overwrite) {
				throw new PopulationStoreException("Result already recorded for candidate " + result.candidateId()
						+ " and scenario " + result.scenarioId());
			}
			Map<String, EvaluationResult> next = new LinkedHashMap<>(current);
			next.put(result.scenarioId(), result);
			results.put(result.candidateId(), Collections.unmodifiableMap(next));
			rolloutsRecorded.merge(result.candidateId(), 1, Integer::sum);
			if (!exists) {
				resultCount.incrementAndGet();
			}
			return result;
		});
	}

	public Optional<Candidate> candidate(String candidateId) {
		return Optional.ofNullable(candidates.get(candidateId));
	}

	/**
	 * All candidates in the order they were recorded.
	 */
	public List<Candidate> candidates() {
		List<Candidate> ordered = new ArrayList<>(recordingOrder.size());
		for (String id : recordingOrder) {
			ordered.add(candidates.get(id));
		}
		return ordered;
	}

	/**
	 * Position of the candidate in recording order, or -1 if unknown.
	 */
	public int recordingIndex(String candidateId) {
		return recordingOrder.indexOf(candidateId);
	}

	public List<EvaluationResult> results(String candidateId) {
		return List.copyOf(results.getOrDefault(candidateId, Map.of()).values());
	}

	public Optional<EvaluationResult> result(String candidateId, String scenarioId) {
		return Optional.ofNullable(results.getOrDefault(candidateId, Map.of()).get(scenarioId));
	}

	public boolean hasResult(String candidateId, String scenarioId) {
		return results.getOrDefault(candidateId, Map.of()).containsKey(scenarioId);
	}

	public List<EvaluationResult> failingResults(String candidateId) {
		return results(candidateId).stream().filter(result -> !result.passed()).toList();
	}

	/**
	 * True when the candidate has a result for every one of the given scenarios.
	 */
	public boolean isFullyEvaluated(String candidateId, Collection<String> scenarioIds) {
		Map<String, EvaluationResult> recorded = results.getOrDefault(candidateId, Map.of());
		return !scenarioIds.isEmpty() && recorded.keySet().containsAll(scenarioIds);
	}

	public ScoreVector scoreVector(String candidateId) {
		return ScoreVector.of(results(candidateId));
	}

	/**
	 * Number of results ever recorded for the candidate, counting those later replaced by a
	 * re-evaluation.
	 */
	public int rolloutsRecorded(String candidateId) {
		return rolloutsRecorded.getOrDefault(candidateId, 0);
	}

	public Optional<Diagnosis> diagnosisFor(String candidateId) {
		return Optional.ofNullable(diagnoses.get(candidateId));
	}

	/**
	 * Ancestors of the candidate from the seed down to the candidate itself, following the
	 * first parent at each step.
	 */
	public List<Candidate> lineage(String candidateId) {
		List<Candidate> chain = new ArrayList<>();
		Candidate current = candidates.get(candidateId);
		while (current != null) {
			chain.add(0, current);
			current = current.parentIds().isEmpty() ? null : candidates.get(current.parentIds().get(0));
		}
		return chain;
	}

	public int size() {
		return recordingOrder.size();
	}

	public int resultCount() {
		return resultCount.get();
	}

	public boolean isClosed() {
		return writer.isShutdown();
	}

	@Override
	public void close() {
		writer.shutdown();
	}

	private void verifyLineage(Candidate candidate) {
		if (candidate.isSeed()) {
			return;
		}
		int deepestParent = -1;
		for (String parentId : candidate.parentIds()) {
			Candidate parent = candidates.get(parentId);
			if (parent == null) {
				throw new PopulationStoreException("Candidate " + candidate.id() + " references unknown parent " + parentId);
			}
			deepestParent = Math.max(deepestParent, parent.generation());
		}
		if (candidate.generation() != deepestParent + 1) {
			throw new PopulationStoreException("Candidate " + candidate.id() + " has generation "
					+ candidate.generation() + " but its deepest parent has generation " + deepestParent);
		}
	}

	private <T> T write(Callable<T> operation) {
		Future<T> future;
		try {
			future = writer.submit(operation);
		}
		catch (RejectedExecutionException e) {
			throw new PopulationStoreException("Population store is closed", e);
		}
		try {
			return future.get();
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new PopulationStoreException("Interrupted while writing to population store", e);
		}
		catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof PopulationStoreException storeException) {
				throw storeException;
			}
			throw new PopulationStoreException("Population store write failed: " + cause, cause);
		}
	}
}
