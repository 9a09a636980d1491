package org.javai.springai.evolution.evaluation;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.javai.springai.evolution.agent.AgentExecutor;
import org.javai.springai.evolution.agent.AgentTrace;
import org.javai.springai.evolution.budget.RolloutBudget;
import org.javai.springai.evolution.population.Candidate;
import org.javai.springai.evolution.population.EvaluationResult;
import org.javai.springai.evolution.population.PopulationStore;
import org.javai.springai.evolution.population.PopulationStoreException;
import org.javai.springai.evolution.scenario.CheckOutcome;
import org.javai.springai.evolution.scenario.Scenario;
import org.javai.springai.evolution.scenario.ScenarioSuite;

/**
 * Evaluator that runs rollouts concurrently on a fixed pool.
 *
 * <p>One budget unit is reserved before each rollout is started. When a reservation is refused
 * no further rollouts start and the batch is marked truncated; rollouts already running are
 * allowed to finish. Each agent call is bounded by a timeout; a timed-out call is interrupted
 * and recorded as a failure that still consumed its budget unit.</p>
 *
 * <p>The evaluator owns its thread pools and must be closed after the run.</p>
 */
public class DefaultCandidateEvaluator implements CandidateEvaluator, AutoCloseable {

	private final ScenarioSuite suite;
	private final AgentExecutor agentExecutor;
	private final RolloutBudget budget;
	private final PopulationStore store;
	private final Duration scenarioTimeout;
	private final ExecutorService rolloutPool;
	private final ExecutorService agentCallPool;
	private final RolloutLogger logger = new RolloutLogger(DefaultCandidateEvaluator.class);

	public DefaultCandidateEvaluator(
			ScenarioSuite suite,
			AgentExecutor agentExecutor,
			RolloutBudget budget,
			PopulationStore store,
			int concurrency,
			Duration scenarioTimeout) {
		this.suite = Objects.requireNonNull(suite, "suite must not be null");
		this.agentExecutor = Objects.requireNonNull(agentExecutor, "agentExecutor must not be null");
		this.budget = Objects.requireNonNull(budget, "budget must not be null");
		this.store = Objects.requireNonNull(store, "store must not be null");
		this.scenarioTimeout = Objects.requireNonNull(scenarioTimeout, "scenarioTimeout must not be null");
		if (concurrency < 1) {
			throw new IllegalArgumentException("concurrency must be >= 1");
		}
		if (scenarioTimeout.isNegative() || scenarioTimeout.isZero()) {
			throw new IllegalArgumentException("scenarioTimeout must be positive");
		}
		this.rolloutPool = Executors.newFixedThreadPool(concurrency, daemonThreads("rollout"));
		this.agentCallPool = Executors.newCachedThreadPool(daemonThreads("agent-call"));
	}

	@Override
	public EvaluationBatch evaluate(Candidate candidate) {
		return evaluate(candidate, suite.scenarioIds(), ReevaluationMode.REUSE_EXISTING);
	}

	@Override
	public EvaluationBatch evaluate(Candidate candidate, List<String> scenarioIds, ReevaluationMode mode) {
		PendingBatch pending = schedule(candidate, scenarioIds, mode);
		awaitAll(List.of(pending));
		return pending.toBatch();
	}

	@Override
	public List<EvaluationBatch> evaluateAll(List<Candidate> candidates) {
		Objects.requireNonNull(candidates, "candidates must not be null");
		List<PendingBatch> pending = new ArrayList<>();
		for (Candidate candidate : candidates) {
			pending.add(schedule(candidate, suite.scenarioIds(), ReevaluationMode.REUSE_EXISTING));
		}
		awaitAll(pending);
		return pending.stream().map(PendingBatch::toBatch).toList();
	}

	@Override
	public void close() {
		rolloutPool.shutdown();
		agentCallPool.shutdownNow();
	}

	/**
	 * Reserve budget and start rollouts for one candidate. Stops at the first refused reservation.
	 */
	private PendingBatch schedule(Candidate candidate, List<String> scenarioIds, ReevaluationMode mode) {
		Objects.requireNonNull(candidate, "candidate must not be null");
		Objects.requireNonNull(mode, "mode must not be null");
		if (scenarioIds == null || scenarioIds.isEmpty()) {
			throw new IllegalArgumentException("scenarioIds must not be empty");
		}
		for (String scenarioId : scenarioIds) {
			suite.get(scenarioId);
		}
		if (store.candidate(candidate.id()).isEmpty()) {
			throw new IllegalStateException("Candidate " + candidate.id() + " must be recorded before evaluation");
		}

		PendingBatch pending = new PendingBatch(candidate);
		for (String scenarioId : new LinkedHashSet<>(scenarioIds)) {
			Scenario scenario = suite.get(scenarioId);
			boolean exists = store.hasResult(candidate.id(), scenarioId);
			if (exists && mode == ReevaluationMode.REUSE_EXISTING) {
				EvaluationResult existing = store.result(candidate.id(), scenarioId).orElseThrow();
				pending.rollouts.add(CompletableFuture.completedFuture(existing));
				continue;
			}
			boolean needsReservation = !exists || mode == ReevaluationMode.FRESH_RESERVATION;
			if (needsReservation) {
				if (!budget.reserve(1)) {
					logger.debug("Budget exhausted: {} of {} scenarios scheduled for candidate {}",
							pending.rollouts.size(), scenarioIds.size(), RolloutLogger.shortId(candidate.id()));
					pending.truncated = true;
					break;
				}
				pending.reserved++;
			}
			boolean overwrite = exists;
			pending.rollouts.add(CompletableFuture.supplyAsync(
					() -> store.recordResult(rollout(candidate, scenario), overwrite), rolloutPool));
		}
		return pending;
	}

	/**
	 * Wait until every scheduled rollout has finished; a store failure is rethrown only then.
	 */
	private void awaitAll(List<PendingBatch> batches) {
		List<CompletableFuture<EvaluationResult>> all = new ArrayList<>();
		batches.forEach(batch -> all.addAll(batch.rollouts));
		try {
			CompletableFuture.allOf(all.toArray(new CompletableFuture[0])).join();
		}
		catch (CompletionException e) {
			Throwable cause = e.getCause() != null ? e.getCause() : e;
			if (cause instanceof PopulationStoreException storeException) {
				throw storeException;
			}
			throw new IllegalStateException("Evaluation failed unexpectedly", cause);
		}
	}

	private EvaluationResult rollout(Candidate candidate, Scenario scenario) {
		Instant start = Instant.now();
		Future<AgentTrace> call = agentCallPool.submit(
				() -> agentExecutor.execute(candidate.instructionText(), scenario.input()));
		AgentTrace trace;
		try {
			trace = call.get(scenarioTimeout.toMillis(), TimeUnit.MILLISECONDS);
		}
		catch (TimeoutException e) {
			call.cancel(true);
			return failure(candidate, scenario, start, "timed out after " + scenarioTimeout.toMillis() + " ms", null);
		}
		catch (ExecutionException e) {
			Throwable cause = e.getCause() != null ? e.getCause() : e;
			return failure(candidate, scenario, start, "agent execution failed: " + cause, cause);
		}
		catch (InterruptedException e) {
			call.cancel(true);
			Thread.currentThread().interrupt();
			return failure(candidate, scenario, start, "interrupted", e);
		}

		if (trace == null) {
			return failure(candidate, scenario, start, "agent returned no trace", null);
		}
		if (trace.failed()) {
			return failure(candidate, scenario, start, trace.failure(), null, trace);
		}

		CheckOutcome outcome;
		try {
			outcome = scenario.checker().check(trace);
		}
		catch (RuntimeException e) {
			return failure(candidate, scenario, start, "checker failed: " + e, e, trace);
		}
		if (outcome == null) {
			return failure(candidate, scenario, start, "checker returned no outcome", null, trace);
		}

		EvaluationResult result = new EvaluationResult(candidate.id(), scenario.scenarioId(), outcome.passed(),
				outcome.score(), trace, Duration.between(start, Instant.now()));
		logger.logRolloutResult(candidate, scenario, result);
		return result;
	}

	private EvaluationResult failure(Candidate candidate, Scenario scenario, Instant start, String reason,
			Throwable error) {
		return failure(candidate, scenario, start, reason, error, AgentTrace.executionFailure(scenario.input(), reason));
	}

	private EvaluationResult failure(Candidate candidate, Scenario scenario, Instant start, String reason,
			Throwable error, AgentTrace trace) {
		AgentTrace failedTrace = trace.failed()
				? trace
				: new AgentTrace(trace.input(), trace.toolCalls(), trace.finalOutput(), reason, trace.attributes());
		Duration duration = Duration.between(start, Instant.now());
		logger.logRolloutFailure(candidate, scenario, reason, duration, error);
		return EvaluationResult.executionFailure(candidate.id(), scenario.scenarioId(), failedTrace, duration);
	}

	private static ThreadFactory daemonThreads(String prefix) {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}

	private static final class PendingBatch {
		private final Candidate candidate;
		private final List<CompletableFuture<EvaluationResult>> rollouts = new ArrayList<>();
		private boolean truncated;
		private int reserved;

		private PendingBatch(Candidate candidate) {
			this.candidate = candidate;
		}

		private EvaluationBatch toBatch() {
			List<EvaluationResult> results = rollouts.stream().map(CompletableFuture::join).toList();
			return new EvaluationBatch(candidate, results, truncated, reserved);
		}
	}
}
