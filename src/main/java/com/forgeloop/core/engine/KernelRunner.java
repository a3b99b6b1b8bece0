package com.forgeloop.core.engine;

import com.forgeloop.core.config.KernelProperties;
import com.forgeloop.core.events.EventBus;
import com.forgeloop.core.events.KernelEvent;
import com.forgeloop.core.graph.WorkGraphClient;
import com.forgeloop.core.logging.MdcContext;
import com.forgeloop.core.metrics.KernelMetrics;
import com.forgeloop.core.model.DispatchResult;
import com.forgeloop.core.model.Issue;
import com.forgeloop.core.model.IssueStatus;
import com.forgeloop.core.model.Proof;
import com.forgeloop.core.model.ScheduleResult;
import com.forgeloop.core.model.VoteOutcome;
import com.forgeloop.core.model.WorkGraph;
import com.forgeloop.core.model.WorkcellHandle;
import com.forgeloop.core.routing.ExplorationController;
import com.forgeloop.core.scheduler.IssueScheduler;
import com.forgeloop.core.transition.TransitionLogger;
import com.forgeloop.core.verifier.ProofVerifier;
import com.forgeloop.workcell.DispatchListener;
import com.forgeloop.workcell.PatchApplier;
import com.forgeloop.workcell.WorkcellDispatcher;
import com.forgeloop.workcell.WorkcellManager;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The orchestration cycle: load, schedule, dispatch in parallel, verify, commit.
 * <p>
 * Every scheduled issue runs in its own lane. A lane claims the issue in the running
 * set, dispatches once (or fans out to several toolchains for speculative issues and
 * waits for all of them), verifies, then commits exactly one outcome: {@code done},
 * back to {@code ready}, or {@code escalated}. Each resolution increments the attempt
 * counter exactly once and every workcell is released on every path. Exceptions inside
 * a lane stay inside it; only a failure to load the work graph ends a cycle early.
 */
@Service
public class KernelRunner implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(KernelRunner.class);

    static final int MIN_POLL_SECONDS = 1;

    private final KernelProperties properties;
    private final WorkGraphClient workGraph;
    private final IssueScheduler scheduler;
    private final WorkcellDispatcher dispatcher;
    private final ProofVerifier verifier;
    private final TransitionLogger transitions;
    private final EscalationService escalations;
    private final PatchApplier patchApplier;
    private final WorkcellManager workcells;
    private final ExplorationController controller;
    private final EventBus eventBus;
    private final KernelMetrics metrics;

    private final RunningIssues running = new RunningIssues();
    private final ExecutorService lanes;
    private final AtomicLong cycleCounter = new AtomicLong();
    private final AtomicInteger completed = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger escalated = new AtomicInteger();
    private volatile boolean stopRequested;
    private volatile CountDownLatch wakeUp = new CountDownLatch(1);

    public KernelRunner(KernelProperties properties, WorkGraphClient workGraph, IssueScheduler scheduler,
                        WorkcellDispatcher dispatcher, ProofVerifier verifier, TransitionLogger transitions,
                        EscalationService escalations, PatchApplier patchApplier, WorkcellManager workcells,
                        ExplorationController controller, EventBus eventBus, KernelMetrics metrics) {
        this.properties = properties;
        this.workGraph = workGraph;
        this.scheduler = scheduler;
        this.dispatcher = dispatcher;
        this.verifier = verifier;
        this.transitions = transitions;
        this.escalations = escalations;
        this.patchApplier = patchApplier;
        this.workcells = workcells;
        this.controller = controller;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.lanes = Executors.newFixedThreadPool(Math.max(1, properties.getRunner().getLanePoolSize()),
                WorkcellDispatcher.namedThreads("forgeloop-lane-"));
    }

    /**
     * Run one cycle.
     *
     * @return true when at least one issue was dispatched (or would have been, in dry-run mode)
     * @throws com.forgeloop.core.graph.WorkGraphException when the work graph cannot be loaded
     */
    public boolean runCycle() {
        long cycle = cycleCounter.incrementAndGet();
        MdcContext.setCycle(cycle);
        try {
            boolean hadWork = doCycle();
            metrics.recordCycle(hadWork);
            return hadWork;
        } finally {
            MdcContext.clear();
        }
    }

    private boolean doCycle() {
        KernelProperties.Runner options = properties.getRunner();
        String target = options.getTargetIssue();

        WorkGraph graph = target == null || target.isBlank() ? workGraph.load() : workGraph.filterToIssue(target);
        if (graph.isEmpty()) {
            if (target == null || target.isBlank()) {
                log.info("No issues in work graph");
            } else {
                log.info("Nothing to do for issue {}", target);
            }
            return false;
        }

        controller.refresh();
        ScheduleResult schedule = scheduler.schedule(graph, running.snapshot());
        List<Issue> scheduled = schedule.scheduledLanes();

        if (scheduled.isEmpty()) {
            Optional<Issue> forced = forcedTarget(graph, target);
            if (forced.isEmpty()) {
                log.info("No ready issues ({} skipped)", schedule.skippedIssues().size());
                return false;
            }
            scheduled = List.of(forced.get());
        }
        metrics.recordScheduledLanes(scheduled.size(), schedule.speculateIssues().size());

        if (options.isDryRun()) {
            for (Issue issue : scheduled) {
                log.info("[dry-run] would dispatch {} '{}' ({})", issue.id(), issue.title(),
                        schedule.isSpeculate(issue.id())
                                ? "speculate: " + String.join(", ", schedule.toolchainsFor(issue.id()))
                                : "single");
            }
            return true;
        }

        Map<String, String> mdc = MDC.getCopyOfContextMap();
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (Issue issue : scheduled) {
            futures.add(CompletableFuture.runAsync(() -> {
                if (mdc != null) {
                    MDC.setContextMap(mdc);
                }
                try {
                    runLane(issue, schedule);
                } finally {
                    MDC.clear();
                }
            }, lanes));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        return true;
    }

    /**
     * In single-cycle mode a targeted issue that the scheduler rejected is dispatched once anyway,
     * unless it is finished, escalated, already running or out of attempts.
     */
    private Optional<Issue> forcedTarget(WorkGraph graph, String target) {
        if (target == null || target.isBlank() || !properties.getRunner().isSingleCycle()) {
            return Optional.empty();
        }
        Optional<Issue> issue = graph.issue(target);
        if (issue.isEmpty() || running.contains(target)) {
            return Optional.empty();
        }
        Issue candidate = issue.get();
        if (!candidate.status().isSchedulable() || candidate.attemptsExhausted()) {
            log.info("Issue {} is {} with {}/{} attempts; not forcing a dispatch", target,
                    candidate.status().wireName(), candidate.attempts(), candidate.maxAttempts());
            return Optional.empty();
        }
        String reason = scheduler.ineligibility(candidate, graph, running.snapshot());
        log.warn("Issue {} is not ready ({}); forcing a one-shot dispatch",
                target, reason == null ? "over budget" : reason);
        return issue;
    }

    private void runLane(Issue issue, ScheduleResult schedule) {
        MdcContext.setIssue(issue.id());
        try (RunningIssues.Claim claim = running.claim(issue.id())) {
            workGraph.updateStatus(issue.id(), IssueStatus.RUNNING);
            publish("issue.started", issue.id(), null, Map.of("attempt", issue.attempts() + 1));

            List<String> fanOut = schedule.toolchainsFor(issue.id());
            if (schedule.isSpeculate(issue.id()) && !fanOut.isEmpty()) {
                runSpeculative(issue, fanOut);
            } else {
                runSingle(issue);
            }
        } catch (RuntimeException e) {
            metrics.recordLaneError();
            log.error("Lane for issue {} failed", issue.id(), e);
        }
    }

    private void runSingle(Issue issue) {
        DispatchResult result = dispatcher.dispatch(issue, null, null, this::onWorkcellCreated);
        try {
            Set<String> declared = result.manifest() == null ? Set.of() : result.manifest().declaredGates();
            boolean verified = result.success() && verifier.verify(result.proof(), declared);
            if (verified) {
                commitSuccess(issue, result);
            } else {
                commitFailure(issue, result, failureSummary(result, declared));
            }
        } finally {
            release(result.workcell(), true);
        }
    }

    private void runSpeculative(Issue issue, List<String> toolchains) {
        log.info("Speculating on issue {} with {}", issue.id(), toolchains);
        List<CompletableFuture<DispatchResult>> futures = new ArrayList<>();
        for (String toolchain : toolchains) {
            futures.add(dispatcher.dispatchAsync(issue, toolchain, "spec-" + toolchain, this::onWorkcellCreated));
        }
        // every candidate settles before the vote
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        List<DispatchResult> results = futures.stream().map(CompletableFuture::join).toList();

        DispatchResult winner = null;
        try {
            List<DispatchResult> withWorkcell = results.stream().filter(DispatchResult::hasWorkcell).toList();
            if (withWorkcell.isEmpty()) {
                commitFailure(issue, results.get(0), "all %d speculative workcells failed to start: %s"
                        .formatted(results.size(), results.get(0).error()));
                return;
            }

            Set<String> declared = withWorkcell.stream()
                    .filter(r -> r.manifest() != null)
                    .findFirst()
                    .map(r -> r.manifest().declaredGates())
                    .orElse(Set.of());
            List<Proof> proofs = results.stream()
                    .map(DispatchResult::proof)
                    .filter(Objects::nonNull)
                    .toList();
            VoteOutcome vote = verifier.vote(proofs, declared);
            metrics.recordVote(vote.tier());

            winner = vote.winner().flatMap(p -> resultFor(results, p)).orElse(null);
            for (DispatchResult loser : withWorkcell) {
                if (loser != winner) {
                    transitions.discard(loser.workcellId());
                }
            }

            if (winner != null && vote.isVerified()) {
                commitSuccess(issue, winner);
            } else if (winner != null) {
                commitFailure(issue, winner, "no verified candidate (best was %s, tier %s): %s"
                        .formatted(winner.workcellId(), vote.tier(), failureSummary(winner, declared)));
            } else {
                DispatchResult representative = withWorkcell.stream()
                        .min(Comparator.comparing(DispatchResult::workcellId))
                        .orElseThrow();
                winner = representative;
                commitFailure(issue, representative, "no usable candidate among %d: %s"
                        .formatted(results.size(), failureSummary(representative, declared)));
            }
        } finally {
            for (DispatchResult result : results) {
                release(result.workcell(), result == winner);
            }
        }
    }

    private static Optional<DispatchResult> resultFor(List<DispatchResult> results, Proof proof) {
        return results.stream().filter(r -> r.proof() == proof).findFirst();
    }

    private void onWorkcellCreated(Issue issue, WorkcellHandle workcell, String toolchain) {
        transitions.begin(workcell.workcellId(), issue, toolchain);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("toolchain", toolchain);
        payload.put("branch", workcell.branchName());
        if (workcell.speculateTag() != null) {
            payload.put("speculate_tag", workcell.speculateTag());
        }
        publish("workcell.created", issue.id(), workcell.workcellId(), payload);
    }

    private void commitSuccess(Issue issue, DispatchResult result) {
        transitions.record(result.workcellId(), issue, result, true);
        int attempts = workGraph.incrementAttempts(issue.id());

        if (issue.applyPatch()) {
            boolean applied;
            try {
                applied = patchApplier.apply(result.proof(), result.workcell());
            } catch (RuntimeException e) {
                log.error("Applying patch of {} failed", result.workcellId(), e);
                applied = false;
            }
            if (!applied) {
                workGraph.addEvent(issue.id(), "patch.apply_failed", Map.of("workcell_id", result.workcellId()));
            }
        }

        workGraph.updateStatus(issue.id(), IssueStatus.DONE);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("workcell_id", result.workcellId());
        payload.put("toolchain", result.toolchain());
        payload.put("duration_ms", result.durationMs());
        payload.put("confidence", result.proof().confidence());
        payload.put("attempts", attempts);
        workGraph.addEvent(issue.id(), "workcell.completed", payload);
        workGraph.addEvent(issue.id(), "issue.completed", Map.of("workcell_id", result.workcellId()));
        publish("issue.completed", issue.id(), result.workcellId(), payload);

        completed.incrementAndGet();
        metrics.recordResolution("done");
        log.info("Issue {} done via {} (attempt {})", issue.id(), result.workcellId(), attempts);
    }

    private void commitFailure(Issue issue, DispatchResult result, String summary) {
        if (result.hasWorkcell()) {
            transitions.record(result.workcellId(), issue, result, false);
        }
        int attempts = workGraph.incrementAttempts(issue.id());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("workcell_id", result.workcellId());
        payload.put("toolchain", result.toolchain());
        payload.put("error", summary);
        payload.put("attempts", attempts);
        workGraph.addEvent(issue.id(), result.hasWorkcell() ? "workcell.failed" : "workcell.create_failed", payload);
        failed.incrementAndGet();

        if (attempts >= issue.maxAttempts()) {
            workGraph.updateStatus(issue.id(), IssueStatus.ESCALATED);
            workGraph.addEvent(issue.id(), "issue.failed", Map.of("resolution", "escalated"));
            escalations.escalate(issue, attempts, summary);
            escalated.incrementAndGet();
            metrics.recordResolution("escalated");
            publish("issue.escalated", issue.id(), result.workcellId(), payload);
            log.warn("Issue {} failed attempt {}/{}; escalated: {}", issue.id(), attempts, issue.maxAttempts(), summary);
        } else {
            workGraph.updateStatus(issue.id(), IssueStatus.READY);
            workGraph.addEvent(issue.id(), "issue.failed", Map.of("resolution", "ready"));
            metrics.recordResolution("ready");
            publish("issue.failed", issue.id(), result.workcellId(), payload);
            log.info("Issue {} failed attempt {}/{}; will retry: {}", issue.id(), attempts, issue.maxAttempts(), summary);
        }
    }

    private String failureSummary(DispatchResult result, Set<String> declared) {
        if (result.error() != null && !result.success()) {
            return result.error();
        }
        Proof proof = result.proof();
        if (proof == null) {
            return "no proof produced";
        }
        if (!proof.verification().blockingFailures().isEmpty()) {
            return "Gate failures: " + String.join(", ", proof.verification().blockingFailures());
        }
        return verifier.firstFailingGate(proof, declared)
                .map(gate -> "Gate failures: " + gate)
                .orElse("verification failed");
    }

    private void release(WorkcellHandle workcell, boolean keepLogs) {
        if (workcell == null) {
            return;
        }
        try {
            workcells.cleanup(workcell, keepLogs);
        } catch (RuntimeException e) {
            log.warn("Failed to release workcell {}: {}", workcell.workcellId(), e.getMessage(), e);
        }
    }

    private void publish(String type, String issueId, String workcellId, Map<String, Object> payload) {
        eventBus.publish(KernelEvent.of(type, issueId, workcellId, payload));
    }

    /**
     * Run cycles until there is no more work, or forever in watch mode, until {@link #stop()}.
     * In watch mode the runner sleeps for the poll interval between cycles and survives work
     * graph failures; otherwise those propagate.
     */
    public RunStats runUntilIdle(boolean watchMode) {
        stopRequested = false;
        wakeUp = new CountDownLatch(1);
        long start = System.nanoTime();
        int cyclesRun = 0;
        int completedBefore = completed.get();
        int failedBefore = failed.get();
        int escalatedBefore = escalated.get();
        Duration poll = Duration.ofSeconds(Math.max(MIN_POLL_SECONDS, properties.getRunner().getPollIntervalSeconds()));

        log.info("Runner started (watch={}, singleCycle={})", watchMode, properties.getRunner().isSingleCycle());
        while (!stopRequested) {
            boolean hadWork;
            try {
                hadWork = runCycle();
            } catch (RuntimeException e) {
                if (!watchMode) {
                    throw e;
                }
                log.error("Cycle failed; retrying in {}s", poll.toSeconds(), e);
                hadWork = false;
            }
            cyclesRun++;

            if (properties.getRunner().isSingleCycle()) {
                break;
            }
            if (!watchMode && (!hadWork || properties.getRunner().isDryRun())) {
                break;
            }
            if (watchMode && !pause(poll)) {
                break;
            }
        }

        RunStats stats = new RunStats(cyclesRun,
                completed.get() - completedBefore,
                failed.get() - failedBefore,
                escalated.get() - escalatedBefore,
                Duration.ofNanos(System.nanoTime() - start));
        log.info("Runner finished: {} cycle(s), {} completed, {} failed, {} escalated in {}s",
                stats.cycles(), stats.completed(), stats.failed(), stats.escalated(), stats.elapsed().toSeconds());
        return stats;
    }

    /**
     * @return false when the pause ended because of {@link #stop()} or an interrupt
     */
    private boolean pause(Duration poll) {
        try {
            return !wakeUp.await(poll.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Ask the runner to stop after the current cycle. In-flight lanes finish normally.
     */
    public void stop() {
        stopRequested = true;
        wakeUp.countDown();
    }

    public Set<String> runningIssues() {
        return running.snapshot();
    }

    /**
     * Stop, give in-flight lanes the configured grace period, then interrupt them.
     * Interrupted dispatches cancel their toolchain and still release their workcells.
     */
    @PreDestroy
    @Override
    public void close() {
        stop();
        lanes.shutdown();
        try {
            int grace = properties.getRunner().getShutdownGraceSeconds();
            if (!lanes.awaitTermination(grace, TimeUnit.SECONDS)) {
                log.warn("Lanes still running after {}s; interrupting", grace);
                lanes.shutdownNow();
                if (!lanes.awaitTermination(grace, TimeUnit.SECONDS)) {
                    log.error("Lanes did not terminate");
                }
            }
        } catch (InterruptedException e) {
            lanes.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
