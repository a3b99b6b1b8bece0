package com.forgeloop.workcell;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forgeloop.core.config.KernelProperties;
import com.forgeloop.core.logging.MdcContext;
import com.forgeloop.core.metrics.KernelMetrics;
import com.forgeloop.core.model.DispatchResult;
import com.forgeloop.core.model.Issue;
import com.forgeloop.core.model.Manifest;
import com.forgeloop.core.model.Proof;
import com.forgeloop.core.model.WorkcellHandle;
import com.forgeloop.core.routing.ExplorationController;
import com.forgeloop.core.routing.RoutingPolicy;
import com.forgeloop.toolchain.ToolchainAdapter;
import com.forgeloop.toolchain.ToolchainRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one issue in one workcell with one toolchain.
 * <p>
 * Resolves the toolchain, creates the workcell, writes the manifest into it and invokes
 * the toolchain adapter under a hard deadline. Every failure along the way comes back as
 * a failed {@link DispatchResult} with error text. The dispatcher never touches the work
 * graph, never applies a patch and never releases the workcell: the caller owns the
 * workcell of every result that carries one.
 */
@Service
public class WorkcellDispatcher {

    private static final Logger log = LoggerFactory.getLogger(WorkcellDispatcher.class);

    static final int MAX_ERROR_LENGTH = 2000;

    private final RoutingPolicy routing;
    private final ToolchainRegistry toolchains;
    private final WorkcellManager workcells;
    private final ManifestBuilder manifestBuilder;
    private final ExplorationController controller;
    private final KernelProperties properties;
    private final ObjectMapper objectMapper;
    private final KernelMetrics metrics;
    private final ExecutorService executor;

    public WorkcellDispatcher(RoutingPolicy routing, ToolchainRegistry toolchains, WorkcellManager workcells,
                              ManifestBuilder manifestBuilder, ExplorationController controller,
                              KernelProperties properties, ObjectMapper objectMapper, KernelMetrics metrics) {
        this.routing = routing;
        this.toolchains = toolchains;
        this.workcells = workcells;
        this.manifestBuilder = manifestBuilder;
        this.controller = controller;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.executor = Executors.newCachedThreadPool(namedThreads("forgeloop-dispatch-"));
    }

    public DispatchResult dispatch(Issue issue, String toolchainOverride, String speculateTag,
                                   DispatchListener listener) {
        return dispatch(issue, toolchainOverride, speculateTag, listener, null);
    }

    /**
     * Blocking dispatch.
     *
     * @param issue             the issue to work on
     * @param toolchainOverride toolchain to use regardless of routing, or null
     * @param speculateTag      tag for speculative siblings, or null for a single dispatch
     * @param listener          notified once the workcell exists
     * @param planner           optional planner directives for the manifest, or null
     */
    public DispatchResult dispatch(Issue issue, String toolchainOverride, String speculateTag,
                                   DispatchListener listener, Map<String, Object> planner) {
        long start = System.nanoTime();
        String toolchain = routing.resolveToolchain(issue, toolchainOverride);

        WorkcellHandle workcell;
        try {
            workcell = workcells.create(issue.id(), speculateTag);
        } catch (RuntimeException e) {
            log.warn("Workcell creation failed for issue {}: {}", issue.id(), e.getMessage());
            return finish(DispatchResult.failed(issue.id(), toolchain, speculateTag, null, null,
                    elapsedMs(start), "workcell creation failed: " + describe(e)));
        }

        MdcContext.setWorkcell(issue.id(), workcell.workcellId(), toolchain);
        try {
            Manifest manifest;
            try {
                manifest = manifestBuilder.build(issue, workcell, toolchain, controller.current(), planner);
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(workcell.manifestPath().toFile(), manifest);
            } catch (IOException | RuntimeException e) {
                return finish(DispatchResult.failed(issue.id(), toolchain, speculateTag, workcell, null,
                        elapsedMs(start), "manifest could not be written: " + describe(e)));
            }

            try {
                listener.onWorkcellCreated(issue, workcell, toolchain);
            } catch (RuntimeException e) {
                log.warn("Dispatch listener failed for workcell {}: {}", workcell.workcellId(), e.getMessage(), e);
            }

            Optional<ToolchainAdapter> adapter = toolchains.get(toolchain);
            if (adapter.isEmpty()) {
                return finish(DispatchResult.failed(issue.id(), toolchain, speculateTag, workcell, manifest,
                        elapsedMs(start), "no adapter registered for toolchain '%s'".formatted(toolchain)));
            }

            Duration timeout = timeoutFor(manifest, toolchain);
            log.info("Dispatching issue {} to {} in {} (timeout {}s)", issue.id(), toolchain,
                    workcell.workcellId(), timeout.toSeconds());
            return finish(invoke(adapter.get(), issue, manifest, workcell, timeout, start));
        } finally {
            MdcContext.clearWorkcell();
        }
    }

    /**
     * Non-blocking variant of {@link #dispatch(Issue, String, String, DispatchListener)}.
     * The future always completes normally.
     */
    public CompletableFuture<DispatchResult> dispatchAsync(Issue issue, String toolchainOverride,
                                                           String speculateTag, DispatchListener listener) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        return CompletableFuture.supplyAsync(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return dispatch(issue, toolchainOverride, speculateTag, listener);
            } finally {
                MDC.clear();
            }
        }, executor).exceptionally(e -> DispatchResult.failed(issue.id(), toolchainOverride, speculateTag,
                null, null, 0L, "dispatch failed: " + describe(e)));
    }

    Duration timeoutFor(Manifest manifest, String toolchain) {
        int seconds = manifest.timeoutOverrideSeconds()
                .orElse(properties.toolchain(toolchain).getTimeoutSeconds());
        return Duration.ofSeconds(Math.max(1, seconds));
    }

    private DispatchResult invoke(ToolchainAdapter adapter, Issue issue, Manifest manifest,
                                  WorkcellHandle workcell, Duration timeout, long start) {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<Proof> future = executor.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return adapter.execute(manifest, workcell, timeout);
            } finally {
                MDC.clear();
            }
        });
        try {
            Proof proof = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (proof == null) {
                return DispatchResult.failed(issue.id(), adapter.name(), workcell.speculateTag(), workcell, manifest,
                        elapsedMs(start), "toolchain returned no proof");
            }
            return DispatchResult.completed(proof, workcell, manifest, adapter.name(), elapsedMs(start));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Toolchain {} timed out after {}s on {}", adapter.name(), timeout.toSeconds(), workcell.workcellId());
            return DispatchResult.failed(issue.id(), adapter.name(), workcell.speculateTag(), workcell, manifest,
                    elapsedMs(start), "timed out after %ds".formatted(timeout.toSeconds()));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Toolchain {} failed on {}: {}", adapter.name(), workcell.workcellId(), cause.getMessage());
            return DispatchResult.failed(issue.id(), adapter.name(), workcell.speculateTag(), workcell, manifest,
                    elapsedMs(start), describe(cause));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return DispatchResult.failed(issue.id(), adapter.name(), workcell.speculateTag(), workcell, manifest,
                    elapsedMs(start), "interrupted");
        }
    }

    private DispatchResult finish(DispatchResult result) {
        metrics.recordDispatch(result.toolchain(), result.success(), result.durationMs());
        if (result.success()) {
            log.info("Dispatch of {} on {} succeeded in {}ms", result.issueId(), result.workcellId(), result.durationMs());
        } else {
            log.info("Dispatch of {} failed after {}ms: {}", result.issueId(), result.durationMs(), result.error());
        }
        return result;
    }

    @PreDestroy
    public void close() {
        executor.shutdownNow();
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    static String describe(Throwable e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return message.length() > MAX_ERROR_LENGTH
                ? message.substring(0, MAX_ERROR_LENGTH) + "... (truncated)"
                : message;
    }

    public static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
