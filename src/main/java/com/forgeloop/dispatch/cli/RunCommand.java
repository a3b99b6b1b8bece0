package com.forgeloop.dispatch.cli;

import com.forgeloop.core.KernelException;
import com.forgeloop.core.config.KernelProperties;
import com.forgeloop.core.engine.KernelRunner;
import com.forgeloop.core.engine.RunStats;
import com.forgeloop.core.events.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: forgeloop run
 * <p>
 * Runs the orchestration loop until the graph is idle, once with {@code --once},
 * or indefinitely with {@code --watch}. Options override the configured runner settings.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Dispatch ready issues to workcells")
@Component
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Option(names = "--once", description = "Run a single cycle and exit")
    boolean once;

    @Option(names = "--watch", description = "Keep polling the work graph until interrupted")
    boolean watch;

    @Option(names = "--issue", paramLabel = "ID", description = "Only consider this issue")
    String issue;

    @Option(names = "--max-concurrent", paramLabel = "N", description = "Override the concurrent workcell limit")
    Integer maxConcurrent;

    @Option(names = "--speculate", description = "Fan every scheduled issue out to several toolchains")
    boolean speculate;

    @Option(names = "--dry-run", description = "Log the schedule without dispatching")
    boolean dryRun;

    private final KernelRunner runner;
    private final KernelProperties properties;
    private final EventBus eventBus;

    public RunCommand(KernelRunner runner, KernelProperties properties, EventBus eventBus) {
        this.runner = runner;
        this.properties = properties;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        if (once && watch) {
            ConsoleOutput.error("--once and --watch cannot be combined");
            return 2;
        }
        if (maxConcurrent != null && maxConcurrent < 1) {
            ConsoleOutput.error("--max-concurrent must be at least 1");
            return 2;
        }
        applyOverrides();

        ConsoleOutput.printBanner();
        if (issue != null) {
            ConsoleOutput.info("Targeting issue " + issue);
        }
        if (dryRun) {
            ConsoleOutput.info("Dry run: nothing will be dispatched");
        }

        // progress for the targeted issue only, or for everything
        String target = properties.getRunner().getTargetIssue();
        EventBus.Subscription progress = target == null || target.isBlank()
                ? eventBus.subscribeAll(ConsoleOutput::event)
                : eventBus.subscribe(target, ConsoleOutput::event);
        Thread hook = new Thread(runner::stop, "forgeloop-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            RunStats stats = runner.runUntilIdle(watch);
            ConsoleOutput.stats(stats);
            return stats.failed() > 0 && stats.completed() == 0 ? 1 : 0;
        } catch (KernelException e) {
            log.error("Run aborted", e);
            ConsoleOutput.error("Run aborted: " + e.getMessage());
            return 1;
        } finally {
            progress.unsubscribe();
            removeHook(hook);
        }
    }

    private void applyOverrides() {
        KernelProperties.Runner options = properties.getRunner();
        options.setSingleCycle(options.isSingleCycle() || once);
        options.setDryRun(options.isDryRun() || dryRun);
        options.setForceSpeculate(options.isForceSpeculate() || speculate);
        if (issue != null && !issue.isBlank()) {
            options.setTargetIssue(issue);
        }
        if (maxConcurrent != null) {
            properties.getScheduling().setMaxConcurrentWorkcells(maxConcurrent);
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down; hook stays registered");
        }
    }
}
