package com.forgeloop.dispatch.cli;

import com.forgeloop.core.KernelException;
import com.forgeloop.core.graph.WorkGraphClient;
import com.forgeloop.core.model.Issue;
import com.forgeloop.core.model.ScheduleResult;
import com.forgeloop.core.model.SkippedIssue;
import com.forgeloop.core.model.WorkGraph;
import com.forgeloop.core.routing.ExplorationController;
import com.forgeloop.core.scheduler.IssueScheduler;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI command: forgeloop schedule
 * <p>
 * Prints what the next cycle would dispatch, and why the other issues are skipped.
 */
@Command(name = "schedule", mixinStandardHelpOptions = true, description = "Show the next cycle's schedule")
@Component
public class ScheduleCommand implements Callable<Integer> {

    @Option(names = "--issue", paramLabel = "ID", description = "Only consider this issue")
    String issue;

    private final WorkGraphClient workGraph;
    private final IssueScheduler scheduler;
    private final ExplorationController controller;

    public ScheduleCommand(WorkGraphClient workGraph, IssueScheduler scheduler, ExplorationController controller) {
        this.workGraph = workGraph;
        this.scheduler = scheduler;
        this.controller = controller;
    }

    @Override
    public Integer call() {
        WorkGraph graph;
        try {
            graph = issue == null ? workGraph.load() : workGraph.filterToIssue(issue);
        } catch (KernelException e) {
            ConsoleOutput.error("Could not load work graph: " + e.getMessage());
            return 1;
        }

        controller.refresh();
        ScheduleResult schedule = scheduler.schedule(graph, Set.of());

        ConsoleOutput.info(graph.issues().size() + " issue(s), control mode " + controller.current().mode());
        if (schedule.isEmpty()) {
            ConsoleOutput.info("Nothing to dispatch");
        } else {
            ConsoleOutput.info("Lanes (" + schedule.scheduledLanes().size() + "):");
            for (Issue lane : schedule.scheduledLanes()) {
                ConsoleOutput.lane(lane, schedule.toolchainsFor(lane.id()));
            }
        }
        if (!schedule.skippedIssues().isEmpty()) {
            ConsoleOutput.info("Skipped (" + schedule.skippedIssues().size() + "):");
            for (SkippedIssue skipped : schedule.skippedIssues()) {
                ConsoleOutput.skipped(skipped);
            }
        }
        return 0;
    }
}
