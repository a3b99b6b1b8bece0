package com.forgeloop.dispatch.cli;

import com.forgeloop.core.engine.RunStats;
import com.forgeloop.core.events.KernelEvent;
import com.forgeloop.core.model.Issue;
import com.forgeloop.core.model.SkippedIssue;
import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output utilities for the Forgeloop CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) FORGELOOP v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FORGELOOP]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void lane(Issue issue, List<String> speculateToolchains) {
        String mode = speculateToolchains.isEmpty()
                ? "single"
                : "speculate " + String.join(", ", speculateToolchains);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(green) >|@ " + issue.id() + " [" + issue.priority() + "/" + issue.risk().wireName()
                        + "] " + issue.title() + " @|faint (" + mode + ")|@"));
    }

    public static void skipped(SkippedIssue skipped) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(yellow) -|@ " + skipped.issueId() + " @|faint " + skipped.reason() + "|@"));
    }

    /**
     * One progress line per kernel event; events without a line of their own are ignored.
     */
    public static void event(KernelEvent event) {
        Object toolchain = event.payload().get("toolchain");
        switch (event.eventType()) {
            case "issue.started" -> info(event.issueId() + " started (attempt " + event.payload().get("attempt") + ")");
            case "workcell.created" -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|faint " + event.issueId() + " -> " + event.workcellId() + " (" + toolchain + ")|@"));
            case "issue.completed" -> success(event.issueId() + " done via " + event.workcellId()
                    + " (" + toolchain + ", " + formatDuration(((Number) event.payload().get("duration_ms")).longValue()) + ")");
            case "issue.failed" -> error(event.issueId() + " failed, will retry: " + event.payload().get("error"));
            case "issue.escalated" -> error(event.issueId() + " escalated after "
                    + event.payload().get("attempts") + " attempt(s): " + event.payload().get("error"));
            default -> {
            }
        }
    }

    public static void stats(RunStats stats) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Run Summary|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Issues: @|fg(green) " + stats.completed() + " completed|@, @|fg(red) "
                        + stats.failed() + " failed|@"
                        + (stats.escalated() > 0 ? ", @|fg(magenta) " + stats.escalated() + " escalated|@" : "")));
        System.out.println("  Cycles: " + stats.cycles());
        System.out.println("  Duration: " + formatDuration(stats.elapsed().toMillis()));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
