package com.forgeloop.workcell;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forgeloop.core.config.KernelProperties;
import com.forgeloop.core.metrics.KernelMetrics;
import com.forgeloop.core.model.WorkcellHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Workcells as git worktrees of the repository, one branch each.
 * <p>
 * A workcell named {@code wc-<issue>-<stamp>[-<tag>]} lives under the workcells
 * directory on branch {@code wc/<issue>/<stamp>[-<tag>]}, forked from the main branch.
 * It carries a {@code .workcell} marker file and a {@code logs/} directory. Cleanup
 * optionally archives the logs, then removes the worktree and deletes its branch.
 * Git operations on the shared repository are serialized.
 */
@Component
public class GitWorktreeWorkcellManager implements WorkcellManager {

    private static final Logger log = LoggerFactory.getLogger(GitWorktreeWorkcellManager.class);

    private static final DateTimeFormatter STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS").withZone(ZoneOffset.UTC);

    private final KernelProperties properties;
    private final GitCli git;
    private final ObjectMapper objectMapper;
    private final KernelMetrics metrics;
    private final ReentrantLock repoLock = new ReentrantLock();
    private final AtomicInteger sequence = new AtomicInteger();

    public GitWorktreeWorkcellManager(KernelProperties properties, GitCli git,
                                      ObjectMapper objectMapper, KernelMetrics metrics) {
        this.properties = properties;
        this.git = git;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    @Override
    public WorkcellHandle create(String issueId, String speculateTag) {
        String safeIssue = sanitize(issueId);
        String stamp = STAMP.format(Instant.now()) + "-" + sequence.incrementAndGet();
        String suffix = speculateTag == null ? stamp : stamp + "-" + sanitize(speculateTag);
        String workcellId = "wc-" + safeIssue + "-" + suffix;
        String branch = "wc/" + safeIssue + "/" + suffix;
        Path repoRoot = repoRoot();
        Path path = repoRoot.resolve(properties.getWorkcellsDir()).resolve(workcellId).normalize();

        repoLock.lock();
        try {
            Files.createDirectories(path.getParent());
            GitCli.Result result = git.run(repoRoot, "worktree", "add", path.toString(),
                    "-b", branch, properties.getMainBranch());
            if (!result.ok()) {
                metrics.recordWorkcellOperation("create", false);
                throw new WorkcellException("git worktree add failed for %s (exit code %d): %s"
                        .formatted(workcellId, result.exitCode(), result.output()));
            }
        } catch (IOException e) {
            metrics.recordWorkcellOperation("create", false);
            throw new WorkcellException("Failed to prepare workcell directory " + path, e);
        } finally {
            repoLock.unlock();
        }

        var handle = new WorkcellHandle(workcellId, issueId, path, branch, speculateTag);
        try {
            Files.createDirectories(handle.logsDir());
            Map<String, Object> marker = new LinkedHashMap<>();
            marker.put("workcell_id", workcellId);
            marker.put("issue_id", issueId);
            marker.put("branch_name", branch);
            marker.put("speculate_tag", speculateTag);
            marker.put("created_at", Instant.now().toString());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.resolve(".workcell").toFile(), marker);
        } catch (IOException e) {
            cleanup(handle, false);
            metrics.recordWorkcellOperation("create", false);
            throw new WorkcellException("Failed to initialise workcell " + workcellId, e);
        }

        metrics.recordWorkcellOperation("create", true);
        log.info("Created workcell {} on branch {}", workcellId, branch);
        return handle;
    }

    @Override
    public void cleanup(WorkcellHandle workcell, boolean keepLogs) {
        if (keepLogs) {
            archiveLogs(workcell);
        }
        Path repoRoot = repoRoot();
        repoLock.lock();
        try {
            GitCli.Result removed = git.run(repoRoot, "worktree", "remove", "--force", workcell.path().toString());
            GitCli.Result deleted = git.run(repoRoot, "branch", "-D", workcell.branchName());
            boolean ok = removed.ok() && deleted.ok();
            metrics.recordWorkcellOperation("cleanup", ok);
            if (!removed.ok()) {
                throw new WorkcellException("git worktree remove failed for %s (exit code %d)"
                        .formatted(workcell.workcellId(), removed.exitCode()));
            }
            if (!deleted.ok()) {
                log.warn("Could not delete branch '{}' of workcell {}", workcell.branchName(), workcell.workcellId());
            }
        } finally {
            repoLock.unlock();
        }
        log.info("Removed workcell {} (logs {})", workcell.workcellId(), keepLogs ? "archived" : "discarded");
    }

    private void archiveLogs(WorkcellHandle workcell) {
        Path source = workcell.path();
        Path target = repoRoot().resolve(properties.getArchivesDir()).resolve(workcell.workcellId()).normalize();
        try {
            Files.createDirectories(target);
            for (String name : new String[]{"manifest.json", "proof.json", ".workcell"}) {
                Path file = source.resolve(name);
                if (Files.exists(file)) {
                    Files.copy(file, target.resolve(name), StandardCopyOption.REPLACE_EXISTING);
                }
            }
            if (Files.isDirectory(workcell.logsDir())) {
                copyTree(workcell.logsDir(), target.resolve("logs"));
            }
            log.debug("Archived logs of {} to {}", workcell.workcellId(), target);
        } catch (IOException e) {
            log.warn("Failed to archive logs of workcell {}: {}", workcell.workcellId(), e.getMessage());
        }
    }

    private static void copyTree(Path from, Path to) throws IOException {
        Files.walkFileTree(from, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                Files.createDirectories(to.resolve(from.relativize(dir)));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.copy(file, to.resolve(from.relativize(file)), StandardCopyOption.REPLACE_EXISTING);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private Path repoRoot() {
        return Path.of(properties.getRepoRoot()).toAbsolutePath().normalize();
    }

    static String sanitize(String value) {
        return value.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
