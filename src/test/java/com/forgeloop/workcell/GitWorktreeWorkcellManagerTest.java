package com.forgeloop.workcell;

import com.forgeloop.core.config.JsonConfig;
import com.forgeloop.core.config.KernelProperties;
import com.forgeloop.core.metrics.KernelMetrics;
import com.forgeloop.core.model.Proof;
import com.forgeloop.core.model.WorkcellHandle;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Runs against a real throwaway git repository; skipped when git is not installed.
 */
class GitWorktreeWorkcellManagerTest {

    @TempDir
    Path repo;

    private final GitCli git = new GitCli();
    private KernelProperties properties;
    private GitWorktreeWorkcellManager manager;

    @BeforeEach
    void setUp() throws Exception {
        assumeTrue(gitAvailable(), "git is not installed");
        git(repo, "init");
        git(repo, "symbolic-ref", "HEAD", "refs/heads/main");
        git(repo, "config", "user.email", "kernel@example.com");
        git(repo, "config", "user.name", "Kernel Test");
        Files.writeString(repo.resolve("README.md"), "hello\n");
        Files.writeString(repo.resolve(".gitignore"), ".workcells/\n.forgeloop/\n");
        git(repo, "add", ".");
        git(repo, "commit", "-m", "initial");

        properties = new KernelProperties();
        properties.setRepoRoot(repo.toString());
        manager = new GitWorktreeWorkcellManager(properties, git, JsonConfig.kernelObjectMapper(),
                new KernelMetrics(new SimpleMeterRegistry()));
    }

    private boolean gitAvailable() {
        try {
            return git.run(Path.of(".").toAbsolutePath(), "--version").ok();
        } catch (WorkcellException e) {
            return false;
        }
    }

    private void git(Path dir, String... args) {
        GitCli.Result result = git.run(dir, args);
        assertTrue(result.ok(), () -> "git " + String.join(" ", args) + " failed: " + result.output());
    }

    @Test
    @DisplayName("Creates a worktree on its own branch with a marker and logs directory")
    void create() {
        WorkcellHandle handle = manager.create("I1", null);

        assertTrue(handle.workcellId().startsWith("wc-I1-"));
        assertTrue(handle.branchName().startsWith("wc/I1/"));
        assertTrue(Files.exists(handle.path().resolve("README.md")));
        assertTrue(Files.exists(handle.path().resolve(".workcell")));
        assertTrue(Files.isDirectory(handle.logsDir()));
        assertTrue(git.run(repo, "rev-parse", "--verify", handle.branchName()).ok());
    }

    @Test
    @DisplayName("Speculative siblings get distinct workcells")
    void speculativeSiblings() {
        WorkcellHandle a = manager.create("I2", "spec-codex");
        WorkcellHandle b = manager.create("I2", "spec-claude");

        assertNotEquals(a.workcellId(), b.workcellId());
        assertTrue(a.workcellId().endsWith("-spec-codex"));
        assertNotEquals(a.path(), b.path());
    }

    @Test
    @DisplayName("Cleanup archives logs when asked and removes worktree and branch")
    void cleanupKeepsLogs() throws Exception {
        WorkcellHandle handle = manager.create("I1", null);
        Files.writeString(handle.logsDir().resolve("codex.log"), "done\n");

        manager.cleanup(handle, true);

        assertFalse(Files.exists(handle.path()));
        assertFalse(git.run(repo, "rev-parse", "--verify", handle.branchName()).ok());
        Path archived = repo.resolve(properties.getArchivesDir()).resolve(handle.workcellId());
        assertEquals("done\n", Files.readString(archived.resolve("logs").resolve("codex.log")));
        assertTrue(Files.exists(archived.resolve(".workcell")));
    }

    @Test
    @DisplayName("Cleanup without logs leaves no archive")
    void cleanupDiscardsLogs() {
        WorkcellHandle handle = manager.create("I1", null);

        manager.cleanup(handle, false);

        assertFalse(Files.exists(repo.resolve(properties.getArchivesDir()).resolve(handle.workcellId())));
    }

    @Test
    @DisplayName("Creation against a missing main branch fails with WorkcellException")
    void missingBranch() {
        properties.setMainBranch("does-not-exist");
        assertThrows(WorkcellException.class, () -> manager.create("I1", null));
    }

    @Test
    @DisplayName("Patch applier merges the workcell branch into main")
    void mergeIntoMain() throws Exception {
        WorkcellHandle handle = manager.create("I1", null);
        Files.writeString(handle.path().resolve("feature.txt"), "new\n");
        git(handle.path(), "add", "feature.txt");
        git(handle.path(), "commit", "-m", "feature");
        var proof = new Proof(null, handle.workcellId(), "I1", null, null, null, null, Map.of());

        assertTrue(new GitPatchApplier(properties, git).apply(proof, handle));

        assertTrue(Files.exists(repo.resolve("feature.txt")));
        manager.cleanup(handle, false);
    }

    @Test
    @DisplayName("sanitize keeps ids safe for paths and branch names")
    void sanitize() {
        assertEquals("I_1_a", GitWorktreeWorkcellManager.sanitize("I 1/a"));
    }
}
