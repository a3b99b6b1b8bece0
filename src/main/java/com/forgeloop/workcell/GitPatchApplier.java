package com.forgeloop.workcell;

import com.forgeloop.core.config.KernelProperties;
import com.forgeloop.core.model.Proof;
import com.forgeloop.core.model.WorkcellHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Merges the workcell branch into the main branch with a merge commit.
 * Merges are serialized; a failed merge is aborted so the main checkout stays clean.
 */
@Component
public class GitPatchApplier implements PatchApplier {

    private static final Logger log = LoggerFactory.getLogger(GitPatchApplier.class);

    private final KernelProperties properties;
    private final GitCli git;

    public GitPatchApplier(KernelProperties properties, GitCli git) {
        this.properties = properties;
        this.git = git;
    }

    @Override
    public synchronized boolean apply(Proof proof, WorkcellHandle workcell) {
        String branch = proof.patch() != null && proof.patch().branch() != null
                ? proof.patch().branch()
                : workcell.branchName();
        Path repoRoot = Path.of(properties.getRepoRoot()).toAbsolutePath().normalize();

        GitCli.Result checkout = git.run(repoRoot, "checkout", properties.getMainBranch());
        if (!checkout.ok()) {
            log.error("Failed to checkout {} before merging {}", properties.getMainBranch(), branch);
            return false;
        }
        GitCli.Result merge = git.run(repoRoot, "merge", branch, "--no-ff", "-m", "Merge " + branch);
        if (!merge.ok()) {
            log.error("Merge of {} into {} failed: {}", branch, properties.getMainBranch(), merge.output());
            git.run(repoRoot, "merge", "--abort");
            return false;
        }
        log.info("Merged {} into {}", branch, properties.getMainBranch());
        return true;
    }
}
