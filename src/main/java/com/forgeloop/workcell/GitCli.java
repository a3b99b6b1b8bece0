package com.forgeloop.workcell;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thin wrapper over the {@code git} command line, via {@link ProcessBuilder}.
 */
@Component
public class GitCli {

    private static final Logger log = LoggerFactory.getLogger(GitCli.class);

    /**
     * Result of one git invocation.
     */
    public record Result(int exitCode, String output) {
        public boolean ok() {
            return exitCode == 0;
        }
    }

    /**
     * Runs a git command and returns its exit code and combined output.
     *
     * @param workDir working directory for the git command
     * @param args    git arguments (e.g. "worktree", "add", path)
     */
    public Result run(Path workDir, String... args) {
        List<String> command = new ArrayList<>();
        command.add("git");
        command.addAll(List.of(args));
        log.debug("Running: {} (in {})", String.join(" ", command), workDir);

        try {
            var process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .start();

            String output;
            try (var reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                output = reader.lines().collect(Collectors.joining("\n"));
            }

            int exitCode = process.waitFor();
            if (exitCode != 0) {
                log.warn("git {} exited with code {}: {}", args.length > 0 ? args[0] : "", exitCode, output);
            }
            return new Result(exitCode, output);
        } catch (IOException e) {
            throw new WorkcellException("git command failed: " + String.join(" ", command), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkcellException("git command interrupted: " + String.join(" ", command), e);
        }
    }
}
