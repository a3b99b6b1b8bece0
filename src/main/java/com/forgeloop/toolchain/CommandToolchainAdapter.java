package com.forgeloop.toolchain;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forgeloop.core.config.KernelProperties;
import com.forgeloop.core.model.Manifest;
import com.forgeloop.core.model.Proof;
import com.forgeloop.core.model.WorkcellHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external toolchain process inside the workcell.
 * <p>
 * The configured command is started in the workcell root with the manifest path
 * appended as its last argument (also exported as {@code FORGELOOP_MANIFEST}).
 * Output goes to {@code logs/<toolchain>.log}. When the process exits, the adapter
 * reads {@code proof.json} from the workcell root.
 */
public class CommandToolchainAdapter implements ToolchainAdapter {

    private static final Logger log = LoggerFactory.getLogger(CommandToolchainAdapter.class);

    private final String name;
    private final KernelProperties.Toolchain config;
    private final ObjectMapper objectMapper;

    public CommandToolchainAdapter(String name, KernelProperties.Toolchain config, ObjectMapper objectMapper) {
        this.name = name;
        this.config = config;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean available() {
        List<String> command = config.getCommand();
        if (!config.isEnabled() || command == null || command.isEmpty()) {
            return false;
        }
        return isExecutable(command.get(0));
    }

    @Override
    public Proof execute(Manifest manifest, WorkcellHandle workcell, Duration timeout) {
        var command = new ArrayList<>(config.getCommand());
        if (command.isEmpty()) {
            throw new ToolchainException("No command configured for toolchain '%s'".formatted(name));
        }
        command.add(workcell.manifestPath().toString());

        Path logFile = workcell.logsDir().resolve(name + ".log");
        Process process;
        try {
            Files.createDirectories(workcell.logsDir());
            var builder = new ProcessBuilder(command)
                    .directory(workcell.path().toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
            builder.environment().putAll(config.getEnv());
            builder.environment().put("FORGELOOP_MANIFEST", workcell.manifestPath().toString());
            builder.environment().put("FORGELOOP_WORKCELL", workcell.workcellId());
            log.debug("Starting toolchain '{}': {}", name, command);
            process = builder.start();
        } catch (IOException e) {
            throw new ToolchainException("Failed to start toolchain '%s'".formatted(name), e);
        }

        int exitCode;
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ToolchainException("Toolchain '%s' timed out after %ds".formatted(name, timeout.toSeconds()));
            }
            exitCode = process.exitValue();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ToolchainException("Toolchain '%s' was interrupted".formatted(name), e);
        }

        Path proofPath = workcell.proofPath();
        if (!Files.exists(proofPath)) {
            throw new ToolchainException("Toolchain '%s' exited with code %d without writing %s"
                    .formatted(name, exitCode, proofPath.getFileName()));
        }
        if (exitCode != 0) {
            log.warn("Toolchain '{}' exited with code {} but wrote a proof", name, exitCode);
        }
        try {
            return objectMapper.readValue(proofPath.toFile(), Proof.class);
        } catch (IOException e) {
            throw new ToolchainException("Malformed proof from toolchain '%s': %s".formatted(name, e.getMessage()), e);
        }
    }

    private static boolean isExecutable(String program) {
        if (program.contains(File.separator)) {
            return Files.isExecutable(Path.of(program));
        }
        String path = System.getenv("PATH");
        if (path == null) {
            return false;
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (!dir.isBlank() && Files.isExecutable(Path.of(dir, program))) {
                return true;
            }
        }
        return false;
    }
}
