package com.forgeloop.workcell;

import com.forgeloop.core.model.WorkcellHandle;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Workcells as plain temp directories, for tests that do not need git.
 */
public class FakeWorkcellManager implements WorkcellManager {

    private final Path root;
    private final AtomicInteger sequence = new AtomicInteger();
    private final List<WorkcellHandle> created = new CopyOnWriteArrayList<>();
    private final Map<String, Boolean> released = new ConcurrentHashMap<>();
    private volatile String failCreateFor;

    public FakeWorkcellManager(Path root) {
        this.root = root;
    }

    /** Make {@link #create} fail for this issue id. */
    public FakeWorkcellManager failCreate(String issueId) {
        this.failCreateFor = issueId;
        return this;
    }

    @Override
    public WorkcellHandle create(String issueId, String speculateTag) {
        if (issueId.equals(failCreateFor)) {
            throw new WorkcellException("sandbox unavailable for " + issueId);
        }
        String suffix = sequence.incrementAndGet() + (speculateTag == null ? "" : "-" + speculateTag);
        String workcellId = "wc-" + issueId + "-" + suffix;
        Path path = root.resolve(workcellId);
        try {
            Files.createDirectories(path.resolve("logs"));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        var handle = new WorkcellHandle(workcellId, issueId, path, "wc/" + issueId + "/" + suffix, speculateTag);
        created.add(handle);
        return handle;
    }

    @Override
    public void cleanup(WorkcellHandle workcell, boolean keepLogs) {
        if (released.putIfAbsent(workcell.workcellId(), keepLogs) != null) {
            throw new IllegalStateException("Workcell released twice: " + workcell.workcellId());
        }
    }

    public List<WorkcellHandle> created() {
        return List.copyOf(created);
    }

    /** Workcell id to the keepLogs flag it was released with. */
    public Map<String, Boolean> released() {
        return Map.copyOf(released);
    }
}
