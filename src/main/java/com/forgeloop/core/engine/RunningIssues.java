package com.forgeloop.core.engine;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The set of issues with a dispatch in flight. Each issue is added once when its lane
 * starts and removed once when the lane settles, through a {@link Claim}.
 */
public class RunningIssues {

    private final ReentrantLock lock = new ReentrantLock();
    private final Set<String> running = new HashSet<>();

    /**
     * Mark an issue as running.
     *
     * @throws IllegalStateException when the issue already has a dispatch in flight
     */
    public Claim claim(String issueId) {
        lock.lock();
        try {
            if (!running.add(issueId)) {
                throw new IllegalStateException("Issue " + issueId + " is already running");
            }
        } finally {
            lock.unlock();
        }
        return new Claim(issueId);
    }

    public boolean contains(String issueId) {
        lock.lock();
        try {
            return running.contains(issueId);
        } finally {
            lock.unlock();
        }
    }

    public Set<String> snapshot() {
        lock.lock();
        try {
            return Set.copyOf(running);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return running.size();
        } finally {
            lock.unlock();
        }
    }

    private void release(String issueId) {
        lock.lock();
        try {
            running.remove(issueId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes its issue from the running set on {@link #close()}; later calls do nothing.
     */
    public final class Claim implements AutoCloseable {

        private final String issueId;
        private final AtomicBoolean released = new AtomicBoolean();

        private Claim(String issueId) {
            this.issueId = issueId;
        }

        public String issueId() {
            return issueId;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                release(issueId);
            }
        }
    }
}
