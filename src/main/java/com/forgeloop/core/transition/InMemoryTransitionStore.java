package com.forgeloop.core.transition;

import com.forgeloop.core.model.TransitionRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Non-durable transition store, used when no DataSource is configured and in tests.
 */
public class InMemoryTransitionStore implements TransitionStore {

    private final Map<String, TransitionRecord> records = new LinkedHashMap<>();

    @Override
    public synchronized void insert(TransitionRecord record) {
        records.putIfAbsent(record.transitionId(), record);
    }

    @Override
    public synchronized OptionalDouble verifiedRate(int window) {
        if (records.isEmpty() || window <= 0) {
            return OptionalDouble.empty();
        }
        List<TransitionRecord> all = new ArrayList<>(records.values());
        List<TransitionRecord> recent = all.subList(Math.max(0, all.size() - window), all.size());
        long verified = recent.stream().filter(TransitionRecord::verified).count();
        return OptionalDouble.of((double) verified / recent.size());
    }

    public synchronized List<TransitionRecord> records() {
        return List.copyOf(records.values());
    }
}
