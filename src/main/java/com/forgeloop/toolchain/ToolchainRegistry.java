package com.forgeloop.toolchain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Toolchain adapters keyed by name, resolved once at startup.
 */
public class ToolchainRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolchainRegistry.class);

    private final Map<String, ToolchainAdapter> adapters = new LinkedHashMap<>();
    private final List<String> priority;

    public ToolchainRegistry(Collection<? extends ToolchainAdapter> adapters, List<String> priority) {
        for (ToolchainAdapter adapter : adapters) {
            if (this.adapters.putIfAbsent(adapter.name(), adapter) != null) {
                throw new IllegalArgumentException("Duplicate toolchain adapter: " + adapter.name());
            }
        }
        this.priority = List.copyOf(priority);
        log.info("Registered toolchains {} (priority {})", this.adapters.keySet(), this.priority);
    }

    public Optional<ToolchainAdapter> get(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(adapters.get(name));
    }

    public boolean isRegistered(String name) {
        return name != null && adapters.containsKey(name);
    }

    public boolean isAvailable(String name) {
        return get(name).map(this::safeAvailable).orElse(false);
    }

    /** Configured priority order, including toolchains with no registered adapter. */
    public List<String> priority() {
        return priority;
    }

    /**
     * Available toolchains: those in the priority list first, in priority order,
     * then any other registered adapter in registration order.
     */
    public List<String> availableToolchains() {
        var result = new ArrayList<String>();
        for (String name : priority) {
            if (isAvailable(name)) {
                result.add(name);
            }
        }
        for (String name : adapters.keySet()) {
            if (!result.contains(name) && isAvailable(name)) {
                result.add(name);
            }
        }
        return result;
    }

    private boolean safeAvailable(ToolchainAdapter adapter) {
        try {
            return adapter.available();
        } catch (RuntimeException e) {
            log.warn("Availability check for toolchain '{}' failed: {}", adapter.name(), e.getMessage());
            return false;
        }
    }
}
