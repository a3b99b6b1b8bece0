package com.forgeloop.workcell;

import com.forgeloop.core.config.KernelProperties;
import com.forgeloop.core.model.Issue;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Declares the quality gates for an issue, as gate name to command.
 * <p>
 * An explicit per-issue gate map wins outright. Otherwise the configured default gates
 * ({@code test}, {@code typecheck}, {@code lint}; blank commands are left out) apply,
 * plus the gates configured for each of the issue's tags.
 */
@Component
public class QualityGateCatalog {

    public static final String TEST = "test";
    public static final String TYPECHECK = "typecheck";
    public static final String LINT = "lint";

    private final KernelProperties properties;

    public QualityGateCatalog(KernelProperties properties) {
        this.properties = properties;
    }

    public Map<String, String> gatesFor(Issue issue) {
        if (!issue.qualityGates().isEmpty()) {
            return new LinkedHashMap<>(issue.qualityGates());
        }
        KernelProperties.Gates config = properties.getGates();
        var gates = new LinkedHashMap<String, String>();
        putIfPresent(gates, TEST, config.getTestCommand());
        putIfPresent(gates, TYPECHECK, config.getTypecheckCommand());
        putIfPresent(gates, LINT, config.getLintCommand());
        for (String tag : issue.tags()) {
            Map<String, String> extra = config.getTagged().get(tag);
            if (extra != null) {
                extra.forEach((name, command) -> putIfPresent(gates, name, command));
            }
        }
        return gates;
    }

    private static void putIfPresent(Map<String, String> gates, String name, String command) {
        if (command != null && !command.isBlank()) {
            gates.put(name, command);
        }
    }
}
