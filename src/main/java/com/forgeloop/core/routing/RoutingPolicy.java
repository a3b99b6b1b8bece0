package com.forgeloop.core.routing;

import com.forgeloop.core.config.KernelProperties;
import com.forgeloop.core.model.Issue;
import com.forgeloop.toolchain.ToolchainRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Maps an issue to toolchains using the configured routing rules.
 * <p>
 * Rules are evaluated in order and the first match wins. A rule's {@code use} list,
 * the fallbacks of each of those toolchains and finally the global priority list
 * form the ordered candidate list.
 */
@Service
public class RoutingPolicy {

    private static final Logger log = LoggerFactory.getLogger(RoutingPolicy.class);

    private final KernelProperties properties;
    private final ToolchainRegistry registry;

    public RoutingPolicy(KernelProperties properties, ToolchainRegistry registry) {
        this.properties = properties;
        this.registry = registry;
    }

    public Optional<KernelProperties.Rule> matchRule(Issue issue) {
        for (KernelProperties.Rule rule : properties.getRouting().getRules()) {
            if (matches(rule.getMatch(), issue)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    /**
     * All candidate toolchains for the issue, most preferred first, without duplicates.
     * Includes toolchains that are currently unavailable.
     */
    public List<String> orderedCandidates(Issue issue) {
        Set<String> ordered = new LinkedHashSet<>();
        matchRule(issue).ifPresent(rule -> {
            for (String name : rule.getUse()) {
                ordered.add(name);
                ordered.addAll(properties.getRouting().getFallbacks().getOrDefault(name, List.of()));
            }
        });
        ordered.addAll(properties.getToolchainPriority());
        return new ArrayList<>(ordered);
    }

    /**
     * Pick the toolchain for a dispatch: the explicit override, else the issue's tool
     * hint when an adapter is registered for it, else the first available candidate,
     * else the first priority entry.
     */
    public String resolveToolchain(Issue issue, String override) {
        if (override != null && !override.isBlank()) {
            return override;
        }
        if (issue.toolHint() != null && registry.isRegistered(issue.toolHint())) {
            return issue.toolHint();
        }
        for (String candidate : orderedCandidates(issue)) {
            if (registry.isAvailable(candidate)) {
                return candidate;
            }
        }
        List<String> priority = properties.getToolchainPriority();
        String fallback = priority.isEmpty() ? null : priority.get(0);
        log.warn("No available toolchain for issue {}; falling back to '{}'", issue.id(), fallback);
        return fallback;
    }

    /**
     * Toolchains eligible for speculative fan-out: available toolchains from the
     * matching rule's {@code use} list, or from the priority list when no rule names any.
     */
    public List<String> speculateCandidates(Issue issue) {
        List<String> source = matchRule(issue)
                .filter(rule -> !rule.getUse().isEmpty())
                .map(KernelProperties.Rule::getUse)
                .orElse(properties.getToolchainPriority());
        return new LinkedHashSet<>(source).stream().filter(registry::isAvailable).toList();
    }

    public boolean ruleRequestsSpeculation(Issue issue) {
        return matchRule(issue).map(KernelProperties.Rule::isSpeculate).orElse(false);
    }

    /** Fan-out width requested by the matching rule, if it sets one. */
    public Optional<Integer> ruleParallelism(Issue issue) {
        return matchRule(issue)
                .map(KernelProperties.Rule::getParallelism)
                .filter(p -> p > 0);
    }

    private boolean matches(KernelProperties.Match match, Issue issue) {
        if (match == null) {
            return true;
        }
        if (match.getToolHint() != null && !match.getToolHint().equals(issue.toolHint())) {
            return false;
        }
        if (match.getRisk() != null && match.getRisk() != issue.risk()) {
            return false;
        }
        if (match.getSize() != null && !match.getSize().equalsIgnoreCase(issue.size())) {
            return false;
        }
        if (!match.getTagsAny().isEmpty() && match.getTagsAny().stream().noneMatch(issue.tags()::contains)) {
            return false;
        }
        if (!match.getTagsAll().isEmpty() && !issue.tags().containsAll(match.getTagsAll())) {
            return false;
        }
        if (match.getTitlePattern() != null && !find(match.getTitlePattern(), issue.title())) {
            return false;
        }
        return match.getDescriptionPattern() == null || find(match.getDescriptionPattern(), issue.description());
    }

    private boolean find(String regex, String text) {
        try {
            return Pattern.compile(regex, Pattern.CASE_INSENSITIVE).matcher(text).find();
        } catch (PatternSyntaxException e) {
            log.warn("Ignoring invalid routing pattern '{}': {}", regex, e.getDescription());
            return false;
        }
    }
}
