package com.forgeloop.core.routing;

import com.forgeloop.core.config.KernelProperties;
import com.forgeloop.core.model.Issue;
import com.forgeloop.core.model.Risk;
import com.forgeloop.toolchain.StubToolchain;
import com.forgeloop.toolchain.ToolchainRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RoutingPolicyTest {

    private KernelProperties properties;
    private StubToolchain codex;
    private StubToolchain claude;
    private StubToolchain local;
    private RoutingPolicy routing;

    @BeforeEach
    void setUp() {
        properties = new KernelProperties();
        properties.setToolchainPriority(List.of("codex", "claude"));
        codex = new StubToolchain("codex");
        claude = new StubToolchain("claude");
        local = new StubToolchain("local");
        routing = new RoutingPolicy(properties,
                new ToolchainRegistry(List.of(codex, claude, local), properties.getToolchainPriority()));
    }

    private KernelProperties.Rule rule(List<String> use) {
        var rule = new KernelProperties.Rule();
        rule.setUse(use);
        properties.getRouting().getRules().add(rule);
        return rule;
    }

    @Test
    @DisplayName("Override wins over everything")
    void override() {
        assertEquals("local", routing.resolveToolchain(Issue.builder("a").toolHint("claude").build(), "local"));
    }

    @Test
    @DisplayName("Registered tool hint wins over priority")
    void toolHint() {
        assertEquals("claude", routing.resolveToolchain(Issue.builder("a").toolHint("claude").build(), null));
    }

    @Test
    @DisplayName("Unknown tool hint falls through to the first available candidate")
    void unknownToolHint() {
        codex.unavailable();
        assertEquals("claude", routing.resolveToolchain(Issue.builder("a").toolHint("gpt-x").build(), null));
    }

    @Test
    @DisplayName("Nothing available -> first priority entry")
    void nothingAvailable() {
        codex.unavailable();
        claude.unavailable();
        properties.setToolchainPriority(List.of("codex", "claude"));
        assertEquals("codex", routing.resolveToolchain(Issue.builder("a").build(), null));
    }

    @Test
    @DisplayName("First matching rule decides the candidates, followed by fallbacks and priority")
    void ruleOrdering() {
        KernelProperties.Rule docs = rule(List.of("local"));
        docs.getMatch().setTagsAny(List.of("docs"));
        properties.getRouting().setFallbacks(Map.of("local", List.of("claude")));

        Issue issue = Issue.builder("a").tags("docs").build();

        assertEquals(List.of("local", "claude", "codex"), routing.orderedCandidates(issue));
        assertEquals("local", routing.resolveToolchain(issue, null));
        assertEquals(List.of("codex", "claude"), routing.orderedCandidates(Issue.builder("b").build()));
    }

    @Test
    @DisplayName("Match conditions are combined")
    void matchConditions() {
        KernelProperties.Rule rule = rule(List.of("local"));
        rule.getMatch().setRisk(Risk.HIGH);
        rule.getMatch().setSize("l");
        rule.getMatch().setTagsAll(List.of("db", "migration"));
        rule.getMatch().setTitlePattern("^schema");

        Issue matching = Issue.builder("a").risk(Risk.HIGH).size("L").tags("db", "migration", "x")
                .title("Schema change for users").build();

        assertTrue(routing.matchRule(matching).isPresent());
        assertTrue(routing.matchRule(matching.toBuilder().risk(Risk.LOW).build()).isEmpty());
        assertTrue(routing.matchRule(matching.toBuilder().tags("db").build()).isEmpty());
        assertTrue(routing.matchRule(matching.toBuilder().title("Add schema").build()).isEmpty());
    }

    @Test
    @DisplayName("Invalid patterns never match")
    void invalidPattern() {
        rule(List.of("local")).getMatch().setDescriptionPattern("([unclosed");
        assertEquals(Optional.empty(), routing.matchRule(Issue.builder("a").description("anything").build()));
    }

    @Test
    @DisplayName("Speculate candidates come from the rule's use list, filtered by availability")
    void speculateCandidates() {
        KernelProperties.Rule rule = rule(List.of("local", "claude"));
        rule.setSpeculate(true);
        rule.setParallelism(2);
        claude.unavailable();

        Issue issue = Issue.builder("a").build();

        assertEquals(List.of("local"), routing.speculateCandidates(issue));
        assertTrue(routing.ruleRequestsSpeculation(issue));
        assertEquals(Optional.of(2), routing.ruleParallelism(issue));
    }

    @Test
    @DisplayName("Without a rule, speculate candidates follow the priority list")
    void speculateFromPriority() {
        assertEquals(List.of("codex", "claude"), routing.speculateCandidates(Issue.builder("a").build()));
        assertFalse(routing.ruleRequestsSpeculation(Issue.builder("a").build()));
    }
}
