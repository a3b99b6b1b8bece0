package com.forgeloop.workcell;

import com.forgeloop.core.config.KernelProperties;
import com.forgeloop.core.model.Issue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QualityGateCatalogTest {

    private KernelProperties properties;
    private QualityGateCatalog catalog;

    @BeforeEach
    void setUp() {
        properties = new KernelProperties();
        catalog = new QualityGateCatalog(properties);
    }

    @Test
    @DisplayName("Default gates are test, typecheck and lint")
    void defaults() {
        Map<String, String> gates = catalog.gatesFor(Issue.builder("a").build());

        assertEquals(List.of("test", "typecheck", "lint"), List.copyOf(gates.keySet()));
        assertEquals("pytest", gates.get("test"));
    }

    @Test
    @DisplayName("Blank commands are left out")
    void blankCommands() {
        properties.getGates().setTypecheckCommand("");
        properties.getGates().setLintCommand(null);

        assertEquals(List.of("test"), List.copyOf(catalog.gatesFor(Issue.builder("a").build()).keySet()));
    }

    @Test
    @DisplayName("Tags add their configured gates")
    void taggedGates() {
        properties.getGates().getTagged().put("frontend", Map.of("e2e", "npm run e2e"));

        Map<String, String> gates = catalog.gatesFor(Issue.builder("a").tags("frontend").build());

        assertEquals("npm run e2e", gates.get("e2e"));
        assertEquals(4, gates.size());
    }

    @Test
    @DisplayName("Explicit issue gates replace everything else")
    void explicitGates() {
        Issue issue = Issue.builder("a").qualityGates(Map.of("build", "make")).tags("frontend").build();
        properties.getGates().getTagged().put("frontend", Map.of("e2e", "npm run e2e"));

        assertEquals(Map.of("build", "make"), catalog.gatesFor(issue));
    }
}
