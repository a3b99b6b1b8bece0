package com.forgeloop.workcell;

import com.fasterxml.jackson.databind.JsonNode;
import com.forgeloop.core.config.JsonConfig;
import com.forgeloop.core.config.KernelProperties;
import com.forgeloop.core.model.ControlDecision;
import com.forgeloop.core.model.Issue;
import com.forgeloop.core.model.Manifest;
import com.forgeloop.core.model.WorkcellHandle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ManifestBuilderTest {

    private KernelProperties properties;
    private ManifestBuilder builder;
    private final ControlDecision control = new ControlDecision("explore", "low rate", 0.05, 0.3, 3);

    @BeforeEach
    void setUp() {
        properties = new KernelProperties();
        var codex = new KernelProperties.Toolchain();
        codex.setModel("gpt-5-codex");
        properties.getToolchains().put("codex", codex);
        builder = new ManifestBuilder(properties, new QualityGateCatalog(properties));
    }

    @Test
    @DisplayName("Single dispatch manifest carries issue, toolchain, gates and control block")
    void singleManifest() {
        Issue issue = Issue.builder("I1").title("Add cache").acceptanceCriteria(List.of("hit rate logged"))
                .forbiddenPaths(List.of("migrations/")).applyPatch(false).build();
        var workcell = new WorkcellHandle("wc-I1-1", "I1", Path.of("/w/wc-I1-1"), "wc/I1/1", null);

        Manifest manifest = builder.build(issue, workcell, "codex", control, null);

        assertEquals("wc-I1-1", manifest.workcellId());
        assertEquals("wc/I1/1", manifest.branchName());
        assertFalse(manifest.applyPatch());
        assertEquals("Add cache", manifest.issue().title());
        assertEquals(List.of("migrations/"), manifest.issue().forbiddenPaths());
        assertEquals("code", manifest.jobType());
        assertEquals("gpt-5-codex", manifest.toolchainConfig().model());
        assertEquals(0.3, manifest.toolchainConfig().sampling().get("temperature"));
        assertEquals(3, manifest.declaredGates().size());
        assertFalse(manifest.speculateMode());
        assertEquals("explore", manifest.control().get("mode"));
        assertNull(manifest.planner());
    }

    @Test
    @DisplayName("Speculative manifest is flagged and tagged")
    void speculativeManifest() {
        var workcell = new WorkcellHandle("wc-I2-1-spec-codex", "I2", Path.of("/w"), "wc/I2/1-spec-codex", "spec-codex");

        Manifest manifest = builder.build(Issue.builder("I2").build(), workcell, "codex", control,
                Map.of("strategy", "small steps"));

        assertTrue(manifest.speculateMode());
        assertEquals("spec-codex", manifest.speculateTag());
        assertEquals("small steps", manifest.planner().get("strategy"));
    }

    @Test
    @DisplayName("Serialized manifest uses the snake_case wire names")
    void wireFormat() throws Exception {
        var workcell = new WorkcellHandle("wc-I1-1", "I1", Path.of("/w"), "wc/I1/1", null);
        Manifest manifest = builder.build(Issue.builder("I1").build(), workcell, "codex", control, null);

        JsonNode json = JsonConfig.kernelObjectMapper().valueToTree(manifest);

        assertEquals("1.0.0", json.get("schema_version").asText());
        assertEquals("wc/I1/1", json.get("branch_name").asText());
        assertTrue(json.get("quality_gates").has("lint"));
        assertTrue(json.get("speculate_tag").isNull());
        assertEquals(3, json.get("control").get("speculate_parallelism").asInt());
        assertFalse(json.has("declared_gates"));
    }
}
