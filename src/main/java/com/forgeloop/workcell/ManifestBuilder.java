package com.forgeloop.workcell;

import com.forgeloop.core.config.KernelProperties;
import com.forgeloop.core.model.ControlDecision;
import com.forgeloop.core.model.Issue;
import com.forgeloop.core.model.Manifest;
import com.forgeloop.core.model.WorkcellHandle;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class ManifestBuilder {

    private final KernelProperties properties;
    private final QualityGateCatalog gates;

    public ManifestBuilder(KernelProperties properties, QualityGateCatalog gates) {
        this.properties = properties;
        this.gates = gates;
    }

    /**
     * Build the manifest for one dispatch.
     *
     * @param planner optional planner directives, copied verbatim; may be null
     */
    public Manifest build(Issue issue, WorkcellHandle workcell, String toolchain,
                          ControlDecision control, Map<String, Object> planner) {
        KernelProperties.Toolchain config = properties.toolchain(toolchain);
        return new Manifest(
                Manifest.SCHEMA_VERSION,
                workcell.workcellId(),
                workcell.branchName(),
                issue.applyPatch(),
                Manifest.IssueSpec.of(issue),
                Manifest.JOB_TYPE_CODE,
                toolchain,
                new Manifest.ToolchainSettings(config.getModel(), control.samplingBlock()),
                gates.gatesFor(issue),
                workcell.speculateTag() != null,
                workcell.speculateTag(),
                control.toManifestBlock(),
                planner);
    }
}
