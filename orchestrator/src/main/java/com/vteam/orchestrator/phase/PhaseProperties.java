package com.vteam.orchestrator.phase;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Artifact path and label for each artifact-producing phase.
 *
 * <pre>
 * vteam:
 *   phases:
 *     specify: { artifact: specs/spec.md,  label: Specify }
 *     plan:    { artifact: specs/plan.md,  label: Plan }
 *     tasks:   { artifact: specs/tasks.md, label: Tasks }
 * </pre>
 *
 * Validated by {@link PhaseDefinitionTable} at startup.
 */
@Component
@ConfigurationProperties(prefix = "vteam.phases")
public class PhaseProperties {

    private Entry specify = new Entry("specs/spec.md",  "Specify");
    private Entry plan    = new Entry("specs/plan.md",  "Plan");
    private Entry tasks   = new Entry("specs/tasks.md", "Tasks");

    public Entry getSpecify() { return specify; }
    public void setSpecify(Entry specify) { this.specify = specify; }
    public Entry getPlan() { return plan; }
    public void setPlan(Entry plan) { this.plan = plan; }
    public Entry getTasks() { return tasks; }
    public void setTasks(Entry tasks) { this.tasks = tasks; }

    public static class Entry {
        private String artifact;
        private String label;

        public Entry() {}

        public Entry(String artifact, String label) {
            this.artifact = artifact;
            this.label    = label;
        }

        public String getArtifact() { return artifact; }
        public void setArtifact(String artifact) { this.artifact = artifact; }
        public String getLabel() { return label; }
        public void setLabel(String label) { this.label = label; }
    }
}
