package com.vteam.orchestrator.agent;

import com.vteam.orchestrator.model.RfeWorkflow;
import com.vteam.orchestrator.model.TargetRepository;
import com.vteam.orchestrator.model.WorkflowPhase;
import com.vteam.orchestrator.phase.PhaseDefinition;
import com.vteam.orchestrator.phase.PhaseDefinitionTable;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the prompt handed to an agent session.
 *
 * The first line is the phase's slash command followed by the workflow
 * description, e.g. "/plan Add SSO login". The agent tooling dispatches on
 * the slash command. The remaining lines frame the work: who the agent is,
 * where the repository lives, and which file it must produce.
 */
@Component
public class PromptComposer {

    private final PhaseDefinitionTable phases;

    public PromptComposer(PhaseDefinitionTable phases) {
        this.phases = phases;
    }

    public String compose(RfeWorkflow workflow, WorkflowPhase phase, String persona) {
        PhaseDefinition def = phases.definitionFor(phase);
        TargetRepository repo = workflow.getTargetRepository();

        Map<String, String> values = Map.of(
                "COMMAND",     "/" + phase.wireName(),
                "DESCRIPTION", workflow.getDescription().strip(),
                "TITLE",       workflow.getTitle(),
                "PERSONA",     persona,
                "LABEL",       def.label(),
                "REPO_URL",    repo.getUrl(),
                "BRANCH",      repo.getBranch(),
                "CLONE_PATH",  repo.getClonePath(),
                "WORKSPACE",   workflow.getWorkspacePath(),
                "ARTIFACT",    def.artifactPath());

        // Single pass: placeholders inside substituted values are left as written.
        return PLACEHOLDER.matcher(FRAMING).replaceAll(m ->
                Matcher.quoteReplacement(values.getOrDefault(m.group(1), m.group())));
    }

    public String displayName(RfeWorkflow workflow, WorkflowPhase phase) {
        return workflow.getTitle() + " - " + phase.wireName();
    }

    // ------------------------------------------------------------------
    // Template
    // ------------------------------------------------------------------

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([A-Z_]+)}}");

    private static final String FRAMING = """
            {{COMMAND}} {{DESCRIPTION}}

            RFE: {{TITLE}}
            You are acting as the {{PERSONA}} agent for the {{LABEL}} phase.

            The target repository {{REPO_URL}} (branch {{BRANCH}}) is cloned at
            {{CLONE_PATH}} inside the workspace {{WORKSPACE}}.

            The phase is complete when {{ARTIFACT}} exists in the workspace.
            Write your result to that path. Do not modify artifacts of other phases.
            """;
}
