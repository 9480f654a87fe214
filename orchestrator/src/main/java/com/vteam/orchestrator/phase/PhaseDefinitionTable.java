package com.vteam.orchestrator.phase;

import com.vteam.orchestrator.model.WorkflowPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Read-only, ordered table of phase definitions.
 *
 * Built once from {@link PhaseProperties}. A malformed table is a startup
 * failure: the constructor throws and the application context never comes up,
 * so nothing at request time has to handle a bad definition.
 */
@Component
public class PhaseDefinitionTable {

    private static final Logger log = LoggerFactory.getLogger(PhaseDefinitionTable.class);

    private final Map<WorkflowPhase, PhaseDefinition> definitions = new EnumMap<>(WorkflowPhase.class);

    public PhaseDefinitionTable(PhaseProperties props) {
        definitions.put(WorkflowPhase.PRE, new PhaseDefinition(WorkflowPhase.PRE, null, "Pre"));
        definitions.put(WorkflowPhase.SPECIFY, artifactPhase(WorkflowPhase.SPECIFY, props.getSpecify()));
        definitions.put(WorkflowPhase.PLAN,    artifactPhase(WorkflowPhase.PLAN,    props.getPlan()));
        definitions.put(WorkflowPhase.TASKS,   artifactPhase(WorkflowPhase.TASKS,   props.getTasks()));
        definitions.put(WorkflowPhase.COMPLETED, new PhaseDefinition(WorkflowPhase.COMPLETED, null, "Completed"));

        Set<String> seen = new HashSet<>();
        for (WorkflowPhase p : WorkflowPhase.ARTIFACT_PHASES) {
            String path = definitions.get(p).artifactPath().toLowerCase(Locale.ROOT);
            if (!seen.add(path)) {
                throw new IllegalStateException(
                        "Phase table: artifact path '" + path + "' is used by more than one phase");
            }
        }
        for (WorkflowPhase p : WorkflowPhase.ARTIFACT_PHASES) {
            log.info("Phase '{}' completes when '{}' exists", p.wireName(), definitions.get(p).artifactPath());
        }
    }

    private static PhaseDefinition artifactPhase(WorkflowPhase phase, PhaseProperties.Entry entry) {
        if (entry == null || entry.getArtifact() == null || entry.getArtifact().isBlank()) {
            throw new IllegalStateException("Phase table: no artifact configured for phase " + phase.wireName());
        }
        String path = entry.getArtifact().trim();
        if (path.startsWith("/") || path.endsWith("/") || path.contains("..")
                || path.contains("//") || path.contains("\\")) {
            throw new IllegalStateException("Phase table: artifact path for phase "
                    + phase.wireName() + " must be a normalized relative file path, got '" + path + "'");
        }
        String label = (entry.getLabel() == null || entry.getLabel().isBlank())
                ? phase.wireName()
                : entry.getLabel().trim();
        return new PhaseDefinition(phase, path, label);
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public PhaseDefinition definitionFor(WorkflowPhase phase) {
        return definitions.get(phase);
    }

    /** Null for phases without an artifact. */
    public String artifactPath(WorkflowPhase phase) {
        return definitions.get(phase).artifactPath();
    }

    /** All phases in order, PRE through COMPLETED. */
    public List<PhaseDefinition> ordered() {
        return new ArrayList<>(definitions.values());
    }

    /** SPECIFY, PLAN, TASKS in order. */
    public List<PhaseDefinition> artifactPhases() {
        return WorkflowPhase.ARTIFACT_PHASES.stream().map(definitions::get).toList();
    }
}
