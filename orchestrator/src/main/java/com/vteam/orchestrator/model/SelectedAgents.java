package com.vteam.orchestrator.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The agent personas chosen for a workflow: 1..8 non-blank ids,
 * de-duplicated, in the order the caller gave them.
 *
 * Constructed only through {@link #of}, which is the validation boundary;
 * everything downstream can rely on the bounds.
 */
public final class SelectedAgents {

    public static final int MIN = 1;
    public static final int MAX = 8;

    private final List<String> personas;

    private SelectedAgents(List<String> personas) {
        this.personas = List.copyOf(personas);
    }

    /**
     * @throws WorkflowException VALIDATION if empty, blank, or more than {@value #MAX}
     */
    public static SelectedAgents of(Collection<String> raw) {
        if (raw == null || raw.isEmpty()) {
            throw WorkflowException.validation("At least " + MIN + " agent must be selected");
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String persona : raw) {
            if (persona == null || persona.isBlank()) {
                throw WorkflowException.validation("Agent persona ids must not be blank");
            }
            unique.add(persona.trim());
        }
        if (unique.size() > MAX) {
            throw WorkflowException.validation(
                    "At most " + MAX + " agents may be selected, got " + unique.size());
        }
        return new SelectedAgents(new ArrayList<>(unique));
    }

    public List<String> personas() { return personas; }

    public int size() { return personas.size(); }

    public boolean contains(String persona) {
        return persona != null && personas.contains(persona.trim());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SelectedAgents other && personas.equals(other.personas);
    }

    @Override
    public int hashCode() { return personas.hashCode(); }

    @Override
    public String toString() { return personas.toString(); }
}
