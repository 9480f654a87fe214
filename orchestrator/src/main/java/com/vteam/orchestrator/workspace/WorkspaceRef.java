package com.vteam.orchestrator.workspace;

import com.vteam.orchestrator.model.RfeWorkflow;
import com.vteam.orchestrator.model.WorkflowException;

import java.util.ArrayList;
import java.util.List;

/**
 * Address of one workflow's workspace: the project whose content store holds
 * it, and the absolute workspace root inside that store.
 *
 * All relative paths handed to a {@link WorkspaceInspector} are resolved
 * through {@link #resolve(String)} so nothing can escape the workspace root.
 */
public record WorkspaceRef(String project, String workspacePath) {

    public static WorkspaceRef of(RfeWorkflow workflow) {
        return new WorkspaceRef(workflow.getProject(), workflow.getWorkspacePath());
    }

    /**
     * Join a workspace-relative path onto the root.
     * "" or null resolves to the root itself.
     *
     * @throws WorkflowException (VALIDATION) on ".." segments
     */
    public String resolve(String relative) {
        List<String> segments = normalize(relative);
        String root = workspacePath.endsWith("/")
                ? workspacePath.substring(0, workspacePath.length() - 1)
                : workspacePath;
        return segments.isEmpty() ? root : root + "/" + String.join("/", segments);
    }

    /** Split into clean segments, dropping empty and "." parts. */
    static List<String> normalize(String relative) {
        List<String> out = new ArrayList<>();
        if (relative == null) return out;
        for (String part : relative.replace('\\', '/').split("/")) {
            if (part.isEmpty() || part.equals(".")) continue;
            if (part.equals("..")) {
                throw WorkflowException.validation("Path must not contain '..': " + relative);
            }
            out.add(part);
        }
        return out;
    }
}
