package com.vteam.orchestrator.workspace;

import java.util.List;

/**
 * Read-only view of a workflow's workspace.
 *
 * Implementations are stateless read-through adapters: every call goes to the
 * backing store, nothing is cached, so phase derivation always sees the
 * workspace as it is now.
 *
 * Paths are workspace-relative and resolved through {@link WorkspaceRef#resolve}.
 */
public interface WorkspaceInspector {

    /**
     * Children of a directory.
     *
     * @return empty list if the directory does not exist
     * @throws WorkspaceUnavailableException if the store cannot be reached
     */
    List<WorkspaceEntry> listEntries(WorkspaceRef workspace, String subpath);

    /**
     * @throws WorkspaceFileNotFoundException if the file does not exist
     * @throws WorkspaceUnavailableException  if the store cannot be reached
     */
    byte[] readFile(WorkspaceRef workspace, String path);

    /**
     * Whether a file exists. The file name is matched case-insensitively
     * against the listing of its parent directory.
     */
    default boolean exists(WorkspaceRef workspace, String path) {
        List<String> segments = WorkspaceRef.normalize(path);
        if (segments.isEmpty()) return false;
        String name   = segments.get(segments.size() - 1);
        String parent = String.join("/", segments.subList(0, segments.size() - 1));
        return listEntries(workspace, parent).stream()
                .anyMatch(e -> !e.isDirectory() && e.name().equalsIgnoreCase(name));
    }
}
