package com.vteam.orchestrator.workspace;

/** Raised by {@link WorkspaceInspector#readFile} when the file does not exist. */
public class WorkspaceFileNotFoundException extends RuntimeException {

    private final String path;

    public WorkspaceFileNotFoundException(String path) {
        super("File not found in workspace: " + path);
        this.path = path;
    }

    public String getPath() { return path; }
}
