package com.vteam.orchestrator.workspace;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One child of a workspace directory.
 *
 * @param name        file or directory name (no path)
 * @param isDirectory true for directories
 * @param size        size in bytes; 0 for directories
 */
public record WorkspaceEntry(String name, @JsonProperty("isDirectory") boolean isDirectory, long size) {}
