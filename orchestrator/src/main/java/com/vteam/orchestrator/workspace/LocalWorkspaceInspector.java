package com.vteam.orchestrator.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Workspace inspector over a directory tree on the local filesystem.
 *
 * A workspace path "/rfe-workflows/rfe-1/workspace" lives at
 * {root}/rfe-workflows/rfe-1/workspace. Used for development and for running
 * next to a shared volume.
 */
@Component
@ConditionalOnProperty(name = "vteam.workspace.mode", havingValue = "local")
public class LocalWorkspaceInspector implements WorkspaceInspector {

    private static final Logger log = LoggerFactory.getLogger(LocalWorkspaceInspector.class);

    private final Path root;

    public LocalWorkspaceInspector(@Value("${vteam.workspace.local.root}") Path root) {
        this.root = root.toAbsolutePath().normalize();
        log.info("Local workspace root: {}", this.root);
    }

    @Override
    public List<WorkspaceEntry> listEntries(WorkspaceRef workspace, String subpath) {
        Path dir = toLocal(workspace.resolve(subpath));
        if (!Files.isDirectory(dir)) return List.of();

        try (Stream<Path> children = Files.list(dir)) {
            return children
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .map(this::toEntry)
                    .toList();
        } catch (IOException e) {
            throw new WorkspaceUnavailableException("Cannot list " + dir, e);
        }
    }

    @Override
    public byte[] readFile(WorkspaceRef workspace, String path) {
        Path file = toLocal(workspace.resolve(path));
        if (!Files.isRegularFile(file)) {
            throw new WorkspaceFileNotFoundException(path);
        }
        try {
            return Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            throw new WorkspaceFileNotFoundException(path);
        } catch (IOException e) {
            throw new WorkspaceUnavailableException("Cannot read " + file, e);
        }
    }

    private Path toLocal(String absWorkspacePath) {
        String rel = absWorkspacePath.startsWith("/") ? absWorkspacePath.substring(1) : absWorkspacePath;
        Path p = root.resolve(rel).normalize();
        if (!p.startsWith(root)) {
            throw new WorkspaceUnavailableException("Path escapes workspace root: " + absWorkspacePath);
        }
        return p;
    }

    private WorkspaceEntry toEntry(Path p) {
        boolean dir = Files.isDirectory(p);
        long size = 0;
        if (!dir) {
            try {
                size = Files.size(p);
            } catch (IOException e) {
                throw new WorkspaceUnavailableException("Cannot stat " + p, e);
            }
        }
        return new WorkspaceEntry(p.getFileName().toString(), dir, size);
    }
}
