package com.vteam.orchestrator.workspace;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * Workspace inspector backed by the per-project content service.
 *
 * Endpoints:
 *   GET {base}/content/list?path=/abs/dir  → {"items":[{name,path,isDir,size,modifiedAt}]}
 *   GET {base}/content/file?path=/abs/file → raw bytes
 *
 * The base URL is a template; "%s" is replaced by the workflow's project,
 * e.g. http://ambient-content.%s.svc:8080.
 *
 * A 404 on list means "directory does not exist" and yields an empty listing.
 * Any other non-2xx status, or a transport failure, is a
 * WorkspaceUnavailableException.
 */
@Component
@ConditionalOnProperty(name = "vteam.workspace.mode", havingValue = "content-service", matchIfMissing = true)
public class ContentServiceWorkspaceInspector implements WorkspaceInspector {

    private static final Logger log = LoggerFactory.getLogger(ContentServiceWorkspaceInspector.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrlTemplate;
    private final Duration     requestTimeout;

    public ContentServiceWorkspaceInspector(
            @Value("${vteam.workspace.content-service.base-url}") String baseUrlTemplate,
            @Value("${vteam.workspace.content-service.request-timeout:10s}") Duration requestTimeout,
            ObjectMapper objectMapper) {
        this.baseUrlTemplate = baseUrlTemplate;
        this.requestTimeout  = requestTimeout;
        this.json            = objectMapper;
        this.http            = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ListResponse(List<Item> items) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Item(String name, String path, @JsonProperty("isDir") boolean isDir, long size) {}

    // ------------------------------------------------------------------
    // WorkspaceInspector
    // ------------------------------------------------------------------

    @Override
    public List<WorkspaceEntry> listEntries(WorkspaceRef workspace, String subpath) {
        String absPath = workspace.resolve(subpath);
        HttpResponse<byte[]> resp = get(workspace, "/content/list", absPath, "list " + absPath);

        if (resp.statusCode() == 404) {
            log.debug("Directory '{}' does not exist", absPath);
            return List.of();
        }
        requireSuccess(resp, "list " + absPath);

        try {
            ListResponse body = json.readValue(resp.body(), ListResponse.class);
            if (body.items() == null) return List.of();
            return body.items().stream()
                    .map(i -> new WorkspaceEntry(i.name(), i.isDir(), i.isDir() ? 0 : i.size()))
                    .toList();
        } catch (IOException e) {
            throw new WorkspaceUnavailableException("Unparseable listing for " + absPath, e);
        }
    }

    @Override
    public byte[] readFile(WorkspaceRef workspace, String path) {
        String absPath = workspace.resolve(path);
        HttpResponse<byte[]> resp = get(workspace, "/content/file", absPath, "read " + absPath);

        if (resp.statusCode() == 404) {
            throw new WorkspaceFileNotFoundException(path);
        }
        requireSuccess(resp, "read " + absPath);
        return resp.body();
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    String baseUrlFor(String project) {
        return baseUrlTemplate.contains("%s")
                ? String.format(baseUrlTemplate, project)
                : baseUrlTemplate;
    }

    private HttpResponse<byte[]> get(WorkspaceRef workspace, String endpoint, String absPath, String opName) {
        URI uri = URI.create(baseUrlFor(workspace.project()) + endpoint
                + "?path=" + URLEncoder.encode(absPath, StandardCharsets.UTF_8));
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(uri)
                    .timeout(requestTimeout)
                    .header("Accept", "application/json")
                    .GET()
                    .build();
            return http.send(req, HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkspaceUnavailableException(opName + " interrupted", e);
        } catch (IOException e) {
            throw new WorkspaceUnavailableException(opName + " failed: " + e.getMessage(), e);
        }
    }

    private static void requireSuccess(HttpResponse<byte[]> resp, String opName) {
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new WorkspaceUnavailableException(
                    opName + " failed: HTTP " + resp.statusCode() + ": "
                    + new String(resp.body(), StandardCharsets.UTF_8));
        }
    }
}
