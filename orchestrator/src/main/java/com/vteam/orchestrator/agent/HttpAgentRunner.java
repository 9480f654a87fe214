package com.vteam.orchestrator.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vteam.orchestrator.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP client for the agentic sessions API.
 *
 *   POST {base}/api/projects/{project}/agentic-sessions         → {"name": "..."}
 *   GET  {base}/api/projects/{project}/agentic-sessions/{name}  → {"status": {"phase": "Running"}, ...}
 *
 * A session that no longer exists on the runner (404 on GET) is reported as
 * STOPPED: it was deleted out from under us and will never finish.
 */
@Component
public class HttpAgentRunner implements AgentRunner {

    private static final Logger log = LoggerFactory.getLogger(HttpAgentRunner.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       token;
    private final Duration     requestTimeout;

    public HttpAgentRunner(
            @Value("${vteam.agents.base-url}") String baseUrl,
            @Value("${vteam.agents.token:}") String token,
            @Value("${vteam.agents.request-timeout:30s}") Duration requestTimeout,
            ObjectMapper objectMapper) {
        this.baseUrl        = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.token          = token;
        this.requestTimeout = requestTimeout;
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // AgentRunner
    // ------------------------------------------------------------------

    @Override
    public String launch(AgentRunRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("prompt",               request.prompt());
        body.put("displayName",          request.displayName());
        body.put("interactive",          false);
        body.put("workspacePath",        request.workspacePath());
        body.put("environmentVariables", request.environment());
        body.put("labels",               request.labels());
        body.put("annotations",          request.annotations());

        String opName = "launch '" + request.displayName() + "'";
        HttpResponse<String> resp = send(builder(sessionsPath(request.project()))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(body)))
                .build(), opName);
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new AgentUnavailableException(
                    opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
        }

        String name = readTree(resp.body(), opName).path("name").asText("");
        if (name.isBlank()) {
            throw new AgentUnavailableException(opName + " returned no session name");
        }
        log.info("Agent session '{}' created for '{}'", name, request.displayName());
        return name;
    }

    @Override
    public SessionStatus pollStatus(String project, String externalName) {
        String opName = "poll session '" + externalName + "'";
        HttpResponse<String> resp = send(builder(sessionsPath(project) + "/"
                + URLEncoder.encode(externalName, StandardCharsets.UTF_8))
                .GET()
                .build(), opName);

        if (resp.statusCode() == 404) {
            log.warn("Agent session '{}' no longer exists on the runner", externalName);
            return SessionStatus.STOPPED;
        }
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new AgentUnavailableException(
                    opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
        }
        String phase = readTree(resp.body(), opName).path("status").path("phase").asText(null);
        return SessionStatus.fromRunnerPhase(phase);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String sessionsPath(String project) {
        return "/api/projects/" + URLEncoder.encode(project, StandardCharsets.UTF_8) + "/agentic-sessions";
    }

    private HttpRequest.Builder builder(String path) {
        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header("Accept", "application/json");
        if (token != null && !token.isBlank()) {
            b.header("Authorization", "Bearer " + token);
        }
        return b;
    }

    private HttpResponse<String> send(HttpRequest req, String opName) {
        try {
            return http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentUnavailableException(opName + " interrupted", e);
        } catch (IOException e) {
            throw new AgentUnavailableException(opName + " failed: " + e.getMessage(), e);
        }
    }

    private JsonNode readTree(String body, String opName) {
        try {
            return json.readTree(body);
        } catch (JsonProcessingException e) {
            throw new AgentUnavailableException("Unparseable response to " + opName, e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new AgentUnavailableException("JSON serialization failed", e);
        }
    }
}
