package com.vteam.orchestrator.api;

import com.vteam.orchestrator.api.dto.*;
import com.vteam.orchestrator.model.RfeWorkflow;
import com.vteam.orchestrator.model.WorkflowException;
import com.vteam.orchestrator.model.WorkflowPhase;
import com.vteam.orchestrator.service.WorkflowService;
import com.vteam.orchestrator.service.WorkflowSummary;
import com.vteam.orchestrator.workspace.WorkspaceEntry;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * REST API for RFE workflows. Every path is scoped to a project; a workflow
 * is invisible (404) from any other project.
 *
 * POST   /api/projects/{p}/rfe-workflows                              create
 * GET    /api/projects/{p}/rfe-workflows                              list (no sessions)
 * GET    /api/projects/{p}/rfe-workflows/{id}                         get (reconciled)
 * PATCH  /api/projects/{p}/rfe-workflows/{id}                         update
 * DELETE /api/projects/{p}/rfe-workflows/{id}                         delete
 * POST   /api/projects/{p}/rfe-workflows/{id}/advance                 advancement check
 * POST   /api/projects/{p}/rfe-workflows/{id}/phases/{phase}/sessions start phase sessions
 * POST   /api/projects/{p}/rfe-workflows/{id}/pause | /resume
 * GET    /api/projects/{p}/rfe-workflows/{id}/sessions?refresh=true
 * POST   /api/projects/{p}/rfe-workflows/{id}/sessions/link
 * DELETE /api/projects/{p}/rfe-workflows/{id}/sessions/{sessionId}     unlink
 * GET    /api/projects/{p}/rfe-workflows/{id}/summary
 * GET    /api/projects/{p}/rfe-workflows/{id}/workspace?path=
 * GET    /api/projects/{p}/rfe-workflows/{id}/workspace/file?path=
 *
 * Authentication happens in front of this service; the caller's identity
 * arrives in the X-Forwarded-User header and is only recorded.
 */
@RestController
@RequestMapping("/api/projects/{project}/rfe-workflows")
public class WorkflowController {

    private final WorkflowService workflowService;

    public WorkflowController(WorkflowService workflowService) {
        this.workflowService = workflowService;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/api/projects/team-a/rfe-workflows \
     *     -H "Content-Type: application/json" \
     *     -d '{"title":"SSO","description":"Add SSO login",
     *          "targetRepository":{"url":"https://github.com/org/app.git"},
     *          "selectedAgents":["pm","architect"]}'
     */
    @PostMapping
    public ResponseEntity<WorkflowResponse> create(
            @PathVariable String project,
            @RequestHeader(value = "X-Forwarded-User", required = false) String user,
            @RequestBody CreateWorkflowRequest req) {
        RfeWorkflow wf = workflowService.create(project, req.toDraft(), user);
        return ResponseEntity.status(HttpStatus.CREATED).body(WorkflowResponse.from(wf));
    }

    @GetMapping
    public List<WorkflowResponse> list(@PathVariable String project) {
        return workflowService.list(project).stream()
                .map(WorkflowResponse::slim)
                .toList();
    }

    @GetMapping("/{id}")
    public WorkflowResponse get(@PathVariable String project, @PathVariable String id) {
        return WorkflowResponse.from(workflowService.get(project, id));
    }

    @PatchMapping("/{id}")
    public WorkflowResponse update(@PathVariable String project, @PathVariable String id,
                                   @RequestBody UpdateWorkflowRequest req) {
        return WorkflowResponse.from(workflowService.update(project, id,
                req.title(), req.description(), req.selectedAgents(), req.version()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String project, @PathVariable String id) {
        workflowService.delete(project, id);
        return ResponseEntity.noContent().build();
    }

    /**
     * 200 with the next phase when the workflow may move on;
     * 409 advancement_blocked naming the missing artifact otherwise.
     */
    @PostMapping("/{id}/advance")
    public AdvanceResponse advance(@PathVariable String project, @PathVariable String id) {
        return AdvanceResponse.from(workflowService.advance(project, id));
    }

    @PostMapping("/{id}/phases/{phase}/sessions")
    public ResponseEntity<List<SessionResponse>> startPhaseSession(
            @PathVariable String project, @PathVariable String id, @PathVariable String phase,
            @RequestBody(required = false) StartPhaseSessionRequest req) {
        StartPhaseSessionRequest body = req != null ? req : new StartPhaseSessionRequest(null, false);
        List<SessionResponse> sessions = workflowService
                .startPhaseSession(project, id, parsePhase(phase), body.personas(), body.regenerate())
                .stream()
                .map(SessionResponse::from)
                .toList();
        return ResponseEntity.status(HttpStatus.CREATED).body(sessions);
    }

    @PostMapping("/{id}/pause")
    public WorkflowResponse pause(@PathVariable String project, @PathVariable String id) {
        return WorkflowResponse.from(workflowService.pause(project, id));
    }

    @PostMapping("/{id}/resume")
    public WorkflowResponse resume(@PathVariable String project, @PathVariable String id) {
        return WorkflowResponse.from(workflowService.resume(project, id));
    }

    // ------------------------------------------------------------------
    // Sessions
    // ------------------------------------------------------------------

    @GetMapping("/{id}/sessions")
    public List<SessionResponse> listSessions(@PathVariable String project, @PathVariable String id,
                                              @RequestParam(defaultValue = "false") boolean refresh) {
        return workflowService.listSessions(project, id, refresh).stream()
                .map(SessionResponse::from)
                .toList();
    }

    @PostMapping("/{id}/sessions/link")
    public ResponseEntity<SessionResponse> linkSession(@PathVariable String project, @PathVariable String id,
                                                       @RequestBody LinkSessionRequest req) {
        SessionResponse linked = SessionResponse.from(workflowService.linkSession(
                project, id, req.sessionName(), parsePhase(req.phase()), req.agentPersona()));
        return ResponseEntity.status(HttpStatus.CREATED).body(linked);
    }

    @DeleteMapping("/{id}/sessions/{sessionId}")
    public ResponseEntity<Void> unlinkSession(@PathVariable String project, @PathVariable String id,
                                              @PathVariable UUID sessionId) {
        workflowService.unlinkSession(project, id, sessionId);
        return ResponseEntity.noContent().build();
    }

    // ------------------------------------------------------------------
    // Summary / workspace
    // ------------------------------------------------------------------

    @GetMapping("/{id}/summary")
    public WorkflowSummary summary(@PathVariable String project, @PathVariable String id) {
        return workflowService.summary(project, id);
    }

    @GetMapping("/{id}/workspace")
    public List<WorkspaceEntry> listWorkspace(@PathVariable String project, @PathVariable String id,
                                              @RequestParam(defaultValue = "") String path) {
        return workflowService.listWorkspace(project, id, path);
    }

    @GetMapping("/{id}/workspace/file")
    public ResponseEntity<byte[]> readWorkspaceFile(@PathVariable String project, @PathVariable String id,
                                                    @RequestParam String path) {
        byte[] content = workflowService.readWorkspaceFile(project, id, path);
        String lower = path.toLowerCase(Locale.ROOT);
        MediaType type = lower.endsWith(".md") || lower.endsWith(".txt")
                ? new MediaType("text", "plain", StandardCharsets.UTF_8)
                : MediaType.APPLICATION_OCTET_STREAM;
        return ResponseEntity.ok().contentType(type).body(content);
    }

    private static WorkflowPhase parsePhase(String raw) {
        try {
            return WorkflowPhase.fromWire(raw);
        } catch (IllegalArgumentException e) {
            throw WorkflowException.validation(e.getMessage());
        }
    }
}
