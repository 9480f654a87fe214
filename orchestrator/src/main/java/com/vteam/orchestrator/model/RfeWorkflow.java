package com.vteam.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * One enhancement-request workflow inside a project.
 *
 * The workflow owns its AgentSessions (cascade + orphan removal): deleting the
 * workflow deletes its sessions, and a session can never move to another
 * workflow.
 *
 * currentPhase is a CACHE of the phase derived from workspace evidence. Only
 * PhaseReconciler writes it, through WorkflowRepository.compareAndSetPhase().
 *
 * DB table: rfe_workflows  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "rfe_workflows")
public class RfeWorkflow {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, updatable = false)
    private String project;

    @Column(nullable = false)
    private String title;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String description;

    @Embedded
    private TargetRepository targetRepository;

    @Column(name = "workspace_path", nullable = false, updatable = false)
    private String workspacePath;

    // Stored as plain strings; order matters (it is the order shown to users).
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "rfe_workflow_agents", joinColumns = @JoinColumn(name = "workflow_id"))
    @OrderColumn(name = "position")
    @Column(name = "persona", nullable = false)
    private List<String> selectedAgents = new ArrayList<>();

    // Not updatable through entity flushes: a save() of a stale copy must
    // never overwrite a phase written by the compare-and-swap query.
    @Enumerated(EnumType.STRING)
    @Column(name = "current_phase", nullable = false, updatable = false)
    private WorkflowPhase currentPhase = WorkflowPhase.PRE;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private WorkflowStatus status = WorkflowStatus.ACTIVE;

    @Column(name = "created_by")
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    // Optimistic lock for every mutation that goes through save().
    // Null until first persist, which is how Spring Data tells new rows apart
    // (the id is assigned by us, not generated).
    @Version
    private Long version;

    @OneToMany(mappedBy = "workflow", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("startedAt ASC")
    private List<AgentSession> agentSessions = new ArrayList<>();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected RfeWorkflow() {}   // required by JPA

    public RfeWorkflow(String project,
                       String title,
                       String description,
                       TargetRepository targetRepository,
                       SelectedAgents selectedAgents,
                       String workspacePath) {
        this.id               = newId();
        this.project          = project;
        this.title            = title;
        this.description      = description;
        this.targetRepository = targetRepository;
        this.selectedAgents   = new ArrayList<>(selectedAgents.personas());
        this.workspacePath    = (workspacePath == null || workspacePath.isBlank())
                ? defaultWorkspacePath(id)
                : workspacePath.trim();
    }

    static String newId() {
        return "rfe-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    public static String defaultWorkspacePath(String workflowId) {
        return "/rfe-workflows/" + workflowId + "/workspace";
    }

    // ------------------------------------------------------------------
    // Session ownership
    // ------------------------------------------------------------------

    public void addSession(AgentSession session) {
        session.attachTo(this);
        agentSessions.add(session);
    }

    public boolean removeSession(UUID sessionId) {
        return agentSessions.removeIf(s -> sessionId.equals(s.getId()));
    }

    public Optional<AgentSession> findSession(UUID sessionId) {
        return agentSessions.stream().filter(s -> sessionId.equals(s.getId())).findFirst();
    }

    public List<AgentSession> sessionsFor(WorkflowPhase phase) {
        return agentSessions.stream().filter(s -> s.getPhase() == phase).toList();
    }

    public boolean hasInFlightSessions() {
        return agentSessions.stream().anyMatch(s -> s.getStatus().isInFlight());
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String           getId()               { return id; }
    public String           getProject()          { return project; }
    public String           getTitle()            { return title; }
    public String           getDescription()      { return description; }
    public TargetRepository getTargetRepository() { return targetRepository; }
    public String           getWorkspacePath()    { return workspacePath; }
    public WorkflowPhase    getCurrentPhase()     { return currentPhase; }
    public WorkflowStatus   getStatus()           { return status; }
    public String           getCreatedBy()        { return createdBy; }
    public Instant          getCreatedAt()        { return createdAt; }
    public Instant          getUpdatedAt()        { return updatedAt; }
    public Long             getVersion()          { return version; }
    public List<AgentSession> getAgentSessions()  { return agentSessions; }

    public SelectedAgents getSelectedAgents() {
        return SelectedAgents.of(selectedAgents);
    }

    public void setTitle(String title)                  { this.title = title; }
    public void setDescription(String description)      { this.description = description; }
    public void setStatus(WorkflowStatus status)        { this.status = status; }
    public void setCreatedBy(String createdBy)          { this.createdBy = createdBy; }

    public void setSelectedAgents(SelectedAgents agents) {
        this.selectedAgents.clear();
        this.selectedAgents.addAll(agents.personas());
    }

    /**
     * Mirror a phase value that has already been written by the
     * compare-and-swap query, so the in-memory entity matches the row.
     */
    public void syncCurrentPhase(WorkflowPhase phase)   { this.currentPhase = phase; }
}
