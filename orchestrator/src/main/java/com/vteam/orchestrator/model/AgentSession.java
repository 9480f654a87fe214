package com.vteam.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One unit of external agent work: a single persona working on a single phase.
 * Multi-agent phases launch one AgentSession per persona.
 *
 * externalName is the handle returned by the agent runner and is what we poll.
 * producedArtifactPath is only a hint: phase completion is decided by the
 * workspace, never by this row.
 *
 * DB table: agent_sessions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "agent_sessions")
public class AgentSession {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "workflow_id", nullable = false)
    private RfeWorkflow workflow;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private WorkflowPhase phase;

    @Column(name = "agent_persona", nullable = false)
    private String agentPersona;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SessionStatus status = SessionStatus.PENDING;

    // Null when the launch itself failed.
    @Column(name = "external_name")
    private String externalName;

    @Column(name = "produced_artifact_path")
    private String producedArtifactPath;

    // True when the session regenerates an artifact that already existed.
    @Column(nullable = false)
    private boolean rerun = false;

    // True when an existing external session was attached by the user.
    @Column(nullable = false)
    private boolean linked = false;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt = Instant.now();

    @Column(name = "completed_at")
    private Instant completedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected AgentSession() {}   // required by JPA

    public AgentSession(WorkflowPhase phase, String agentPersona, String externalName,
                        String producedArtifactPath) {
        this.phase                = phase;
        this.agentPersona         = agentPersona;
        this.externalName         = externalName;
        this.producedArtifactPath = producedArtifactPath;
    }

    /** A session whose launch was rejected by the runner. */
    public static AgentSession launchFailed(WorkflowPhase phase, String agentPersona,
                                            String producedArtifactPath, String reason) {
        AgentSession s = new AgentSession(phase, agentPersona, null, producedArtifactPath);
        s.status        = SessionStatus.FAILED;
        s.failureReason = reason;
        s.completedAt   = s.startedAt;
        return s;
    }

    void attachTo(RfeWorkflow workflow) {
        this.workflow = workflow;
    }

    /**
     * Record a newly observed runner status. completedAt is stamped on the
     * first terminal observation only.
     *
     * @return true if the status changed
     */
    public boolean observe(SessionStatus observed) {
        if (observed == status) return false;
        this.status = observed;
        if (observed.isTerminal() && completedAt == null) {
            this.completedAt = Instant.now();
        }
        return true;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID          getId()                   { return id; }
    public RfeWorkflow   getWorkflow()             { return workflow; }
    public WorkflowPhase getPhase()                { return phase; }
    public String        getAgentPersona()         { return agentPersona; }
    public SessionStatus getStatus()               { return status; }
    public String        getExternalName()         { return externalName; }
    public String        getProducedArtifactPath() { return producedArtifactPath; }
    public boolean       isRerun()                 { return rerun; }
    public boolean       isLinked()                { return linked; }
    public String        getFailureReason()        { return failureReason; }
    public Instant       getStartedAt()            { return startedAt; }
    public Instant       getCompletedAt()          { return completedAt; }

    public void setRerun(boolean rerun)            { this.rerun = rerun; }
    public void setLinked(boolean linked)          { this.linked = linked; }
}
