package com.vteam.orchestrator.repository;

import com.vteam.orchestrator.model.RfeWorkflow;
import com.vteam.orchestrator.model.WorkflowPhase;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * CRUD + queries for the rfe_workflows table.
 */
public interface WorkflowRepository extends JpaRepository<RfeWorkflow, String> {

    /** Workflows are only ever visible inside their own project. */
    Optional<RfeWorkflow> findByIdAndProject(String id, String project);

    List<RfeWorkflow> findByProjectOrderByCreatedAtDesc(String project);

    /**
     * Compare-and-swap of the cached phase.
     *
     * Writes {@code derived} only if the row still holds {@code expected}.
     * Two reconcilers racing on the same workflow both compute the same
     * derived phase; exactly one of them sees an update count of 1.
     *
     * The version column is left alone: the phase is a cache of workspace
     * evidence, not a user edit, so it must not fail concurrent updates.
     *
     * @return 1 if this caller won the swap, 0 otherwise
     */
    @Modifying(flushAutomatically = true)
    @Query("""
            UPDATE RfeWorkflow w
               SET w.currentPhase = :derived,
                   w.updatedAt    = :now
             WHERE w.id = :id
               AND w.currentPhase = :expected
            """)
    int compareAndSetPhase(@Param("id") String id,
                           @Param("expected") WorkflowPhase expected,
                           @Param("derived") WorkflowPhase derived,
                           @Param("now") Instant now);
}
