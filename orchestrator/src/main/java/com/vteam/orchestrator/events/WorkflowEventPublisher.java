package com.vteam.orchestrator.events;

import com.vteam.orchestrator.metrics.OrchestratorMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.Map;

/**
 * Single exit point for workflow events: each one is logged, counted and
 * handed to the Spring event bus.
 *
 * Inside a transaction the event is held until the transaction commits and
 * dropped if it rolls back, so listeners never hear about a phase or status
 * change that was not stored.
 */
@Component
public class WorkflowEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEventPublisher.class);

    private final ApplicationEventPublisher springEvents;
    private final OrchestratorMetrics       metrics;

    public WorkflowEventPublisher(ApplicationEventPublisher springEvents, OrchestratorMetrics metrics) {
        this.springEvents = springEvents;
        this.metrics      = metrics;
    }

    public WorkflowEvent publish(String type, String workflowId, Map<String, Object> payload) {
        WorkflowEvent event = WorkflowEvent.of(type, workflowId, payload);
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    emit(event);
                }
            });
        } else {
            emit(event);
        }
        return event;
    }

    private void emit(WorkflowEvent event) {
        if (WorkflowEvent.PHASE_REGRESSION_DETECTED.equals(event.type())) {
            log.warn("Event {} for workflow {}: {}", event.type(), event.workflowId(), event.payload());
        } else {
            log.info("Event {} for workflow {}: {}", event.type(), event.workflowId(), event.payload());
        }
        metrics.recordEvent(event.type());
        springEvents.publishEvent(event);
    }
}
