package com.vteam.orchestrator.api.dto;

import java.util.List;

/**
 * Request body for PATCH /api/projects/{project}/rfe-workflows/{id}.
 * Every field is optional; absent fields are left unchanged. When version is
 * given, the update fails with 409 if the workflow changed in the meantime.
 */
public record UpdateWorkflowRequest(String title,
                                    String description,
                                    List<String> selectedAgents,
                                    Long version) {}
