package org.elogsync.pipeline.api.contracts;

import java.util.Objects;

/**
 * An automated analysis workflow defined for the experiment.
 *
 * @param workflowKey    Natural key (remote id, or the name when the id is missing)
 * @param parametersJson Workflow parameters serialized as JSON text
 */
public record WorkflowDefinition(
    String workflowKey,
    String name,
    String executable,
    String trigger,
    String location,
    String parametersJson,
    String runParamName,
    String runParamValue,
    String runAsUser
) {
    public WorkflowDefinition {
        Objects.requireNonNull(workflowKey, "workflowKey must not be null");
    }
}
