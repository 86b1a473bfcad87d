package org.elogsync.pipeline.api.contracts;

import java.util.Objects;

/**
 * One answered field of the proposal questionnaire.
 */
public record QuestionnaireField(
    String proposal,
    String category,
    String fieldId,
    String fieldName,
    String fieldValue,
    String modifiedTime,
    String modifiedUid
) {
    public QuestionnaireField {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(fieldId, "fieldId must not be null");
    }
}
