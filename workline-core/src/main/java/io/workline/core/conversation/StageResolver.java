package io.workline.core.conversation;

import io.workline.core.session.FieldValue;
import io.workline.core.timeline.TimelineAnalysis;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Derives the stage from what has been collected so far; stages are never advanced by hand.
 */
public final class StageResolver {
    private final FieldCatalog catalog;

    public StageResolver(FieldCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
    }

    public ConversationStage resolve(int callerTurns, Map<String, List<FieldValue>> fields, TimelineAnalysis timeline) {
        if (callerTurns == 0) {
            return ConversationStage.GREETING;
        }
        if (!catalog.covered(fields, FieldCatalog.FULL_NAME)) {
            return ConversationStage.IDENTITY;
        }
        if (FieldCatalog.REQUIRED.stream().anyMatch(name -> !catalog.covered(fields, name))) {
            return ConversationStage.EMPLOYMENT;
        }
        if (!timeline.openGaps().isEmpty()) {
            return ConversationStage.GAP_RESOLUTION;
        }
        if (!catalog.covered(fields, FieldCatalog.SCHOOL_NAME) || !catalog.covered(fields, FieldCatalog.DEGREE)) {
            return ConversationStage.EDUCATION;
        }
        if (!catalog.covered(fields, FieldCatalog.SKILLS)) {
            return ConversationStage.SKILLS;
        }
        return ConversationStage.CLOSING;
    }
}
