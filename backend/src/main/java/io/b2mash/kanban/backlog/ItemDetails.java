package io.b2mash.kanban.backlog;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Descriptive fields of a backlog item. A null component means "not supplied"; see {@link
 * ItemField} for resetting a field.
 */
public record ItemDetails(
    String title,
    String description,
    String type,
    UUID reviewerId,
    UUID assigneeId,
    BigDecimal estimateValue,
    Integer storyPoint,
    Instant deadline,
    String acceptanceCriteria) {}
