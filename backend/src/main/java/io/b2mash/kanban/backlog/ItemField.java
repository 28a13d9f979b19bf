package io.b2mash.kanban.backlog;

/**
 * Optional item fields that a partial update can reset to empty. A null in {@link ItemDetails}
 * leaves a field alone, so clearing has to be asked for by name. The title is required and cannot
 * be cleared.
 */
public enum ItemField {
  DESCRIPTION,
  ACCEPTANCE_CRITERIA,
  TYPE,
  REVIEWER_ID,
  ASSIGNEE_ID,
  ESTIMATE_VALUE,
  STORY_POINT,
  DEADLINE
}
