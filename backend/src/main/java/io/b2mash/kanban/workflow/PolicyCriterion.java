package io.b2mash.kanban.workflow;

import io.b2mash.kanban.backlog.BacklogItem;

/** A condition an item has to meet before a workflow policy lets it cross an edge. */
public enum PolicyCriterion {
  ASSIGNEE_REQUIRED("Item must have an assignee") {
    @Override
    public boolean isMetBy(BacklogItem item) {
      return item.getAssigneeId() != null;
    }
  },
  REVIEWER_REQUIRED("Item must have a reviewer") {
    @Override
    public boolean isMetBy(BacklogItem item) {
      return item.getReviewerId() != null;
    }
  },
  STORY_POINTS_ESTIMATED("Story points must be estimated") {
    @Override
    public boolean isMetBy(BacklogItem item) {
      return item.getStoryPoint() != null && item.getStoryPoint() > 0;
    }
  },
  ACCEPTANCE_CRITERIA_DEFINED("Acceptance criteria must be defined") {
    @Override
    public boolean isMetBy(BacklogItem item) {
      return item.getAcceptanceCriteria() != null && !item.getAcceptanceCriteria().isBlank();
    }
  },
  /** A paused item is on hold, i.e. blocked. */
  NO_BLOCKERS("Item is paused and has to be resumed first") {
    @Override
    public boolean isMetBy(BacklogItem item) {
      return !item.isPaused();
    }
  };

  private final String violationMessage;

  PolicyCriterion(String violationMessage) {
    this.violationMessage = violationMessage;
  }

  public abstract boolean isMetBy(BacklogItem item);

  public String violationMessage() {
    return violationMessage;
  }
}
