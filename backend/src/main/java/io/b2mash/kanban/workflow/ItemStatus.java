package io.b2mash.kanban.workflow;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Workflow state of a backlog item, one per board column. Legal moves are adjacent columns in
 * either direction, except that Done never returns straight to Backlog.
 */
public enum ItemStatus {
  BACKLOG,
  TODO,
  DOING,
  DONE;

  private static final Map<ItemStatus, Set<ItemStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          BACKLOG, Set.of(TODO),
          TODO, Set.of(DOING, BACKLOG),
          DOING, Set.of(DONE, TODO),
          DONE, Set.of(DOING));

  private static final Set<ItemStatus> CAPACITY_CONSTRAINED = EnumSet.of(TODO, DOING);

  /** Every item starts here. */
  public static ItemStatus initial() {
    return BACKLOG;
  }

  /** Returns the set of statuses this status can transition to. */
  public Set<ItemStatus> allowedTransitions() {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of());
  }

  /** Returns true if transitioning from this status to the target is allowed. */
  public boolean canTransitionTo(ItemStatus target) {
    return allowedTransitions().contains(target);
  }

  /** Only Todo and Doing carry a WIP limit; Backlog and Done are unbounded. */
  public boolean isCapacityConstrained() {
    return CAPACITY_CONSTRAINED.contains(this);
  }
}
