package io.b2mash.kanban.workflow;

import java.util.List;

/**
 * Result of evaluating the workflow policy of one edge against one item.
 *
 * @param allowed true if the edge has no active policy or the item meets all its criteria
 * @param violations unmet criteria, in declaration order (empty if allowed)
 */
public record PolicyCheck(
    ItemStatus fromStatus, ItemStatus toStatus, boolean allowed, List<PolicyViolation> violations) {

  static PolicyCheck passed(ItemStatus from, ItemStatus to) {
    return new PolicyCheck(from, to, true, List.of());
  }
}
