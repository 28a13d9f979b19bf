package io.b2mash.kanban.workflow;

/**
 * One unmet criterion of a workflow policy.
 *
 * @param criterion the criterion that failed
 * @param message human-readable description, suitable for showing to the user
 */
public record PolicyViolation(PolicyCriterion criterion, String message) {

  static PolicyViolation of(PolicyCriterion criterion) {
    return new PolicyViolation(criterion, criterion.violationMessage());
  }
}
