package io.b2mash.kanban.exception;

import io.b2mash.kanban.workflow.ItemStatus;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a requested status change is not an edge of the workflow graph. The problem body
 * carries both the current and the attempted status.
 */
public class IllegalTransitionException extends ErrorResponseException {

  private final ItemStatus currentStatus;
  private final ItemStatus attemptedStatus;

  public IllegalTransitionException(UUID itemId, ItemStatus current, ItemStatus attempted) {
    super(HttpStatus.CONFLICT, createProblem(itemId, current, attempted), null);
    this.currentStatus = current;
    this.attemptedStatus = attempted;
  }

  public ItemStatus getCurrentStatus() {
    return currentStatus;
  }

  public ItemStatus getAttemptedStatus() {
    return attemptedStatus;
  }

  private static ProblemDetail createProblem(
      UUID itemId, ItemStatus current, ItemStatus attempted) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Illegal status transition");
    problem.setDetail(
        "Cannot move backlog item " + itemId + " from " + current + " to " + attempted);
    problem.setProperty("currentStatus", current.name());
    problem.setProperty("attemptedStatus", attempted.name());
    problem.setProperty("allowedTargets", current.allowedTransitions());
    return problem;
  }
}
