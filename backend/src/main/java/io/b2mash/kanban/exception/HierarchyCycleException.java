package io.b2mash.kanban.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class HierarchyCycleException extends ErrorResponseException {

  public HierarchyCycleException(UUID itemId, UUID newParentId) {
    super(HttpStatus.CONFLICT, createProblem(itemId, newParentId), null);
  }

  private static ProblemDetail createProblem(UUID itemId, UUID newParentId) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Hierarchy cycle");
    problem.setDetail(
        "Backlog item "
            + itemId
            + " cannot be placed under "
            + newParentId
            + " because it is that item or one of its ancestors");
    problem.setProperty("itemId", itemId);
    problem.setProperty("parentId", newParentId);
    return problem;
  }
}
