package io.b2mash.kanban.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Deleting an item with children needs an explicit deletion policy. */
public class HasChildrenException extends ErrorResponseException {

  public HasChildrenException(UUID itemId, int childCount) {
    super(HttpStatus.CONFLICT, createProblem(itemId, childCount), null);
  }

  private static ProblemDetail createProblem(UUID itemId, int childCount) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Item has children");
    problem.setDetail(
        "Backlog item "
            + itemId
            + " has "
            + childCount
            + " child item(s). Choose DETACH_CHILDREN or CASCADE_DELETE.");
    problem.setProperty("childCount", childCount);
    return problem;
  }
}
