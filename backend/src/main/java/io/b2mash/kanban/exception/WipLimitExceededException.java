package io.b2mash.kanban.exception;

import io.b2mash.kanban.workflow.ItemStatus;
import java.math.BigDecimal;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Admission into a capacity-constrained column was refused. An expected business outcome, not a
 * fault: the body reports the column's current load and limit so the caller can tell the user.
 */
public class WipLimitExceededException extends ErrorResponseException {

  private final ItemStatus column;
  private final BigDecimal currentLoad;
  private final BigDecimal incomingWeight;
  private final int limit;

  public WipLimitExceededException(
      UUID projectId,
      ItemStatus column,
      BigDecimal currentLoad,
      BigDecimal incomingWeight,
      int limit) {
    super(
        HttpStatus.CONFLICT,
        createProblem(projectId, column, currentLoad, incomingWeight, limit),
        null);
    this.column = column;
    this.currentLoad = currentLoad;
    this.incomingWeight = incomingWeight;
    this.limit = limit;
  }

  public ItemStatus getColumn() {
    return column;
  }

  public BigDecimal getCurrentLoad() {
    return currentLoad;
  }

  public BigDecimal getIncomingWeight() {
    return incomingWeight;
  }

  public int getLimit() {
    return limit;
  }

  private static ProblemDetail createProblem(
      UUID projectId,
      ItemStatus column,
      BigDecimal currentLoad,
      BigDecimal incomingWeight,
      int limit) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("WIP limit exceeded");
    problem.setDetail(
        "Cannot admit weight "
            + incomingWeight.toPlainString()
            + " into "
            + column
            + ": current load "
            + currentLoad.toPlainString()
            + " of limit "
            + limit);
    problem.setProperty("projectId", projectId);
    problem.setProperty("column", column.name());
    problem.setProperty("currentLoad", currentLoad);
    problem.setProperty("incomingWeight", incomingWeight);
    problem.setProperty("limit", limit);
    return problem;
  }
}
