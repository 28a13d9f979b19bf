package io.b2mash.kanban.wip;

import io.b2mash.kanban.workflow.ItemStatus;
import java.math.BigDecimal;

/**
 * Outcome of an admission check. {@code overLimit} with {@code admitted} set is a soft-limit
 * breach: the item goes in and the caller is warned.
 */
public record AdmissionResult(
    ItemStatus column,
    boolean admitted,
    boolean overLimit,
    BigDecimal currentLoad,
    BigDecimal incomingWeight,
    Integer limit,
    WipLimitType limitType) {

  static AdmissionResult evaluate(WipLimit wipLimit, BigDecimal currentLoad, BigDecimal weight) {
    if (wipLimit.isUnlimited()) {
      return new AdmissionResult(
          wipLimit.getColumn(), true, false, currentLoad, weight, null, wipLimit.getLimitType());
    }
    boolean over = currentLoad.add(weight).compareTo(BigDecimal.valueOf(wipLimit.getLimit())) > 0;
    boolean admitted = !over || wipLimit.getLimitType() == WipLimitType.SOFT;
    return new AdmissionResult(
        wipLimit.getColumn(),
        admitted,
        over,
        currentLoad,
        weight,
        wipLimit.getLimit(),
        wipLimit.getLimitType());
  }

  /** Admission that bypassed the limit check, e.g. a move within one column. */
  static AdmissionResult unchecked(ItemStatus column) {
    return new AdmissionResult(column, true, false, BigDecimal.ZERO, BigDecimal.ZERO, null, null);
  }

  /** Human-readable warning for a soft-limit breach, null otherwise. */
  public String warning() {
    if (!admitted || !overLimit) {
      return null;
    }
    return "Soft WIP limit "
        + limit
        + " of "
        + column
        + " exceeded: load is now "
        + currentLoad.add(incomingWeight).toPlainString();
  }
}
