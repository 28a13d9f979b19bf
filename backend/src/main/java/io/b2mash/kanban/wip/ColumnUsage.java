package io.b2mash.kanban.wip;

import io.b2mash.kanban.workflow.ItemStatus;
import java.math.BigDecimal;

/** Current load of one column against its limit. {@code available} is null when unlimited. */
public record ColumnUsage(
    ItemStatus column,
    Integer limit,
    WipLimitType limitType,
    BigDecimal currentLoad,
    BigDecimal available) {

  static ColumnUsage of(WipLimit wipLimit, BigDecimal load) {
    BigDecimal available =
        wipLimit.isUnlimited()
            ? null
            : BigDecimal.valueOf(wipLimit.getLimit()).subtract(load).max(BigDecimal.ZERO);
    return new ColumnUsage(
        wipLimit.getColumn(), wipLimit.getLimit(), wipLimit.getLimitType(), load, available);
  }
}
