package io.b2mash.kanban.project;

import io.b2mash.kanban.backlog.BacklogItem;
import java.math.BigDecimal;

/**
 * How much of a column's capacity an item consumes. Under a sized policy an item without a size
 * weighs the same as under {@link #ITEM_COUNT}.
 */
public enum WipPolicy {
  ITEM_COUNT,
  STORY_POINTS,
  ESTIMATE;

  public BigDecimal weightOf(BacklogItem item) {
    return switch (this) {
      case ITEM_COUNT -> BigDecimal.ONE;
      case STORY_POINTS ->
          item.getStoryPoint() != null ? BigDecimal.valueOf(item.getStoryPoint()) : BigDecimal.ONE;
      case ESTIMATE -> item.getEstimateValue() != null ? item.getEstimateValue() : BigDecimal.ONE;
    };
  }
}
