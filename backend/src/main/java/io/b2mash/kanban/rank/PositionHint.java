package io.b2mash.kanban.rank;

import java.util.UUID;

/**
 * Where an item should land in its column. {@code AFTER} names the item it should follow;
 * {@code AT_RANK} asks for an exact rank, which is honoured when free and otherwise resolved to
 * the slot right after the item holding it.
 */
public record PositionHint(Placement placement, UUID afterItemId, Long rank) {

  public enum Placement {
    TOP,
    BOTTOM,
    AFTER,
    AT_RANK
  }

  public static PositionHint top() {
    return new PositionHint(Placement.TOP, null, null);
  }

  public static PositionHint bottom() {
    return new PositionHint(Placement.BOTTOM, null, null);
  }

  public static PositionHint after(UUID itemId) {
    return new PositionHint(Placement.AFTER, itemId, null);
  }

  public static PositionHint atRank(long rank) {
    return new PositionHint(Placement.AT_RANK, null, rank);
  }

  /** {@code after(id)} when an anchor is given, otherwise the top of the column. */
  public static PositionHint afterOrTop(UUID afterItemId) {
    return afterItemId != null ? after(afterItemId) : top();
  }
}
