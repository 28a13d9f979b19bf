package io.b2mash.kanban.rank;

import java.util.OptionalLong;

/**
 * Arithmetic of the rank key space. Ranks are signed longs spaced {@link #STEP} apart after a
 * rebalance, which leaves about twenty halvings between any two neighbours before a column has to
 * be renumbered. An empty result means the gap is exhausted and the column must be rebalanced.
 */
public final class RankSpace {

  public static final long STEP = 1L << 20;

  /** Ranks stay within {@code [-BOUND, BOUND]} so that neighbour arithmetic cannot overflow. */
  public static final long BOUND = 1L << 62;

  private RankSpace() {}

  /** Rank for the first item of an empty column. */
  public static long initial() {
    return STEP;
  }

  public static OptionalLong before(long first) {
    return first - STEP < -BOUND ? OptionalLong.empty() : OptionalLong.of(first - STEP);
  }

  public static OptionalLong after(long last) {
    return last + STEP > BOUND ? OptionalLong.empty() : OptionalLong.of(last + STEP);
  }

  /** Midpoint of two neighbours, {@code lower < upper}. */
  public static OptionalLong between(long lower, long upper) {
    if (upper - lower < 2) {
      return OptionalLong.empty();
    }
    return OptionalLong.of(lower + (upper - lower) / 2);
  }

  /** Rank of the item at {@code index} after a rebalance. */
  public static long evenlySpaced(int index) {
    return (index + 1L) * STEP;
  }

  public static boolean inBounds(long rank) {
    return rank >= -BOUND && rank <= BOUND;
  }
}
