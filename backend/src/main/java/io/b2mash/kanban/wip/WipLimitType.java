package io.b2mash.kanban.wip;

/** HARD limits refuse admission; SOFT limits admit and flag the overrun. */
public enum WipLimitType {
  HARD,
  SOFT
}
