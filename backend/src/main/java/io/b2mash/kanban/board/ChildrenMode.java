package io.b2mash.kanban.board;

/** How much of each card's hierarchy the board attaches. */
public enum ChildrenMode {
  /** Direct children only. */
  DIRECT,
  /** The full subtree, cut off at the configured maximum depth. */
  SUBTREE
}
