package io.b2mash.kanban.hierarchy;

/** What happens to the children of a deleted item. There is no default. */
public enum DeletionPolicy {
  /** Children become roots. */
  DETACH_CHILDREN,
  /** The whole subtree is removed, leaves first. */
  CASCADE_DELETE
}
