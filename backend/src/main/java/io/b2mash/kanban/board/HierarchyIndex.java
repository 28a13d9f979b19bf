package io.b2mash.kanban.board;

import io.b2mash.kanban.backlog.BacklogItem;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Parent to children lookup over one snapshot of a project's items, so the board can attach
 * hierarchy without a query per card.
 */
final class HierarchyIndex {

  private static final Comparator<BacklogItem> CHILD_ORDER =
      Comparator.comparing(BacklogItem::getCreatedAt).thenComparing(BacklogItem::getId);

  private final Map<UUID, List<BacklogItem>> childrenByParent;

  private HierarchyIndex(Map<UUID, List<BacklogItem>> childrenByParent) {
    this.childrenByParent = childrenByParent;
  }

  static HierarchyIndex of(Collection<BacklogItem> items) {
    var byParent = new HashMap<UUID, List<BacklogItem>>();
    for (var item : items) {
      if (item.getParentId() != null) {
        byParent.computeIfAbsent(item.getParentId(), k -> new ArrayList<>()).add(item);
      }
    }
    byParent.values().forEach(children -> children.sort(CHILD_ORDER));
    return new HierarchyIndex(byParent);
  }

  List<BacklogItem> childrenOf(UUID itemId) {
    return childrenByParent.getOrDefault(itemId, List.of());
  }
}
