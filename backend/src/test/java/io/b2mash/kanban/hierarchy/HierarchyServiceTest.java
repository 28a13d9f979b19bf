package io.b2mash.kanban.hierarchy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.kanban.audit.AuditService;
import io.b2mash.kanban.backlog.BacklogItem;
import io.b2mash.kanban.backlog.BacklogItemRepository;
import io.b2mash.kanban.exception.CrossProjectReferenceException;
import io.b2mash.kanban.exception.HierarchyCycleException;
import io.b2mash.kanban.project.ProjectService;
import io.b2mash.kanban.testutil.TestEntities;
import io.b2mash.kanban.workflow.ItemStatus;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HierarchyServiceTest {

  private static final UUID PROJECT_ID = UUID.randomUUID();

  @Mock private BacklogItemRepository backlogItemRepository;
  @Mock private ProjectService projectService;
  @Mock private AuditService auditService;
  @InjectMocks private HierarchyService service;

  private final UUID idA = UUID.randomUUID();
  private final UUID idB = UUID.randomUUID();
  private final UUID idC = UUID.randomUUID();

  @Test
  void reparent_under_own_descendant_is_a_cycle_and_writes_nothing() {
    var a = TestEntities.item(idA, PROJECT_ID, ItemStatus.BACKLOG, 1);
    var b = TestEntities.child(idB, PROJECT_ID, idA);
    when(backlogItemRepository.findById(idA)).thenReturn(Optional.of(a));
    when(backlogItemRepository.findById(idB)).thenReturn(Optional.of(b));
    when(backlogItemRepository.findParentIdById(idB)).thenReturn(Optional.of(idA));

    assertThatThrownBy(() -> service.reparent(idA, idB, null))
        .isInstanceOf(HierarchyCycleException.class);
    assertThat(a.getParentId()).isNull();
    verify(backlogItemRepository, never()).save(any());
    verify(projectService).lockHierarchy(PROJECT_ID);
  }

  @Test
  void deep_descendant_is_found_by_the_ancestor_walk() {
    var a = TestEntities.item(idA, PROJECT_ID, ItemStatus.BACKLOG, 1);
    var c = TestEntities.child(idC, PROJECT_ID, idB);
    when(backlogItemRepository.findById(idA)).thenReturn(Optional.of(a));
    when(backlogItemRepository.findById(idC)).thenReturn(Optional.of(c));
    when(backlogItemRepository.findParentIdById(idC)).thenReturn(Optional.of(idB));
    when(backlogItemRepository.findParentIdById(idB)).thenReturn(Optional.of(idA));

    assertThatThrownBy(() -> service.reparent(idA, idC, null))
        .isInstanceOf(HierarchyCycleException.class);
  }

  @Test
  void item_cannot_be_its_own_parent() {
    var a = TestEntities.item(idA, PROJECT_ID, ItemStatus.BACKLOG, 1);
    when(backlogItemRepository.findById(idA)).thenReturn(Optional.of(a));

    assertThatThrownBy(() -> service.reparent(idA, idA, null))
        .isInstanceOf(HierarchyCycleException.class);
  }

  @Test
  void parent_from_another_project_is_rejected() {
    var a = TestEntities.item(idA, PROJECT_ID, ItemStatus.BACKLOG, 1);
    var foreign = TestEntities.item(idB, UUID.randomUUID(), ItemStatus.BACKLOG, 1);
    when(backlogItemRepository.findById(idA)).thenReturn(Optional.of(a));
    when(backlogItemRepository.findById(idB)).thenReturn(Optional.of(foreign));

    assertThatThrownBy(() -> service.reparent(idA, idB, null))
        .isInstanceOf(CrossProjectReferenceException.class);
    verify(backlogItemRepository, never()).save(any());
  }

  @Test
  void valid_reparent_is_saved_and_audited() {
    var a = TestEntities.item(idA, PROJECT_ID, ItemStatus.TODO, 1);
    var b = TestEntities.item(idB, PROJECT_ID, ItemStatus.BACKLOG, 1);
    when(backlogItemRepository.findById(idA)).thenReturn(Optional.of(a));
    when(backlogItemRepository.findById(idB)).thenReturn(Optional.of(b));
    when(backlogItemRepository.findParentIdById(idB)).thenReturn(Optional.empty());
    when(backlogItemRepository.save(a)).thenReturn(a);

    var result = service.reparent(idA, idB, null);

    assertThat(result.getParentId()).isEqualTo(idB);
    verify(auditService)
        .log(argThat(record -> record.eventType().equals("backlog_item.reparented")));
  }

  @Test
  void detaching_makes_the_item_a_root() {
    var b = TestEntities.child(idB, PROJECT_ID, idA);
    when(backlogItemRepository.findById(idB)).thenReturn(Optional.of(b));
    when(backlogItemRepository.save(b)).thenReturn(b);

    assertThat(service.reparent(idB, null, null).getParentId()).isNull();
  }

  @Test
  void descendants_are_depth_first_lazy_and_restartable() {
    var c1 = TestEntities.child(UUID.randomUUID(), PROJECT_ID, idA);
    var c2 = TestEntities.child(UUID.randomUUID(), PROJECT_ID, idA);
    var g1 = TestEntities.child(UUID.randomUUID(), PROJECT_ID, c1.getId());
    when(backlogItemRepository.existsById(idA)).thenReturn(true);
    stubChildren(Map.of(idA, List.of(c1, c2), c1.getId(), List.of(g1)));

    var descendants = service.getDescendants(idA);
    verify(backlogItemRepository, never()).findChildren(any());

    assertThat(descendants).containsExactly(c1, g1, c2);
    assertThat(descendants).containsExactly(c1, g1, c2);
    verify(backlogItemRepository, times(2)).findChildren(idA);
  }

  @Test
  void subtree_lists_every_item_after_its_descendants() {
    var root = TestEntities.item(idA, PROJECT_ID, ItemStatus.BACKLOG, 1);
    var c1 = TestEntities.child(UUID.randomUUID(), PROJECT_ID, idA);
    var c2 = TestEntities.child(UUID.randomUUID(), PROJECT_ID, idA);
    var g1 = TestEntities.child(UUID.randomUUID(), PROJECT_ID, c1.getId());
    stubChildren(Map.of(idA, List.of(c1, c2), c1.getId(), List.of(g1)));

    List<BacklogItem> order = new ArrayList<>(service.collectSubtreeLeavesFirst(root));

    assertThat(order).containsExactlyInAnyOrder(root, c1, c2, g1);
    assertThat(order.indexOf(g1)).isLessThan(order.indexOf(c1));
    assertThat(order.indexOf(c1)).isLessThan(order.indexOf(root));
    assertThat(order.indexOf(c2)).isLessThan(order.indexOf(root));
    assertThat(order.get(order.size() - 1)).isSameAs(root);
  }

  private void stubChildren(Map<UUID, List<BacklogItem>> childrenByParent) {
    when(backlogItemRepository.findChildren(any()))
        .thenAnswer(inv -> childrenByParent.getOrDefault(inv.getArgument(0), List.of()));
  }
}
