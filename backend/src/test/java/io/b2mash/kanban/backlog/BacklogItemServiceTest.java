package io.b2mash.kanban.backlog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.kanban.audit.AuditEventRecord;
import io.b2mash.kanban.audit.AuditService;
import io.b2mash.kanban.exception.HasChildrenException;
import io.b2mash.kanban.exception.ValidationException;
import io.b2mash.kanban.exception.WipLimitExceededException;
import io.b2mash.kanban.hierarchy.DeletionPolicy;
import io.b2mash.kanban.hierarchy.HierarchyService;
import io.b2mash.kanban.project.ProjectRepository;
import io.b2mash.kanban.project.ProjectService;
import io.b2mash.kanban.project.WipPolicy;
import io.b2mash.kanban.rank.PositionHint;
import io.b2mash.kanban.rank.RankSequencer;
import io.b2mash.kanban.testutil.TestEntities;
import io.b2mash.kanban.wip.WipAdmissionService;
import io.b2mash.kanban.workflow.ItemStatus;
import io.b2mash.kanban.workflow.StatusChangeRepository;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BacklogItemServiceTest {

  private static final UUID PROJECT_ID = UUID.randomUUID();

  @Mock private BacklogItemRepository backlogItemRepository;
  @Mock private ProjectRepository projectRepository;
  @Mock private ProjectService projectService;
  @Mock private HierarchyService hierarchyService;
  @Mock private WipAdmissionService wipAdmissionService;
  @Mock private RankSequencer rankSequencer;
  @Mock private StatusChangeRepository statusChangeRepository;
  @Mock private AuditService auditService;
  @InjectMocks private BacklogItemService service;

  @Captor private ArgumentCaptor<AuditEventRecord> auditCaptor;

  private final UUID parentId = UUID.randomUUID();

  private static ItemDetails titled(String title) {
    return new ItemDetails(title, null, null, null, null, null, null, null, null);
  }

  private static ItemDetails points(int storyPoints) {
    return new ItemDetails(null, null, null, null, null, null, storyPoints, null, null);
  }

  @Test
  void create_places_the_item_at_the_bottom_of_backlog() {
    var project = TestEntities.project(PROJECT_ID, WipPolicy.ITEM_COUNT);
    when(projectService.lockHierarchy(PROJECT_ID)).thenReturn(project);
    when(rankSequencer.assignRank(PROJECT_ID, ItemStatus.BACKLOG, PositionHint.bottom(), null))
        .thenReturn(3L << 20);
    when(backlogItemRepository.save(any(BacklogItem.class)))
        .thenAnswer(inv -> TestEntities.setField(inv.getArgument(0), "id", UUID.randomUUID()));

    var item = service.create(PROJECT_ID, null, titled("Login page"));

    assertThat(item.getStatus()).isEqualTo(ItemStatus.BACKLOG);
    assertThat(item.getRank()).isEqualTo(3L << 20);
    var order = inOrder(projectService, wipAdmissionService, rankSequencer);
    order.verify(projectService).lockHierarchy(PROJECT_ID);
    order.verify(wipAdmissionService).lockColumn(PROJECT_ID, ItemStatus.BACKLOG);
    order
        .verify(rankSequencer)
        .assignRank(PROJECT_ID, ItemStatus.BACKLOG, PositionHint.bottom(), null);
  }

  @Test
  void create_without_title_is_rejected_before_any_write() {
    assertThatThrownBy(() -> service.create(PROJECT_ID, null, titled("  ")))
        .isInstanceOf(ValidationException.class);
    verifyNoInteractions(projectService, backlogItemRepository, rankSequencer);
  }

  @Test
  void create_with_negative_points_is_rejected() {
    var details = new ItemDetails("Title", null, null, null, null, null, -1, null, null);

    assertThatThrownBy(() -> service.create(PROJECT_ID, null, details))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void heavier_item_in_a_constrained_column_must_pass_admission() {
    var item = TestEntities.item(UUID.randomUUID(), PROJECT_ID, ItemStatus.DOING, 1);
    var project = TestEntities.project(PROJECT_ID, WipPolicy.STORY_POINTS);
    when(backlogItemRepository.findById(item.getId())).thenReturn(Optional.of(item));
    when(projectRepository.findById(PROJECT_ID)).thenReturn(Optional.of(project));
    when(wipAdmissionService.admit(project, ItemStatus.DOING, item))
        .thenThrow(
            new WipLimitExceededException(
                PROJECT_ID, ItemStatus.DOING, BigDecimal.valueOf(4), BigDecimal.valueOf(8), 10));

    assertThatThrownBy(() -> service.update(item.getId(), points(8), null, null))
        .isInstanceOf(WipLimitExceededException.class);
    verify(backlogItemRepository, never()).save(any());
  }

  @Test
  void lighter_item_skips_admission() {
    var item = TestEntities.item(UUID.randomUUID(), PROJECT_ID, ItemStatus.DOING, 1);
    TestEntities.setField(item, "storyPoint", 5);
    var project = TestEntities.project(PROJECT_ID, WipPolicy.STORY_POINTS);
    when(backlogItemRepository.findById(item.getId())).thenReturn(Optional.of(item));
    when(projectRepository.findById(PROJECT_ID)).thenReturn(Optional.of(project));
    when(backlogItemRepository.save(item)).thenReturn(item);

    var updated = service.update(item.getId(), points(2), null, null);

    assertThat(updated.getStoryPoint()).isEqualTo(2);
    verifyNoInteractions(wipAdmissionService);
  }

  @Test
  void unassigning_clears_the_assignee_and_is_audited() {
    var item = TestEntities.item(UUID.randomUUID(), PROJECT_ID, ItemStatus.TODO, 1);
    TestEntities.setField(item, "assigneeId", UUID.randomUUID());
    var project = TestEntities.project(PROJECT_ID, WipPolicy.ITEM_COUNT);
    when(backlogItemRepository.findById(item.getId())).thenReturn(Optional.of(item));
    when(projectRepository.findById(PROJECT_ID)).thenReturn(Optional.of(project));
    when(backlogItemRepository.save(item)).thenReturn(item);

    var updated = service.update(item.getId(), titled(null), Set.of(ItemField.ASSIGNEE_ID), null);

    assertThat(updated.getAssigneeId()).isNull();
    verify(auditService).log(auditCaptor.capture());
    assertThat(auditCaptor.getValue().details()).containsKey("assignee_id");
    verifyNoInteractions(wipAdmissionService);
  }

  @Test
  void clearing_a_size_that_lowers_the_weight_skips_admission() {
    var item = TestEntities.item(UUID.randomUUID(), PROJECT_ID, ItemStatus.DOING, 1);
    TestEntities.setField(item, "storyPoint", 8);
    var project = TestEntities.project(PROJECT_ID, WipPolicy.STORY_POINTS);
    when(backlogItemRepository.findById(item.getId())).thenReturn(Optional.of(item));
    when(projectRepository.findById(PROJECT_ID)).thenReturn(Optional.of(project));
    when(backlogItemRepository.save(item)).thenReturn(item);

    var updated =
        service.update(item.getId(), titled(null), Set.of(ItemField.STORY_POINT), null);

    assertThat(updated.getStoryPoint()).isNull();
    verifyNoInteractions(wipAdmissionService);
  }

  @Test
  void clearing_a_zero_size_makes_the_item_heavier_and_needs_admission() {
    var item = TestEntities.item(UUID.randomUUID(), PROJECT_ID, ItemStatus.DOING, 1);
    TestEntities.setField(item, "storyPoint", 0);
    var project = TestEntities.project(PROJECT_ID, WipPolicy.STORY_POINTS);
    when(backlogItemRepository.findById(item.getId())).thenReturn(Optional.of(item));
    when(projectRepository.findById(PROJECT_ID)).thenReturn(Optional.of(project));
    when(wipAdmissionService.admit(project, ItemStatus.DOING, item))
        .thenThrow(
            new WipLimitExceededException(
                PROJECT_ID, ItemStatus.DOING, BigDecimal.valueOf(3), BigDecimal.ONE, 3));

    assertThatThrownBy(
            () -> service.update(item.getId(), titled(null), Set.of(ItemField.STORY_POINT), null))
        .isInstanceOf(WipLimitExceededException.class);
    verify(backlogItemRepository, never()).save(any());
  }

  @Test
  void setting_and_clearing_the_same_field_is_rejected() {
    var patch = new ItemDetails(null, null, null, null, UUID.randomUUID(), null, null, null, null);

    assertThatThrownBy(
            () -> service.update(UUID.randomUUID(), patch, Set.of(ItemField.ASSIGNEE_ID), null))
        .isInstanceOf(ValidationException.class);
    verifyNoInteractions(backlogItemRepository);
  }

  @Test
  void resuming_in_a_constrained_column_passes_admission_first() {
    var item = TestEntities.item(UUID.randomUUID(), PROJECT_ID, ItemStatus.TODO, 1);
    item.pause();
    var project = TestEntities.project(PROJECT_ID, WipPolicy.ITEM_COUNT);
    when(backlogItemRepository.findById(item.getId())).thenReturn(Optional.of(item));
    when(projectRepository.findById(PROJECT_ID)).thenReturn(Optional.of(project));
    when(wipAdmissionService.admitWeight(
            project, ItemStatus.TODO, BigDecimal.ONE, item.getId()))
        .thenThrow(
            new WipLimitExceededException(
                PROJECT_ID, ItemStatus.TODO, BigDecimal.ONE, BigDecimal.ONE, 1));

    assertThatThrownBy(() -> service.setPaused(item.getId(), false, null))
        .isInstanceOf(WipLimitExceededException.class);
    assertThat(item.isPaused()).isTrue();
  }

  @Test
  void pausing_never_needs_admission() {
    var item = TestEntities.item(UUID.randomUUID(), PROJECT_ID, ItemStatus.DOING, 1);
    when(backlogItemRepository.findById(item.getId())).thenReturn(Optional.of(item));
    when(backlogItemRepository.save(item)).thenReturn(item);

    assertThat(service.setPaused(item.getId(), true, null).isPaused()).isTrue();
    verifyNoInteractions(wipAdmissionService);
  }

  @Test
  void delete_with_children_and_no_policy_is_refused() {
    var parent = TestEntities.item(parentId, PROJECT_ID, ItemStatus.BACKLOG, 1);
    var child = TestEntities.child(UUID.randomUUID(), PROJECT_ID, parentId);
    when(backlogItemRepository.findById(parentId)).thenReturn(Optional.of(parent));
    when(backlogItemRepository.findChildren(parentId)).thenReturn(List.of(child));

    assertThatThrownBy(() -> service.delete(parentId, null, null))
        .isInstanceOf(HasChildrenException.class);
    verify(backlogItemRepository, never()).delete(any());
    assertThat(child.getParentId()).isEqualTo(parentId);
  }

  @Test
  void detach_children_turns_them_into_roots() {
    var parent = TestEntities.item(parentId, PROJECT_ID, ItemStatus.BACKLOG, 1);
    var child = TestEntities.child(UUID.randomUUID(), PROJECT_ID, parentId);
    when(backlogItemRepository.findById(parentId)).thenReturn(Optional.of(parent));
    when(backlogItemRepository.findChildren(parentId)).thenReturn(List.of(child));

    var deleted = service.delete(parentId, DeletionPolicy.DETACH_CHILDREN, null);

    assertThat(deleted).containsExactly(parentId);
    assertThat(child.getParentId()).isNull();
    verify(backlogItemRepository).delete(parent);
    verify(backlogItemRepository, never()).delete(child);
  }

  @Test
  void cascade_delete_removes_leaves_before_their_parents() {
    var parent = TestEntities.item(parentId, PROJECT_ID, ItemStatus.BACKLOG, 1);
    var child = TestEntities.child(UUID.randomUUID(), PROJECT_ID, parentId);
    when(backlogItemRepository.findById(parentId)).thenReturn(Optional.of(parent));
    when(backlogItemRepository.findChildren(parentId)).thenReturn(List.of(child));
    when(hierarchyService.collectSubtreeLeavesFirst(parent)).thenReturn(List.of(child, parent));

    var deleted = service.delete(parentId, DeletionPolicy.CASCADE_DELETE, null);

    assertThat(deleted).containsExactly(child.getId(), parentId);
    var order = inOrder(backlogItemRepository);
    order.verify(backlogItemRepository).delete(child);
    order.verify(backlogItemRepository).delete(parent);
    verify(statusChangeRepository).deleteByItemId(eq(child.getId()));
  }

  @Test
  void leaf_deletes_without_a_policy() {
    var leaf = TestEntities.item(parentId, PROJECT_ID, ItemStatus.DONE, 1);
    when(backlogItemRepository.findById(parentId)).thenReturn(Optional.of(leaf));
    when(backlogItemRepository.findChildren(parentId)).thenReturn(List.of());

    assertThat(service.delete(parentId, null, null)).containsExactly(parentId);
    verify(backlogItemRepository).delete(leaf);
  }
}
