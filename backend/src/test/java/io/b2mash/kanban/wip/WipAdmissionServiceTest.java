package io.b2mash.kanban.wip;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.kanban.audit.AuditService;
import io.b2mash.kanban.backlog.BacklogItemRepository;
import io.b2mash.kanban.exception.ValidationException;
import io.b2mash.kanban.exception.WipLimitExceededException;
import io.b2mash.kanban.project.ProjectRepository;
import io.b2mash.kanban.project.WipPolicy;
import io.b2mash.kanban.testutil.TestEntities;
import io.b2mash.kanban.workflow.ItemStatus;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class WipAdmissionServiceTest {

  private static final UUID PROJECT_ID = UUID.randomUUID();

  @Mock private WipLimitRepository wipLimitRepository;
  @Mock private BacklogItemRepository backlogItemRepository;
  @Mock private ProjectRepository projectRepository;
  @Mock private AuditService auditService;
  @InjectMocks private WipAdmissionService service;

  private final UUID idA = UUID.randomUUID();
  private final UUID idB = UUID.randomUUID();
  private final UUID idC = UUID.randomUUID();

  @Test
  void full_hard_column_refuses_and_reports_load_and_limit() {
    var project = TestEntities.project(PROJECT_ID, WipPolicy.ITEM_COUNT);
    var incoming = TestEntities.item(idC, PROJECT_ID, ItemStatus.TODO, 1);
    when(wipLimitRepository.findForUpdate(PROJECT_ID, ItemStatus.DOING))
        .thenReturn(
            Optional.of(TestEntities.limit(PROJECT_ID, ItemStatus.DOING, 2, WipLimitType.HARD)));
    when(backlogItemRepository.findActiveInColumn(PROJECT_ID, ItemStatus.DOING, idC))
        .thenReturn(
            List.of(
                TestEntities.item(idA, PROJECT_ID, ItemStatus.DOING, 1),
                TestEntities.item(idB, PROJECT_ID, ItemStatus.DOING, 2)));

    assertThatThrownBy(() -> service.admit(project, ItemStatus.DOING, incoming))
        .isInstanceOf(WipLimitExceededException.class)
        .satisfies(
            ex -> {
              var wip = (WipLimitExceededException) ex;
              assertThat(wip.getCurrentLoad()).isEqualByComparingTo("2");
              assertThat(wip.getLimit()).isEqualTo(2);
              assertThat(wip.getColumn()).isEqualTo(ItemStatus.DOING);
            });
  }

  @Test
  void soft_limit_admits_with_overflow_flag() {
    var project = TestEntities.project(PROJECT_ID, WipPolicy.ITEM_COUNT);
    var incoming = TestEntities.item(idC, PROJECT_ID, ItemStatus.TODO, 1);
    when(wipLimitRepository.findForUpdate(PROJECT_ID, ItemStatus.DOING))
        .thenReturn(
            Optional.of(TestEntities.limit(PROJECT_ID, ItemStatus.DOING, 1, WipLimitType.SOFT)));
    when(backlogItemRepository.findActiveInColumn(PROJECT_ID, ItemStatus.DOING, idC))
        .thenReturn(List.of(TestEntities.item(idA, PROJECT_ID, ItemStatus.DOING, 1)));

    var result = service.admit(project, ItemStatus.DOING, incoming);

    assertThat(result.admitted()).isTrue();
    assertThat(result.overLimit()).isTrue();
  }

  @Test
  void paused_item_enters_a_full_column_with_no_weight() {
    var project = TestEntities.project(PROJECT_ID, WipPolicy.ITEM_COUNT);
    var incoming = TestEntities.item(idC, PROJECT_ID, ItemStatus.TODO, 1);
    incoming.pause();
    when(wipLimitRepository.findForUpdate(PROJECT_ID, ItemStatus.DOING))
        .thenReturn(
            Optional.of(TestEntities.limit(PROJECT_ID, ItemStatus.DOING, 1, WipLimitType.HARD)));
    when(backlogItemRepository.findActiveInColumn(PROJECT_ID, ItemStatus.DOING, idC))
        .thenReturn(List.of(TestEntities.item(idA, PROJECT_ID, ItemStatus.DOING, 1)));

    var result = service.admit(project, ItemStatus.DOING, incoming);

    assertThat(result.admitted()).isTrue();
    assertThat(result.incomingWeight()).isEqualByComparingTo("0");
  }

  @Test
  void story_point_policy_sums_points() {
    var project = TestEntities.project(PROJECT_ID, WipPolicy.STORY_POINTS);
    var five = TestEntities.item(idA, PROJECT_ID, ItemStatus.DOING, 1);
    TestEntities.setField(five, "storyPoint", 5);
    var unsized = TestEntities.item(idB, PROJECT_ID, ItemStatus.DOING, 2);
    when(backlogItemRepository.findActiveInColumn(PROJECT_ID, ItemStatus.DOING, null))
        .thenReturn(List.of(five, unsized));

    assertThat(service.currentLoad(project, ItemStatus.DOING, null)).isEqualByComparingTo("6");
  }

  @Test
  void preview_takes_no_lock_and_does_not_throw() {
    var project = TestEntities.project(PROJECT_ID, WipPolicy.ITEM_COUNT);
    var item = TestEntities.item(idC, PROJECT_ID, ItemStatus.TODO, 1);
    when(backlogItemRepository.findById(idC)).thenReturn(Optional.of(item));
    when(projectRepository.findById(PROJECT_ID)).thenReturn(Optional.of(project));
    when(wipLimitRepository.findByProjectIdAndBoardColumn(PROJECT_ID, ItemStatus.DOING))
        .thenReturn(
            Optional.of(TestEntities.limit(PROJECT_ID, ItemStatus.DOING, 1, WipLimitType.HARD)));
    when(backlogItemRepository.findActiveInColumn(PROJECT_ID, ItemStatus.DOING, idC))
        .thenReturn(List.of(TestEntities.item(idA, PROJECT_ID, ItemStatus.DOING, 1)));

    var result = service.previewAdmission(idC, ItemStatus.DOING);

    assertThat(result.admitted()).isFalse();
    assertThat(result.currentLoad()).isEqualByComparingTo("1");
    verify(wipLimitRepository, never()).findForUpdate(any(), any());
  }

  @Test
  void negative_weight_is_rejected_before_any_lookup() {
    assertThatThrownBy(
            () -> service.checkAdmission(PROJECT_ID, ItemStatus.TODO, BigDecimal.valueOf(-1)))
        .isInstanceOf(ValidationException.class);
    verify(projectRepository, never()).findById(any());
  }

  @Test
  void setting_a_limit_is_audited() {
    var project = TestEntities.project(PROJECT_ID, WipPolicy.ITEM_COUNT);
    var row = TestEntities.limit(PROJECT_ID, ItemStatus.TODO, null, null);
    when(projectRepository.findById(PROJECT_ID)).thenReturn(Optional.of(project));
    when(wipLimitRepository.findForUpdate(PROJECT_ID, ItemStatus.TODO))
        .thenReturn(Optional.of(row));
    when(wipLimitRepository.save(row)).thenReturn(row);

    var saved = service.setWipLimit(PROJECT_ID, ItemStatus.TODO, 4, WipLimitType.HARD);

    assertThat(saved.getLimit()).isEqualTo(4);
    verify(auditService)
        .log(argThat(record -> record.eventType().equals("wip_limit.updated")));
  }
}
