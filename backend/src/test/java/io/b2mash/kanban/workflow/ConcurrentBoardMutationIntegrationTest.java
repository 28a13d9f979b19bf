package io.b2mash.kanban.workflow;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.kanban.TestcontainersConfiguration;
import io.b2mash.kanban.backlog.BacklogItem;
import io.b2mash.kanban.backlog.BacklogItemRepository;
import io.b2mash.kanban.backlog.BacklogItemService;
import io.b2mash.kanban.backlog.ItemDetails;
import io.b2mash.kanban.board.BoardService;
import io.b2mash.kanban.board.ChildrenMode;
import io.b2mash.kanban.board.KanbanBoard;
import io.b2mash.kanban.exception.HierarchyCycleException;
import io.b2mash.kanban.exception.WipLimitExceededException;
import io.b2mash.kanban.hierarchy.HierarchyService;
import io.b2mash.kanban.project.ProjectService;
import io.b2mash.kanban.project.WipPolicy;
import io.b2mash.kanban.rank.PositionHint;
import io.b2mash.kanban.wip.WipAdmissionService;
import io.b2mash.kanban.wip.WipLimitType;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class ConcurrentBoardMutationIntegrationTest {

  @Autowired private ProjectService projectService;
  @Autowired private BacklogItemService backlogItemService;
  @Autowired private BacklogItemRepository backlogItemRepository;
  @Autowired private WorkflowService workflowService;
  @Autowired private WipAdmissionService wipAdmissionService;
  @Autowired private HierarchyService hierarchyService;
  @Autowired private BoardService boardService;

  @Test
  void parallelTransitionsNeverOverfillAHardLimit() throws Exception {
    var projectId = projectService.createProject("Race WIP", WipPolicy.ITEM_COUNT).getId();
    wipAdmissionService.setWipLimit(projectId, ItemStatus.DOING, 2, WipLimitType.HARD);
    var items = new ArrayList<UUID>();
    for (int i = 0; i < 6; i++) {
      var id = createItem(projectId, "Racer " + i, null);
      workflowService.transition(id, ItemStatus.TODO, null, null);
      items.add(id);
    }

    var results = new ConcurrentLinkedQueue<UUID>();
    var errors =
        runConcurrently(
            items.stream()
                .<Callable<Void>>map(
                    id ->
                        () -> {
                          workflowService.transition(id, ItemStatus.DOING, null, null);
                          results.add(id);
                          return null;
                        })
                .toList());

    assertThat(results).hasSize(2);
    assertThat(errors).hasSize(4).allMatch(e -> e instanceof WipLimitExceededException);
    var project = projectService.getProject(projectId);
    assertThat(wipAdmissionService.currentLoad(project, ItemStatus.DOING, null))
        .isEqualByComparingTo("2");

    var doing = boardService.getBoard(projectId, ChildrenMode.DIRECT).columns().get(2);
    assertThat(doing.items())
        .extracting(KanbanBoard.Card::id)
        .containsExactlyInAnyOrderElementsOf(results);
  }

  @Test
  void opposingReparentsCannotFormACycle() throws Exception {
    var projectId = projectService.createProject("Race cycle", WipPolicy.ITEM_COUNT).getId();
    var a = createItem(projectId, "A", null);
    var b = createItem(projectId, "B", null);

    var errors =
        runConcurrently(
            List.of(
                () -> {
                  hierarchyService.reparent(a, b, null);
                  return null;
                },
                () -> {
                  hierarchyService.reparent(b, a, null);
                  return null;
                }));

    assertThat(errors).hasSize(1).allMatch(e -> e instanceof HierarchyCycleException);
    var parentOfA = backlogItemRepository.findById(a).map(BacklogItem::getParentId).orElse(null);
    var parentOfB = backlogItemRepository.findById(b).map(BacklogItem::getParentId).orElse(null);
    assertThat(parentOfA == null || parentOfB == null).isTrue();
    assertThat(parentOfA != null || parentOfB != null).isTrue();
  }

  @Test
  void concurrentCreatesGetDistinctRanks() throws Exception {
    var projectId = projectService.createProject("Race create", WipPolicy.ITEM_COUNT).getId();
    var parent = createItem(projectId, "Parent", null);

    var tasks = new ArrayList<Callable<Void>>();
    for (int i = 0; i < 8; i++) {
      var title = "Item " + i;
      var parentId = i % 2 == 0 ? parent : null;
      tasks.add(
          () -> {
            createItem(projectId, title, parentId);
            return null;
          });
    }
    var errors = runConcurrently(tasks);

    assertThat(errors).isEmpty();
    var backlog = backlogItemRepository.findByProjectId(projectId);
    assertThat(backlog).hasSize(9);
    assertThat(new HashSet<>(backlog.stream().map(BacklogItem::getRank).toList())).hasSize(9);
  }

  @Test
  void boardReadDuringTransitionsShowsEachItemOnce() throws Exception {
    var projectId = projectService.createProject("Race board", WipPolicy.ITEM_COUNT).getId();
    var items = new ArrayList<UUID>();
    for (int i = 0; i < 5; i++) {
      items.add(createItem(projectId, "Mover " + i, null));
    }

    var tasks = new ArrayList<Callable<Void>>();
    for (var id : items) {
      tasks.add(
          () -> {
            workflowService.transition(id, ItemStatus.TODO, PositionHint.top(), null);
            return null;
          });
    }
    var sightings = new ConcurrentLinkedQueue<Integer>();
    for (int i = 0; i < 5; i++) {
      tasks.add(
          () -> {
            var board = boardService.getBoard(projectId, ChildrenMode.DIRECT);
            var ids = new ArrayList<UUID>();
            board.columns().forEach(c -> c.items().forEach(card -> ids.add(card.id())));
            assertThat(new HashSet<>(ids)).hasSameSizeAs(ids);
            sightings.add(ids.size());
            return null;
          });
    }
    var errors = runConcurrently(tasks);

    assertThat(errors).isEmpty();
    assertThat(sightings).hasSize(5).containsOnly(5);
  }

  // --- Helpers ---

  private UUID createItem(UUID projectId, String title, UUID parentId) {
    return backlogItemService
        .create(
            projectId,
            parentId,
            new ItemDetails(title, null, null, null, null, null, null, null, null))
        .getId();
  }

  private static List<Throwable> runConcurrently(List<Callable<Void>> tasks) throws Exception {
    var latch = new CountDownLatch(1);
    var errors = new ConcurrentLinkedQueue<Throwable>();
    var executor = Executors.newFixedThreadPool(tasks.size());

    for (var task : tasks) {
      executor.submit(
          () -> {
            try {
              latch.await();
              task.call();
            } catch (Throwable e) {
              errors.add(e);
            }
          });
    }

    // Release all threads at the same time
    latch.countDown();

    executor.shutdown();
    assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
    return new ArrayList<>(errors);
  }
}
