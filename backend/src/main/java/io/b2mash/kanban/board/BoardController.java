package io.b2mash.kanban.board;

import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class BoardController {

  private final BoardService boardService;

  public BoardController(BoardService boardService) {
    this.boardService = boardService;
  }

  @GetMapping("/api/projects/{projectId}/board")
  public ResponseEntity<KanbanBoard> getBoard(
      @PathVariable UUID projectId, @RequestParam(required = false) ChildrenMode children) {
    return ResponseEntity.ok(boardService.getBoard(projectId, children));
  }
}
