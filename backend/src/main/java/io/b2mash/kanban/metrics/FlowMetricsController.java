package io.b2mash.kanban.metrics;

import io.b2mash.kanban.metrics.FlowMetricsService.ItemFlowMetrics;
import io.b2mash.kanban.metrics.FlowMetricsService.ProjectFlowMetrics;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class FlowMetricsController {

  private final FlowMetricsService flowMetricsService;

  public FlowMetricsController(FlowMetricsService flowMetricsService) {
    this.flowMetricsService = flowMetricsService;
  }

  @GetMapping("/api/projects/{projectId}/flow-metrics")
  public ResponseEntity<ProjectFlowMetrics> getProjectMetrics(@PathVariable UUID projectId) {
    return ResponseEntity.ok(flowMetricsService.getProjectMetrics(projectId));
  }

  @GetMapping("/api/items/{itemId}/flow-metrics")
  public ResponseEntity<ItemFlowMetrics> getItemMetrics(@PathVariable UUID itemId) {
    return ResponseEntity.ok(flowMetricsService.getItemMetrics(itemId));
  }
}
