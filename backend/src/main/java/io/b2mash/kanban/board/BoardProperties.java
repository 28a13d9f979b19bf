package io.b2mash.kanban.board;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Board assembly settings, bound from {@code kanban.board.*}.
 *
 * @param children default hierarchy attachment when a request does not ask for one
 * @param maxDepth deepest level attached in {@link ChildrenMode#SUBTREE} mode
 */
@Validated
@ConfigurationProperties(prefix = "kanban.board")
public record BoardProperties(ChildrenMode children, @Min(1) Integer maxDepth) {

  public BoardProperties {
    if (children == null) {
      children = ChildrenMode.DIRECT;
    }
    if (maxDepth == null) {
      maxDepth = 16;
    }
  }

  public int depthFor(ChildrenMode mode) {
    return mode == ChildrenMode.SUBTREE ? maxDepth : 1;
  }
}
