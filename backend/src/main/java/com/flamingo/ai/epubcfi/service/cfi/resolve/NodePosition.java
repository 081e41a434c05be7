package com.flamingo.ai.epubcfi.service.cfi.resolve;

import com.flamingo.ai.epubcfi.service.cfi.model.RelativePosition;
import com.flamingo.ai.epubcfi.service.cfi.tree.TreeNode;

/**
 * Intermediate result of descending one step.
 *
 * @param node reached node, or the anchor of a virtual position
 * @param offset character offset into a text node, image offset for {@code img}, otherwise 0
 * @param relativeToNode {@code null} unless the step addressed a virtual position
 */
public record NodePosition(TreeNode node, int offset, RelativePosition relativeToNode) {

  public static NodePosition at(TreeNode node, int offset) {
    return new NodePosition(node, offset, null);
  }

  public static NodePosition before(TreeNode node) {
    return new NodePosition(node, 0, RelativePosition.BEFORE);
  }

  public static NodePosition after(TreeNode node, int offset) {
    return new NodePosition(node, offset, RelativePosition.AFTER);
  }

  public boolean isVirtual() {
    return relativeToNode != null;
  }
}
