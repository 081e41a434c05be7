package com.flamingo.ai.epubcfi.service.cfi.model;

import com.flamingo.ai.epubcfi.service.cfi.tree.TreeNode;

/**
 * A node with an optional offset, one per document when generating a multi-part CFI.
 *
 * @param node node to address
 * @param offset character offset, or {@code null}
 */
public record NodeOffset(TreeNode node, Integer offset) {

  public static NodeOffset of(TreeNode node) {
    return new NodeOffset(node, null);
  }
}
