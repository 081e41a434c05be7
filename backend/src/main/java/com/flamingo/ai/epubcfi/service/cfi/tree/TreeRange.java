package com.flamingo.ai.epubcfi.service.cfi.tree;

import com.flamingo.ai.epubcfi.service.cfi.model.ResolvedTarget;

/** A native span over a {@link DocumentTree}, positioned from a resolved CFI range. */
public interface TreeRange extends ResolvedTarget {

  void setStart(TreeNode node, int offset);

  void setStartBefore(TreeNode node);

  void setStartAfter(TreeNode node);

  void setEnd(TreeNode node, int offset);

  void setEndBefore(TreeNode node);

  void setEndAfter(TreeNode node);

  /** Text covered by the range. */
  String text();

  @Override
  default boolean isRange() {
    return true;
  }
}
