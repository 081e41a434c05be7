package com.flamingo.ai.epubcfi.service.cfi.tree.dom;

import com.flamingo.ai.epubcfi.exception.CfiResolutionException;
import com.flamingo.ai.epubcfi.service.cfi.tree.TreeNode;
import com.flamingo.ai.epubcfi.service.cfi.tree.TreeRange;
import org.w3c.dom.DOMException;
import org.w3c.dom.ranges.Range;
import org.w3c.dom.ranges.RangeException;

/** {@link TreeRange} backed by a DOM Level 2 {@link Range}. */
public final class DomTreeRange implements TreeRange {

  private final Range range;

  DomTreeRange(Range range) {
    this.range = range;
  }

  /** The underlying DOM range. */
  public Range unwrap() {
    return range;
  }

  @Override
  public void setStart(TreeNode node, int offset) {
    apply(() -> range.setStart(DomTreeNode.unwrap(node), offset), node);
  }

  @Override
  public void setStartBefore(TreeNode node) {
    apply(() -> range.setStartBefore(DomTreeNode.unwrap(node)), node);
  }

  @Override
  public void setStartAfter(TreeNode node) {
    apply(() -> range.setStartAfter(DomTreeNode.unwrap(node)), node);
  }

  @Override
  public void setEnd(TreeNode node, int offset) {
    apply(() -> range.setEnd(DomTreeNode.unwrap(node), offset), node);
  }

  @Override
  public void setEndBefore(TreeNode node) {
    apply(() -> range.setEndBefore(DomTreeNode.unwrap(node)), node);
  }

  @Override
  public void setEndAfter(TreeNode node) {
    apply(() -> range.setEndAfter(DomTreeNode.unwrap(node)), node);
  }

  @Override
  public String text() {
    return range.toString();
  }

  private static void apply(Runnable boundary, TreeNode node) {
    try {
      boundary.run();
    } catch (DOMException | RangeException e) {
      throw new CfiResolutionException("Cannot place range boundary at " + node, e);
    }
  }
}
