package com.flamingo.ai.epubcfi.service.cfi.resolve;

import com.flamingo.ai.epubcfi.exception.CfiResolutionException;
import com.flamingo.ai.epubcfi.service.cfi.tree.TreeNode;
import java.util.List;

/**
 * The CFI way of numbering child nodes, in both directions.
 *
 * <p>Elements get even indexes and the text between them odd ones. Two adjacent elements are
 * separated by an implied empty text position, so an element following an element (or starting
 * the child list) takes two slots, and one following text takes one. Adjacent text and CDATA
 * nodes share a single index; offsets run across the whole merged run. Other node kinds
 * (comments, processing instructions) are not counted.
 */
public final class SiblingIndexer {

  private SiblingIndexer() {}

  /**
   * Computes the CFI index of {@code target} among {@code children}.
   *
   * @param children all child nodes of the parent, in order
   * @param target one of {@code children}
   * @param offset offset into {@code target}, or {@code null}
   * @return index, and the offset translated to the merged text run
   * @throws CfiResolutionException if {@code target} is not among {@code children}
   */
  public static SiblingIndex indexOf(List<TreeNode> children, TreeNode target, Integer offset) {
    int count = 0;
    int runOffset = 0;
    boolean lastWasElement = false;
    boolean first = true;

    for (TreeNode child : children) {
      if (child.isElement()) {
        count += lastWasElement || first ? 2 : 1;
        first = false;
        if (child.equals(target)) {
          return new SiblingIndex(count, child.hasTagName("img") ? offset : null);
        }
        runOffset = 0;
        lastWasElement = true;
      } else if (child.isText()) {
        if (lastWasElement || first) {
          count++;
          first = false;
        }
        if (child.equals(target)) {
          return new SiblingIndex(count, offset == null ? null : offset + runOffset);
        }
        runOffset += textLength(child);
        lastWasElement = false;
      }
    }
    throw new CfiResolutionException("The specified node was not found among its siblings");
  }

  /**
   * Finds the child of {@code parent} addressed by a CFI index.
   *
   * @param parent node to descend into
   * @param index CFI index of the child
   * @param offset step offset, or {@code null}; walks across a merged text run
   * @return the child position; a virtual position for indexes outside the children
   */
  public static NodePosition childAt(TreeNode parent, int index, Integer offset) {
    List<TreeNode> children = parent.children();
    if (children.isEmpty()) {
      return NodePosition.at(parent, 0);
    }
    if (index <= 0) {
      return NodePosition.before(children.get(0));
    }

    int remaining = offset == null ? 0 : offset;
    int count = 0;
    TreeNode lastChild = null;
    for (TreeNode child : children) {
      if (child.isElement()) {
        if (count % 2 == 0) {
          count += 2;
          if (count >= index) {
            return elementPosition(child, offset);
          }
        } else {
          count++;
          if (count == index) {
            return elementPosition(child, offset);
          }
          if (count > index) {
            // the offset ran past the end of the preceding text run
            return lastChild == null
                ? NodePosition.at(parent, 0)
                : NodePosition.at(lastChild, textLength(lastChild));
          }
        }
        lastChild = child;
      } else if (child.isText()) {
        if (count % 2 == 0) {
          count++;
        }
        if (count == index) {
          int length = textLength(child);
          if (remaining >= length) {
            remaining -= length;
          } else {
            return NodePosition.at(child, remaining);
          }
        }
        lastChild = child;
      }
    }

    if (index > count) {
      TreeNode anchor = lastChild != null ? lastChild : parent;
      return NodePosition.after(anchor, anchor.isText() ? textLength(anchor) : 0);
    }
    // offset at or past the end of the last text run
    return NodePosition.at(lastChild, textLength(lastChild));
  }

  /**
   * Length of a text node's content as the tree stores it. Generation and resolution both count
   * with this, so offsets agree whatever references the markup used.
   */
  public static int textLength(TreeNode node) {
    String text = node.textContent();
    return text == null ? 0 : text.length();
  }

  private static NodePosition elementPosition(TreeNode element, Integer offset) {
    if (element.hasTagName("img") && offset != null && offset != 0) {
      return NodePosition.at(element, offset);
    }
    return NodePosition.at(element, 0);
  }
}
