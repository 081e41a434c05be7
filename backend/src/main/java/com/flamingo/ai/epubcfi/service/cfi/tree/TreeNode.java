package com.flamingo.ai.epubcfi.service.cfi.tree;

import java.util.List;

/**
 * A node of a document tree as seen by CFI parsing and generation.
 *
 * <p>Implementations wrap the nodes of a caller-owned tree and must compare equal when they wrap
 * the same underlying node.
 */
public interface TreeNode {

  NodeKind kind();

  /**
   * Parent element.
   *
   * @return the parent, or {@code null} for the document's root element
   */
  TreeNode parent();

  /** Child nodes in document order, all kinds included. */
  List<TreeNode> children();

  TreeNode previousSibling();

  TreeNode nextSibling();

  /** Lower-cased local name for elements, {@code null} otherwise. */
  String tagName();

  /** Value of the element's id attribute, {@code null} when absent. */
  String id();

  /** Attribute value by (qualified) name, {@code null} when absent. */
  String attribute(String name);

  /** Raw character content of a text or CDATA node. */
  String textContent();

  default boolean isElement() {
    return kind() == NodeKind.ELEMENT;
  }

  default boolean isText() {
    return kind() == NodeKind.TEXT || kind() == NodeKind.CDATA_SECTION;
  }

  default boolean hasTagName(String name) {
    return isElement() && name.equals(tagName());
  }
}
