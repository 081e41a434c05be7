package com.flamingo.ai.epubcfi.service.cfi.generate;

import com.flamingo.ai.epubcfi.exception.CfiResolutionException;
import com.flamingo.ai.epubcfi.service.cfi.model.NodeOffset;
import com.flamingo.ai.epubcfi.service.cfi.parsing.CfiEscaper;
import com.flamingo.ai.epubcfi.service.cfi.resolve.SiblingIndex;
import com.flamingo.ai.epubcfi.service.cfi.resolve.SiblingIndexer;
import com.flamingo.ai.epubcfi.service.cfi.tree.TreeNode;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds CFI strings from tree nodes.
 *
 * <p>Paths are written relative to the document's root element, which is also where resolution
 * starts. Spine children are addressed relative to their {@code package} element.
 */
public final class CfiGenerator {

  private CfiGenerator() {}

  /** {@code epubcfi(...)} for a single node, with an optional offset. */
  public static String generate(TreeNode node, Integer offset) {
    return wrap(generatePart(node, offset));
  }

  /** {@code epubcfi(...)} with one {@code !}-separated part per node, outermost document first. */
  public static String generate(List<NodeOffset> nodes) {
    if (nodes == null || nodes.isEmpty()) {
      throw new IllegalArgumentException("At least one node is required");
    }
    return wrap(
        nodes.stream()
            .map(n -> generatePart(n.node(), n.offset()))
            .collect(Collectors.joining("!")));
  }

  /**
   * The steps leading from the root element (or {@code package}) to {@code node}.
   *
   * @param node text node or element below the root element
   * @param offset character offset for text nodes and {@code img} elements, or {@code null}
   */
  public static String generatePart(TreeNode node, Integer offset) {
    Objects.requireNonNull(node, "node");
    if (node.parent() == null) {
      throw new CfiResolutionException(
          "The root element cannot be addressed by a CFI step",
          "The node cannot be addressed by a CFI");
    }
    boolean spineChild = node.parent().hasTagName("spine");

    StringBuilder cfi = new StringBuilder();
    TreeNode current = node;
    boolean innermost = true;
    while (current.parent() != null) {
      TreeNode parent = current.parent();
      SiblingIndex index =
          SiblingIndexer.indexOf(parent.children(), current, innermost ? offset : null);
      StringBuilder step = new StringBuilder().append('/').append(index.nodeIndex());
      String id = current.isElement() ? current.id() : null;
      if (id != null && !id.isEmpty()) {
        step.append('[').append(CfiEscaper.escape(id)).append(']');
      }
      if (innermost && index.offset() != null) {
        step.append(':').append(index.offset());
      }
      cfi.insert(0, step);
      innermost = false;
      current = parent;
      if (spineChild && current.hasTagName("package")) {
        break;
      }
    }
    return cfi.toString();
  }

  private static String wrap(String path) {
    return "epubcfi(" + path + ")";
  }
}
