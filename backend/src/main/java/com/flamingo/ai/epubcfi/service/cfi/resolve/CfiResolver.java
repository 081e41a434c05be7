package com.flamingo.ai.epubcfi.service.cfi.resolve;

import com.flamingo.ai.epubcfi.exception.CfiResolutionException;
import com.flamingo.ai.epubcfi.service.cfi.model.CfiPart;
import com.flamingo.ai.epubcfi.service.cfi.model.CfiPath;
import com.flamingo.ai.epubcfi.service.cfi.model.CfiStep;
import com.flamingo.ai.epubcfi.service.cfi.model.RelativePosition;
import com.flamingo.ai.epubcfi.service.cfi.model.ResolvedLocation;
import com.flamingo.ai.epubcfi.service.cfi.model.ResolvedRange;
import com.flamingo.ai.epubcfi.service.cfi.model.ResolvedTarget;
import com.flamingo.ai.epubcfi.service.cfi.tree.DocumentTree;
import com.flamingo.ai.epubcfi.service.cfi.tree.TreeNode;
import com.flamingo.ai.epubcfi.service.cfi.tree.TreeRange;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps parsed CFI paths onto a document tree.
 *
 * <p>Each part is resolved against its own document. The first part starts at the package
 * document's {@code package} element when there is one; every other part starts at the root
 * element. Unless ids are ignored, resolution jumps to the innermost step whose id exists in the
 * document and descends by index from there.
 */
@Slf4j
public final class CfiResolver {

  private static final String PACKAGE = "package";

  private final ResolveOptions options;

  public CfiResolver(ResolveOptions options) {
    this.options = options != null ? options : ResolveOptions.DEFAULT;
  }

  /**
   * Walks the steps of one part.
   *
   * @param partIndex position of the part in its path
   * @param part the steps to follow
   * @param tree the document the part addresses
   * @return the final position
   */
  public NodePosition resolveNode(int partIndex, CfiPart part, DocumentTree tree) {
    Objects.requireNonNull(tree, "tree");
    TreeNode start = null;
    if (partIndex == 0) {
      start = tree.firstElementByTagName(PACKAGE).orElse(null);
    }
    if (start == null) {
      start = tree.rootElement();
    }
    if (start == null) {
      throw new CfiResolutionException(
          "Document is incompatible with CFIs: it has no root element",
          "The document cannot be addressed by a CFI");
    }

    List<CfiStep> steps = part.steps();
    NodePosition position = NodePosition.at(start, 0);
    int from = 0;
    if (!options.ignoreIds()) {
      for (int i = steps.size() - 1; i >= 0; i--) {
        String id = steps.get(i).nodeId();
        if (id == null) {
          continue;
        }
        Optional<TreeNode> element = tree.elementById(id);
        if (element.isPresent()) {
          log.debug("Jumping to element with id '{}' at step {}", id, i);
          from = i + 1;
          position = idPosition(element.get(), steps.get(i));
          break;
        }
      }
    }

    for (int i = from; i < steps.size(); i++) {
      CfiStep step = steps.get(i);
      position = SiblingIndexer.childAt(position.node(), step.nodeIndex(), step.offset());
      if (step.textLocationAssertion() != null) {
        position =
            TextAssertionCorrector.correct(
                tree, position, step.offset(), step.textLocationAssertion());
      }
    }
    return position;
  }

  /** Resolves the last part of {@code path} to a location carrying its final step's fields. */
  public ResolvedLocation resolveLocation(CfiPath path, DocumentTree tree) {
    int index = path.size() - 1;
    CfiPart part = path.lastPart();
    NodePosition position = resolveNode(index, part, tree);
    return toLocation(position, part.lastStep());
  }

  /**
   * Resolves both ends of a simple range.
   *
   * @return a {@link ResolvedRange}, or a positioned {@link TreeRange} with the {@code range}
   *     option
   */
  public ResolvedTarget resolveRange(CfiPath from, CfiPath to, DocumentTree tree) {
    if (!options.range()) {
      return new ResolvedRange(resolveLocation(from, tree), resolveLocation(to, tree));
    }
    NodePosition start = resolveNode(from.size() - 1, from.lastPart(), tree);
    NodePosition end = resolveNode(to.size() - 1, to.lastPart(), tree);

    TreeRange range = tree.createRange();
    if (start.relativeToNode() == RelativePosition.AFTER) {
      range.setStartAfter(start.node());
    } else if (start.relativeToNode() == RelativePosition.BEFORE || !start.node().isText()) {
      range.setStartBefore(start.node());
    } else {
      range.setStart(start.node(), start.offset());
    }
    if (end.relativeToNode() == RelativePosition.BEFORE) {
      range.setEndBefore(end.node());
    } else if (end.relativeToNode() == RelativePosition.AFTER || !end.node().isText()) {
      range.setEndAfter(end.node());
    } else {
      range.setEnd(end.node(), end.offset());
    }
    return range;
  }

  /**
   * Resolves a non-final part and reads the URI of the document the next part addresses.
   *
   * @param path the whole path
   * @param partIndex index of a part that is not the last one
   * @param tree the document the part addresses
   */
  public String resolveUri(CfiPath path, int partIndex, DocumentTree tree) {
    if (partIndex < 0 || partIndex > path.size() - 2) {
      throw new CfiResolutionException(
          "Part index " + partIndex + " is out of bounds for a CFI with " + path.size() + " parts");
    }
    NodePosition position = resolveNode(partIndex, path.part(partIndex), tree);
    return DocumentLinkResolver.linkedUri(position.node(), tree);
  }

  private static NodePosition idPosition(TreeNode element, CfiStep step) {
    if (element.hasTagName("img") && step.offset() != null && step.offset() != 0) {
      return NodePosition.at(element, step.offset());
    }
    return NodePosition.at(element, 0);
  }

  private static ResolvedLocation toLocation(NodePosition position, CfiStep step) {
    return ResolvedLocation.builder()
        .node(position.node())
        .offset(step.offset() != null ? position.offset() : null)
        .relativeToNode(position.relativeToNode())
        .nodeId(step.nodeId())
        .textLocationAssertion(step.textLocationAssertion())
        .sideBias(step.sideBias())
        .temporal(step.temporal())
        .spatial(step.spatial())
        .build();
  }
}
