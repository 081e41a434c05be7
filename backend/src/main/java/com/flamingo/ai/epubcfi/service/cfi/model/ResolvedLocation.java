package com.flamingo.ai.epubcfi.service.cfi.model;

import com.flamingo.ai.epubcfi.service.cfi.tree.TreeNode;
import lombok.Builder;

/**
 * A location in a live document tree, carrying the qualifiers of the step it was resolved from.
 *
 * @param node the addressed node, or the anchor of a virtual position
 * @param offset character offset into {@code node}; {@code null} when the step had no offset
 * @param relativeToNode set when the location lies before the first or after the last child
 * @param nodeId id assertion of the final step
 * @param textLocationAssertion assertion of the final step
 * @param sideBias side bias of the final step
 * @param temporal time position of the final step
 * @param spatial space position of the final step
 */
@Builder
public record ResolvedLocation(
    TreeNode node,
    Integer offset,
    RelativePosition relativeToNode,
    String nodeId,
    TextLocationAssertion textLocationAssertion,
    SideBias sideBias,
    Double temporal,
    SpatialPosition spatial)
    implements ResolvedTarget {

  @Override
  public boolean isRange() {
    return false;
  }
}
