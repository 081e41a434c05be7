package com.flamingo.ai.epubcfi.service.cfi.resolve;

/**
 * CFI index of a node among its siblings.
 *
 * @param nodeIndex index counted the CFI way
 * @param offset offset into the merged text run for text nodes, the supplied offset for {@code
 *     img} elements, otherwise {@code null}
 */
public record SiblingIndex(int nodeIndex, Integer offset) {}
