package com.flamingo.ai.epubcfi.service.cfi.tree;

import java.util.Optional;

/** A parsed document that CFIs are resolved against and generated from. */
public interface DocumentTree {

  /**
   * The document element, where resolution of a part starts.
   *
   * @return the root element, or {@code null} if the document has none
   */
  TreeNode rootElement();

  Optional<TreeNode> elementById(String id);

  /** First element in document order with the given lower-case local name. */
  Optional<TreeNode> firstElementByTagName(String tagName);

  /** Decodes markup character references ({@code &amp;}, {@code &#160;}, ...) in {@code text}. */
  String decodeEntities(String text);

  /** Creates an empty native range over this document. */
  TreeRange createRange();
}
