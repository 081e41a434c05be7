package com.flamingo.ai.epubcfi.service.cfi.resolve;

import com.flamingo.ai.epubcfi.exception.LinkNotFoundException;
import com.flamingo.ai.epubcfi.service.cfi.tree.DocumentTree;
import com.flamingo.ai.epubcfi.service.cfi.tree.TreeNode;

/** Reads the reference to the next document from the element a non-final CFI part addresses. */
public final class DocumentLinkResolver {

  private DocumentLinkResolver() {}

  /**
   * Returns the linked document's URI, as written in the document.
   *
   * <ul>
   *   <li>{@code itemref} in a {@code spine}: {@code href} of the manifest item named by {@code
   *       idref}
   *   <li>{@code iframe}, {@code embed}: {@code src}
   *   <li>{@code object}: {@code data}
   *   <li>{@code image}, {@code use}: {@code xlink:href}
   * </ul>
   *
   * @throws LinkNotFoundException if the node is not one of these or lacks the attribute
   */
  public static String linkedUri(TreeNode node, DocumentTree tree) {
    if (node == null || !node.isElement()) {
      throw new LinkNotFoundException(null, "No URI found: the CFI does not address an element");
    }
    String tagName = node.tagName();
    switch (tagName) {
      case "itemref":
        if (node.parent() != null && node.parent().hasTagName("spine")) {
          return spineHref(node, tree);
        }
        break;
      case "iframe":
      case "embed":
        return required(node, "src");
      case "object":
        return required(node, "data");
      case "image":
      case "use":
        return required(node, "xlink:href");
      default:
        break;
    }
    throw new LinkNotFoundException(tagName, "No URI found on <" + tagName + "> element");
  }

  private static String spineHref(TreeNode itemref, DocumentTree tree) {
    String idref = required(itemref, "idref");
    TreeNode item =
        tree.elementById(idref)
            .orElseThrow(
                () ->
                    new LinkNotFoundException(
                        "itemref", "Manifest item '" + idref + "' is missing from the package"));
    String href = item.attribute("href");
    if (href == null || href.isEmpty()) {
      throw new LinkNotFoundException(
          item.tagName(), "Manifest item '" + idref + "' is missing href attribute");
    }
    return href;
  }

  private static String required(TreeNode element, String attribute) {
    String value = element.attribute(attribute);
    if (value == null || value.isEmpty()) {
      throw new LinkNotFoundException(
          element.tagName(),
          element.tagName() + " element is missing '" + attribute + "' attribute");
    }
    return value;
  }
}
