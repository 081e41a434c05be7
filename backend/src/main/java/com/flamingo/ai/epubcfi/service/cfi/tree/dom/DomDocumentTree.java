package com.flamingo.ai.epubcfi.service.cfi.tree.dom;

import com.flamingo.ai.epubcfi.exception.CfiResolutionException;
import com.flamingo.ai.epubcfi.service.cfi.tree.DocumentTree;
import com.flamingo.ai.epubcfi.service.cfi.tree.TreeNode;
import com.flamingo.ai.epubcfi.service.cfi.tree.TreeRange;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Optional;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.jsoup.parser.Parser;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.w3c.dom.ranges.DocumentRange;
import org.xml.sax.SAXException;

/**
 * {@link DocumentTree} over a W3C DOM {@link Document}, such as one produced by the JDK's {@code
 * DocumentBuilderFactory}.
 *
 * <p>Ids are looked up through the attributes themselves ({@code id}, then {@code xml:id}) because
 * a non-validating parse does not mark them as ID-typed. Nothing is cached, so the adapter sees
 * later edits of the wrapped document.
 */
public final class DomDocumentTree implements DocumentTree {

  static final String XML_NS = "http://www.w3.org/XML/1998/namespace";

  private final Document document;

  private DomDocumentTree(Document document) {
    this.document = Objects.requireNonNull(document, "document");
  }

  public static DomDocumentTree of(Document document) {
    return new DomDocumentTree(document);
  }

  /**
   * Parses an XML document (package document, XHTML content document) into a tree.
   *
   * <p>Namespace aware, DOCTYPE declarations rejected. Adjacent text and CDATA nodes are kept
   * as parsed.
   *
   * @throws IOException if the stream cannot be read or is not well-formed XML
   */
  public static DomDocumentTree parse(InputStream inputStream) throws IOException {
    try {
      DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
      dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      dbf.setNamespaceAware(true);
      return new DomDocumentTree(dbf.newDocumentBuilder().parse(inputStream));
    } catch (ParserConfigurationException | SAXException e) {
      throw new IOException("Failed to parse document: " + e.getMessage(), e);
    }
  }

  public Document getDocument() {
    return document;
  }

  /** Wraps a node of this document, e.g. to generate a CFI for it. */
  public TreeNode node(Node node) {
    if (node == null) {
      return null;
    }
    if (node.getOwnerDocument() != document) {
      throw new IllegalArgumentException("Node does not belong to this document");
    }
    return new DomTreeNode(node, this);
  }

  @Override
  public TreeNode rootElement() {
    return node(document.getDocumentElement());
  }

  @Override
  public Optional<TreeNode> elementById(String id) {
    if (id == null || id.isEmpty()) {
      return Optional.empty();
    }
    Element typed = document.getElementById(id);
    if (typed != null) {
      return Optional.of(node(typed));
    }
    NodeList elements = document.getElementsByTagName("*");
    for (int i = 0; i < elements.getLength(); i++) {
      Element element = (Element) elements.item(i);
      if (id.equals(DomTreeNode.idOf(element))) {
        return Optional.of(node(element));
      }
    }
    return Optional.empty();
  }

  @Override
  public Optional<TreeNode> firstElementByTagName(String tagName) {
    NodeList elements = document.getElementsByTagName("*");
    for (int i = 0; i < elements.getLength(); i++) {
      Element element = (Element) elements.item(i);
      if (tagName.equals(DomTreeNode.localNameOf(element))) {
        return Optional.of(node(element));
      }
    }
    return Optional.empty();
  }

  @Override
  public String decodeEntities(String text) {
    if (text == null || text.indexOf('&') < 0) {
      return text;
    }
    return Parser.unescapeEntities(text, false);
  }

  @Override
  public TreeRange createRange() {
    if (!(document instanceof DocumentRange)) {
      throw new CfiResolutionException(
          "DOM implementation " + document.getClass().getName() + " does not support ranges",
          "The document does not support ranges");
    }
    return new DomTreeRange(((DocumentRange) document).createRange());
  }
}
