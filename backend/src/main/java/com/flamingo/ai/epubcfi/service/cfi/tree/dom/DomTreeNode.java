package com.flamingo.ai.epubcfi.service.cfi.tree.dom;

import com.flamingo.ai.epubcfi.service.cfi.tree.NodeKind;
import com.flamingo.ai.epubcfi.service.cfi.tree.TreeNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/** {@link TreeNode} wrapping a W3C DOM node; equal when the wrapped nodes are the same. */
public final class DomTreeNode implements TreeNode {

  private static final String XLINK_NS = "http://www.w3.org/1999/xlink";

  private final Node node;
  private final DomDocumentTree tree;

  DomTreeNode(Node node, DomDocumentTree tree) {
    this.node = node;
    this.tree = tree;
  }

  /** The wrapped DOM node. */
  public Node unwrap() {
    return node;
  }

  static Node unwrap(TreeNode treeNode) {
    if (!(treeNode instanceof DomTreeNode)) {
      throw new IllegalArgumentException("Not a DOM tree node: " + treeNode);
    }
    return ((DomTreeNode) treeNode).node;
  }

  @Override
  public NodeKind kind() {
    switch (node.getNodeType()) {
      case Node.ELEMENT_NODE:
        return NodeKind.ELEMENT;
      case Node.TEXT_NODE:
        return NodeKind.TEXT;
      case Node.CDATA_SECTION_NODE:
        return NodeKind.CDATA_SECTION;
      default:
        return NodeKind.OTHER;
    }
  }

  @Override
  public TreeNode parent() {
    Node parent = node.getParentNode();
    if (parent == null || parent.getNodeType() != Node.ELEMENT_NODE) {
      return null;
    }
    return tree.node(parent);
  }

  @Override
  public List<TreeNode> children() {
    NodeList childNodes = node.getChildNodes();
    if (childNodes.getLength() == 0) {
      return Collections.emptyList();
    }
    List<TreeNode> children = new ArrayList<>(childNodes.getLength());
    for (int i = 0; i < childNodes.getLength(); i++) {
      children.add(tree.node(childNodes.item(i)));
    }
    return children;
  }

  @Override
  public TreeNode previousSibling() {
    return tree.node(node.getPreviousSibling());
  }

  @Override
  public TreeNode nextSibling() {
    return tree.node(node.getNextSibling());
  }

  @Override
  public String tagName() {
    return node.getNodeType() == Node.ELEMENT_NODE ? localNameOf((Element) node) : null;
  }

  @Override
  public String id() {
    return node.getNodeType() == Node.ELEMENT_NODE ? idOf((Element) node) : null;
  }

  @Override
  public String attribute(String name) {
    if (node.getNodeType() != Node.ELEMENT_NODE) {
      return null;
    }
    Element element = (Element) node;
    if (element.hasAttribute(name)) {
      return element.getAttribute(name);
    }
    // documents may bind the xlink namespace to another prefix
    if (name.startsWith("xlink:") && element.hasAttributeNS(XLINK_NS, name.substring(6))) {
      return element.getAttributeNS(XLINK_NS, name.substring(6));
    }
    return null;
  }

  @Override
  public String textContent() {
    return isText() ? node.getNodeValue() : node.getTextContent();
  }

  static String localNameOf(Element element) {
    String name = element.getLocalName() != null ? element.getLocalName() : element.getTagName();
    int colon = name.indexOf(':');
    if (colon >= 0) {
      name = name.substring(colon + 1);
    }
    return name.toLowerCase(Locale.ROOT);
  }

  static String idOf(Element element) {
    String id = element.getAttribute("id");
    if (!id.isEmpty()) {
      return id;
    }
    id = element.getAttributeNS(DomDocumentTree.XML_NS, "id");
    return id == null || id.isEmpty() ? null : id;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof DomTreeNode && ((DomTreeNode) o).node == node;
  }

  @Override
  public int hashCode() {
    return System.identityHashCode(node);
  }

  @Override
  public String toString() {
    if (isElement()) {
      String id = id();
      return "<" + tagName() + (id != null ? " id=\"" + id + "\"" : "") + ">";
    }
    return kind() + "[" + node.getNodeValue() + "]";
  }
}
