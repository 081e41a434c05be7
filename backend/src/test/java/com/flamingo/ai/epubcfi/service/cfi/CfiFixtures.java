package com.flamingo.ai.epubcfi.service.cfi;

import com.flamingo.ai.epubcfi.service.cfi.tree.TreeNode;
import com.flamingo.ai.epubcfi.service.cfi.tree.dom.DomDocumentTree;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/** Loads the XML documents under {@code src/test/resources/fixtures}. */
public final class CfiFixtures {

  public static final String CHAPTER_CFI = "epubcfi(/6/4[chap01ref]!/4[body01]/10[para05]/3:5)";

  private CfiFixtures() {}

  public static DomDocumentTree load(String name) {
    try (InputStream in = CfiFixtures.class.getResourceAsStream("/fixtures/" + name)) {
      if (in == null) {
        throw new IllegalArgumentException("No fixture named " + name);
      }
      return DomDocumentTree.parse(in);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Parses inline markup. */
  public static DomDocumentTree fromString(String xml) {
    try {
      return DomDocumentTree.parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static DomDocumentTree packageDocument() {
    return load("package.opf");
  }

  public static DomDocumentTree chapter() {
    return load("chapter01.xhtml");
  }

  public static DomDocumentTree compactChapter() {
    return load("chapter01-compact.xhtml");
  }

  /** Element with the given id; fails the test if absent. */
  public static TreeNode byId(DomDocumentTree tree, String id) {
    return tree.elementById(id).orElseThrow(() -> new AssertionError("No element with id " + id));
  }

  /** Last child node of the element with the given id. */
  public static TreeNode lastChildOf(DomDocumentTree tree, String id) {
    List<TreeNode> children = byId(tree, id).children();
    return children.get(children.size() - 1);
  }
}
