package com.flamingo.ai.epubcfi.service.cfi;

import com.flamingo.ai.epubcfi.service.cfi.model.NodeOffset;
import com.flamingo.ai.epubcfi.service.cfi.model.ResolvedTarget;
import com.flamingo.ai.epubcfi.service.cfi.parsing.ParseOptions;
import com.flamingo.ai.epubcfi.service.cfi.tree.DocumentTree;
import com.flamingo.ai.epubcfi.service.cfi.tree.TreeNode;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/** Service interface for parsing, resolving, comparing and generating CFIs. */
public interface CfiService {

  /**
   * Parses a CFI with the configured options.
   *
   * @param cfi the CFI string
   * @return the parsed CFI
   * @throws com.flamingo.ai.epubcfi.exception.MalformedCfiException if the string is not a CFI
   */
  Cfi parse(String cfi);

  /**
   * Parses a CFI with explicit options.
   *
   * @param cfi the CFI string
   * @param options parse options
   * @return the parsed CFI
   */
  Cfi parse(String cfi, ParseOptions options);

  /** The configured parse options. */
  ParseOptions defaultParseOptions();

  /**
   * Compares two CFI strings in document order.
   *
   * @return negative, zero or positive as {@code left} comes before, with or after {@code right}
   */
  int compare(String left, String right);

  /**
   * Sorts CFI strings in document order.
   *
   * @param cfis the CFI strings
   * @return the same strings, sorted
   */
  List<String> sort(List<String> cfis);

  String escape(String value);

  /**
   * Generates the CFI of a node.
   *
   * @param node text node or element
   * @param offset character offset, or {@code null}
   * @return the CFI string
   */
  String generate(TreeNode node, Integer offset);

  /** Generates a multi-document CFI, one part per node. */
  String generate(List<NodeOffset> nodes);

  /**
   * Reads the URI of the document following part {@code partIndex}.
   *
   * @throws com.flamingo.ai.epubcfi.exception.LinkNotFoundException if the part does not address
   *     a link
   */
  String resolveUri(String cfi, int partIndex, DocumentTree tree);

  /** Resolves the final part of a CFI against its document. */
  ResolvedTarget resolveLast(String cfi, DocumentTree tree);

  /** Follows all document hops from a loaded first document, using the configured fetcher. */
  CompletableFuture<ResolvedTarget> resolve(String cfi, DocumentTree startTree);

  /** Follows all document hops, fetching the first document from {@code startUri}. */
  CompletableFuture<ResolvedTarget> resolve(String cfi, String startUri);
}
