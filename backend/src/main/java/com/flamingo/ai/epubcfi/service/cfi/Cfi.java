package com.flamingo.ai.epubcfi.service.cfi;

import com.flamingo.ai.epubcfi.service.cfi.compare.CfiComparator;
import com.flamingo.ai.epubcfi.service.cfi.generate.CfiGenerator;
import com.flamingo.ai.epubcfi.service.cfi.model.CfiPath;
import com.flamingo.ai.epubcfi.service.cfi.model.CfiStep;
import com.flamingo.ai.epubcfi.service.cfi.model.NodeOffset;
import com.flamingo.ai.epubcfi.service.cfi.model.ParsedCfi;
import com.flamingo.ai.epubcfi.service.cfi.model.ResolvedTarget;
import com.flamingo.ai.epubcfi.service.cfi.parsing.CfiEscaper;
import com.flamingo.ai.epubcfi.service.cfi.parsing.CfiExpression;
import com.flamingo.ai.epubcfi.service.cfi.parsing.CfiParser;
import com.flamingo.ai.epubcfi.service.cfi.parsing.ParseOptions;
import com.flamingo.ai.epubcfi.service.cfi.resolve.CfiResolver;
import com.flamingo.ai.epubcfi.service.cfi.resolve.DocumentChainResolver;
import com.flamingo.ai.epubcfi.service.cfi.resolve.DocumentFetcher;
import com.flamingo.ai.epubcfi.service.cfi.resolve.ResolveOptions;
import com.flamingo.ai.epubcfi.service.cfi.tree.DocumentTree;
import com.flamingo.ai.epubcfi.service.cfi.tree.TreeNode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A parsed EPUB Canonical Fragment Identifier.
 *
 * <p>Instances are immutable and safe to share. A CFI addresses either a single location or a
 * simple range ({@code epubcfi(prefix,start,end)}); for a range, {@link #getPath()} is the prefix
 * shared by both ends. Equality is structural and ignores the source string's formatting.
 *
 * <pre>{@code
 * Cfi cfi = Cfi.parse("epubcfi(/6/4[chap01ref]!/4[body01]/10[para05]/3:5)");
 * String href = cfi.resolveUri(0, packageDocument);
 * ResolvedTarget location = cfi.resolveLast(chapterDocument);
 * }</pre>
 */
public final class Cfi {

  private final String source;
  private final CfiPath path;
  private final List<CfiStep> fromSuffix;
  private final List<CfiStep> toSuffix;

  private Cfi(String source, CfiExpression expression) {
    this.source = source;
    this.path = expression.path();
    this.fromSuffix = expression.fromSuffix();
    this.toSuffix = expression.toSuffix();
  }

  /** Parses {@code cfi} with default options. */
  public static Cfi parse(String cfi) {
    return parse(cfi, ParseOptions.DEFAULT);
  }

  /**
   * Parses {@code cfi}.
   *
   * @throws com.flamingo.ai.epubcfi.exception.MalformedCfiException if it is not a valid CFI
   */
  public static Cfi parse(String cfi, ParseOptions options) {
    return new Cfi(cfi, new CfiParser(options).parse(cfi));
  }

  public boolean isRange() {
    return fromSuffix != null;
  }

  /** The location path, or for a range the common prefix. */
  public CfiPath getPath() {
    return path;
  }

  /** Full path of the range start. */
  public CfiPath getFrom() {
    if (!isRange()) {
      throw new IllegalStateException("Trying to get beginning of non-range CFI");
    }
    return path.extendLastPart(fromSuffix);
  }

  /** Full path of the range end. */
  public CfiPath getTo() {
    if (!isRange()) {
      throw new IllegalStateException("Trying to get end of non-range CFI");
    }
    return path.extendLastPart(toSuffix);
  }

  /** Plain-data form, suitable for serialization. */
  public ParsedCfi get() {
    return isRange() ? ParsedCfi.range(getFrom(), getTo()) : ParsedCfi.location(path);
  }

  /** URI of the document that follows part {@code partIndex}, read from {@code tree}. */
  public String resolveUri(int partIndex, DocumentTree tree) {
    return resolveUri(partIndex, tree, ResolveOptions.DEFAULT);
  }

  public String resolveUri(int partIndex, DocumentTree tree, ResolveOptions options) {
    return new CfiResolver(options).resolveUri(path, partIndex, tree);
  }

  /** Resolves the final part against the last document of the chain. */
  public ResolvedTarget resolveLast(DocumentTree tree) {
    return resolveLast(tree, ResolveOptions.DEFAULT);
  }

  /**
   * Resolves the final part against the last document of the chain.
   *
   * @return a {@link com.flamingo.ai.epubcfi.service.cfi.model.ResolvedLocation}, or for a range a
   *     {@link com.flamingo.ai.epubcfi.service.cfi.model.ResolvedRange} (or native {@link
   *     com.flamingo.ai.epubcfi.service.cfi.tree.TreeRange} with the {@code range} option)
   */
  public ResolvedTarget resolveLast(DocumentTree tree, ResolveOptions options) {
    CfiResolver resolver = new CfiResolver(options);
    if (!isRange()) {
      return resolver.resolveLocation(path, tree);
    }
    return resolver.resolveRange(getFrom(), getTo(), tree);
  }

  /**
   * Follows every document hop from an already loaded first document.
   *
   * @param fetcher loads linked documents; may be {@code null} for single-document CFIs
   */
  public CompletableFuture<ResolvedTarget> resolve(
      DocumentTree startTree, DocumentFetcher fetcher, ResolveOptions options) {
    Objects.requireNonNull(startTree, "startTree");
    return chain(fetcher, options).resolve(path, startTree, null, t -> resolveLast(t, options));
  }

  /** Follows every document hop, fetching the first document from {@code startUri}. */
  public CompletableFuture<ResolvedTarget> resolve(
      String startUri, DocumentFetcher fetcher, ResolveOptions options) {
    Objects.requireNonNull(startUri, "startUri");
    return chain(fetcher, options).resolve(path, null, startUri, t -> resolveLast(t, options));
  }

  private static DocumentChainResolver chain(DocumentFetcher fetcher, ResolveOptions options) {
    return new DocumentChainResolver(new CfiResolver(options), fetcher);
  }

  /** Document order: negative if {@code a} comes first. */
  public static int compare(Cfi a, Cfi b) {
    return CfiComparator.INSTANCE.compare(a, b);
  }

  /** Returns the CFIs in document order. */
  public static List<Cfi> sort(Collection<Cfi> cfis) {
    List<Cfi> sorted = new ArrayList<>(cfis);
    sorted.sort(CfiComparator.INSTANCE);
    return sorted;
  }

  public static String generate(TreeNode node) {
    return CfiGenerator.generate(node, null);
  }

  public static String generate(TreeNode node, Integer offset) {
    return CfiGenerator.generate(node, offset);
  }

  public static String generate(List<NodeOffset> nodes) {
    return CfiGenerator.generate(nodes);
  }

  public static String escape(String value) {
    return CfiEscaper.escape(value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Cfi)) {
      return false;
    }
    Cfi other = (Cfi) o;
    return path.equals(other.path)
        && Objects.equals(fromSuffix, other.fromSuffix)
        && Objects.equals(toSuffix, other.toSuffix);
  }

  @Override
  public int hashCode() {
    return Objects.hash(path, fromSuffix, toSuffix);
  }

  /** The string this CFI was parsed from. */
  @Override
  public String toString() {
    return source;
  }
}
