package com.flamingo.ai.epubcfi.service.cfi.resolve;

import com.flamingo.ai.epubcfi.exception.DocumentFetchException;
import com.flamingo.ai.epubcfi.service.cfi.model.CfiPath;
import com.flamingo.ai.epubcfi.service.cfi.model.ResolvedTarget;
import com.flamingo.ai.epubcfi.service.cfi.tree.DocumentTree;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Follows the document hops of a multi-part CFI, fetching one linked document at a time.
 *
 * <p>Each hop depends on the previous document, so fetches run strictly in sequence. A failed or
 * missing fetch completes the returned future exceptionally with a {@link DocumentFetchException};
 * resolution errors complete it with their own exception.
 */
@Slf4j
public final class DocumentChainResolver {

  private final CfiResolver resolver;
  private final DocumentFetcher fetcher;

  /**
   * @param resolver resolves each part
   * @param fetcher loads linked documents; may be {@code null} when no fetch is needed
   */
  public DocumentChainResolver(CfiResolver resolver, DocumentFetcher fetcher) {
    this.resolver = resolver;
    this.fetcher = fetcher;
  }

  /**
   * Resolves {@code path} starting from a loaded document or from a URI.
   *
   * @param path the whole path
   * @param startTree document of the first part, or {@code null} when {@code startUri} is given
   * @param startUri URI of the first part's document, or {@code null}
   * @param resolveLast resolves the final document once it is loaded
   */
  public CompletableFuture<ResolvedTarget> resolve(
      CfiPath path,
      DocumentTree startTree,
      String startUri,
      Function<DocumentTree, ResolvedTarget> resolveLast) {
    if (startTree == null && startUri == null) {
      throw new IllegalArgumentException("Either a start document or a start URI is required");
    }
    CompletableFuture<Hop> chain = CompletableFuture.completedFuture(new Hop(startTree, startUri));
    for (int i = 0; i < path.size() - 1; i++) {
      int partIndex = i;
      chain =
          chain.thenCompose(
              hop ->
                  load(hop)
                      .thenApply(
                          tree -> new Hop(tree, resolver.resolveUri(path, partIndex, tree))));
    }
    return chain.thenCompose(this::load).thenApply(resolveLast);
  }

  private CompletableFuture<DocumentTree> load(Hop hop) {
    if (hop.uri() == null) {
      return CompletableFuture.completedFuture(hop.tree());
    }
    return fetch(hop.uri());
  }

  private CompletableFuture<DocumentTree> fetch(String uri) {
    if (fetcher == null) {
      return CompletableFuture.failedFuture(
          new DocumentFetchException(uri, "No document fetcher available to load " + uri));
    }
    log.debug("Fetching linked document {}", uri);
    CompletableFuture<DocumentTree> future;
    try {
      future = fetcher.fetch(uri);
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(
          new DocumentFetchException(uri, "Failed to get: " + uri, e));
    }
    if (future == null) {
      return CompletableFuture.failedFuture(
          new DocumentFetchException(uri, "Fetcher returned no result for " + uri));
    }
    return future.handle(
        (tree, error) -> {
          if (error != null) {
            Throwable cause = error instanceof CompletionException ? error.getCause() : error;
            throw new DocumentFetchException(uri, "Failed to get: " + uri, cause);
          }
          if (tree == null) {
            throw new DocumentFetchException(uri, "Fetcher returned no document for " + uri);
          }
          return tree;
        });
  }

  /** A document to resolve against, given either loaded or by URI. */
  private record Hop(DocumentTree tree, String uri) {}
}
