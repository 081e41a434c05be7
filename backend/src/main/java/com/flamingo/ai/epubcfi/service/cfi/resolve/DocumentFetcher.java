package com.flamingo.ai.epubcfi.service.cfi.resolve;

import com.flamingo.ai.epubcfi.service.cfi.tree.DocumentTree;
import java.util.concurrent.CompletableFuture;

/**
 * Retrieves and parses the document behind a URI found while following a multi-document CFI.
 *
 * <p>Transport, caching, timeouts and cancellation are up to the implementation.
 */
@FunctionalInterface
public interface DocumentFetcher {

  CompletableFuture<DocumentTree> fetch(String uri);
}
