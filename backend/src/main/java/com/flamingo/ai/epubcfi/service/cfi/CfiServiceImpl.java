package com.flamingo.ai.epubcfi.service.cfi;

import com.flamingo.ai.epubcfi.config.CfiConfig;
import com.flamingo.ai.epubcfi.exception.MalformedCfiException;
import com.flamingo.ai.epubcfi.service.cfi.model.NodeOffset;
import com.flamingo.ai.epubcfi.service.cfi.model.ResolvedTarget;
import com.flamingo.ai.epubcfi.service.cfi.parsing.ParseOptions;
import com.flamingo.ai.epubcfi.service.cfi.resolve.DocumentFetcher;
import com.flamingo.ai.epubcfi.service.cfi.tree.DocumentTree;
import com.flamingo.ai.epubcfi.service.cfi.tree.TreeNode;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of the CfiService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class CfiServiceImpl implements CfiService {

  private final CfiConfig cfiConfig;
  private final MeterRegistry meterRegistry;
  private final Optional<DocumentFetcher> documentFetcher;

  @Override
  @Timed(value = "cfi.parse", description = "Time to parse a CFI")
  public Cfi parse(String cfi) {
    return parse(cfi, defaultParseOptions());
  }

  @Override
  @Timed(value = "cfi.parse", description = "Time to parse a CFI")
  public Cfi parse(String cfi, ParseOptions options) {
    try {
      Cfi parsed = Cfi.parse(cfi, options);
      meterRegistry.counter("cfi.parsed").increment();
      log.debug("Parsed CFI {} (range: {})", cfi, parsed.isRange());
      return parsed;
    } catch (MalformedCfiException e) {
      meterRegistry.counter("cfi.parse.failed").increment();
      throw e;
    }
  }

  @Override
  public ParseOptions defaultParseOptions() {
    return cfiConfig.parseOptions();
  }

  @Override
  @Timed(value = "cfi.compare", description = "Time to compare two CFIs")
  public int compare(String left, String right) {
    return Integer.signum(Cfi.compare(parse(left), parse(right)));
  }

  @Override
  @Timed(value = "cfi.sort", description = "Time to sort CFIs")
  public List<String> sort(List<String> cfis) {
    log.info("Sorting {} CFIs", cfis.size());
    return Cfi.sort(cfis.stream().map(this::parse).toList()).stream()
        .map(Cfi::toString)
        .toList();
  }

  @Override
  public String escape(String value) {
    return Cfi.escape(value);
  }

  @Override
  @Timed(value = "cfi.generate", description = "Time to generate a CFI")
  public String generate(TreeNode node, Integer offset) {
    String cfi = Cfi.generate(node, offset);
    meterRegistry.counter("cfi.generated").increment();
    return cfi;
  }

  @Override
  @Timed(value = "cfi.generate", description = "Time to generate a CFI")
  public String generate(List<NodeOffset> nodes) {
    String cfi = Cfi.generate(nodes);
    meterRegistry.counter("cfi.generated").increment();
    return cfi;
  }

  @Override
  @Timed(value = "cfi.resolve.uri", description = "Time to resolve a linked document URI")
  public String resolveUri(String cfi, int partIndex, DocumentTree tree) {
    return parse(cfi).resolveUri(partIndex, tree, cfiConfig.resolveOptions());
  }

  @Override
  @Timed(value = "cfi.resolve", description = "Time to resolve a CFI")
  public ResolvedTarget resolveLast(String cfi, DocumentTree tree) {
    ResolvedTarget target = parse(cfi).resolveLast(tree, cfiConfig.resolveOptions());
    meterRegistry.counter("cfi.resolved").increment();
    return target;
  }

  @Override
  public CompletableFuture<ResolvedTarget> resolve(String cfi, DocumentTree startTree) {
    return countResolved(
        parse(cfi)
            .resolve(startTree, documentFetcher.orElse(null), cfiConfig.resolveOptions()));
  }

  @Override
  public CompletableFuture<ResolvedTarget> resolve(String cfi, String startUri) {
    log.info("Resolving CFI {} from {}", cfi, startUri);
    return countResolved(
        parse(cfi).resolve(startUri, documentFetcher.orElse(null), cfiConfig.resolveOptions()));
  }

  private CompletableFuture<ResolvedTarget> countResolved(
      CompletableFuture<ResolvedTarget> future) {
    return future.whenComplete(
        (target, error) -> {
          if (error == null) {
            meterRegistry.counter("cfi.resolved").increment();
          } else {
            log.debug("Asynchronous CFI resolution failed: {}", error.getMessage());
          }
        });
  }
}
