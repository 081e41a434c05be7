package com.flamingo.ai.epubcfi.service.cfi.resolve;

import static com.flamingo.ai.epubcfi.service.cfi.CfiFixtures.CHAPTER_CFI;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.epubcfi.exception.DocumentFetchException;
import com.flamingo.ai.epubcfi.exception.LinkNotFoundException;
import com.flamingo.ai.epubcfi.service.cfi.Cfi;
import com.flamingo.ai.epubcfi.service.cfi.CfiFixtures;
import com.flamingo.ai.epubcfi.service.cfi.model.ResolvedLocation;
import com.flamingo.ai.epubcfi.service.cfi.model.ResolvedTarget;
import com.flamingo.ai.epubcfi.service.cfi.tree.dom.DomDocumentTree;
import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DocumentChainResolverTest {

  @Mock private DocumentFetcher fetcher;

  private DomDocumentTree opf;
  private DomDocumentTree chapter;

  @BeforeEach
  void setUp() {
    opf = CfiFixtures.packageDocument();
    chapter = CfiFixtures.chapter();
  }

  @Test
  void shouldFetchLinkedDocument_whenStartingFromPackage() throws Exception {
    // Given
    when(fetcher.fetch("chapter01.xhtml")).thenReturn(CompletableFuture.completedFuture(chapter));

    // When
    ResolvedTarget target =
        Cfi.parse(CHAPTER_CFI).resolve(opf, fetcher, ResolveOptions.DEFAULT).get();

    // Then
    ResolvedLocation location = (ResolvedLocation) target;
    assertThat(location.node()).isEqualTo(CfiFixtures.lastChildOf(chapter, "para05"));
    assertThat(location.offset()).isEqualTo(5);
    verify(fetcher).fetch("chapter01.xhtml");
  }

  @Test
  void shouldFetchStartDocument_whenStartingFromUri() throws Exception {
    // Given
    when(fetcher.fetch("OEBPS/content.opf")).thenReturn(CompletableFuture.completedFuture(opf));
    when(fetcher.fetch("chapter01.xhtml")).thenReturn(CompletableFuture.completedFuture(chapter));

    // When
    ResolvedTarget target =
        Cfi.parse(CHAPTER_CFI).resolve("OEBPS/content.opf", fetcher, ResolveOptions.DEFAULT).get();

    // Then
    assertThat(((ResolvedLocation) target).offset()).isEqualTo(5);
    InOrder order = inOrder(fetcher);
    order.verify(fetcher).fetch("OEBPS/content.opf");
    order.verify(fetcher).fetch("chapter01.xhtml");
  }

  @Test
  void shouldFollowEveryHop_inDocumentOrder() throws Exception {
    // Given
    DomDocumentTree embeds = CfiFixtures.load("embeds.xhtml");
    DomDocumentTree frame =
        CfiFixtures.fromString("<html><body><p id=\"greeting\">hello world</p></body></html>");
    when(fetcher.fetch("chapter01.xhtml")).thenReturn(CompletableFuture.completedFuture(embeds));
    when(fetcher.fetch("frame.xhtml")).thenReturn(CompletableFuture.completedFuture(frame));

    // When
    ResolvedLocation location =
        (ResolvedLocation)
            Cfi.parse("epubcfi(/6/4[chap01ref]!/4/2[frame]!/2/2[greeting]/1:6)")
                .resolve(opf, fetcher, ResolveOptions.DEFAULT)
                .get();

    // Then
    assertThat(location.node().textContent()).isEqualTo("hello world");
    assertThat(location.offset()).isEqualTo(6);
    InOrder order = inOrder(fetcher);
    order.verify(fetcher).fetch("chapter01.xhtml");
    order.verify(fetcher).fetch("frame.xhtml");
  }

  @Test
  void shouldResolveWithoutFetcher_whenSingleDocument() throws Exception {
    ResolvedTarget target =
        Cfi.parse("epubcfi(/4[body01]/10[para05]/3:2)")
            .resolve(chapter, null, ResolveOptions.DEFAULT)
            .get();

    assertThat(((ResolvedLocation) target).offset()).isEqualTo(2);
  }

  @Test
  void shouldFail_whenFetcherMissingForMultiDocumentCfi() {
    CompletableFuture<ResolvedTarget> future =
        Cfi.parse(CHAPTER_CFI).resolve(opf, null, ResolveOptions.DEFAULT);

    assertThatThrownBy(future::get)
        .isInstanceOf(ExecutionException.class)
        .hasCauseInstanceOf(DocumentFetchException.class)
        .hasMessageContaining("chapter01.xhtml");
  }

  @Test
  void shouldWrapFailure_whenFetchCompletesExceptionally() {
    // Given
    IOException notFound = new IOException("404 Not Found");
    when(fetcher.fetch(anyString())).thenReturn(CompletableFuture.failedFuture(notFound));

    // When
    CompletableFuture<ResolvedTarget> future =
        Cfi.parse(CHAPTER_CFI).resolve(opf, fetcher, ResolveOptions.DEFAULT);

    // Then
    assertThatThrownBy(future::get)
        .isInstanceOf(ExecutionException.class)
        .cause()
        .isInstanceOf(DocumentFetchException.class)
        .hasMessage("Failed to get: chapter01.xhtml")
        .hasCause(notFound);
  }

  @Test
  void shouldWrapFailure_whenFetcherThrows() {
    when(fetcher.fetch(anyString())).thenThrow(new IllegalStateException("offline"));

    CompletableFuture<ResolvedTarget> future =
        Cfi.parse(CHAPTER_CFI).resolve(opf, fetcher, ResolveOptions.DEFAULT);

    assertThatThrownBy(future::get)
        .cause()
        .isInstanceOf(DocumentFetchException.class)
        .hasMessage("Failed to get: chapter01.xhtml")
        .extracting("uri")
        .isEqualTo("chapter01.xhtml");
  }

  @Test
  void shouldFail_whenFetcherReturnsNoDocument() {
    when(fetcher.fetch(anyString())).thenReturn(CompletableFuture.completedFuture(null));

    CompletableFuture<ResolvedTarget> future =
        Cfi.parse(CHAPTER_CFI).resolve(opf, fetcher, ResolveOptions.DEFAULT);

    assertThatThrownBy(future::get).hasCauseInstanceOf(DocumentFetchException.class);
  }

  @Test
  void shouldFail_whenFetcherReturnsNoFuture() {
    when(fetcher.fetch(anyString())).thenReturn(null);

    CompletableFuture<ResolvedTarget> future =
        Cfi.parse(CHAPTER_CFI).resolve(opf, fetcher, ResolveOptions.DEFAULT);

    assertThatThrownBy(future::get).hasCauseInstanceOf(DocumentFetchException.class);
  }

  @Test
  void shouldStopBeforeFetching_whenLinkMissing() {
    // When
    CompletableFuture<ResolvedTarget> future =
        Cfi.parse("epubcfi(/6/10[missingref]!/4/2)").resolve(opf, fetcher, ResolveOptions.DEFAULT);

    // Then
    assertThatThrownBy(future::get).hasCauseInstanceOf(LinkNotFoundException.class);
    verify(fetcher, never()).fetch(anyString());
  }

  @Test
  void shouldRequireStartDocumentOrUri() {
    DocumentChainResolver resolver =
        new DocumentChainResolver(new CfiResolver(ResolveOptions.DEFAULT), fetcher);

    assertThatThrownBy(
            () -> resolver.resolve(Cfi.parse(CHAPTER_CFI).getPath(), null, null, tree -> null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
