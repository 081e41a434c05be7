package com.flamingo.ai.epubcfi.service.cfi.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * One {@code /N[id]} step of a CFI part, addressing one level of tree descent.
 *
 * <p>{@code nodeIndex} is counted the CFI way: even indexes address elements, odd indexes the
 * (possibly empty) text runs between them. The qualifiers {@code offset}, {@code
 * textLocationAssertion}, {@code sideBias}, {@code temporal} and {@code spatial} only mean
 * something on the last step of a path.
 *
 * @param nodeIndex CFI child index, never negative
 * @param nodeId id assertion from the bracket after the index
 * @param offset character offset (or image offset for {@code img} elements)
 * @param textLocationAssertion text expected around the offset
 * @param sideBias tie-break direction on an assertion boundary
 * @param temporal time position ({@code ~})
 * @param spatial space position ({@code @})
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CfiStep(
    int nodeIndex,
    @JsonProperty("nodeID") String nodeId,
    Integer offset,
    TextLocationAssertion textLocationAssertion,
    SideBias sideBias,
    Double temporal,
    SpatialPosition spatial) {

  public static CfiStep of(int nodeIndex) {
    return CfiStep.builder().nodeIndex(nodeIndex).build();
  }

  /** Copy of this step keeping only the index and id. */
  public CfiStep withoutQualifiers() {
    if (!qualified()) {
      return this;
    }
    return toBuilder()
        .offset(null)
        .textLocationAssertion(null)
        .sideBias(null)
        .temporal(null)
        .spatial(null)
        .build();
  }

  /** Whether any terminal-only qualifier is present. */
  public boolean qualified() {
    return offset != null
        || textLocationAssertion != null
        || sideBias != null
        || temporal != null
        || spatial != null;
  }
}
