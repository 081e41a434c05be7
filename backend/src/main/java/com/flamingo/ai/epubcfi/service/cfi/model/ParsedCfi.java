package com.flamingo.ai.epubcfi.service.cfi.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Plain-data view of a parsed CFI: the path for a single location, or the full {@code from} and
 * {@code to} paths for a simple range.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParsedCfi(
    CfiPath path, CfiPath from, CfiPath to, @JsonProperty("isRange") boolean range) {

  public static ParsedCfi location(CfiPath path) {
    return new ParsedCfi(path, null, null, false);
  }

  public static ParsedCfi range(CfiPath from, CfiPath to) {
    return new ParsedCfi(null, from, to, true);
  }
}
