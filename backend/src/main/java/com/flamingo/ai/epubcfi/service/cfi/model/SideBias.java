package com.flamingo.ai.epubcfi.service.cfi.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Which side of an ambiguous assertion boundary a location leans to ({@code ;s=b} / {@code ;s=a}). */
public enum SideBias {
  BEFORE("b", "before"),
  AFTER("a", "after");

  private final String code;
  private final String label;

  SideBias(String code, String label) {
    this.code = code;
    this.label = label;
  }

  /** The single-letter code used inside a CFI bracket. */
  public String code() {
    return code;
  }

  @JsonValue
  public String label() {
    return label;
  }

  public static SideBias fromCode(String code) {
    return AFTER.code.equals(code) ? AFTER : BEFORE;
  }
}
