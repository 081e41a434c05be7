package com.flamingo.ai.epubcfi.service.cfi.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Virtual position of a resolved location relative to its anchor node. */
public enum RelativePosition {
  BEFORE("before"),
  AFTER("after");

  private final String label;

  RelativePosition(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }
}
