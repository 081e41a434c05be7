package com.flamingo.ai.epubcfi.service.cfi.model;

/** The two ends of a resolved simple range. */
public record ResolvedRange(ResolvedLocation from, ResolvedLocation to) implements ResolvedTarget {

  @Override
  public boolean isRange() {
    return true;
  }
}
