package com.flamingo.ai.epubcfi.service.cfi.model;

/**
 * Result of resolving the last part of a CFI: a {@link ResolvedLocation}, a {@link ResolvedRange}
 * or a native range of the tree.
 */
public interface ResolvedTarget {

  boolean isRange();
}
