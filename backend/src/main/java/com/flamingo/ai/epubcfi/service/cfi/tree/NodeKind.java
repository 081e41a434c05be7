package com.flamingo.ai.epubcfi.service.cfi.tree;

/** Node kinds that matter for CFI counting; everything else (comments, PIs) is {@link #OTHER}. */
public enum NodeKind {
  ELEMENT,
  TEXT,
  CDATA_SECTION,
  OTHER
}
