package com.flamingo.ai.epubcfi.service.cfi.parsing;

/** What the step scanner does after a {@link ScanState} has seen a character. */
public enum Transition {
  /** Character consumed, keep scanning. */
  CONTINUE,
  /** The current value ended; hand the same character to {@link ScanState#NONE}. */
  REDISPATCH,
  /** Step complete; the character belongs to whatever follows. */
  END,
  /** Step complete and the character ({@code !}) consumed; the next step is in a new document. */
  END_AFTER
}
