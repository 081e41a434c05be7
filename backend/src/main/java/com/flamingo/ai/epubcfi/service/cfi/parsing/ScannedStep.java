package com.flamingo.ai.epubcfi.service.cfi.parsing;

import com.flamingo.ai.epubcfi.service.cfi.model.CfiStep;

/**
 * One scanned step.
 *
 * @param step the step
 * @param next index in the scanned string where scanning should resume
 * @param newDocument whether the step was terminated by a {@code !} document hop
 */
public record ScannedStep(CfiStep step, int next, boolean newDocument) {}
