package com.flamingo.ai.epubcfi.service.cfi.parsing;

import com.flamingo.ai.epubcfi.service.cfi.model.CfiPath;
import com.flamingo.ai.epubcfi.service.cfi.model.CfiStep;
import java.util.List;

/**
 * Structure of a parsed CFI string.
 *
 * @param path the location, or for a range the prefix shared by both ends
 * @param fromSuffix steps appended to the last part of {@code path} for the range start, {@code
 *     null} unless this is a range
 * @param toSuffix steps appended for the range end, {@code null} unless this is a range
 */
public record CfiExpression(CfiPath path, List<CfiStep> fromSuffix, List<CfiStep> toSuffix) {

  public CfiExpression {
    fromSuffix = fromSuffix == null ? null : List.copyOf(fromSuffix);
    toSuffix = toSuffix == null ? null : List.copyOf(toSuffix);
  }

  public boolean isRange() {
    return fromSuffix != null;
  }
}
