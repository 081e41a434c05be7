package com.flamingo.ai.epubcfi.service.cfi.parsing;

/**
 * Parse-time options.
 *
 * @param flattenRange parse a simple range as its start location only
 * @param stricter strip offset, assertion, temporal and spatial qualifiers from every step that is
 *     not the last step of its part, and reject {@code :} mixed with {@code ~} or {@code @}
 */
public record ParseOptions(boolean flattenRange, boolean stricter) {

  public static final ParseOptions DEFAULT = new ParseOptions(false, true);

  public ParseOptions withFlattenRange(boolean flattenRange) {
    return new ParseOptions(flattenRange, stricter);
  }

  public ParseOptions withStricter(boolean stricter) {
    return new ParseOptions(flattenRange, stricter);
  }
}
