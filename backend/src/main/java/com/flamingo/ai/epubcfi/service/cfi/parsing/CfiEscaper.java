package com.flamingo.ai.epubcfi.service.cfi.parsing;

import java.util.regex.Pattern;

/** Circumflex escaping of the characters that are structural inside a CFI. */
public final class CfiEscaper {

  private static final Pattern RESERVED = Pattern.compile("[\\[\\]\\^,();]");

  private CfiEscaper() {}

  /** Prefixes each of {@code [ ] ^ , ( ) ;} with {@code ^}. */
  public static String escape(String value) {
    if (value == null || value.isEmpty()) {
      return value;
    }
    return RESERVED.matcher(value).replaceAll("^$0");
  }

  /** Removes escaping circumflexes; {@code ^^} decodes to a single {@code ^}. */
  static String unescape(String value) {
    if (value == null || value.indexOf('^') < 0) {
      return value;
    }
    StringBuilder out = new StringBuilder(value.length());
    boolean escaped = false;
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == '^' && !escaped) {
        escaped = true;
        continue;
      }
      out.append(c);
      escaped = false;
    }
    return out.toString();
  }
}
