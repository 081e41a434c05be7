package com.flamingo.ai.epubcfi.service.cfi.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Text expected around a character offset, used to relocate the offset when the document has
 * changed since the CFI was created.
 *
 * <p>Either a plain {@code text} (bracket without a comma, expected to start at the offset) or a
 * {@code pre}/{@code post} pair (text expected immediately before and after the addressed
 * character). Exactly one of the two forms is populated; in the pair form either side may be
 * {@code null}.
 *
 * @param text plain assertion text, {@code null} for the pre/post form
 * @param pre text expected before the offset
 * @param post text expected after the addressed character
 */
public record TextLocationAssertion(String text, String pre, String post) {

  public static TextLocationAssertion plain(String text) {
    return new TextLocationAssertion(text, null, null);
  }

  public static TextLocationAssertion prePost(String pre, String post) {
    return new TextLocationAssertion(null, pre, post);
  }

  /** Whether this is the plain form (no comma inside the bracket). */
  public boolean plain() {
    return text != null;
  }

  /** Serialised as a bare string for the plain form, as {@code {pre, post}} otherwise. */
  @JsonValue
  public Object jsonValue() {
    if (plain()) {
      return text;
    }
    Map<String, String> value = new LinkedHashMap<>();
    if (pre != null) {
      value.put("pre", pre);
    }
    if (post != null) {
      value.put("post", post);
    }
    return value;
  }
}
