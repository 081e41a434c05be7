package com.flamingo.ai.epubcfi.service.cfi.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.ArrayList;
import java.util.List;

/**
 * A full CFI path: one part per document, the last one addressing the final location.
 *
 * @param parts at least one part
 */
public record CfiPath(List<CfiPart> parts) {

  public CfiPath {
    parts = List.copyOf(parts);
    if (parts.isEmpty()) {
      throw new IllegalArgumentException("A CFI path needs at least one part");
    }
  }

  @Override
  @JsonValue
  public List<CfiPart> parts() {
    return parts;
  }

  public CfiPart part(int index) {
    return parts.get(index);
  }

  public CfiPart lastPart() {
    return parts.get(parts.size() - 1);
  }

  public int size() {
    return parts.size();
  }

  /** New path whose last part is extended with {@code suffix}. */
  public CfiPath extendLastPart(List<CfiStep> suffix) {
    if (suffix == null || suffix.isEmpty()) {
      return this;
    }
    List<CfiPart> extended = new ArrayList<>(parts);
    extended.set(extended.size() - 1, lastPart().append(suffix));
    return new CfiPath(extended);
  }
}
