package com.flamingo.ai.epubcfi.service.cfi.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * The steps addressing a location inside one document; parts are separated by {@code !}.
 *
 * @param steps at least one step, outermost first
 */
public record CfiPart(List<CfiStep> steps) {

  public CfiPart {
    steps = List.copyOf(steps);
    if (steps.isEmpty()) {
      throw new IllegalArgumentException("A CFI part needs at least one step");
    }
  }

  @Override
  @JsonValue
  public List<CfiStep> steps() {
    return steps;
  }

  public CfiStep lastStep() {
    return steps.get(steps.size() - 1);
  }

  public int size() {
    return steps.size();
  }

  public CfiPart append(List<CfiStep> suffix) {
    List<CfiStep> extended = new ArrayList<>(steps);
    extended.addAll(suffix);
    return new CfiPart(extended);
  }

  /** Applies {@code mapper} to every step but the last. */
  public CfiPart mapLeadingSteps(UnaryOperator<CfiStep> mapper) {
    List<CfiStep> mapped = new ArrayList<>(steps.size());
    for (int i = 0; i < steps.size() - 1; i++) {
      mapped.add(mapper.apply(steps.get(i)));
    }
    mapped.add(lastStep());
    return new CfiPart(mapped);
  }
}
