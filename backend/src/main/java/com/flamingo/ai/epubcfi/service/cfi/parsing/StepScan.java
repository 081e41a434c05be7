package com.flamingo.ai.epubcfi.service.cfi.parsing;

import com.flamingo.ai.epubcfi.exception.MalformedCfiException;
import com.flamingo.ai.epubcfi.service.cfi.model.CfiStep;
import com.flamingo.ai.epubcfi.service.cfi.model.SideBias;
import com.flamingo.ai.epubcfi.service.cfi.model.SpatialPosition;
import com.flamingo.ai.epubcfi.service.cfi.model.TextLocationAssertion;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Mutable state of a single step scan, shared by the {@link ScanState} transitions.
 *
 * <p>Not thread-safe; one instance per scanned step.
 */
public final class StepScan {

  private static final Pattern SPATIAL = Pattern.compile("^([\\d.]+):([\\d.]+)$");
  private static final Pattern SIDE_BIAS = Pattern.compile(";s=([ba])");

  private final String cfi;
  private final ParseOptions options;
  private final StringBuilder buffer = new StringBuilder();

  private ScanState state = ScanState.NONE;
  private ScanState previous = ScanState.NONE;
  private boolean escaped;
  private boolean seenSlash;
  private boolean seenSeparator;
  private boolean assertionSplit;
  private int lastSemicolon = -1;

  private Integer nodeIndex;
  private String nodeId;
  private Integer offset;
  private String assertionPre;
  private TextLocationAssertion assertion;
  private SideBias sideBias;
  private Double temporal;
  private SpatialPosition spatial;

  public StepScan(String cfi, ParseOptions options) {
    this.cfi = cfi;
    this.options = options;
  }

  public ScanState state() {
    return state;
  }

  public ScanState previous() {
    return previous;
  }

  public ParseOptions options() {
    return options;
  }

  public boolean escaped() {
    return escaped;
  }

  void escape() {
    escaped = true;
  }

  void clearEscape() {
    escaped = false;
  }

  /** Starts accumulating a value in {@code next}. */
  void enter(ScanState next) {
    previous = state;
    state = next;
    buffer.setLength(0);
    seenSeparator = false;
    assertionSplit = false;
    lastSemicolon = -1;
  }

  /** Returns to {@link ScanState#NONE}, remembering which value just ended. */
  void leave() {
    previous = state;
    state = ScanState.NONE;
    buffer.setLength(0);
  }

  /** Marks the first {@code /} of the step; returns false if one was already seen. */
  boolean markSlash() {
    if (seenSlash) {
      return false;
    }
    seenSlash = true;
    return true;
  }

  /** Marks the single separator a value may contain ({@code .} or {@code :}). */
  boolean markSeparator() {
    if (seenSeparator) {
      return false;
    }
    seenSeparator = true;
    return true;
  }

  boolean seenSeparator() {
    return seenSeparator;
  }

  void append(int c) {
    buffer.append((char) c);
  }

  void markSemicolon() {
    lastSemicolon = buffer.length();
  }

  boolean hasBuffered() {
    return buffer.length() > 0;
  }

  boolean hasOffset() {
    return offset != null;
  }

  boolean hasTemporalOrSpatial() {
    return temporal != null || spatial != null;
  }

  void closeNodeIndex() {
    if (hasBuffered()) {
      nodeIndex = parseInt("node index");
    }
  }

  void closeOffset() {
    if (hasBuffered()) {
      offset = parseInt("offset");
    }
  }

  void closeTemporal() {
    if (hasBuffered()) {
      try {
        temporal = Double.parseDouble(buffer.toString());
      } catch (NumberFormatException e) {
        throw new MalformedCfiException(cfi, "Invalid temporal position '" + buffer + "'", e);
      }
    }
  }

  void closeSpatial() {
    Matcher matcher = SPATIAL.matcher(buffer);
    if (!matcher.matches()) {
      return;
    }
    try {
      spatial =
          new SpatialPosition(
              Double.parseDouble(matcher.group(1)), Double.parseDouble(matcher.group(2)));
    } catch (NumberFormatException e) {
      throw new MalformedCfiException(cfi, "Invalid spatial position '" + buffer + "'", e);
    }
  }

  void closeNodeId() {
    nodeId = hasBuffered() ? buffer.toString() : null;
  }

  /**
   * An unescaped comma inside an assertion bracket: the text since the previous comma becomes the
   * {@code pre} text, so the last comma decides the split.
   */
  void splitAssertion() {
    assertionSplit = true;
    assertionPre = hasBuffered() ? buffer.toString() : null;
    buffer.setLength(0);
    lastSemicolon = -1;
  }

  void closeAssertion() {
    String text = buffer.toString();
    if (lastSemicolon >= 0 && SIDE_BIAS.matcher(text.substring(lastSemicolon)).matches()) {
      sideBias = SideBias.fromCode(text.substring(lastSemicolon + 3));
      text = text.substring(0, lastSemicolon);
    }
    if (assertionSplit) {
      assertion = TextLocationAssertion.prePost(assertionPre, text.isEmpty() ? null : text);
    } else if (!text.isEmpty()) {
      assertion = TextLocationAssertion.plain(text);
    }
  }

  MalformedCfiException malformed(String message) {
    return new MalformedCfiException(cfi, message);
  }

  /** Builds the scanned step; fails when no node index was read. */
  CfiStep toStep() {
    if (nodeIndex == null) {
      throw malformed("Missing child node index in CFI");
    }
    return CfiStep.builder()
        .nodeIndex(nodeIndex)
        .nodeId(nodeId)
        .offset(offset)
        .textLocationAssertion(assertion)
        .sideBias(sideBias)
        .temporal(temporal)
        .spatial(spatial)
        .build();
  }

  private int parseInt(String what) {
    try {
      return Integer.parseInt(buffer.toString());
    } catch (NumberFormatException e) {
      throw new MalformedCfiException(cfi, "Invalid " + what + " '" + buffer + "'", e);
    }
  }
}
