package com.flamingo.ai.epubcfi.service.cfi.parsing;

import com.flamingo.ai.epubcfi.exception.MalformedCfiException;
import com.flamingo.ai.epubcfi.service.cfi.model.CfiPart;
import com.flamingo.ai.epubcfi.service.cfi.model.CfiPath;
import com.flamingo.ai.epubcfi.service.cfi.model.CfiStep;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Parses {@code epubcfi(...)} strings into {@link CfiExpression}s.
 *
 * <p>Steps are read one at a time by a {@link StepScanner}. A {@code !} closes the current part
 * (document hop). Up to two top-level commas split a simple range into the shared prefix, the
 * start suffix and the end suffix. A range whose end suffix is missing, or any range when {@link
 * ParseOptions#flattenRange()} is set, degenerates to its start location.
 */
@Slf4j
public final class CfiParser {

  private static final Pattern WRAPPER = Pattern.compile("^epubcfi\\((.*)\\)$", Pattern.DOTALL);

  private final ParseOptions options;

  public CfiParser(ParseOptions options) {
    this.options = options != null ? options : ParseOptions.DEFAULT;
  }

  public CfiExpression parse(String cfi) {
    if (cfi == null) {
      throw new MalformedCfiException("CFI must not be null");
    }
    Matcher matcher = WRAPPER.matcher(cfi.trim());
    if (!matcher.matches()) {
      throw new MalformedCfiException(cfi, "Not a valid CFI");
    }
    String body = matcher.group(1);
    if (body.isEmpty()) {
      throw new MalformedCfiException(cfi, "Empty CFI");
    }

    StepScanner scanner = new StepScanner(cfi, options);
    List<CfiPart> parts = new ArrayList<>();
    List<CfiStep> steps = new ArrayList<>();
    List<CfiStep> from = null;
    List<CfiStep> to = null;
    int commas = 0;
    int position = 0;

    while (position < body.length()) {
      ScannedStep scanned = scanner.scan(body, position);
      if (commas > 0 && scanned.newDocument()) {
        throw new MalformedCfiException(cfi, "CFI is a range that spans multiple documents");
      }
      steps.add(scanned.step());
      position = scanned.next();

      boolean atEnd = position >= body.length();
      if (atEnd || scanned.newDocument()) {
        if (commas == 0) {
          parts.add(new CfiPart(steps));
        } else if (commas == 1) {
          from = steps;
        } else {
          to = steps;
        }
        steps = new ArrayList<>();
      }

      if (!atEnd && body.charAt(position) == ',') {
        if (scanned.newDocument()) {
          // a range must start inside the document the last hop entered
          throw new MalformedCfiException(cfi, "CFI is a range that spans multiple documents");
        }
        if (commas == 0) {
          if (!steps.isEmpty()) {
            parts.add(new CfiPart(steps));
          }
        } else if (commas == 1) {
          if (!steps.isEmpty()) {
            from = steps;
          }
        } else {
          throw new MalformedCfiException(cfi, "Too many commas in CFI range");
        }
        steps = new ArrayList<>();
        commas++;
        position++;
      }
    }

    if (parts.isEmpty()) {
      throw new MalformedCfiException(cfi, "CFI range has no common path");
    }
    CfiPath path = new CfiPath(parts);
    if (from == null || from.isEmpty()) {
      from = null;
      to = null;
    } else if (options.flattenRange() || to == null || to.isEmpty()) {
      log.debug("Flattening range {} to its start location", cfi);
      path = path.extendLastPart(from);
      from = null;
      to = null;
    }

    if (options.stricter()) {
      return stripQualifiers(path, from, to);
    }
    return new CfiExpression(path, from, to);
  }

  /** Removes terminal-only qualifiers from steps that cannot be terminal. */
  private static CfiExpression stripQualifiers(
      CfiPath path, List<CfiStep> from, List<CfiStep> to) {
    List<CfiPart> parts = new ArrayList<>(path.size());
    for (CfiPart part : path.parts()) {
      parts.add(part.mapLeadingSteps(CfiStep::withoutQualifiers));
    }
    if (from == null) {
      return new CfiExpression(new CfiPath(parts), null, null);
    }
    // the shared prefix continues into both suffixes, so none of its steps is terminal
    int last = parts.size() - 1;
    List<CfiStep> prefix = new ArrayList<>();
    for (CfiStep step : path.lastPart().steps()) {
      prefix.add(step.withoutQualifiers());
    }
    parts.set(last, new CfiPart(prefix));
    return new CfiExpression(new CfiPath(parts), stripLeading(from), stripLeading(to));
  }

  private static List<CfiStep> stripLeading(List<CfiStep> steps) {
    List<CfiStep> stripped = new ArrayList<>(steps.size());
    for (int i = 0; i < steps.size(); i++) {
      CfiStep step = steps.get(i);
      stripped.add(i < steps.size() - 1 ? step.withoutQualifiers() : step);
    }
    return stripped;
  }
}
