package com.flamingo.ai.epubcfi.service.cfi.parsing;

/**
 * States of the step scanner. Each state consumes one character at a time; {@code -1} signals
 * the end of input. The scanner has already consumed an unescaped {@code ^} and raised the escape
 * flag before the following character reaches a state.
 */
public enum ScanState {

  /** Between values: structural characters start values or end the step. */
  NONE {
    @Override
    public Transition accept(StepScan scan, int c) {
      if (c == END_OF_INPUT) {
        return Transition.END;
      }
      if (scan.escaped()) {
        return Transition.CONTINUE;
      }
      switch (c) {
        case '!':
          return Transition.END_AFTER;
        case ',':
          return Transition.END;
        case '/':
          if (!scan.markSlash()) {
            return Transition.END;
          }
          scan.enter(NODE_INDEX);
          return Transition.CONTINUE;
        case ':':
          if (scan.options().stricter() && scan.hasTemporalOrSpatial()) {
            throw scan.malformed("Character offset cannot follow a temporal or spatial position");
          }
          scan.enter(OFFSET);
          return Transition.CONTINUE;
        case '~':
        case '@':
          if (scan.options().stricter() && scan.hasOffset()) {
            throw scan.malformed("Temporal or spatial position cannot follow a character offset");
          }
          scan.enter(c == '~' ? TEMPORAL : SPATIAL);
          return Transition.CONTINUE;
        case '[':
          if (scan.previous() == OFFSET) {
            scan.enter(ASSERTION);
          } else if (scan.previous() == NODE_INDEX) {
            scan.enter(NODE_ID);
          }
          return Transition.CONTINUE;
        default:
          // vendor extensions such as "4vnd.foo" carry no meaning
          return Transition.CONTINUE;
      }
    }
  },

  /** Digits after {@code /}. */
  NODE_INDEX {
    @Override
    public Transition accept(StepScan scan, int c) {
      if (isDigit(c)) {
        scan.append(c);
        return Transition.CONTINUE;
      }
      scan.closeNodeIndex();
      scan.leave();
      return Transition.REDISPATCH;
    }
  },

  /** Digits after {@code :}. */
  OFFSET {
    @Override
    public Transition accept(StepScan scan, int c) {
      if (isDigit(c)) {
        scan.append(c);
        return Transition.CONTINUE;
      }
      scan.closeOffset();
      scan.leave();
      return Transition.REDISPATCH;
    }
  },

  /** Decimal number after {@code ~}. */
  TEMPORAL {
    @Override
    public Transition accept(StepScan scan, int c) {
      if (isDigit(c) || (c == '.' && scan.markSeparator())) {
        scan.append(c);
        return Transition.CONTINUE;
      }
      scan.closeTemporal();
      scan.leave();
      return Transition.REDISPATCH;
    }
  },

  /** {@code x:y} after {@code @}. */
  SPATIAL {
    @Override
    public Transition accept(StepScan scan, int c) {
      if (isDigit(c) || c == '.' || (c == ':' && scan.markSeparator())) {
        scan.append(c);
        return Transition.CONTINUE;
      }
      if (scan.seenSeparator()) {
        scan.closeSpatial();
      }
      scan.leave();
      return Transition.REDISPATCH;
    }
  },

  /** Bracket after an offset: text location assertion and side bias. */
  ASSERTION {
    @Override
    public Transition accept(StepScan scan, int c) {
      if (c == END_OF_INPUT) {
        throw scan.malformed("Unterminated text location assertion");
      }
      if (scan.escaped()) {
        scan.append(c);
      } else if (c == ']') {
        scan.closeAssertion();
        scan.leave();
      } else if (c == ',') {
        scan.splitAssertion();
      } else {
        if (c == ';') {
          scan.markSemicolon();
        }
        scan.append(c);
      }
      return Transition.CONTINUE;
    }
  },

  /** Bracket after a node index: the id assertion, in which a comma is literal. */
  NODE_ID {
    @Override
    public Transition accept(StepScan scan, int c) {
      if (c == END_OF_INPUT) {
        throw scan.malformed("Unterminated node id");
      }
      if (c == ']' && !scan.escaped()) {
        scan.closeNodeId();
        scan.leave();
      } else {
        scan.append(c);
      }
      return Transition.CONTINUE;
    }
  };

  public static final int END_OF_INPUT = -1;

  /**
   * Feeds one character to this state.
   *
   * @param scan the scan in progress
   * @param c the character, or {@link #END_OF_INPUT}
   * @return what the scanner should do next
   */
  public abstract Transition accept(StepScan scan, int c);

  static boolean isDigit(int c) {
    return c >= '0' && c <= '9';
  }
}
