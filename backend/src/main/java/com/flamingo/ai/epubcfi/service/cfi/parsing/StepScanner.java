package com.flamingo.ai.epubcfi.service.cfi.parsing;

/** Scans one {@code /N[...]} step, with its qualifiers, from the body of a CFI. */
public final class StepScanner {

  private final String cfi;
  private final ParseOptions options;

  /**
   * @param cfi the whole CFI, used in error messages
   * @param options parse options
   */
  public StepScanner(String cfi, ParseOptions options) {
    this.cfi = cfi;
    this.options = options;
  }

  /**
   * Scans the step starting at {@code start}.
   *
   * @param body the text between {@code epubcfi(} and {@code )}
   * @param start index of the step's leading {@code /}
   * @return the step and where the next one starts
   */
  public ScannedStep scan(String body, int start) {
    StepScan scan = new StepScan(cfi, options);
    for (int i = start; ; i++) {
      int c = i < body.length() ? body.charAt(i) : ScanState.END_OF_INPUT;
      if (c == '^' && !scan.escaped()) {
        scan.escape();
        continue;
      }
      Transition transition = scan.state().accept(scan, c);
      if (transition == Transition.REDISPATCH) {
        transition = ScanState.NONE.accept(scan, c);
      }
      scan.clearEscape();
      if (transition == Transition.END) {
        return new ScannedStep(scan.toStep(), i, false);
      }
      if (transition == Transition.END_AFTER) {
        return new ScannedStep(scan.toStep(), i + 1, true);
      }
    }
  }
}
