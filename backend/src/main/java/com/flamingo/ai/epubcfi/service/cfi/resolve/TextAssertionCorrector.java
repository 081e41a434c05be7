package com.flamingo.ai.epubcfi.service.cfi.resolve;

import com.flamingo.ai.epubcfi.service.cfi.model.TextLocationAssertion;
import com.flamingo.ai.epubcfi.service.cfi.tree.DocumentTree;
import com.flamingo.ai.epubcfi.service.cfi.tree.TreeNode;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Moves a text offset to where its text location assertion actually matches.
 *
 * <p>The whole run of adjacent text nodes around the tentative position is searched, and the match
 * closest to the offset from the CFI wins. Correction is best effort: whenever the assertion does
 * not match, or the match cannot be mapped back onto a node, the tentative position is returned
 * unchanged. Node text is searched as stored; only the assertion's own text is entity-decoded.
 */
@Slf4j
public final class TextAssertionCorrector {

  private TextAssertionCorrector() {}

  /**
   * @param tree the document
   * @param tentative position reached by index-based descent
   * @param parsedOffset offset written in the CFI, {@code null} read as 0
   * @param assertion text expected at the location
   * @return the corrected position, or {@code tentative}
   */
  public static NodePosition correct(
      DocumentTree tree,
      NodePosition tentative,
      Integer parsedOffset,
      TextLocationAssertion assertion) {
    if (assertion == null || tentative.isVirtual() || !tentative.node().isText()) {
      return tentative;
    }

    TreeNode start = tentative.node();
    while (start.previousSibling() != null && start.previousSibling().isText()) {
      start = start.previousSibling();
    }
    List<TreeNode> run = new ArrayList<>();
    List<Integer> lengths = new ArrayList<>();
    StringBuilder text = new StringBuilder();
    for (TreeNode node = start; node != null && node.isText(); node = node.nextSibling()) {
      run.add(node);
      lengths.add(SiblingIndexer.textLength(node));
      text.append(node.textContent() == null ? "" : node.textContent());
    }

    Pattern pattern;
    int shift;
    if (assertion.plain()) {
      pattern = Pattern.compile(Pattern.quote(decode(tree, assertion.text())));
      shift = 0;
    } else {
      String pre = decode(tree, assertion.pre());
      String post = decode(tree, assertion.post());
      pattern = Pattern.compile(Pattern.quote(pre) + "." + Pattern.quote(post), Pattern.DOTALL);
      shift = pre.length();
    }

    int target = parsedOffset == null ? 0 : parsedOffset;
    Integer best = closestMatch(pattern.matcher(text), shift, target);
    if (best == null) {
      log.debug("Text location assertion {} not found near offset {}", assertion, target);
      return tentative;
    }

    int local = best;
    int i = 0;
    while (local >= lengths.get(i)) {
      local -= lengths.get(i);
      if (i + 1 >= lengths.size()) {
        log.debug("Assertion match at {} lies beyond the text run, keeping offset", best);
        return tentative;
      }
      i++;
    }
    if (run.get(i).equals(tentative.node()) && local == tentative.offset()) {
      return tentative;
    }
    log.debug("Corrected offset {} to {} using text location assertion", target, best);
    return NodePosition.at(run.get(i), local);
  }

  /** Start of the match nearest to {@code target}; overlapping matches count, first wins ties. */
  private static Integer closestMatch(Matcher matcher, int shift, int target) {
    Integer best = null;
    int bestDistance = Integer.MAX_VALUE;
    int from = 0;
    while (from <= matcher.regionEnd() && matcher.find(from)) {
      int position = matcher.start() + shift;
      int distance = Math.abs(position - target);
      if (distance < bestDistance) {
        best = position;
        bestDistance = distance;
      }
      from = matcher.start() + 1;
    }
    return best;
  }

  private static String decode(DocumentTree tree, String text) {
    return text == null ? "" : tree.decodeEntities(text);
  }
}
