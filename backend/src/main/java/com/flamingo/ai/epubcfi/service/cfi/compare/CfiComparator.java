package com.flamingo.ai.epubcfi.service.cfi.compare;

import com.flamingo.ai.epubcfi.service.cfi.Cfi;
import com.flamingo.ai.epubcfi.service.cfi.model.CfiPart;
import com.flamingo.ai.epubcfi.service.cfi.model.CfiPath;
import com.flamingo.ai.epubcfi.service.cfi.model.CfiStep;
import com.flamingo.ai.epubcfi.service.cfi.model.SpatialPosition;
import java.util.Comparator;
import java.util.List;

/**
 * Document order of CFIs.
 *
 * <p>Paths are compared part by part and step by step on node indexes; a path that runs out first
 * sorts first. Offsets, and for element steps temporal and spatial positions, are compared only
 * on the last step. A range sorts by its start, then by its end; against a plain location only
 * its start counts.
 */
public final class CfiComparator implements Comparator<Cfi> {

  public static final CfiComparator INSTANCE = new CfiComparator();

  @Override
  public int compare(Cfi a, Cfi b) {
    if (a.isRange() && b.isRange()) {
      int diff = comparePath(a.getFrom(), b.getFrom());
      return diff != 0 ? diff : comparePath(a.getTo(), b.getTo());
    }
    CfiPath pathA = a.isRange() ? a.getFrom() : a.getPath();
    CfiPath pathB = b.isRange() ? b.getFrom() : b.getPath();
    return comparePath(pathA, pathB);
  }

  public static int comparePath(CfiPath a, CfiPath b) {
    int max = Math.max(a.size(), b.size());
    for (int i = 0; i < max; i++) {
      if (i >= a.size()) {
        return -1;
      }
      if (i >= b.size()) {
        return 1;
      }
      int diff = compareParts(a.part(i), b.part(i));
      if (diff != 0) {
        return diff;
      }
    }
    return 0;
  }

  public static int compareParts(CfiPart a, CfiPart b) {
    List<CfiStep> stepsA = a.steps();
    List<CfiStep> stepsB = b.steps();
    int max = Math.max(stepsA.size(), stepsB.size());
    for (int i = 0; i < max; i++) {
      if (i >= stepsA.size()) {
        return -1;
      }
      if (i >= stepsB.size()) {
        return 1;
      }
      CfiStep stepA = stepsA.get(i);
      CfiStep stepB = stepsB.get(i);
      int diff = Integer.compare(stepA.nodeIndex(), stepB.nodeIndex());
      if (diff != 0) {
        return diff;
      }
      // a position before the first child is terminal
      if (stepA.nodeIndex() == 0) {
        return 0;
      }
      if (i < max - 1) {
        continue;
      }

      // only element steps carry temporal or spatial positions
      if (stepA.nodeIndex() % 2 == 0) {
        diff = compareTemporal(stepA.temporal(), stepB.temporal());
        if (diff != 0) {
          return diff;
        }
        diff = compareSpatial(stepA.spatial(), stepB.spatial());
        if (diff != 0) {
          return diff;
        }
      }
      diff = Integer.compare(orZero(stepA.offset()), orZero(stepB.offset()));
      if (diff != 0) {
        return diff;
      }
    }
    return 0;
  }

  static int compareTemporal(Double a, Double b) {
    if (a == null || b == null) {
      return a == null ? (b == null ? 0 : -1) : 1;
    }
    return Double.compare(a, b);
  }

  static int compareSpatial(SpatialPosition a, SpatialPosition b) {
    if (a == null || b == null) {
      return a == null ? (b == null ? 0 : -1) : 1;
    }
    int diff = Double.compare(a.y(), b.y());
    return diff != 0 ? diff : Double.compare(a.x(), b.x());
  }

  private static int orZero(Integer value) {
    return value == null ? 0 : value;
  }
}
