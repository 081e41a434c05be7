package com.flamingo.ai.epubcfi.service.cfi.resolve;

/**
 * Resolve-time options.
 *
 * @param ignoreIds descend by node index only, never jumping to an element by its id
 * @param range resolve a simple range into a native {@link
 *     com.flamingo.ai.epubcfi.service.cfi.tree.TreeRange} instead of a pair of locations
 */
public record ResolveOptions(boolean ignoreIds, boolean range) {

  public static final ResolveOptions DEFAULT = new ResolveOptions(false, false);

  public ResolveOptions withIgnoreIds(boolean ignoreIds) {
    return new ResolveOptions(ignoreIds, range);
  }

  public ResolveOptions withRange(boolean range) {
    return new ResolveOptions(ignoreIds, range);
  }
}
