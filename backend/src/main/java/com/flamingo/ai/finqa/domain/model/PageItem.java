package com.flamingo.ai.finqa.domain.model;

/** Positioned content on an extracted page: either a {@link TextSpan} or a {@link TableRegion}. */
public interface PageItem {

  /** Character offset of the item within its page. */
  int offset();

  /** Offset just past the item (exclusive). */
  int endOffset();
}
