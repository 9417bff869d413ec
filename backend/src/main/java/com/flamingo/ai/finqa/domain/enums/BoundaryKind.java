package com.flamingo.ai.finqa.domain.enums;

/**
 * Kind of structural transition detected in an extracted document.
 *
 * <p>The declaration order doubles as the precedence used when two boundaries land on the same
 * position: earlier constants win.
 */
public enum BoundaryKind {
  STATEMENT_CHANGE,
  TABLE_END,
  TABLE_START,
  SECTION_HEADING,
  PAGE_BREAK;

  /** Whether the chunker must close the current chunk at a boundary of this kind. */
  public boolean isClosing() {
    return this == STATEMENT_CHANGE || this == TABLE_START || this == TABLE_END;
  }

  /** Returns true when this kind takes precedence over {@code other} at a shared position. */
  public boolean outranks(BoundaryKind other) {
    return ordinal() < other.ordinal();
  }
}
