package com.flamingo.ai.finqa.domain.model;

import com.flamingo.ai.finqa.domain.enums.BoundaryKind;
import com.flamingo.ai.finqa.domain.enums.StatementType;
import java.util.Comparator;

/**
 * A structural transition detected in a document.
 *
 * @param id stable identifier, unique within the document
 * @param page page the boundary sits on
 * @param offset character offset within the page
 * @param kind what kind of transition this is
 * @param statementType statement in effect from this boundary on
 */
public record Boundary(
    String id, int page, int offset, BoundaryKind kind, StatementType statementType) {

  /** Orders boundaries by (page, offset). */
  public static final Comparator<Boundary> BY_POSITION =
      Comparator.comparingInt(Boundary::page).thenComparingInt(Boundary::offset);

  public boolean samePosition(Boundary other) {
    return page == other.page && offset == other.offset;
  }

  /** Whether this boundary lies at or before the given position. */
  public boolean isAtOrBefore(int otherPage, int otherOffset) {
    return page < otherPage || (page == otherPage && offset <= otherOffset);
  }
}
