package com.flamingo.ai.finqa.service.ingestion;

import com.flamingo.ai.finqa.domain.model.Boundary;
import java.util.List;

/**
 * Output of boundary detection.
 *
 * @param boundaries boundaries ordered by (page, offset), at most one per position
 * @param extractionGap true when no structural cue was found and the document was treated as a
 *     single unclassified section
 */
public record BoundaryDetection(List<Boundary> boundaries, boolean extractionGap) {

  public BoundaryDetection {
    boundaries = List.copyOf(boundaries);
  }
}
