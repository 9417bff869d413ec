package com.flamingo.ai.finqa.service.agents;

import com.flamingo.ai.finqa.domain.enums.FinancialMetric;
import com.flamingo.ai.finqa.domain.model.Chunk;

/**
 * A line-item value read from a statement table.
 *
 * @param metric the line item
 * @param value the parsed number; parenthesised figures are negative
 * @param rowLabel label of the table row the value came from
 * @param columnLabel header of the column the value came from
 * @param source chunk holding the table
 */
public record MetricValue(
    FinancialMetric metric, double value, String rowLabel, String columnLabel, Chunk source) {}
