package com.flamingo.ai.finqa.service.orchestration;

import com.flamingo.ai.finqa.domain.model.PartialAnswer;
import com.flamingo.ai.finqa.domain.model.SubQuery;

/**
 * Latest state of one sub-query in the validation loop.
 *
 * @param subQuery the last attempt issued
 * @param partial the answer kept for this sub-query
 * @param retries retries spent so far
 * @param timedOut whether an attempt was cut off by the question deadline
 */
public record SubQueryOutcome(
    SubQuery subQuery, PartialAnswer partial, int retries, boolean timedOut) {}
