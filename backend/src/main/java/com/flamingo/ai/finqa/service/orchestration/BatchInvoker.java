package com.flamingo.ai.finqa.service.orchestration;

import com.flamingo.ai.finqa.domain.model.PartialAnswer;
import com.flamingo.ai.finqa.domain.model.SubQuery;
import java.util.List;

/**
 * Runs a batch of sub-queries through their agents. Returns one partial answer per sub-query, in
 * the same order; sub-queries cut off by the question deadline come back with a TIMEOUT gap.
 */
@FunctionalInterface
public interface BatchInvoker {

  List<PartialAnswer> invoke(List<SubQuery> subQueries);
}
