package com.flamingo.ai.finqa.service.agents;

import com.flamingo.ai.finqa.domain.enums.TaskCategory;
import com.flamingo.ai.finqa.domain.model.PartialAnswer;
import com.flamingo.ai.finqa.domain.model.SubQuery;

/**
 * Answers sub-queries of one task category from retrieved evidence.
 *
 * <p>Implementations hold no per-question state and may be invoked concurrently for different
 * sub-queries. Missing or unreadable evidence is reported as a zero-confidence {@link
 * PartialAnswer} carrying an evidence gap rather than as an exception.
 */
public interface SpecializedAgent {

  TaskCategory category();

  PartialAnswer answer(SubQuery subQuery);
}
