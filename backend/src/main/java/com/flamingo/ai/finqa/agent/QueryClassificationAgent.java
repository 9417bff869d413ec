package com.flamingo.ai.finqa.agent;

import com.flamingo.ai.finqa.agent.dto.QueryClassificationResult;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * Classifies financial questions that no keyword rule recognises. Only consulted as a fallback by
 * the question router.
 */
public interface QueryClassificationAgent {

  @SystemMessage(
      """
        You route questions about company financial reports to specialist analysts.

        Categories:
        - CALCULATION: the question asks for a ratio, margin or other computed figure
        - TEMPORAL_COMPARISON: the question compares a figure across fiscal periods
        - RISK_EXTRACTION: the question asks about risks, exposures or uncertainties
        - GENERAL: anything else answerable from the report

        A question may belong to several categories. Use GENERAL only when no other category
        applies.

        Return JSON with these fields:
        - categories (array of category names)
        - reasoning (string) - one sentence
        """)
  @UserMessage(
      """
        Question: {{question}}

        Return JSON with categories and reasoning fields.
        """)
  QueryClassificationResult classify(@V("question") String question);
}
