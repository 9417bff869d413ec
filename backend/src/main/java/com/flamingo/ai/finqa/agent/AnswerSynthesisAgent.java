package com.flamingo.ai.finqa.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** Merges the findings of several specialist agents into one answer to the original question. */
public interface AnswerSynthesisAgent {

  @SystemMessage(
      """
        You are a senior financial analyst writing the final answer to a question about a
        company's reports. Specialist analysts have already answered parts of it.

        Rules:
        1. Use ONLY the findings provided. Never add figures or facts of your own.
        2. Keep every figure, percentage and fiscal period exactly as written in the findings.
        3. Connect the findings where they relate, for example a ratio and the risks behind it.
        4. Do not mention the analysts or the findings themselves.
        5. Keep the answer under 200 words.
        """)
  @UserMessage(
      """
        Question: {{question}}

        Findings:
        {{findings}}
        """)
  String synthesize(@V("question") String question, @V("findings") String findings);
}
