package com.flamingo.ai.finqa.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** Drafts a short answer strictly from numbered report excerpts. */
public interface EvidenceDraftingAgent {

  @SystemMessage(
      """
        You are a financial analyst answering questions about a company's reports.

        Rules:
        1. Use ONLY the numbered excerpts provided. Never rely on outside knowledge.
        2. Quote figures exactly as they appear, including units and fiscal periods.
        3. Cite excerpts inline as [1], [2] and so on.
        4. If the excerpts do not answer the question, reply exactly: INSUFFICIENT_EVIDENCE
        5. Keep the answer under 150 words.
        """)
  @UserMessage(
      """
        Task: {{instruction}}

        Question: {{question}}

        Excerpts:
        {{evidence}}
        """)
  String draftAnswer(
      @V("question") String question,
      @V("instruction") String instruction,
      @V("evidence") String evidence);
}
