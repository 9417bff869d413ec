package com.flamingo.ai.finqa.service.qa;

import com.flamingo.ai.finqa.domain.model.ExtractedDocument;
import com.flamingo.ai.finqa.domain.model.FinalAnswer;
import com.flamingo.ai.finqa.domain.model.IngestionResult;
import com.flamingo.ai.finqa.domain.model.RetrievalFilters;
import java.util.List;

/** Entry point for ingesting financial reports and answering questions about them. */
public interface FinancialQaService {

  /**
   * Answers a question over every ingested document.
   *
   * @param question natural-language question
   * @return the composed or degraded answer
   */
  FinalAnswer answerQuestion(String question);

  /**
   * Answers a question with caller-supplied retrieval filters.
   *
   * @param question natural-language question
   * @param filters constraints applied to every retrieval, e.g. document ids
   * @return the composed or degraded answer
   * @throws IllegalArgumentException if the question is blank
   */
  FinalAnswer answerQuestion(String question, RetrievalFilters filters);

  /**
   * Chunks, embeds and indexes one document, replacing any earlier version of it.
   *
   * @param document the extracted document
   * @return ingestion summary
   */
  IngestionResult ingestDocument(ExtractedDocument document);

  /**
   * Ingests several documents in parallel; failures are reported per document.
   *
   * @param documents the extracted documents
   * @return one result per document, in input order
   */
  List<IngestionResult> ingestDocuments(List<ExtractedDocument> documents);
}
