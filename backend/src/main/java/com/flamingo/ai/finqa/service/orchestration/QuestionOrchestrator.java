package com.flamingo.ai.finqa.service.orchestration;

import com.flamingo.ai.finqa.config.FinQaConfig;
import com.flamingo.ai.finqa.domain.enums.EvidenceGap;
import com.flamingo.ai.finqa.domain.model.FinalAnswer;
import com.flamingo.ai.finqa.domain.model.PartialAnswer;
import com.flamingo.ai.finqa.domain.model.RetrievalFilters;
import com.flamingo.ai.finqa.domain.model.SubQuery;
import com.flamingo.ai.finqa.exception.AgentParseException;
import com.flamingo.ai.finqa.exception.CallInterruptedException;
import com.flamingo.ai.finqa.exception.CollaboratorUnavailableException;
import com.flamingo.ai.finqa.service.agents.AgentRegistry;
import com.flamingo.ai.finqa.service.agents.SpecializedAgent;
import com.flamingo.ai.finqa.service.routing.QueryRouter;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs one question end to end: routing, concurrent agent invocation, confidence validation and
 * aggregation.
 *
 * <p>Sub-queries of one round run concurrently on the sub-query executor and are awaited against a
 * single question deadline. A sub-query still running at the deadline is interrupted and reported
 * with a TIMEOUT gap; agent failures never escape as exceptions.
 */
@Service
@Slf4j
public class QuestionOrchestrator {

  private final QueryRouter queryRouter;
  private final AgentRegistry agentRegistry;
  private final ConfidenceValidator confidenceValidator;
  private final AnswerAggregator answerAggregator;
  private final FinQaConfig config;
  private final Executor subQueryExecutor;
  private final MeterRegistry meterRegistry;

  public QuestionOrchestrator(
      QueryRouter queryRouter,
      AgentRegistry agentRegistry,
      ConfidenceValidator confidenceValidator,
      AnswerAggregator answerAggregator,
      FinQaConfig config,
      @Qualifier("subQueryExecutor") Executor subQueryExecutor,
      MeterRegistry meterRegistry) {
    this.queryRouter = queryRouter;
    this.agentRegistry = agentRegistry;
    this.confidenceValidator = confidenceValidator;
    this.answerAggregator = answerAggregator;
    this.config = config;
    this.subQueryExecutor = subQueryExecutor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Answers a question. Always returns a {@link FinalAnswer}; missing evidence shows up as a
   * DEGRADED status with caveats.
   *
   * @param question natural-language question
   * @param filters caller-supplied retrieval filters
   */
  @Timed(value = "question.answer", description = "Time to answer one question")
  public FinalAnswer answer(String question, RetrievalFilters filters) {
    String questionId = UUID.randomUUID().toString();
    long deadline = System.nanoTime() + config.getOrchestration().getQuestionTimeout().toNanos();

    List<SubQuery> subQueries = queryRouter.route(questionId, question, filters);
    log.info(
        "Question {} routed to {}",
        questionId,
        subQueries.stream().map(SubQuery::category).toList());

    BatchInvoker invoker = batch -> invokeAll(batch, deadline);
    ValidationPolicy policy = ValidationPolicy.from(config.getValidation());
    ValidationOutcome outcome =
        confidenceValidator.validate(subQueries, invoker.invoke(subQueries), policy, invoker);
    FinalAnswer answer = answerAggregator.aggregate(question, outcome, policy);

    meterRegistry.counter("question.answers", "status", answer.status().name()).increment();
    if (outcome.timedOut()) {
      meterRegistry.counter("question.timeouts").increment();
    }
    log.info(
        "Question {} finished {} with confidence {} after {} retries",
        questionId,
        answer.status(),
        String.format("%.2f", answer.confidence()),
        answer.retryCount());
    return answer;
  }

  private List<PartialAnswer> invokeAll(List<SubQuery> subQueries, long deadline) {
    List<FutureTask<PartialAnswer>> tasks = new ArrayList<>();
    for (SubQuery subQuery : subQueries) {
      SpecializedAgent agent = agentRegistry.forCategory(subQuery.category());
      FutureTask<PartialAnswer> task = new FutureTask<>(() -> agent.answer(subQuery));
      try {
        subQueryExecutor.execute(task);
        tasks.add(task);
      } catch (RejectedExecutionException e) {
        log.warn("No worker free for sub-query {}: {}", subQuery.id(), e.getMessage());
        meterRegistry.counter("subquery.rejections").increment();
        tasks.add(null);
      }
    }
    List<PartialAnswer> answers = new ArrayList<>();
    for (int i = 0; i < subQueries.size(); i++) {
      FutureTask<PartialAnswer> task = tasks.get(i);
      answers.add(
          task == null
              ? PartialAnswer.insufficient(
                  subQueries.get(i),
                  EvidenceGap.COLLABORATOR_UNAVAILABLE,
                  "no sub-query worker was free")
              : await(subQueries.get(i), task, deadline));
    }
    return answers;
  }

  private PartialAnswer await(SubQuery subQuery, FutureTask<PartialAnswer> task, long deadline) {
    long remaining = deadline - System.nanoTime();
    try {
      PartialAnswer answer = task.get(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
      if (answer == null) {
        return PartialAnswer.insufficient(
            subQuery, EvidenceGap.AGENT_PARSE_FAILURE, "the agent returned no answer");
      }
      return answer;
    } catch (TimeoutException e) {
      task.cancel(true);
      log.warn("Sub-query {} timed out at the question deadline", subQuery.id());
      return PartialAnswer.insufficient(
          subQuery, EvidenceGap.TIMEOUT, EvidenceGap.TIMEOUT.getDescription());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      task.cancel(true);
      return PartialAnswer.insufficient(
          subQuery, EvidenceGap.TIMEOUT, "the question was interrupted");
    } catch (ExecutionException e) {
      return failed(subQuery, e.getCause() != null ? e.getCause() : e);
    }
  }

  private PartialAnswer failed(SubQuery subQuery, Throwable cause) {
    if (cause instanceof CallInterruptedException) {
      return PartialAnswer.insufficient(
          subQuery, EvidenceGap.TIMEOUT, "the sub-query was cancelled");
    }
    if (cause instanceof CollaboratorUnavailableException unavailable) {
      log.warn("Sub-query {} lost collaborator {}", subQuery.id(), unavailable.getCollaborator());
      return PartialAnswer.insufficient(
          subQuery,
          EvidenceGap.COLLABORATOR_UNAVAILABLE,
          "the " + unavailable.getCollaborator() + " service is unavailable");
    }
    if (cause instanceof AgentParseException) {
      log.warn("Sub-query {} could not be parsed: {}", subQuery.id(), cause.getMessage());
      return PartialAnswer.insufficient(
          subQuery, EvidenceGap.AGENT_PARSE_FAILURE, cause.getMessage());
    }
    log.error("Agent for sub-query {} failed", subQuery.id(), cause);
    meterRegistry.counter("agent.failures", "category", subQuery.category().name()).increment();
    return PartialAnswer.insufficient(
        subQuery, EvidenceGap.AGENT_PARSE_FAILURE, "the agent failed unexpectedly");
  }
}
