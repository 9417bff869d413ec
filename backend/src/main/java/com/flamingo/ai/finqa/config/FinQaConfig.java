package com.flamingo.ai.finqa.config;

import com.flamingo.ai.finqa.domain.enums.AggregationPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for ingestion, retrieval and question orchestration. */
@Configuration
@ConfigurationProperties(prefix = "finqa")
@Validated
@Getter
@Setter
public class FinQaConfig {

  @Valid private Chunking chunking = new Chunking();
  @Valid private Retrieval retrieval = new Retrieval();
  @Valid private Routing routing = new Routing();
  @Valid private Validation validation = new Validation();
  @Valid private Collaborator collaborator = new Collaborator();
  @Valid private Orchestration orchestration = new Orchestration();
  @Valid private Agents agents = new Agents();

  @Getter
  @Setter
  public static class Chunking {
    /** Chunks below this size are merged with a neighbour when allowed. */
    @Min(1)
    private int lowerTokens = 200;

    /** Narrative chunks are split at sentence ends before exceeding this size. */
    @Min(2)
    private int upperTokens = 500;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int defaultTopK = 8;

    /** Hard cap on topK regardless of what callers ask for. */
    @Min(1)
    @Max(100)
    private int maxTopK = 20;

    /** Candidates scoring below this are treated as no evidence. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double similarityFloor = 0.35;

    /** Serialize vector index calls when the collaborator is unsafe for concurrent use. */
    private boolean serializeCalls = false;
  }

  @Getter
  @Setter
  public static class Routing {
    /**
     * Fiscal year assumed by comparisons that name no year. 0 derives it from the clock (previous
     * calendar year).
     */
    private int referenceFiscalYear = 0;

    /** Whether unmatched questions are classified by the language model. */
    private boolean modelFallbackEnabled = true;
  }

  @Getter
  @Setter
  public static class Validation {
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double confidenceThreshold = 0.6;

    /** Retries per sub-query after the initial attempt. */
    @Min(0)
    private int maxRetries = 2;

    private AggregationPolicy aggregation = AggregationPolicy.MINIMUM;
  }

  @Getter
  @Setter
  public static class Collaborator {
    /** Total attempts per collaborator call, including the first. */
    @Min(1)
    private int maxAttempts = 3;

    private Duration initialBackoff = Duration.ofMillis(200);

    @DecimalMin("1.0")
    private double backoffMultiplier = 2.0;
  }

  @Getter
  @Setter
  public static class Orchestration {
    private Duration questionTimeout = Duration.ofSeconds(60);
  }

  @Getter
  @Setter
  public static class Agents {
    /** Chunks handed to the language model when drafting an answer. */
    @Min(1)
    private int maxEvidenceChunks = 5;

    /** Whether the risk agent asks the language model to summarise extracted statements. */
    private boolean draftRiskSummaries = false;

    /** Whether answers built from several agents are merged by the language model. */
    private boolean synthesizeAnswers = true;
  }
}
