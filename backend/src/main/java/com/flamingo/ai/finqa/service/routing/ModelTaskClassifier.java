package com.flamingo.ai.finqa.service.routing;

import com.flamingo.ai.finqa.agent.QueryClassificationAgent;
import com.flamingo.ai.finqa.agent.dto.QueryClassificationResult;
import com.flamingo.ai.finqa.domain.enums.TaskCategory;
import com.flamingo.ai.finqa.exception.CollaboratorUnavailableException;
import com.flamingo.ai.finqa.service.collaborator.CollaboratorGuard;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Language-model fallback for questions no keyword rule recognises. Unusable output or an
 * unavailable model yields an empty set, which the router turns into GENERAL.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ModelTaskClassifier {

  private final QueryClassificationAgent classificationAgent;
  private final CollaboratorGuard guard;
  private final MeterRegistry meterRegistry;

  public Set<TaskCategory> classify(String question) {
    Set<TaskCategory> categories = EnumSet.noneOf(TaskCategory.class);
    QueryClassificationResult result;
    try {
      result =
          guard.call(
              CollaboratorGuard.LANGUAGE_MODEL, () -> classificationAgent.classify(question));
    } catch (CollaboratorUnavailableException e) {
      log.warn("Model classification unavailable, defaulting to general: {}", e.getMessage());
      meterRegistry.counter("routing.model_fallback.unavailable").increment();
      return categories;
    }
    if (result == null || result.categories() == null) {
      log.warn("Model classification returned no categories for question");
      return categories;
    }
    for (String name : result.categories()) {
      if (name == null) {
        continue;
      }
      try {
        categories.add(TaskCategory.valueOf(name.strip().toUpperCase(Locale.ROOT)));
      } catch (IllegalArgumentException e) {
        log.debug("Ignoring unknown category '{}' from model classification", name);
      }
    }
    log.debug("Model classified question as {} ({})", categories, result.reasoning());
    return categories;
  }
}
