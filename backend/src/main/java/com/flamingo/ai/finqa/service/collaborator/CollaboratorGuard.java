package com.flamingo.ai.finqa.service.collaborator;

import com.flamingo.ai.finqa.config.FinQaConfig;
import com.flamingo.ai.finqa.exception.CallInterruptedException;
import com.flamingo.ai.finqa.exception.CollaboratorUnavailableException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Wraps every call to an external collaborator (embedding model, vector index, language model) in
 * a Resilience4j retry with exponential backoff. Exhausted retries surface as {@link
 * CollaboratorUnavailableException} so callers can record an explicit evidence gap.
 */
@Component
@Slf4j
public class CollaboratorGuard {

  public static final String EMBEDDING = "embedding";
  public static final String VECTOR_INDEX = "vector-index";
  public static final String LANGUAGE_MODEL = "language-model";

  private final RetryConfig retryConfig;
  private final MeterRegistry meterRegistry;
  private final Map<String, Retry> retries = new ConcurrentHashMap<>();

  public CollaboratorGuard(FinQaConfig config, MeterRegistry meterRegistry) {
    FinQaConfig.Collaborator settings = config.getCollaborator();
    this.retryConfig =
        RetryConfig.custom()
            .maxAttempts(settings.getMaxAttempts())
            .intervalFunction(
                IntervalFunction.ofExponentialBackoff(
                    Math.max(1L, settings.getInitialBackoff().toMillis()),
                    settings.getBackoffMultiplier()))
            .ignoreExceptions(
                CollaboratorUnavailableException.class, CallInterruptedException.class)
            .build();
    this.meterRegistry = meterRegistry;
  }

  /**
   * Invokes the collaborator, retrying failures with backoff.
   *
   * @param collaborator collaborator name used for logging and metrics
   * @param call the collaborator call
   * @return the call's result
   * @throws CollaboratorUnavailableException when every attempt failed
   * @throws CallInterruptedException when the calling thread is interrupted
   */
  public <T> T call(String collaborator, Supplier<T> call) {
    Retry retry = retries.computeIfAbsent(collaborator, this::createRetry);
    Supplier<T> attempt =
        () -> {
          if (Thread.currentThread().isInterrupted()) {
            throw new CallInterruptedException(collaborator);
          }
          return call.get();
        };
    try {
      return Retry.decorateSupplier(retry, attempt).get();
    } catch (CollaboratorUnavailableException | CallInterruptedException e) {
      throw e;
    } catch (RuntimeException e) {
      // the interrupt flag survives an interrupted backoff sleep
      if (Thread.currentThread().isInterrupted()) {
        throw new CallInterruptedException(collaborator, e);
      }
      int attempts = retry.getRetryConfig().getMaxAttempts();
      log.warn(
          "Collaborator '{}' failed after {} attempt(s): {}",
          collaborator,
          attempts,
          e.getMessage());
      meterRegistry.counter("collaborator.unavailable", "collaborator", collaborator).increment();
      throw new CollaboratorUnavailableException(collaborator, attempts, e);
    }
  }

  /** Void variant of {@link #call(String, Supplier)}. */
  public void run(String collaborator, Runnable call) {
    call(
        collaborator,
        () -> {
          call.run();
          return null;
        });
  }

  private Retry createRetry(String collaborator) {
    Retry retry = Retry.of(collaborator, retryConfig);
    retry
        .getEventPublisher()
        .onRetry(
            event -> {
              log.debug(
                  "Retrying collaborator '{}' (attempt {}) after {}: {}",
                  collaborator,
                  event.getNumberOfRetryAttempts(),
                  event.getWaitInterval(),
                  event.getLastThrowable() != null
                      ? event.getLastThrowable().getMessage()
                      : "unknown error");
              meterRegistry
                  .counter("collaborator.retries", "collaborator", collaborator)
                  .increment();
            });
    return retry;
  }
}
