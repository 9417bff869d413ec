package com.flamingo.ai.finqa.exception;

/**
 * Thrown when an external collaborator (embedding model, vector index, language model) keeps
 * failing after the configured retries.
 */
public class CollaboratorUnavailableException extends RuntimeException {

  private final String collaborator;
  private final int attempts;
  private final String userMessage;

  public CollaboratorUnavailableException(String collaborator, int attempts, Throwable cause) {
    super(
        "Collaborator '"
            + collaborator
            + "' unavailable after "
            + attempts
            + " attempt(s): "
            + (cause != null ? cause.getMessage() : "unknown error"),
        cause);
    this.collaborator = collaborator;
    this.attempts = attempts;
    this.userMessage =
        "The " + collaborator + " service is temporarily unavailable. Please try again later.";
  }

  public String getCollaborator() {
    return collaborator;
  }

  public int getAttempts() {
    return attempts;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
