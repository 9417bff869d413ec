package com.flamingo.ai.finqa.exception;

/**
 * Thrown when the thread making a collaborator call was interrupted, typically because the
 * question deadline passed and the sub-query was cancelled. Never retried.
 */
public class CallInterruptedException extends RuntimeException {

  private final String collaborator;

  public CallInterruptedException(String collaborator) {
    this(collaborator, null);
  }

  public CallInterruptedException(String collaborator, Throwable cause) {
    super("Call to '" + collaborator + "' was interrupted", cause);
    this.collaborator = collaborator;
  }

  public String getCollaborator() {
    return collaborator;
  }
}
