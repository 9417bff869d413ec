package com.flamingo.ai.finqa.exception;

/** Thrown when an agent cannot read the figures or statements it needs from retrieved chunks. */
public class AgentParseException extends RuntimeException {

  public AgentParseException(String message) {
    super(message);
  }
}
