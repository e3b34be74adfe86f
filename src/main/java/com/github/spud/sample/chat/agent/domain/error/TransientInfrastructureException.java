package com.github.spud.sample.chat.agent.domain.error;

/**
 * An infrastructure dependency was unavailable or too slow. The message that hit it was not
 * processed and is safe to redeliver.
 */
public class TransientInfrastructureException extends RuntimeException {

  public TransientInfrastructureException(String message) {
    super(message);
  }

  public TransientInfrastructureException(String message, Throwable cause) {
    super(message, cause);
  }
}
