package com.github.spud.sample.chat.agent.domain.session;

import com.github.spud.sample.chat.agent.domain.error.TransientInfrastructureException;

public class SessionStoreException extends TransientInfrastructureException {

  public SessionStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
