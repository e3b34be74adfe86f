package com.github.spud.sample.chat.agent.domain.directory;

import com.github.spud.sample.chat.agent.domain.error.TransientInfrastructureException;

/**
 * The directory could not answer. Never means "no such user".
 */
public class DirectoryUnavailableException extends TransientInfrastructureException {

  public DirectoryUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
