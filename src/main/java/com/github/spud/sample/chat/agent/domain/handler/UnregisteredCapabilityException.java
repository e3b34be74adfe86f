package com.github.spud.sample.chat.agent.domain.handler;

import lombok.Getter;

@Getter
public class UnregisteredCapabilityException extends RuntimeException {

  private final String capability;

  public UnregisteredCapabilityException(String capability) {
    super("No task handler registered for: " + capability);
    this.capability = capability;
  }
}
