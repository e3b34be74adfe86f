package com.github.spud.sample.chat.agent.domain.handler;

import lombok.Builder;
import lombok.Value;

/**
 * What a handler wants sent back to the sender
 */
@Value
@Builder
public class AgentResponse {

  /**
   * Text delivered to the sender, never null
   */
  private String replyText;

  /**
   * A confirmation notification went out while handling this message
   */
  private boolean notificationSent;

  /**
   * Asks the dispatcher to clear the sender's session after replying
   */
  private boolean endSession;

  public static AgentResponse of(String replyText) {
    return AgentResponse.builder().replyText(replyText).build();
  }
}
