package com.github.spud.sample.chat.agent.infrastructure.whatsapp;

import reactor.core.publisher.Mono;

/**
 * Outbound delivery of reply texts. Delivery failures are logged, never signalled.
 */
public interface ReplySender {

  Mono<Void> send(String recipient, String text);
}
