package com.github.spud.sample.chat.agent.infrastructure.whatsapp;

import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Posts text replies to the Graph API {@code /{phone-number-id}/messages} endpoint.
 * Without an API token replies are only logged.
 */
@Slf4j
@Component
public class WhatsAppReplySender implements ReplySender {

  private final WebClient webClient;
  private final WhatsAppProperties properties;

  public WhatsAppReplySender(WebClient.Builder webClientBuilder, WhatsAppProperties properties) {
    this.webClient = webClientBuilder.baseUrl(properties.getGraphApiBaseUrl()).build();
    this.properties = properties;
  }

  @Override
  public Mono<Void> send(String recipient, String text) {
    if (!StringUtils.hasText(properties.getApiToken())) {
      log.warn("WhatsApp API token not set, reply to {} logged only: {}", recipient, text);
      return Mono.empty();
    }

    Map<String, Object> payload = Map.of(
      "messaging_product", "whatsapp",
      "to", recipient,
      "type", "text",
      "text", Map.of("body", text));

    return webClient.post()
      .uri("/{phoneNumberId}/messages", properties.getPhoneNumberId())
      .headers(headers -> headers.setBearerAuth(properties.getApiToken()))
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue(payload)
      .retrieve()
      .toBodilessEntity()
      .doOnSuccess(response -> log.info("Reply sent to {}", recipient))
      .onErrorResume(e -> {
        log.error("Failed to send reply to {}: {}", recipient, e.getMessage());
        return Mono.empty();
      })
      .then();
  }
}
