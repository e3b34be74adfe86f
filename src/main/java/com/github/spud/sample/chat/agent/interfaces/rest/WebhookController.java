package com.github.spud.sample.chat.agent.interfaces.rest;

import com.github.spud.sample.chat.agent.domain.auth.AgentReplies;
import com.github.spud.sample.chat.agent.domain.dispatch.MessageDispatcher;
import com.github.spud.sample.chat.agent.infrastructure.whatsapp.ReplySender;
import com.github.spud.sample.chat.agent.infrastructure.whatsapp.WhatsAppProperties;
import com.github.spud.sample.chat.agent.interfaces.rest.dto.WebhookPayload;
import com.github.spud.sample.chat.agent.interfaces.rest.dto.WebhookPayload.InboundMessage;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * WhatsApp Cloud API webhook
 */
@Slf4j
@RestController
@RequestMapping("/webhook")
@RequiredArgsConstructor
public class WebhookController {

  static final String LOGOUT_KEYWORD = "logout";

  private final MessageDispatcher dispatcher;
  private final ReplySender replySender;
  private final AgentReplies replies;
  private final WhatsAppProperties whatsAppProperties;

  /**
   * Meta subscription handshake
   */
  @GetMapping
  public ResponseEntity<String> verify(
    @RequestParam(name = "hub.mode", required = false) String mode,
    @RequestParam(name = "hub.verify_token", required = false) String verifyToken,
    @RequestParam(name = "hub.challenge", required = false) String challenge) {
    if ("subscribe".equals(mode) && whatsAppProperties.getVerifyToken().equals(verifyToken)) {
      log.info("Webhook verified successfully");
      return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body(challenge);
    }
    log.warn("Webhook verification failed (bad token or mode)");
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body("Forbidden");
  }

  /**
   * Incoming messages. Messages are handled in payload order; each reply is sent before the next
   * message is routed.
   */
  @PostMapping
  public Mono<Map<String, String>> receive(@RequestBody WebhookPayload payload) {
    return Flux.fromIterable(payload.textMessages())
      .concatMap(message -> Mono.fromCallable(() -> handle(message))
        .subscribeOn(Schedulers.boundedElastic())
        .flatMap(reply -> replySender.send(message.from(), reply)))
      .then(Mono.fromSupplier(() -> Map.of("status", "ok")));
  }

  private String handle(InboundMessage message) {
    log.info("Message from {}: {}", message.from(), StringUtils.truncate(message.text(), 80));
    if (LOGOUT_KEYWORD.equalsIgnoreCase(message.text().trim())) {
      dispatcher.logout(message.from());
      return replies.loggedOut();
    }
    return dispatcher.route(message.from(), message.text());
  }
}
