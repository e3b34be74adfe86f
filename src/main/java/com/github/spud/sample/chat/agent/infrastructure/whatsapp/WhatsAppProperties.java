package com.github.spud.sample.chat.agent.infrastructure.whatsapp;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * WhatsApp Business Cloud API settings
 */
@Component
@Getter
public class WhatsAppProperties {

  @Value("${app.whatsapp.verify-token:changeme}")
  private String verifyToken;

  @Value("${app.whatsapp.api-token:}")
  private String apiToken;

  @Value("${app.whatsapp.phone-number-id:}")
  private String phoneNumberId;

  @Value("${app.whatsapp.graph-api-base-url:https://graph.facebook.com/v21.0}")
  private String graphApiBaseUrl;
}
