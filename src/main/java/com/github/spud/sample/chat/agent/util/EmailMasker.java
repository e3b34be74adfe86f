package com.github.spud.sample.chat.agent.util;

import org.springframework.util.StringUtils;

/**
 * Masks email addresses for replies and logs: {@code john@example.com -> j***n@example.com}
 */
public final class EmailMasker {

  private static final String MASK = "***";

  private EmailMasker() {
  }

  public static String mask(String email) {
    if (!StringUtils.hasText(email)) {
      return MASK;
    }
    int at = email.lastIndexOf('@');
    if (at <= 0) {
      return MASK;
    }
    String local = email.substring(0, at);
    String domain = email.substring(at + 1);
    String maskedLocal = local.length() <= 2
      ? local.charAt(0) + MASK
      : local.charAt(0) + MASK + local.charAt(local.length() - 1);
    return maskedLocal + "@" + domain;
  }
}
