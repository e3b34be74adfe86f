package com.github.spud.sample.chat.agent.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class EmailMaskerTest {

  @ParameterizedTest
  @CsvSource({
    "john@example.com, j***n@example.com",
    "carol.davis@globex.com, c***s@globex.com",
    "ab@example.com, a***@example.com",
    "x@example.com, x***@example.com"
  })
  void masksLocalPart(String email, String expected) {
    assertThat(EmailMasker.mask(email)).isEqualTo(expected);
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"   ", "not-an-email", "@example.com"})
  void unusableInputIsFullyMasked(String email) {
    assertThat(EmailMasker.mask(email)).isEqualTo("***");
  }

  @Test
  void keepsDomainVisible() {
    assertThat(EmailMasker.mask("support@acme.example")).endsWith("@acme.example");
  }
}
