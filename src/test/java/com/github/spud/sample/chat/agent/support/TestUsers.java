package com.github.spud.sample.chat.agent.support;

import com.github.spud.sample.chat.agent.domain.directory.DirectoryUser;

/**
 * Directory fixtures shared by the tests
 */
public final class TestUsers {

  public static final DirectoryUser ALICE = DirectoryUser.builder()
    .userId("U1")
    .phone("+15551234567")
    .clientCode("ACME-1001")
    .companyId("acme_corp")
    .name("Alice Johnson")
    .email("alice@example.com")
    .build();

  public static final DirectoryUser CAROL = DirectoryUser.builder()
    .userId("U3")
    .phone("+442071234567")
    .clientCode("GLX-2001")
    .companyId("globex_inc")
    .name("Carol Davis")
    .email("carol@example.com")
    .build();

  public static final String UNKNOWN_PHONE = "+19999999999";

  private TestUsers() {
  }
}
