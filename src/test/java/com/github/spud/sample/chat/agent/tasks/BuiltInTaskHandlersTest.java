package com.github.spud.sample.chat.agent.tasks;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.spud.sample.chat.agent.application.config.AgentProperties;
import com.github.spud.sample.chat.agent.domain.auth.AgentReplies;
import com.github.spud.sample.chat.agent.domain.handler.AgentResponse;
import com.github.spud.sample.chat.agent.domain.handler.TaskHandlerRegistry;
import com.github.spud.sample.chat.agent.domain.session.Session;
import com.github.spud.sample.chat.agent.domain.state.AuthState;
import com.github.spud.sample.chat.agent.support.InMemoryDirectoryLookup;
import com.github.spud.sample.chat.agent.support.TestUsers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BuiltInTaskHandlersTest {

  private final Session alice = Session.initial("+15551234567")
    .transitionTo(AuthState.VERIFIED, "U1");

  private AgentProperties properties;
  private TaskHandlerRegistry registry;
  private InMemoryDirectoryLookup directory;

  @BeforeEach
  void setUp() {
    properties = new AgentProperties();
    properties.setAppName("Acme Support");
    registry = new TaskHandlerRegistry();
    directory = new InMemoryDirectoryLookup().add(TestUsers.ALICE);
    registry.register(new HelpTaskHandler(registry, properties));
    registry.register(new ProfileTaskHandler(directory));
    registry.register(new LogoutTaskHandler(new AgentReplies(properties)));
  }

  @Test
  void helpListsEveryRegisteredCommand() {
    String reply = registry.require("help").handle("anything", alice).getReplyText();

    assertThat(reply)
      .contains("Acme Support")
      .contains("*/help* - show this list")
      .contains("*/profile* - show the account you are verified as")
      .contains("*/logout* - end your session");
  }

  @Test
  void profileShowsMaskedEmail() {
    String reply = registry.require("profile").handle("/profile", alice).getReplyText();

    assertThat(reply)
      .contains("Alice Johnson")
      .contains("acme_corp")
      .contains("ACME-1001")
      .contains("a***e@example.com")
      .doesNotContain("alice@example.com");
  }

  @Test
  void profileOfVanishedUserDegradesGracefully() {
    Session ghost = Session.initial("+15550000000").transitionTo(AuthState.VERIFIED, "U404");

    AgentResponse response = registry.require("profile").handle("/profile", ghost);

    assertThat(response.getReplyText()).contains("couldn't load");
    assertThat(response.isEndSession()).isFalse();
  }

  @Test
  void logoutEndsTheSession() {
    AgentResponse response = registry.require("logout").handle("/logout", alice);

    assertThat(response.isEndSession()).isTrue();
    assertThat(response.getReplyText()).contains("logged out");
  }
}
