package com.github.spud.sample.chat.agent.domain.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.github.spud.sample.chat.agent.application.config.AgentProperties;
import com.github.spud.sample.chat.agent.domain.directory.DirectoryLookup;
import com.github.spud.sample.chat.agent.domain.directory.DirectoryUnavailableException;
import com.github.spud.sample.chat.agent.domain.notify.Notifier;
import com.github.spud.sample.chat.agent.domain.session.Session;
import com.github.spud.sample.chat.agent.domain.state.AuthState;
import com.github.spud.sample.chat.agent.domain.state.AuthStateMachineDriver;
import com.github.spud.sample.chat.agent.domain.state.AuthStateMachineFactory;
import com.github.spud.sample.chat.agent.support.TestUsers;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AuthenticationHandlerTest {

  @Mock
  private DirectoryLookup directoryLookup;

  @Mock
  private Notifier notifier;

  private AuthenticationHandler handler;

  @BeforeEach
  void setUp() {
    AgentProperties properties = new AgentProperties();
    properties.setSupportContact("support@example.com");
    handler = new AuthenticationHandler(directoryLookup, notifier,
      new AuthStateMachineDriver(new AuthStateMachineFactory()), new AgentReplies(properties));
  }

  @Test
  @DisplayName("Known phone verifies silently")
  void knownPhoneVerifies() {
    when(directoryLookup.findByPhone("+15551234567")).thenReturn(Optional.of(TestUsers.ALICE));

    AuthResult result = handler.authenticate("Hi", Session.initial("+15551234567"));

    assertThat(result.session().getAuthState()).isEqualTo(AuthState.VERIFIED);
    assertThat(result.session().getUserId()).isEqualTo("U1");
    assertThat(result.response().getReplyText()).contains("verified").contains("Alice Johnson");
    assertThat(result.response().isNotificationSent()).isFalse();
    verifyNoInteractions(notifier);
    verify(directoryLookup, never()).findByClientCode(anyString());
  }

  @Test
  @DisplayName("Unknown phone asks for the client code")
  void unknownPhoneAsksForClientCode() {
    when(directoryLookup.findByPhone(TestUsers.UNKNOWN_PHONE)).thenReturn(Optional.empty());

    AuthResult result = handler.authenticate("Hello", Session.initial(TestUsers.UNKNOWN_PHONE));

    assertThat(result.session().getAuthState()).isEqualTo(AuthState.AWAITING_CLIENT_CODE);
    assertThat(result.session().getUserId()).isNull();
    assertThat(result.response().getReplyText()).contains("Client Code");
  }

  @Test
  @DisplayName("Valid client code verifies and sends one confirmation")
  void validClientCodeVerifiesAndNotifies() {
    when(directoryLookup.findByClientCode("GLX-2001")).thenReturn(Optional.of(TestUsers.CAROL));
    when(notifier.sendConfirmation(TestUsers.CAROL)).thenReturn(true);

    AuthResult result = handler.authenticate("GLX-2001", awaiting());

    assertThat(result.session().getAuthState()).isEqualTo(AuthState.VERIFIED);
    assertThat(result.session().getUserId()).isEqualTo("U3");
    assertThat(result.response().isNotificationSent()).isTrue();
    assertThat(result.response().getReplyText())
      .contains("Carol Davis")
      .contains("confirmation email")
      .contains("c***l@example.com");
    verify(notifier, times(1)).sendConfirmation(TestUsers.CAROL);
    verify(directoryLookup, never()).findByPhone(anyString());
  }

  @Test
  void clientCodeIsTrimmed() {
    when(directoryLookup.findByClientCode("GLX-2001")).thenReturn(Optional.of(TestUsers.CAROL));
    when(notifier.sendConfirmation(any())).thenReturn(true);

    AuthResult result = handler.authenticate("  GLX-2001 \n", awaiting());

    assertThat(result.session().isVerified()).isTrue();
  }

  @Test
  @DisplayName("Invalid client code rejects with support contact")
  void invalidClientCodeRejects() {
    when(directoryLookup.findByClientCode("INVALID")).thenReturn(Optional.empty());

    AuthResult result = handler.authenticate("INVALID", awaiting());

    assertThat(result.session().getAuthState()).isEqualTo(AuthState.REJECTED);
    assertThat(result.session().getUserId()).isNull();
    assertThat(result.response().getReplyText())
      .contains("couldn't verify your identity")
      .contains("support@example.com");
    verifyNoInteractions(notifier);
  }

  @Test
  void blankClientCodeAsksAgainWithoutTransition() {
    Session awaiting = awaiting();

    AuthResult result = handler.authenticate("   ", awaiting);

    assertThat(result.session()).isSameAs(awaiting);
    assertThat(result.response().getReplyText()).contains("Client Code");
    verifyNoInteractions(directoryLookup);
  }

  @Test
  @DisplayName("Failed notification does not undo verification")
  void undeliveredNotificationKeepsVerification() {
    when(directoryLookup.findByClientCode("GLX-2001")).thenReturn(Optional.of(TestUsers.CAROL));
    when(notifier.sendConfirmation(TestUsers.CAROL)).thenReturn(false);

    AuthResult result = handler.authenticate("GLX-2001", awaiting());

    assertThat(result.session().isVerified()).isTrue();
    assertThat(result.response().isNotificationSent()).isFalse();
    assertThat(result.response().getReplyText()).doesNotContain("confirmation email");
  }

  @Test
  void throwingNotifierKeepsVerification() {
    when(directoryLookup.findByClientCode("GLX-2001")).thenReturn(Optional.of(TestUsers.CAROL));
    when(notifier.sendConfirmation(TestUsers.CAROL))
      .thenThrow(new IllegalStateException("smtp down"));

    AuthResult result = handler.authenticate("GLX-2001", awaiting());

    assertThat(result.session().isVerified()).isTrue();
    assertThat(result.response().isNotificationSent()).isFalse();
  }

  @Test
  @DisplayName("Directory outage propagates instead of rejecting")
  void directoryOutagePropagates() {
    when(directoryLookup.findByClientCode("GLX-2001"))
      .thenThrow(new DirectoryUnavailableException("down", new TimeoutException()));

    assertThatThrownBy(() -> handler.authenticate("GLX-2001", awaiting()))
      .isInstanceOf(DirectoryUnavailableException.class);
    verifyNoInteractions(notifier);
  }

  @Test
  void rejectedSenderStaysRejected() {
    Session rejected = Session.initial(TestUsers.UNKNOWN_PHONE)
      .transitionTo(AuthState.REJECTED, null);

    AuthResult result = handler.authenticate("GLX-2001", rejected);

    assertThat(result.session()).isSameAs(rejected);
    assertThat(result.response().getReplyText()).contains("couldn't verify");
    verifyNoInteractions(directoryLookup, notifier);
  }

  @Test
  void verifiedSenderIsNotLookedUpAgain() {
    Session verified = Session.initial("+15551234567").transitionTo(AuthState.VERIFIED, "U1");

    AuthResult result = handler.authenticate("Hi", verified);

    assertThat(result.session()).isSameAs(verified);
    verifyNoInteractions(directoryLookup, notifier);
  }

  @Test
  @DisplayName("Same message against the same state repeats the same transition")
  void sameInputSameOutcome() {
    when(directoryLookup.findByClientCode("INVALID")).thenReturn(Optional.empty());
    Session awaiting = awaiting();

    AuthResult first = handler.authenticate("INVALID", awaiting);
    AuthResult second = handler.authenticate("INVALID", awaiting);

    assertThat(second.session().getAuthState()).isEqualTo(first.session().getAuthState());
    assertThat(second.response().getReplyText()).isEqualTo(first.response().getReplyText());
  }

  @Test
  void handleExposesOnlyTheReply() {
    when(directoryLookup.findByPhone("+15551234567")).thenReturn(Optional.of(TestUsers.ALICE));

    assertThat(handler.name()).isEqualTo("auth");
    assertThat(handler.handle("Hi", Session.initial("+15551234567")).getReplyText())
      .contains("Welcome back");
  }

  private static Session awaiting() {
    return Session.initial(TestUsers.UNKNOWN_PHONE)
      .transitionTo(AuthState.AWAITING_CLIENT_CODE, null);
  }
}
