package com.github.spud.sample.chat.agent.infrastructure.persistence.entity;

import com.github.spud.sample.chat.agent.domain.session.Session;
import com.github.spud.sample.chat.agent.domain.state.AuthState;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.time.OffsetDateTime;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.CreationTimestamp;

@Getter
@Setter
@Entity
@Table(name = "chat_session")
public class ChatSessionEntity {

  @Id
  @Size(max = 64)
  @Column(name = "sender_address", nullable = false, length = 64)
  private String senderAddress;

  @NotNull
  @ColumnDefault("'UNVERIFIED'")
  @Column(name = "auth_state", nullable = false, length = 32)
  @Enumerated(EnumType.STRING)
  private AuthState authState = AuthState.UNVERIFIED;

  @Size(max = 64)
  @Column(name = "user_id", length = 64)
  private String userId;

  @NotNull
  @Column(name = "last_updated", nullable = false)
  private Instant lastUpdated;

  @ColumnDefault("now()")
  @CreationTimestamp
  @Column(name = "created_at", updatable = false)
  private OffsetDateTime createdAt;

  public static ChatSessionEntity fromDomain(Session session) {
    ChatSessionEntity entity = new ChatSessionEntity();
    entity.setSenderAddress(session.getSenderAddress());
    entity.setAuthState(session.getAuthState());
    entity.setUserId(session.getUserId());
    entity.setLastUpdated(session.getLastUpdated());
    return entity;
  }

  /**
   * Rows are mapped as found; an inconsistent row is left for the dispatcher to detect
   */
  public Session toDomain() {
    return Session.builder()
      .senderAddress(senderAddress)
      .authState(authState)
      .userId(userId)
      .lastUpdated(lastUpdated)
      .build();
  }
}
