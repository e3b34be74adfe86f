package com.github.spud.sample.chat.agent.infrastructure.persistence.entity;

import com.github.spud.sample.chat.agent.domain.directory.DirectoryUser;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.OffsetDateTime;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.CreationTimestamp;

/**
 * Customer directory row. Provisioned externally; this service only reads it.
 */
@Getter
@Setter
@Entity
@Table(name = "directory_user", indexes = {
  @Index(name = "ix_directory_user_company_id", columnList = "company_id")
})
public class DirectoryUserEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "id", nullable = false)
  private Long id;

  @Size(max = 64)
  @NotNull
  @Column(name = "user_id", nullable = false, unique = true, length = 64)
  private String userId;

  @Size(max = 64)
  @NotNull
  @Column(name = "company_id", nullable = false, length = 64)
  private String companyId;

  @Size(max = 128)
  @NotNull
  @Column(name = "client_code", nullable = false, unique = true, length = 128)
  private String clientCode;

  @Size(max = 256)
  @NotNull
  @Column(name = "name", nullable = false, length = 256)
  private String name;

  @Size(max = 32)
  @NotNull
  @Column(name = "phone", nullable = false, unique = true, length = 32)
  private String phone;

  @Size(max = 256)
  @NotNull
  @Column(name = "email", nullable = false, length = 256)
  private String email;

  @NotNull
  @ColumnDefault("true")
  @Column(name = "active", nullable = false)
  private boolean active = true;

  @ColumnDefault("now()")
  @CreationTimestamp
  @Column(name = "created_at")
  private OffsetDateTime createdAt;

  public DirectoryUser toDomain() {
    return DirectoryUser.builder()
      .userId(userId)
      .phone(phone)
      .clientCode(clientCode)
      .companyId(companyId)
      .name(name)
      .email(email)
      .build();
  }
}
