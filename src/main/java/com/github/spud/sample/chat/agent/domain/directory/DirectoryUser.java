package com.github.spud.sample.chat.agent.domain.directory;

import lombok.Builder;
import lombok.Value;

/**
 * Customer identity as resolved from the directory. Read-only for this service.
 */
@Value
@Builder
public class DirectoryUser {

  /**
   * Opaque unique identifier
   */
  private String userId;

  /**
   * Canonical address, unique across all users
   */
  private String phone;

  /**
   * Company-issued fallback identifier, matched case-sensitively
   */
  private String clientCode;

  /**
   * Tenant grouping, informational only
   */
  private String companyId;

  private String name;

  private String email;
}
