package com.github.spud.sample.chat.agent.application.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Agent configuration properties bound from {@code app.*}
 */
@Data
@Component
@ConfigurationProperties(prefix = "app")
public class AgentProperties {

  /**
   * Product name used in replies and confirmation emails
   */
  private String appName = "WhatsApp Agent";

  /**
   * Where rejected senders are sent for help
   */
  private String supportContact = "support@example.com";

  private DirectoryConfig directory = new DirectoryConfig();

  private NotifyConfig notify = new NotifyConfig();

  private SessionConfig session = new SessionConfig();

  private DispatchConfig dispatch = new DispatchConfig();

  @Data
  public static class DirectoryConfig {

    /**
     * Upper bound for a single directory query
     */
    private Duration lookupTimeout = Duration.ofSeconds(3);

    /**
     * Worker threads for directory queries; at most the datasource pool size is useful
     */
    private int lookupThreads = 10;

    /**
     * Insert the demo customers on startup when the directory is empty
     */
    private boolean seedDemoData = false;
  }

  @Data
  public static class NotifyConfig {

    /**
     * Notifier implementation: log | email
     */
    private String mode = "log";

    /**
     * Upper bound for a single notification attempt
     */
    private Duration timeout = Duration.ofSeconds(5);

    /**
     * Worker threads for notification sends
     */
    private int threads = 4;

    /**
     * Sender address of confirmation emails
     */
    private String from = "no-reply@example.com";
  }

  @Data
  public static class SessionConfig {

    /**
     * Session store implementation: memory | jpa
     */
    private String store = "memory";

    /**
     * Idle time after which a session is discarded. Unset means sessions never expire.
     */
    private Duration ttl;
  }

  @Data
  public static class DispatchConfig {

    /**
     * Task handler that receives verified traffic without an explicit command
     */
    private String defaultHandler = "help";

    /**
     * Prefix that marks a message as a command, e.g. {@code /profile}
     */
    private String commandPrefix = "/";
  }
}
