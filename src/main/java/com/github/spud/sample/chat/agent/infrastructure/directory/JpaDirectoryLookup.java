package com.github.spud.sample.chat.agent.infrastructure.directory;

import com.github.spud.sample.chat.agent.application.config.AgentProperties;
import com.github.spud.sample.chat.agent.application.config.SchedulerConfig;
import com.github.spud.sample.chat.agent.domain.directory.DirectoryLookup;
import com.github.spud.sample.chat.agent.domain.directory.DirectoryUnavailableException;
import com.github.spud.sample.chat.agent.domain.directory.DirectoryUser;
import com.github.spud.sample.chat.agent.infrastructure.persistence.entity.DirectoryUserEntity;
import com.github.spud.sample.chat.agent.infrastructure.persistence.repository.DirectoryUserRepository;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Directory lookups against the {@code directory_user} table.
 * <p>
 * Each query runs on the dedicated directory scheduler under {@code app.directory.lookup-timeout}.
 * Timeouts and database errors become {@link DirectoryUnavailableException}. Inactive users are
 * invisible.
 */
@Slf4j
@Component
public class JpaDirectoryLookup implements DirectoryLookup {

  private final DirectoryUserRepository repository;
  private final AgentProperties properties;
  private final Scheduler scheduler;

  public JpaDirectoryLookup(DirectoryUserRepository repository, AgentProperties properties,
    @Qualifier(SchedulerConfig.DIRECTORY_SCHEDULER) Scheduler scheduler) {
    this.repository = repository;
    this.properties = properties;
    this.scheduler = scheduler;
  }

  @Override
  public Optional<DirectoryUser> findByPhone(String phone) {
    List<DirectoryUserEntity> matches = query("phone",
      () -> repository.findAllByPhoneAndActiveTrue(phone));
    if (matches == null || matches.isEmpty()) {
      return Optional.empty();
    }
    if (matches.size() > 1) {
      // phone is unique by contract; an ambiguous match must not pick a user
      log.warn("Phone {} matches {} active users, ignoring the phone match", phone,
        matches.size());
      return Optional.empty();
    }
    return Optional.of(matches.get(0).toDomain());
  }

  @Override
  public Optional<DirectoryUser> findByClientCode(String clientCode) {
    return Optional.ofNullable(query("client code",
        () -> repository.findByClientCodeAndActiveTrue(clientCode).orElse(null)))
      .map(DirectoryUserEntity::toDomain);
  }

  @Override
  public Optional<DirectoryUser> findByUserId(String userId) {
    return Optional.ofNullable(query("user id",
        () -> repository.findByUserIdAndActiveTrue(userId).orElse(null)))
      .map(DirectoryUserEntity::toDomain);
  }

  private <T> T query(String key, Callable<T> query) {
    try {
      return Mono.fromCallable(query)
        .subscribeOn(scheduler)
        .timeout(properties.getDirectory().getLookupTimeout())
        .block();
    } catch (RuntimeException e) {
      log.error("Directory lookup by {} failed: {}", key, e.getMessage());
      throw new DirectoryUnavailableException("Directory lookup by " + key + " failed", e);
    }
  }
}
