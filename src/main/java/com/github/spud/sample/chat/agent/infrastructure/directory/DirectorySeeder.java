package com.github.spud.sample.chat.agent.infrastructure.directory;

import com.github.spud.sample.chat.agent.infrastructure.persistence.entity.DirectoryUserEntity;
import com.github.spud.sample.chat.agent.infrastructure.persistence.repository.DirectoryUserRepository;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Inserts demo customers into an empty directory, for local runs
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.directory.seed-demo-data", havingValue = "true")
public class DirectorySeeder implements CommandLineRunner {

  private final DirectoryUserRepository repository;

  @Override
  @Transactional
  public void run(String... args) {
    if (repository.count() > 0) {
      log.info("Directory already populated, skipping demo seed");
      return;
    }
    List<DirectoryUserEntity> users = List.of(
      user("U1", "acme_corp", "ACME-1001", "Alice Johnson", "+15551234567", "alice@example.com"),
      user("U2", "acme_corp", "ACME-1002", "Bob Smith", "+15559876543", "bob@example.com"),
      user("U3", "globex_inc", "GLX-2001", "Carol Davis", "+442071234567", "carol@example.com"),
      user("U4", "globex_inc", "GLX-2002", "Dan Wilson", "+919876543210", "dan@example.com"));
    repository.saveAll(users);
    log.info("Seeded {} demo users into the directory", users.size());
  }

  static DirectoryUserEntity user(String userId, String companyId, String clientCode, String name,
    String phone, String email) {
    DirectoryUserEntity entity = new DirectoryUserEntity();
    entity.setUserId(userId);
    entity.setCompanyId(companyId);
    entity.setClientCode(clientCode);
    entity.setName(name);
    entity.setPhone(phone);
    entity.setEmail(email);
    entity.setActive(true);
    return entity;
  }
}
