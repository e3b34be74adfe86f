package com.github.spud.sample.chat.agent.infrastructure.persistence.repository;

import com.github.spud.sample.chat.agent.infrastructure.persistence.entity.DirectoryUserEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DirectoryUserRepository extends JpaRepository<DirectoryUserEntity, Long> {

  List<DirectoryUserEntity> findAllByPhoneAndActiveTrue(String phone);

  Optional<DirectoryUserEntity> findByClientCodeAndActiveTrue(String clientCode);

  Optional<DirectoryUserEntity> findByUserIdAndActiveTrue(String userId);
}
