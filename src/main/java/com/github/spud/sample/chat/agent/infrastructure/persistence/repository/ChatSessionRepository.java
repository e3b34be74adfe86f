package com.github.spud.sample.chat.agent.infrastructure.persistence.repository;

import com.github.spud.sample.chat.agent.infrastructure.persistence.entity.ChatSessionEntity;
import java.time.Instant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

public interface ChatSessionRepository extends JpaRepository<ChatSessionEntity, String> {

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("DELETE FROM ChatSessionEntity s WHERE s.lastUpdated < :cutoff")
  int deleteIdleSince(Instant cutoff);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("UPDATE ChatSessionEntity s SET s.lastUpdated = :now WHERE s.senderAddress = :senderAddress")
  int touch(String senderAddress, Instant now);
}
