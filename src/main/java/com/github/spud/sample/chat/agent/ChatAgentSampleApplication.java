package com.github.spud.sample.chat.agent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@EnableJpaRepositories
@SpringBootApplication
public class ChatAgentSampleApplication {

  public static void main(String[] args) {
    SpringApplication.run(ChatAgentSampleApplication.class, args);
  }

}
