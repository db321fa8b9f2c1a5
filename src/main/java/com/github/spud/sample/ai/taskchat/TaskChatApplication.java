package com.github.spud.sample.ai.taskchat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@EnableJpaRepositories
@SpringBootApplication
public class TaskChatApplication {

  public static void main(String[] args) {
    SpringApplication.run(TaskChatApplication.class, args);
  }

}
