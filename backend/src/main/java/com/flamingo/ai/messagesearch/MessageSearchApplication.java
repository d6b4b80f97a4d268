package com.flamingo.ai.messagesearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the message semantic search service. */
@SpringBootApplication
public class MessageSearchApplication {

  public static void main(String[] args) {
    SpringApplication.run(MessageSearchApplication.class, args);
  }
}
