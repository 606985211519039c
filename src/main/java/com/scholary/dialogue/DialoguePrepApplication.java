package com.scholary.dialogue;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class DialoguePrepApplication {

  public static void main(String[] args) {
    SpringApplication.run(DialoguePrepApplication.class, args);
  }
}
