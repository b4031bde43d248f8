package com.scholary.video.assistant;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VideoAssistantApplication {

  public static void main(String[] args) {
    SpringApplication.run(VideoAssistantApplication.class, args);
  }
}
