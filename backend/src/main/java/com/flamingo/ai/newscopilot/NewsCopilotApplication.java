package com.flamingo.ai.newscopilot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** News Copilot: concurrent, cached, quality-controlled AI analyses of news articles. */
@SpringBootApplication
public class NewsCopilotApplication {

  public static void main(String[] args) {
    SpringApplication.run(NewsCopilotApplication.class, args);
  }
}
