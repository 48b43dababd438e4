package com.partnerbridge.bothub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BotHubServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(BotHubServiceApplication.class, args);
  }
}
