package com.partnerbridge.bothub.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "bothub.telegram")
public record TelegramProperties(
    String apiBaseUrl,
    Duration timeout,
    Duration uploadTimeout,
    int messageLimit,
    Duration chunkDelay,
    String webhookSecret) {

  public TelegramProperties {
    apiBaseUrl =
        apiBaseUrl == null || apiBaseUrl.isBlank() ? "https://api.telegram.org" : apiBaseUrl;
    timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
    uploadTimeout = uploadTimeout == null ? Duration.ofSeconds(30) : uploadTimeout;
    messageLimit = messageLimit <= 0 ? 4096 : messageLimit;
    chunkDelay = chunkDelay == null ? Duration.ofMillis(50) : chunkDelay;
    webhookSecret = webhookSecret == null ? "" : webhookSecret.trim();
  }
}
