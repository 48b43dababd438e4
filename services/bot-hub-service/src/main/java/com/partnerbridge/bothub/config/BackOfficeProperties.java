package com.partnerbridge.bothub.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Back-office integration API.
 *
 * @param chatIdProperty counterparty field that stores the linked Telegram chat id
 */
@ConfigurationProperties(prefix = "bothub.backoffice")
public record BackOfficeProperties(String baseUrl, Duration timeout, String chatIdProperty) {

  public BackOfficeProperties {
    baseUrl =
        baseUrl == null || baseUrl.isBlank() ? "https://integration.regos.uz/gateway/out" : baseUrl;
    timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
    chatIdProperty = chatIdProperty == null || chatIdProperty.isBlank() ? "oked" : chatIdProperty;
  }
}
