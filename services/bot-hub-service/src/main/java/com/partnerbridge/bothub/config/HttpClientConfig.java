package com.partnerbridge.bothub.config;

import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/** RestClients with hard connect/read timeouts; a timeout is reported, never retried here. */
@Configuration
public class HttpClientConfig {

  @Bean
  public RestClient telegramRestClient(RestClient.Builder builder, TelegramProperties properties) {
    return builder
        .clone()
        .baseUrl(properties.apiBaseUrl())
        .requestFactory(requestFactory(properties.timeout()))
        .build();
  }

  @Bean
  public RestClient telegramUploadRestClient(
      RestClient.Builder builder, TelegramProperties properties) {
    return builder
        .clone()
        .baseUrl(properties.apiBaseUrl())
        .requestFactory(requestFactory(properties.uploadTimeout()))
        .build();
  }

  @Bean
  public RestClient backOfficeRestClient(
      RestClient.Builder builder, BackOfficeProperties properties) {
    return builder
        .clone()
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory(properties.timeout()))
        .build();
  }

  private static SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
    SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout(Math.toIntExact(timeout.toMillis()));
    factory.setReadTimeout(Math.toIntExact(timeout.toMillis()));
    return factory;
  }
}
