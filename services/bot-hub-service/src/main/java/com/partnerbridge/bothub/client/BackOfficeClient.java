package com.partnerbridge.bothub.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.partnerbridge.bothub.registry.Credentials;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Request/response RPC client for the tenant's back-office integration API. Each call is
 * {@code POST <base-url>/<integration token>/v1/<endpoint>} with a JSON payload.
 */
@Service
@Slf4j
public class BackOfficeClient {

  private final RestClient rest;

  public BackOfficeClient(@Qualifier("backOfficeRestClient") RestClient rest) {
    this.rest = rest;
  }

  public BackOfficeResponse call(String endpoint, Object payload, String token) {
    if (token == null || token.isBlank()) {
      throw new IllegalArgumentException("back-office token is blank");
    }
    log.debug("Back-office request {} for integration {}", endpoint, Credentials.mask(token));
    JsonNode resp;
    try {
      resp =
          rest.post()
              .uri(b -> b.path("/{token}/v1/").path(endpoint).build(token))
              .contentType(MediaType.APPLICATION_JSON)
              .body(payload)
              .retrieve()
              .body(JsonNode.class);
    } catch (RestClientException e) {
      throw Upstreams.translate(endpoint, e);
    }
    if (resp == null) {
      return BackOfficeResponse.failed("empty response");
    }
    boolean ok = resp.path("ok").asBoolean(false);
    String description = resp.path("description").asText(resp.path("error").asText(null));
    if (!ok) {
      log.warn("Back-office {} returned ok=false: {}", endpoint, description);
    }
    return new BackOfficeResponse(ok, resp.path("result"), description);
  }
}
