package com.partnerbridge.bothub.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.partnerbridge.bothub.events.BackOfficeEventEnvelope;
import com.partnerbridge.bothub.events.ExternalEventRouter;
import com.partnerbridge.bothub.events.RouteResult;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/** Document events from the back office. Answers 200 in every case, the body says what happened. */
@RestController
@Slf4j
@RequiredArgsConstructor
public class BackOfficeWebhookController {

  private final ExternalEventRouter router;

  @PostMapping("/external/webhook")
  public Map<String, Object> webhook(@RequestBody JsonNode body) {
    BackOfficeEventEnvelope envelope;
    try {
      envelope = BackOfficeEventEnvelope.from(body);
    } catch (IllegalArgumentException e) {
      log.warn("Rejected back-office event: {}", e.getMessage());
      return Map.of("ok", false, "message", e.getMessage());
    }
    RouteResult result = router.handle(envelope);
    return Map.of("ok", result.ok(), "message", result.message());
  }
}
