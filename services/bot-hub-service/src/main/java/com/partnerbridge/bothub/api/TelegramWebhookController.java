package com.partnerbridge.bothub.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.partnerbridge.bothub.config.TelegramProperties;
import com.partnerbridge.bothub.conversation.ConversationDispatcher;
import com.partnerbridge.bothub.conversation.DispatchOutcome;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * Telegram webhook for every registered bot; the path key picks the bot. Always answers 200 so
 * Telegram does not redeliver an update the hub already decided about.
 */
@RestController
@Slf4j
public class TelegramWebhookController {

  private final ConversationDispatcher dispatcher;
  private final String secretToken;

  public TelegramWebhookController(
      ConversationDispatcher dispatcher, TelegramProperties telegram) {
    this.dispatcher = dispatcher;
    this.secretToken = telegram.webhookSecret();
  }

  @PostMapping("/webhook/{webhookKey}")
  public Map<String, Object> webhook(
      @PathVariable String webhookKey,
      @RequestBody JsonNode update,
      @RequestHeader(value = "X-Telegram-Bot-Api-Secret-Token", required = false)
          String headerSecret) {

    if (!secretToken.isBlank() && !secretToken.equals(headerSecret)) {
      log.warn("Webhook secret token mismatch for {}", webhookKey);
      return Map.of("ok", false);
    }

    DispatchOutcome outcome = dispatcher.dispatch(webhookKey, update);
    return Map.of(
        "ok",
        outcome.status() != DispatchOutcome.Status.DROPPED,
        "status",
        outcome.status().name().toLowerCase(Locale.ROOT));
  }
}
