package com.partnerbridge.bothub.backoffice;

import com.fasterxml.jackson.databind.JsonNode;
import com.partnerbridge.bothub.config.BackOfficeProperties;
import java.util.OptionalLong;
import org.springframework.stereotype.Component;

/**
 * The counterparty field that holds the linked Telegram chat id. The back office stores it as a
 * free-form string, so values may be blank, numeric, or garbage.
 */
@Component
public class ChatIdProperty {

  private final String name;

  public ChatIdProperty(BackOfficeProperties properties) {
    this.name = properties.chatIdProperty();
  }

  public String name() {
    return name;
  }

  /** Reads the chat id from a counterparty record; empty when absent, blank or unparsable. */
  public OptionalLong read(JsonNode partner) {
    if (partner == null || !partner.isObject()) {
      return OptionalLong.empty();
    }
    return parse(partner.get(name));
  }

  static OptionalLong parse(JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) {
      return OptionalLong.empty();
    }
    if (value.isIntegralNumber()) {
      return OptionalLong.of(value.asLong());
    }
    if (value.isNumber()) {
      return OptionalLong.of((long) value.asDouble());
    }
    if (!value.isTextual()) {
      return OptionalLong.empty();
    }
    String text = value.asText().trim();
    if (text.isEmpty()) {
      return OptionalLong.empty();
    }
    try {
      return OptionalLong.of(Long.parseLong(text));
    } catch (NumberFormatException e) {
      return OptionalLong.empty();
    }
  }
}
