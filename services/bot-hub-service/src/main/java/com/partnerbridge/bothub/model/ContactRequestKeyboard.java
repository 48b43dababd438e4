package com.partnerbridge.bothub.model;

import java.util.List;
import java.util.Map;

/** One-time reply keyboard with a single "share my contact" button. */
public record ContactRequestKeyboard(String buttonText) implements ReplyMarkup {

  @Override
  public Map<String, Object> toTelegram() {
    return Map.of(
        "keyboard",
        List.of(List.of(Map.of("text", buttonText, "request_contact", true))),
        "resize_keyboard",
        true,
        "one_time_keyboard",
        true);
  }
}
