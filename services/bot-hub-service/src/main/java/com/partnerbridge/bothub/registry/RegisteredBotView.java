package com.partnerbridge.bothub.registry;

import java.time.Instant;

/** Secret-free view of a registered bot, for status output. */
public record RegisteredBotView(
    String maskedCredential,
    long tenantId,
    String displayName,
    String botUsername,
    Instant registeredAt) {

  static RegisteredBotView of(BotHandle h) {
    return new RegisteredBotView(
        Credentials.mask(h.credential()),
        h.tenantId(),
        h.displayName(),
        h.botUsername(),
        h.registeredAt());
  }
}
