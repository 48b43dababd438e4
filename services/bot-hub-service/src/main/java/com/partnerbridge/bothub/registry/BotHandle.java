package com.partnerbridge.bothub.registry;

import java.time.Instant;

/**
 * A live, registered bot endpoint.
 *
 * @param webhookKey credential prefix used as the webhook path segment
 */
public record BotHandle(
    String credential,
    String displayName,
    long tenantId,
    String botUsername,
    Instant registeredAt,
    String webhookKey) {

  public String webhookPath() {
    return "/webhook/" + webhookKey;
  }

  @Override
  public String toString() {
    return "BotHandle[credential="
        + Credentials.mask(credential)
        + ", displayName="
        + displayName
        + ", tenantId="
        + tenantId
        + ", botUsername="
        + botUsername
        + ", registeredAt="
        + registeredAt
        + "]";
  }
}
