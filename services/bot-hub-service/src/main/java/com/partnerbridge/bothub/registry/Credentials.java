package com.partnerbridge.bothub.registry;

/** Helpers for bot credentials, which are secrets and never logged in full. */
public final class Credentials {

  static final int WEBHOOK_KEY_LENGTH = 10;

  private Credentials() {}

  /** Stable public prefix of a credential, used as the webhook path segment. */
  public static String webhookKey(String credential) {
    if (credential == null || credential.isBlank()) {
      throw new IllegalArgumentException("credential is blank");
    }
    String t = credential.trim();
    return t.length() <= WEBHOOK_KEY_LENGTH ? t : t.substring(0, WEBHOOK_KEY_LENGTH);
  }

  public static String mask(String credential) {
    if (credential == null || credential.isBlank()) {
      return "<none>";
    }
    return webhookKey(credential) + "...";
  }
}
