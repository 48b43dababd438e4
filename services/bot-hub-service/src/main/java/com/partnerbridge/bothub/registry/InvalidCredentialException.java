package com.partnerbridge.bothub.registry;

/** Telegram rejected the bot credential; nothing was registered. */
public class InvalidCredentialException extends RuntimeException {

  public InvalidCredentialException(String credential) {
    super("Telegram rejected credential " + Credentials.mask(credential));
  }
}
