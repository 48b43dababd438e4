package com.partnerbridge.bothub.backoffice;

import java.util.OptionalLong;

/** Counterparty record as far as the bot cares about it. */
public record Partner(long id, String name, String phones, OptionalLong linkedChatId) {

  public boolean isLinkedTo(long chatId) {
    return linkedChatId.isPresent() && linkedChatId.getAsLong() == chatId;
  }

  public String displayName() {
    return name == null || name.isBlank() ? "#" + id : name;
  }
}
