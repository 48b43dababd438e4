package com.partnerbridge.bothub.conversation;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Locale;

/** The parts of a Telegram update the dispatcher acts on. */
public record IncomingUpdate(
    Kind kind,
    long chatId,
    long senderId,
    String senderName,
    String text,
    SharedContact contact,
    String callbackId,
    String callbackData) {

  public enum Kind {
    START,
    CONTACT,
    CALLBACK,
    TEXT,
    OTHER
  }

  /**
   * @param userId Telegram user the contact belongs to; null when the contact is not a Telegram
   *     user
   */
  public record SharedContact(String phone, Long userId, String firstName, String lastName) {

    public String fullName() {
      String first = firstName == null ? "" : firstName.trim();
      String last = lastName == null ? "" : lastName.trim();
      return (first + " " + last).trim();
    }
  }

  public static IncomingUpdate parse(JsonNode update) {
    JsonNode callback = update == null ? null : update.get("callback_query");
    if (callback != null && callback.isObject()) {
      JsonNode from = callback.path("from");
      return new IncomingUpdate(
          Kind.CALLBACK,
          callback.path("message").path("chat").path("id").asLong(from.path("id").asLong()),
          from.path("id").asLong(),
          senderName(from),
          null,
          null,
          callback.path("id").asText(null),
          callback.path("data").asText(""));
    }
    JsonNode message = update == null ? null : update.get("message");
    if (message == null || !message.isObject()) {
      return new IncomingUpdate(Kind.OTHER, 0, 0, null, null, null, null, null);
    }
    long chatId = message.path("chat").path("id").asLong();
    JsonNode from = message.path("from");
    long senderId = from.path("id").asLong(chatId);
    String name = senderName(from);

    JsonNode contact = message.get("contact");
    if (contact != null && contact.isObject()) {
      JsonNode userId = contact.get("user_id");
      SharedContact shared =
          new SharedContact(
              contact.path("phone_number").asText(""),
              userId == null || userId.isNull() ? null : userId.asLong(),
              contact.path("first_name").asText(null),
              contact.path("last_name").asText(null));
      return new IncomingUpdate(Kind.CONTACT, chatId, senderId, name, null, shared, null, null);
    }
    String text = message.path("text").asText(null);
    if (text == null) {
      return new IncomingUpdate(Kind.OTHER, chatId, senderId, name, null, null, null, null);
    }
    Kind kind = isStartCommand(text) ? Kind.START : Kind.TEXT;
    return new IncomingUpdate(kind, chatId, senderId, name, text, null, null, null);
  }

  /** {@code /start}, {@code /start payload} and {@code /start@SomeBot}. */
  static boolean isStartCommand(String text) {
    String t = text.trim();
    if (!t.startsWith("/")) {
      return false;
    }
    String cmd = t.split("\\s+", 2)[0];
    int at = cmd.indexOf('@');
    if (at >= 0) {
      cmd = cmd.substring(0, at);
    }
    return cmd.toLowerCase(Locale.ROOT).equals("/start");
  }

  private static String senderName(JsonNode from) {
    String first = from.path("first_name").asText("").trim();
    String last = from.path("last_name").asText("").trim();
    String full = (first + " " + last).trim();
    if (!full.isEmpty()) {
      return full;
    }
    String username = from.path("username").asText("");
    return username.isBlank() ? null : username;
  }
}
