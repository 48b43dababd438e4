package com.partnerbridge.bothub.model;

import java.util.Map;

/** Keyboard attached to an outgoing message, rendered into Telegram's reply_markup object. */
public interface ReplyMarkup {

  Map<String, Object> toTelegram();
}
