package com.partnerbridge.bothub.client;

/** Result of Telegram's getMe for a bot credential. */
public record BotIdentity(long id, String username, String firstName) {}
