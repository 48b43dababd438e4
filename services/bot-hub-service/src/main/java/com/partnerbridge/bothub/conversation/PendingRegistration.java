package com.partnerbridge.bothub.conversation;

import java.time.Instant;

/** A shared contact with no back-office match, waiting for the user to confirm sign-up. */
public record PendingRegistration(
    long chatId, String phone, String displayName, long tenantId, Instant createdAt) {}
