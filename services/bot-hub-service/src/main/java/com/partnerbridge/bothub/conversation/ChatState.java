package com.partnerbridge.bothub.conversation;

/**
 * Where a chat stands in identification. Only {@link #AWAITING_REGISTRATION_CONFIRM} is held in
 * memory (as a {@link PendingRegistration}); the rest is re-derived from the back office on each
 * interaction.
 */
public enum ChatState {
  UNKNOWN,
  AWAITING_CONTACT,
  AWAITING_REGISTRATION_CONFIRM,
  VERIFIED
}
