package com.partnerbridge.bothub.conversation;

/** What happened to one inbound update. {@code state} is the chat's state afterwards. */
public record DispatchOutcome(Status status, ChatState state) {

  public enum Status {
    HANDLED,
    /** Update for a bot that is not registered. */
    DROPPED,
    /** Update kind the bot does not react to. */
    IGNORED,
    /** Handling failed; the user got an apology. */
    FAILED
  }

  public static DispatchOutcome handled(ChatState state) {
    return new DispatchOutcome(Status.HANDLED, state);
  }

  public static DispatchOutcome dropped() {
    return new DispatchOutcome(Status.DROPPED, ChatState.UNKNOWN);
  }

  public static DispatchOutcome ignored() {
    return new DispatchOutcome(Status.IGNORED, ChatState.UNKNOWN);
  }

  public static DispatchOutcome failed() {
    return new DispatchOutcome(Status.FAILED, ChatState.UNKNOWN);
  }
}
