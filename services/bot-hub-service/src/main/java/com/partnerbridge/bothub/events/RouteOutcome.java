package com.partnerbridge.bothub.events;

public enum RouteOutcome {
  DELIVERED(true),
  DUPLICATE(true),
  NO_MATCHING_TENANT(false),
  NO_RECIPIENT(true),
  IGNORED(true),
  NO_DOCUMENT(true),
  UPSTREAM_ERROR(false),
  DELIVERY_FAILED(false);

  private final boolean ok;

  RouteOutcome(boolean ok) {
    this.ok = ok;
  }

  /** Whether the back office should consider the event handled. */
  public boolean ok() {
    return ok;
  }
}
