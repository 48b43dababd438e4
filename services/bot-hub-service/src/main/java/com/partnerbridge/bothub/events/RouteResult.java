package com.partnerbridge.bothub.events;

import java.util.Locale;

public record RouteResult(RouteOutcome outcome, String detail) {

  public static RouteResult of(RouteOutcome outcome) {
    return new RouteResult(outcome, null);
  }

  public static RouteResult of(RouteOutcome outcome, String detail) {
    return new RouteResult(outcome, detail);
  }

  public boolean ok() {
    return outcome.ok();
  }

  public String message() {
    String base = outcome.name().toLowerCase(Locale.ROOT).replace('_', ' ');
    return detail == null ? base : base + ": " + detail;
  }
}
