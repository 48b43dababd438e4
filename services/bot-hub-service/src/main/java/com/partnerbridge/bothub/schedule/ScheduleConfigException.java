package com.partnerbridge.bothub.schedule;

/** A stored schedule row cannot be turned into a valid schedule. */
public class ScheduleConfigException extends RuntimeException {

  public ScheduleConfigException(String message) {
    super(message);
  }

  public ScheduleConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
