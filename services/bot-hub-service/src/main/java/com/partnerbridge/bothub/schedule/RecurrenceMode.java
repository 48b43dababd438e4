package com.partnerbridge.bothub.schedule;

import java.util.Locale;

public enum RecurrenceMode {
  DAILY,
  /** Days of week, 0 = Monday .. 6 = Sunday. */
  WEEKDAYS,
  /** Days of month, 1..31. */
  MONTHLY;

  public static RecurrenceMode fromWire(String value) {
    if (value == null || value.isBlank()) {
      throw new ScheduleConfigException("recurrence mode is blank");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ScheduleConfigException("unknown recurrence mode: " + value);
    }
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
