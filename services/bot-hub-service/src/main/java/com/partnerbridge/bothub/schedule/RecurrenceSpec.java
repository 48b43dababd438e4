package com.partnerbridge.bothub.schedule;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.Collections;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * When a schedule fires: a time of day plus, for {@code WEEKDAYS} and {@code MONTHLY}, the days it
 * fires on. Instances may be invalid; {@link #parse} rejects invalid rows and {@link #problem()}
 * tells why.
 */
public record RecurrenceSpec(RecurrenceMode mode, LocalTime time, SortedSet<Integer> days) {

  private static final DateTimeFormatter TIME_OF_DAY = DateTimeFormatter.ofPattern("H:mm");

  public RecurrenceSpec {
    if (mode == null || time == null) {
      throw new ScheduleConfigException("recurrence mode and time are required");
    }
    days = Collections.unmodifiableSortedSet(days == null ? new TreeSet<>() : new TreeSet<>(days));
  }

  public static RecurrenceSpec daily(LocalTime time) {
    return new RecurrenceSpec(RecurrenceMode.DAILY, time, null);
  }

  public static RecurrenceSpec weekdays(LocalTime time, Collection<Integer> days) {
    return new RecurrenceSpec(RecurrenceMode.WEEKDAYS, time, new TreeSet<>(days));
  }

  public static RecurrenceSpec monthly(LocalTime time, Collection<Integer> days) {
    return new RecurrenceSpec(RecurrenceMode.MONTHLY, time, new TreeSet<>(days));
  }

  /**
   * Builds a validated spec from stored values.
   *
   * @param time {@code H:mm}, e.g. {@code 9:00} or {@code 09:00}
   * @throws ScheduleConfigException when the values do not form a valid schedule
   */
  public static RecurrenceSpec parse(String mode, String time, Collection<Integer> days) {
    LocalTime at;
    try {
      at = LocalTime.parse(time == null ? "" : time.trim(), TIME_OF_DAY);
    } catch (DateTimeParseException e) {
      throw new ScheduleConfigException("invalid time of day: " + time, e);
    }
    RecurrenceMode m = RecurrenceMode.fromWire(mode);
    RecurrenceSpec spec =
        new RecurrenceSpec(m, at, m == RecurrenceMode.DAILY ? null : toSet(days));
    Optional<String> problem = spec.problem();
    if (problem.isPresent()) {
      throw new ScheduleConfigException(problem.get());
    }
    return spec;
  }

  public Optional<String> problem() {
    return switch (mode) {
      case DAILY -> days.isEmpty() ? Optional.empty() : Optional.of("daily schedule carries days");
      case WEEKDAYS -> checkRange(0, 6, "weekday");
      case MONTHLY -> checkRange(1, 31, "day of month");
    };
  }

  public boolean isValid() {
    return problem().isEmpty();
  }

  private Optional<String> checkRange(int min, int max, String what) {
    if (days.isEmpty()) {
      return Optional.of(mode.wireName() + " schedule has no days");
    }
    if (days.first() < min || days.last() > max) {
      return Optional.of(what + " out of range " + min + ".." + max + ": " + days);
    }
    return Optional.empty();
  }

  private static SortedSet<Integer> toSet(Collection<Integer> days) {
    TreeSet<Integer> out = new TreeSet<>();
    if (days != null) {
      for (Integer d : days) {
        if (d != null) out.add(d);
      }
    }
    return out;
  }
}
