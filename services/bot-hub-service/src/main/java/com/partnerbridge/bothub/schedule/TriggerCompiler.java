package com.partnerbridge.bothub.schedule;

import java.time.DayOfWeek;
import java.time.ZoneId;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

/** Compiles a {@link RecurrenceSpec} into a Spring cron trigger. */
@Component
@Slf4j
public class TriggerCompiler {

  /**
   * @return empty when the spec is invalid (e.g. an empty day subset); the caller skips the config
   */
  public Optional<CronTrigger> compile(RecurrenceSpec spec, ZoneId zone) {
    Optional<String> expression = expression(spec);
    if (expression.isEmpty()) {
      log.warn("Schedule {} cannot be compiled: {}", spec, spec.problem().orElse("?"));
      return Optional.empty();
    }
    return Optional.of(new CronTrigger(expression.get(), zone));
  }

  /** Six-field Spring cron expression, seconds first. Weekdays are 0 = Monday .. 6 = Sunday. */
  static Optional<String> expression(RecurrenceSpec spec) {
    if (!spec.isValid()) {
      return Optional.empty();
    }
    String prefix = "0 " + spec.time().getMinute() + " " + spec.time().getHour() + " ";
    return Optional.of(
        switch (spec.mode()) {
          case DAILY -> prefix + "* * *";
          case WEEKDAYS -> prefix + "* * " + weekdayNames(spec);
          case MONTHLY -> prefix + join(spec) + " * *";
        });
  }

  private static String weekdayNames(RecurrenceSpec spec) {
    return spec.days().stream()
        .map(d -> DayOfWeek.of(d + 1).getDisplayName(TextStyle.SHORT, Locale.ENGLISH))
        .map(s -> s.toUpperCase(Locale.ROOT))
        .collect(Collectors.joining(","));
  }

  private static String join(RecurrenceSpec spec) {
    return spec.days().stream().map(String::valueOf).collect(Collectors.joining(","));
  }
}
