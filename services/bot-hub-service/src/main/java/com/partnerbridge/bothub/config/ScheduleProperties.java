package com.partnerbridge.bothub.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param partnerPause pause between partners in one balance run
 * @param balanceLookbackDays how many days back a balance statement reaches
 */
@ConfigurationProperties(prefix = "bothub.schedule")
public record ScheduleProperties(Duration partnerPause, int balanceLookbackDays) {

  public ScheduleProperties {
    partnerPause = partnerPause == null ? Duration.ofSeconds(1) : partnerPause;
    balanceLookbackDays = balanceLookbackDays <= 0 ? 30 : balanceLookbackDays;
  }
}
