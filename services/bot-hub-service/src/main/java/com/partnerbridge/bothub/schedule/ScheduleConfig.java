package com.partnerbridge.bothub.schedule;

/** A tenant-defined recurring task, as stored. */
public record ScheduleConfig(
    long id, long tenantId, ScheduleTaskKind taskKind, RecurrenceSpec recurrence, boolean enabled) {

  public String jobId() {
    return ScheduleEngine.jobId(id);
  }
}
