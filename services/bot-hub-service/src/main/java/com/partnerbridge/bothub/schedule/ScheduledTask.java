package com.partnerbridge.bothub.schedule;

/** Work behind one {@link ScheduleTaskKind}; invoked on the schedule thread when a job fires. */
public interface ScheduledTask {

  ScheduleTaskKind kind();

  void run(ScheduleConfig config);
}
