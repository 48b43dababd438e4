package com.partnerbridge.bothub.schedule;

/** Work a schedule performs when it fires. */
public enum ScheduleTaskKind {
  PARTNER_BALANCE_ALERT("send_partner_balance");

  private final String wireName;

  ScheduleTaskKind(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static ScheduleTaskKind fromWire(String value) {
    for (ScheduleTaskKind k : values()) {
      if (k.wireName.equals(value)) {
        return k;
      }
    }
    throw new ScheduleConfigException("unknown schedule type: " + value);
  }
}
