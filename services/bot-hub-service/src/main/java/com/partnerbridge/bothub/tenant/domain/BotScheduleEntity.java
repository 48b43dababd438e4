package com.partnerbridge.bothub.tenant.domain;

import jakarta.persistence.*;
import java.time.Instant;
import org.hibernate.Hibernate;

/** Raw schedule row; validated into a ScheduleConfig when read. */
@Entity
@Table(name = "bot_schedules")
public class BotScheduleEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "bot_id", nullable = false)
  private Long botId;

  // 'send_partner_balance'
  @Column(name = "schedule_type", nullable = false, length = 64)
  private String scheduleType;

  // H:mm
  @Column(name = "time_of_day", nullable = false, length = 8)
  private String timeOfDay;

  // 'daily' | 'weekdays' | 'monthly'
  @Column(name = "recurrence_mode", nullable = false, length = 16)
  private String recurrenceMode;

  // JSON array, e.g. [0,2,4]
  @Column(name = "recurrence_days", length = 255)
  private String recurrenceDays;

  @Column(name = "enabled", nullable = false)
  private boolean enabled;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected BotScheduleEntity() {
    // for JPA
  }

  public BotScheduleEntity(
      Long botId,
      String scheduleType,
      String timeOfDay,
      String recurrenceMode,
      String recurrenceDays,
      boolean enabled) {
    this.botId = botId;
    this.scheduleType = scheduleType;
    this.timeOfDay = timeOfDay;
    this.recurrenceMode = recurrenceMode;
    this.recurrenceDays = recurrenceDays;
    this.enabled = enabled;
  }

  @PrePersist
  public void prePersist() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }

  public Long getId() {
    return id;
  }

  public Long getBotId() {
    return botId;
  }

  public String getScheduleType() {
    return scheduleType;
  }

  public String getTimeOfDay() {
    return timeOfDay;
  }

  public String getRecurrenceMode() {
    return recurrenceMode;
  }

  public String getRecurrenceDays() {
    return recurrenceDays;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || Hibernate.getClass(this) != Hibernate.getClass(o)) {
      return false;
    }
    BotScheduleEntity that = (BotScheduleEntity) o;
    return id != null && id.equals(that.id);
  }

  @Override
  public int hashCode() {
    return getClass().hashCode();
  }
}
