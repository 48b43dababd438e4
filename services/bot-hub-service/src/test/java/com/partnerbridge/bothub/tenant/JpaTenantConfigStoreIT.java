package com.partnerbridge.bothub.tenant;

import static org.assertj.core.api.Assertions.assertThat;

import com.partnerbridge.bothub.schedule.RecurrenceMode;
import com.partnerbridge.bothub.schedule.ScheduleConfig;
import com.partnerbridge.bothub.schedule.ScheduleTaskKind;
import java.time.LocalTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers
@SpringBootTest
class JpaTenantConfigStoreIT {

  @Container
  static final PostgreSQLContainer<?> postgres =
      new PostgreSQLContainer<>("postgres:16-alpine")
          .withDatabaseName("bothub")
          .withUsername("bothub_app")
          .withPassword("1111");

  @DynamicPropertySource
  static void props(DynamicPropertyRegistry r) {
    r.add("spring.datasource.url", postgres::getJdbcUrl);
    r.add("spring.datasource.username", postgres::getUsername);
    r.add("spring.datasource.password", postgres::getPassword);
    // No Telegram calls at startup.
    r.add("bothub.bootstrap.enabled", () -> "false");
  }

  @Autowired TenantConfigStore store;
  @Autowired JdbcTemplate jdbc;

  private long shopId;
  private long retiredId;

  @BeforeEach
  void seed() {
    jdbc.update("DELETE FROM bots");
    shopId = insertBot("111111111:AAbb", "Shop", "tok-shop", true);
    retiredId = insertBot("222222222:CCdd", "Retired", "tok-retired", false);
  }

  private long insertBot(String credential, String name, String token, boolean active) {
    return jdbc.queryForObject(
        "INSERT INTO bots (credential, display_name, back_office_token, active)"
            + " VALUES (?, ?, ?, ?) RETURNING id",
        Long.class,
        credential,
        name,
        token,
        active);
  }

  private long insertSchedule(String type, String time, String mode, String days, boolean on) {
    return jdbc.queryForObject(
        "INSERT INTO bot_schedules"
            + " (bot_id, schedule_type, time_of_day, recurrence_mode, recurrence_days, enabled)"
            + " VALUES (?, ?, ?, ?, ?, ?) RETURNING id",
        Long.class,
        shopId,
        type,
        time,
        mode,
        days,
        on);
  }

  @Test
  void activeTenantsAndTokenLookup() {
    assertThat(store.getActiveTenants()).extracting(TenantBot::tenantId).containsExactly(shopId);
    assertThat(store.findByCorrelationToken("tok-shop"))
        .get()
        .extracting(TenantBot::displayName)
        .isEqualTo("Shop");
    assertThat(store.findByCorrelationToken("tok-retired")).isEmpty();
    assertThat(store.findByTenantId(retiredId).orElseThrow().active()).isFalse();
  }

  @Test
  void malformedScheduleRowsAreLeftOut() {
    long good = insertSchedule("send_partner_balance", "9:00", "weekdays", "[0,2,4]", true);
    long off = insertSchedule("send_partner_balance", "18:30", "daily", null, false);
    long noDays = insertSchedule("send_partner_balance", "9:00", "weekdays", "[]", true);
    long badType = insertSchedule("send_report", "9:00", "daily", null, true);
    long badJson = insertSchedule("send_partner_balance", "9:00", "monthly", "1,15", true);

    List<ScheduleConfig> configs = store.getScheduleConfigs();

    assertThat(configs).extracting(ScheduleConfig::id).containsExactly(good, off);
    ScheduleConfig first = configs.get(0);
    assertThat(first.taskKind()).isEqualTo(ScheduleTaskKind.PARTNER_BALANCE_ALERT);
    assertThat(first.recurrence().mode()).isEqualTo(RecurrenceMode.WEEKDAYS);
    assertThat(first.recurrence().time()).isEqualTo(LocalTime.of(9, 0));
    assertThat(first.recurrence().days()).containsExactly(0, 2, 4);
    assertThat(configs.get(1).enabled()).isFalse();
    assertThat(store.getScheduleConfig(noDays)).isEmpty();
    assertThat(store.getScheduleConfig(badType)).isEmpty();
    assertThat(store.getScheduleConfig(badJson)).isEmpty();
  }

  @Test
  void settingsFallBackToDefaults() {
    jdbc.update(
        "INSERT INTO bot_settings (bot_id, self_registration_allowed, partner_group_id)"
            + " VALUES (?, TRUE, 4)",
        shopId);

    TenantSettings shop = store.getTenantSettings(shopId);
    assertThat(shop.selfRegistrationAllowed()).isTrue();
    assertThat(shop.defaultPartnerGroupId()).isEqualTo(4L);
    assertThat(shop.languageCode()).isEqualTo("ru");
    assertThat(store.getTenantSettings(retiredId)).isEqualTo(TenantSettings.defaults(retiredId));
  }
}
