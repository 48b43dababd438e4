package com.partnerbridge.bothub.tenant;

import com.partnerbridge.bothub.schedule.ScheduleConfig;
import java.util.List;
import java.util.Optional;

/** Read side of the persisted bot, settings and schedule configuration. */
public interface TenantConfigStore {

  List<TenantBot> getActiveTenants();

  /** Active bot whose back-office integration token equals {@code token}. */
  Optional<TenantBot> findByCorrelationToken(String token);

  Optional<TenantBot> findByTenantId(long tenantId);

  /** Valid schedule rows, enabled or not. Malformed rows are logged and left out. */
  List<ScheduleConfig> getScheduleConfigs();

  /**
   * @return empty when the row is missing or malformed
   */
  Optional<ScheduleConfig> getScheduleConfig(long id);

  /** Settings row, or {@link TenantSettings#defaults} when the tenant has none. */
  TenantSettings getTenantSettings(long tenantId);
}
