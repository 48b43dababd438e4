package com.partnerbridge.bothub.registry;

import com.partnerbridge.bothub.schedule.ScheduleEngine;
import com.partnerbridge.bothub.tenant.TenantBot;
import com.partnerbridge.bothub.tenant.TenantConfigStore;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/** Registers every active tenant bot on startup, then arms the tenant schedules. */
@Component
@RequiredArgsConstructor
@Slf4j
public class BotRegistryBootstrapper implements ApplicationRunner {

  private final TenantConfigStore tenants;
  private final BotRegistry registry;
  private final ScheduleEngine engine;

  @Value("${bothub.bootstrap.enabled:true}")
  private boolean enabled;

  @Override
  public void run(ApplicationArguments args) {
    if (!enabled) {
      log.info("Bootstrap is disabled; bots and schedules stay idle until reloaded");
      return;
    }
    List<TenantBot> active = tenants.getActiveTenants();
    int registered = registry.reconcileOnStartup(active);
    if (registered < active.size()) {
      log.warn(
          "{} of {} active bots could not be registered",
          active.size() - registered,
          active.size());
    }
    engine.start();
  }
}
