package com.partnerbridge.bothub.api;

import com.partnerbridge.bothub.registry.BotRegistry;
import com.partnerbridge.bothub.registry.ReconcileReport;
import com.partnerbridge.bothub.registry.RegisteredBotView;
import com.partnerbridge.bothub.schedule.EngineStatus;
import com.partnerbridge.bothub.schedule.ScheduleEngine;
import com.partnerbridge.bothub.tenant.TenantConfigStore;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Operator endpoints, guarded by {@link AdminTokenFilter}. */
@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
public class AdminController {

  private final ScheduleEngine engine;
  private final BotRegistry registry;
  private final TenantConfigStore tenants;

  @PostMapping("/schedules/reload")
  public EngineStatus reloadSchedules() {
    return engine.reload();
  }

  /** Picks up bots activated, deactivated or given a new token since startup. */
  @PostMapping("/bots/reconcile")
  public ReconcileReport reconcileBots() {
    return registry.reconcile(tenants.getActiveTenants());
  }

  @GetMapping("/status")
  public AdminStatus status() {
    return new AdminStatus(engine.status(), registry.snapshot());
  }

  public record AdminStatus(EngineStatus schedules, List<RegisteredBotView> bots) {}
}
