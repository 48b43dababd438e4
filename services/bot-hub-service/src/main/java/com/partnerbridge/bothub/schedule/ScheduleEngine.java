package com.partnerbridge.bothub.schedule;

import com.partnerbridge.bothub.config.BotHubProperties;
import com.partnerbridge.bothub.config.SchedulerConfig;
import com.partnerbridge.bothub.tenant.TenantConfigStore;
import jakarta.annotation.PreDestroy;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

/**
 * Arms one cron job per enabled schedule row. The armed set is rebuilt from the store on every
 * {@link #reload()}, so it never outlives the rows it came from.
 */
@Service
@Slf4j
public class ScheduleEngine {

  private static final String JOB_PREFIX = "schedule:";

  private final TaskScheduler scheduler;
  private final TenantConfigStore store;
  private final TriggerCompiler compiler;
  private final Map<ScheduleTaskKind, ScheduledTask> tasks;
  private final ZoneId zone;

  private final Object lock = new Object();
  private volatile Map<String, ScheduledFuture<?>> armed = Map.of();
  private volatile boolean running;

  public ScheduleEngine(
      @Qualifier(SchedulerConfig.SCHEDULE_RUNNER) TaskScheduler scheduler,
      TenantConfigStore store,
      TriggerCompiler compiler,
      List<ScheduledTask> tasks,
      BotHubProperties hub) {
    this.scheduler = scheduler;
    this.store = store;
    this.compiler = compiler;
    this.zone = hub.zoneId();
    Map<ScheduleTaskKind, ScheduledTask> byKind = new EnumMap<>(ScheduleTaskKind.class);
    for (ScheduledTask task : tasks) {
      byKind.put(task.kind(), task);
    }
    this.tasks = Collections.unmodifiableMap(byKind);
  }

  public static String jobId(long configId) {
    return JOB_PREFIX + configId;
  }

  public void start() {
    synchronized (lock) {
      if (running) {
        return;
      }
      running = true;
      armed = arm();
      log.info("Schedule engine started with {} job(s) in zone {}", armed.size(), zone);
    }
  }

  @PreDestroy
  public void stop() {
    synchronized (lock) {
      running = false;
      cancelAll();
      log.info("Schedule engine stopped");
    }
  }

  /** Cancels every armed job and arms the current rows again. Starts the engine if needed. */
  public EngineStatus reload() {
    synchronized (lock) {
      cancelAll();
      running = true;
      armed = arm();
      log.info("Schedules reloaded: {} job(s) armed", armed.size());
    }
    return status();
  }

  /** Runs the task behind {@code configId}, re-reading the row first. */
  public void onFire(long configId) {
    Optional<ScheduleConfig> config = store.getScheduleConfig(configId);
    if (config.isEmpty()) {
      log.warn("Schedule {} fired but no longer exists", configId);
      return;
    }
    if (!config.get().enabled()) {
      log.info("Schedule {} is disabled, skipping", configId);
      return;
    }
    ScheduledTask task = tasks.get(config.get().taskKind());
    if (task == null) {
      log.warn("No task for schedule {} of kind {}", configId, config.get().taskKind());
      return;
    }
    log.info("Executing schedule {} ({})", configId, config.get().taskKind().wireName());
    try {
      task.run(config.get());
    } catch (RuntimeException e) {
      log.error("Schedule {} failed: {}", configId, e.getMessage(), e);
    }
  }

  public EngineStatus status() {
    Map<String, ScheduledFuture<?>> current = armed;
    List<String> ids = new ArrayList<>(current.keySet());
    Collections.sort(ids);
    return new EngineStatus(running, ids.size(), List.copyOf(ids));
  }

  private Map<String, ScheduledFuture<?>> arm() {
    Map<String, ScheduledFuture<?>> out = new LinkedHashMap<>();
    for (ScheduleConfig config : store.getScheduleConfigs()) {
      if (!config.enabled()) {
        log.debug("Schedule {} is disabled", config.id());
        continue;
      }
      if (!tasks.containsKey(config.taskKind())) {
        log.warn("Schedule {} has no task for kind {}", config.id(), config.taskKind());
        continue;
      }
      Optional<CronTrigger> trigger = compiler.compile(config.recurrence(), zone);
      if (trigger.isEmpty()) {
        continue;
      }
      long id = config.id();
      ScheduledFuture<?> future = scheduler.schedule(() -> onFire(id), trigger.get());
      if (future == null) {
        log.warn("Scheduler refused schedule {}", id);
        continue;
      }
      out.put(config.jobId(), future);
      log.info("Armed {} with cron '{}'", config.jobId(), trigger.get().getExpression());
    }
    return Collections.unmodifiableMap(out);
  }

  private void cancelAll() {
    armed.values().forEach(f -> f.cancel(false));
    armed = Map.of();
  }
}
