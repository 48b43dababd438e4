package com.partnerbridge.bothub.schedule;

import com.partnerbridge.bothub.backoffice.BalanceEntry;
import com.partnerbridge.bothub.backoffice.BalanceGateway;
import com.partnerbridge.bothub.backoffice.Partner;
import com.partnerbridge.bothub.backoffice.PartnerDirectory;
import com.partnerbridge.bothub.backoffice.Reference;
import com.partnerbridge.bothub.config.BotHubProperties;
import com.partnerbridge.bothub.config.ScheduleProperties;
import com.partnerbridge.bothub.config.SchedulerConfig;
import com.partnerbridge.bothub.conversation.BotMessageTemplates;
import com.partnerbridge.bothub.events.AmountFormatter;
import com.partnerbridge.bothub.outbound.OutboundChannel;
import com.partnerbridge.bothub.registry.BotHandle;
import com.partnerbridge.bothub.registry.BotRegistry;
import com.partnerbridge.bothub.tenant.TenantBot;
import com.partnerbridge.bothub.tenant.TenantConfigStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Tells every chat-linked partner of a tenant about its negative balances: a summary text and the
 * statement as a file. Partners without a negative balance get nothing.
 */
@Component
@Slf4j
public class BalanceAlertTask implements ScheduledTask {

  private final TenantConfigStore tenants;
  private final BotRegistry registry;
  private final PartnerDirectory partners;
  private final BalanceGateway balances;
  private final BalanceReportGenerator reports;
  private final OutboundChannel outbound;
  private final BotMessageTemplates messages;
  private final Executor fanout;
  private final Duration partnerPause;
  private final int lookbackDays;
  private final ZoneId zone;

  public BalanceAlertTask(
      TenantConfigStore tenants,
      BotRegistry registry,
      PartnerDirectory partners,
      BalanceGateway balances,
      BalanceReportGenerator reports,
      OutboundChannel outbound,
      BotMessageTemplates messages,
      @Qualifier(SchedulerConfig.FANOUT_EXECUTOR) Executor fanout,
      ScheduleProperties schedule,
      BotHubProperties hub) {
    this.tenants = tenants;
    this.registry = registry;
    this.partners = partners;
    this.balances = balances;
    this.reports = reports;
    this.outbound = outbound;
    this.messages = messages;
    this.fanout = fanout;
    this.partnerPause = schedule.partnerPause();
    this.lookbackDays = schedule.balanceLookbackDays();
    this.zone = hub.zoneId();
  }

  @Override
  public ScheduleTaskKind kind() {
    return ScheduleTaskKind.PARTNER_BALANCE_ALERT;
  }

  @Override
  public void run(ScheduleConfig config) {
    Optional<TenantBot> tenant = tenants.findByTenantId(config.tenantId());
    if (tenant.isEmpty() || !tenant.get().active() || !tenant.get().hasBackOfficeToken()) {
      log.warn(
          "Schedule {}: tenant {} is inactive or has no back-office token",
          config.id(),
          config.tenantId());
      return;
    }
    Optional<BotHandle> bot = registry.lookupByTenant(config.tenantId());
    if (bot.isEmpty()) {
      log.warn("Schedule {}: no registered bot for tenant {}", config.id(), config.tenantId());
      return;
    }
    String token = tenant.get().backOfficeToken();

    List<Partner> linked = partners.listChatLinked(token);
    if (linked.isEmpty()) {
      log.info("Schedule {}: no chat-linked partners", config.id());
      return;
    }

    CompletableFuture<List<Reference>> firmsFuture =
        CompletableFuture.supplyAsync(() -> balances.firms(token), fanout);
    CompletableFuture<List<Reference>> currenciesFuture =
        CompletableFuture.supplyAsync(() -> balances.currencies(token), fanout);
    List<Reference> firms = await(firmsFuture);
    List<Reference> currencies = await(currenciesFuture);
    if (firms.isEmpty() || currencies.isEmpty()) {
      log.warn("Schedule {}: no firms or currencies in the back office", config.id());
      return;
    }

    LocalDate to = LocalDate.now(zone);
    LocalDate from = to.minusDays(lookbackDays);
    int notified = 0;
    for (int i = 0; i < linked.size(); i++) {
      if (i > 0 && !pause()) {
        log.warn("Schedule {} interrupted after {} partner(s)", config.id(), i);
        return;
      }
      Partner partner = linked.get(i);
      try {
        if (notifyPartner(bot.get(), token, partner, firms, currencies, from, to)) {
          notified++;
        }
      } catch (RuntimeException e) {
        log.error("Balance alert for partner {} failed: {}", partner.id(), e.getMessage(), e);
      }
    }
    log.info("Schedule {}: {} of {} partner(s) alerted", config.id(), notified, linked.size());
  }

  boolean notifyPartner(
      BotHandle bot,
      String token,
      Partner partner,
      List<Reference> firms,
      List<Reference> currencies,
      LocalDate from,
      LocalDate to) {
    AtomicInteger failures = new AtomicInteger();
    List<CompletableFuture<List<BalanceEntry>>> calls = new ArrayList<>();
    for (Reference firm : firms) {
      for (Reference currency : currencies) {
        calls.add(
            submit(
                    () ->
                        balances.partnerBalance(
                            token, partner.id(), firm.id(), currency.id(), from, to, zone))
                .exceptionally(
                    ex -> {
                      failures.incrementAndGet();
                      log.warn(
                          "Balance of partner {} for firm {} / currency {} failed: {}",
                          partner.id(),
                          firm.id(),
                          currency.id(),
                          rootMessage(ex));
                      return List.of();
                    }));
      }
    }
    CompletableFuture.allOf(calls.toArray(new CompletableFuture[0])).join();
    List<BalanceEntry> entries = new ArrayList<>();
    calls.forEach(c -> entries.addAll(c.join()));
    if (failures.get() > 0) {
      log.warn(
          "Partner {}: {} of {} balance queries failed",
          partner.id(),
          failures.get(),
          calls.size());
    }

    List<NegativeBalance> negative =
        BalanceAggregator.negativeBalances(entries, names(firms), names(currencies));
    if (negative.isEmpty()) {
      log.debug("Partner {} has no negative balance", partner.id());
      return false;
    }

    long chatId = partner.linkedChatId().getAsLong();
    outbound.sendText(bot, chatId, summary(negative));
    Path report = null;
    try {
      report = reports.render(partner.id(), entries);
      outbound.sendFile(bot, chatId, report, messages.text(BotMessageTemplates.BALANCE_CAPTION));
    } finally {
      delete(report);
    }
    return true;
  }

  String summary(List<NegativeBalance> negative) {
    StringBuilder sb = new StringBuilder(messages.text(BotMessageTemplates.BALANCE_ALERT));
    for (NegativeBalance b : negative) {
      sb.append('\n')
          .append(
              messages.text(
                  BotMessageTemplates.BALANCE_LINE,
                  b.firmName(),
                  b.currencyName(),
                  AmountFormatter.format(b.balance())));
    }
    return sb.append("\n\n").append(messages.text(BotMessageTemplates.BALANCE_FOOTER)).toString();
  }

  /** A full fan-out queue fails the one query instead of the whole partner. */
  private <T> CompletableFuture<T> submit(Supplier<T> call) {
    try {
      return CompletableFuture.supplyAsync(call, fanout);
    } catch (RejectedExecutionException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  private static <T> T await(CompletableFuture<T> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw e;
    }
  }

  private static Map<Long, String> names(List<Reference> refs) {
    return refs.stream().collect(Collectors.toMap(Reference::id, Reference::name, (a, b) -> a));
  }

  private static String rootMessage(Throwable ex) {
    Throwable t = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
    return t.getMessage();
  }

  private static void delete(Path report) {
    if (report == null) {
      return;
    }
    try {
      Files.deleteIfExists(report);
    } catch (IOException e) {
      log.warn("Could not delete report {}: {}", report, e.getMessage());
    }
  }

  private boolean pause() {
    if (partnerPause.isZero() || partnerPause.isNegative()) {
      return true;
    }
    try {
      Thread.sleep(partnerPause.toMillis());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
