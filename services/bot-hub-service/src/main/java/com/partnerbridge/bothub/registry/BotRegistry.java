package com.partnerbridge.bothub.registry;

import com.partnerbridge.bothub.client.BotIdentity;
import com.partnerbridge.bothub.client.TelegramBotClient;
import com.partnerbridge.bothub.client.UpstreamException;
import com.partnerbridge.bothub.config.BotHubProperties;
import com.partnerbridge.bothub.config.TelegramProperties;
import com.partnerbridge.bothub.conversation.BotMessageTemplates;
import com.partnerbridge.bothub.tenant.TenantBot;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Live set of registered bots and their webhook bindings.
 *
 * <p>Single writer: every mutation runs under the registry monitor and publishes fresh immutable
 * maps, so webhook threads read without locking and never see a half-applied change.
 */
@Service
@Slf4j
public class BotRegistry {

  private final TelegramBotClient telegram;
  private final BotHubProperties hub;
  private final TelegramProperties telegramProperties;
  private final BotMessageTemplates messages;

  private volatile Map<String, BotHandle> byCredential = Map.of();
  private volatile Map<String, BotHandle> byWebhookKey = Map.of();

  public BotRegistry(
      TelegramBotClient telegram,
      BotHubProperties hub,
      TelegramProperties telegramProperties,
      BotMessageTemplates messages) {
    this.telegram = telegram;
    this.hub = hub;
    this.telegramProperties = telegramProperties;
    this.messages = messages;
  }

  /**
   * Registers a bot, or re-binds the webhook of one that is already registered.
   *
   * @throws InvalidCredentialException when Telegram rejects the credential
   * @throws UpstreamException when Telegram cannot be reached to check the credential
   */
  public synchronized BotHandle register(String credential, String displayName, long tenantId) {
    String webhookKey = Credentials.webhookKey(credential);
    BotHandle existing = byCredential.get(credential);
    if (existing != null) {
      log.info("Bot {} already registered, re-binding webhook", Credentials.mask(credential));
      bindWebhook(existing);
      return existing;
    }

    BotIdentity identity =
        telegram.getMe(credential).orElseThrow(() -> new InvalidCredentialException(credential));
    String name =
        displayName == null || displayName.isBlank() ? identity.username() : displayName;
    BotHandle handle =
        new BotHandle(credential, name, tenantId, identity.username(), Instant.now(), webhookKey);

    Map<String, BotHandle> credentials = new HashMap<>(byCredential);
    Map<String, BotHandle> keys = new HashMap<>(byWebhookKey);
    BotHandle rotated = keys.get(webhookKey);
    if (rotated != null) {
      // same bot, new secret: the new handle takes over the webhook path
      credentials.remove(rotated.credential());
      log.info("Credential rotated for bot {}", Credentials.mask(credential));
    }
    List<BotHandle> replaced =
        credentials.values().stream().filter(h -> h.tenantId() == tenantId).toList();
    for (BotHandle old : replaced) {
      credentials.remove(old.credential());
      keys.remove(old.webhookKey(), old);
    }
    credentials.put(credential, handle);
    keys.put(webhookKey, handle);
    publish(credentials, keys);
    log.info("Registered bot {} ({}) for tenant {}", name, Credentials.mask(credential), tenantId);

    for (BotHandle old : replaced) {
      log.info(
          "Bot {} replaced for tenant {}, releasing its webhook",
          Credentials.mask(old.credential()),
          tenantId);
      releaseWebhook(old.credential());
    }
    bindWebhook(handle);
    publishMenuButton(handle);
    return handle;
  }

  /**
   * @return false when the credential was not registered
   */
  public synchronized boolean unregister(String credential) {
    BotHandle handle = credential == null ? null : byCredential.get(credential);
    if (handle == null) {
      return false;
    }
    releaseWebhook(credential);
    Map<String, BotHandle> credentials = new HashMap<>(byCredential);
    Map<String, BotHandle> keys = new HashMap<>(byWebhookKey);
    credentials.remove(credential);
    keys.remove(handle.webhookKey(), handle);
    publish(credentials, keys);
    log.info("Unregistered bot {}", Credentials.mask(credential));
    return true;
  }

  public Optional<BotHandle> lookup(String credential) {
    if (credential == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(byCredential.get(credential));
  }

  public Optional<BotHandle> lookupByWebhookKey(String webhookKey) {
    if (webhookKey == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(byWebhookKey.get(webhookKey));
  }

  public Optional<BotHandle> lookupByTenant(long tenantId) {
    return byCredential.values().stream().filter(h -> h.tenantId() == tenantId).findFirst();
  }

  /**
   * Registers every active bot. A failing bot is logged and skipped.
   *
   * @return how many bots are registered afterwards
   */
  public int reconcileOnStartup(List<TenantBot> activeBots) {
    int ok = 0;
    for (TenantBot bot : activeBots) {
      if (!bot.active()) continue;
      try {
        register(bot.credential(), bot.displayName(), bot.tenantId());
        ok++;
      } catch (RuntimeException e) {
        log.error(
            "Failed to register bot {} of tenant {}: {}",
            Credentials.mask(bot.credential()),
            bot.tenantId(),
            e.getMessage());
      }
    }
    log.info("Startup reconciliation: {}/{} bots registered", ok, activeBots.size());
    return ok;
  }

  /**
   * Brings the live set in line with the stored bots: active bots not yet live (new, or with a
   * new token) are registered, live bots no longer active are unregistered.
   */
  public synchronized ReconcileReport reconcile(List<TenantBot> activeBots) {
    Set<String> wanted = new HashSet<>();
    int registered = 0;
    int failed = 0;
    for (TenantBot bot : activeBots) {
      if (!bot.active()) continue;
      wanted.add(bot.credential());
      if (byCredential.containsKey(bot.credential())) continue;
      try {
        register(bot.credential(), bot.displayName(), bot.tenantId());
        registered++;
      } catch (RuntimeException e) {
        failed++;
        log.error(
            "Failed to register bot {} of tenant {}: {}",
            Credentials.mask(bot.credential()),
            bot.tenantId(),
            e.getMessage());
      }
    }
    int unregistered = 0;
    for (String credential : List.copyOf(byCredential.keySet())) {
      if (!wanted.contains(credential) && unregister(credential)) {
        unregistered++;
      }
    }
    ReconcileReport report = new ReconcileReport(registered, unregistered, failed, size());
    log.info("Bot reconciliation: {}", report);
    return report;
  }

  public List<RegisteredBotView> snapshot() {
    return byCredential.values().stream()
        .map(RegisteredBotView::of)
        .sorted(Comparator.comparingLong(RegisteredBotView::tenantId))
        .toList();
  }

  public int size() {
    return byCredential.size();
  }

  private void publish(Map<String, BotHandle> credentials, Map<String, BotHandle> keys) {
    byCredential = Map.copyOf(credentials);
    byWebhookKey = Map.copyOf(keys);
  }

  private void releaseWebhook(String credential) {
    try {
      telegram.deleteWebhook(credential);
    } catch (UpstreamException e) {
      log.warn("deleteWebhook failed for {}: {}", Credentials.mask(credential), e.getMessage());
    }
  }

  private void bindWebhook(BotHandle handle) {
    if (!hub.hasPublicBaseUrl()) {
      log.warn(
          "Public base URL not set; bot {} registered without webhook",
          Credentials.mask(handle.credential()));
      return;
    }
    String url = hub.publicBaseUrl() + handle.webhookPath();
    try {
      telegram.setWebhook(handle.credential(), url, telegramProperties.webhookSecret());
      log.info("Webhook set for {}: {}", Credentials.mask(handle.credential()), url);
    } catch (UpstreamException e) {
      log.error(
          "setWebhook failed for {}: {}", Credentials.mask(handle.credential()), e.getMessage());
    }
  }

  private void publishMenuButton(BotHandle handle) {
    if (!hub.hasWebAppUrl()) {
      return;
    }
    String url = hub.webAppUrl() + "?tenant=" + handle.tenantId();
    String text = messages.text(BotMessageTemplates.MENU_BUTTON);
    try {
      telegram.setChatMenuButton(handle.credential(), text, url);
    } catch (UpstreamException e) {
      log.warn(
          "Menu button not published for {}: {}",
          Credentials.mask(handle.credential()),
          e.getMessage());
    }
  }
}
