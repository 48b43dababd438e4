package com.partnerbridge.bothub.tenant;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.partnerbridge.bothub.schedule.RecurrenceSpec;
import com.partnerbridge.bothub.schedule.ScheduleConfig;
import com.partnerbridge.bothub.schedule.ScheduleConfigException;
import com.partnerbridge.bothub.schedule.ScheduleTaskKind;
import com.partnerbridge.bothub.tenant.domain.BotEntity;
import com.partnerbridge.bothub.tenant.domain.BotScheduleEntity;
import com.partnerbridge.bothub.tenant.domain.BotSettingsEntity;
import com.partnerbridge.bothub.tenant.repository.BotRepository;
import com.partnerbridge.bothub.tenant.repository.BotScheduleRepository;
import com.partnerbridge.bothub.tenant.repository.BotSettingsRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Tenant configuration backed by the bots, bot_settings and bot_schedules tables. */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaTenantConfigStore implements TenantConfigStore {

  private static final TypeReference<List<Integer>> DAY_LIST = new TypeReference<>() {};

  private final BotRepository bots;
  private final BotSettingsRepository settings;
  private final BotScheduleRepository schedules;
  private final ObjectMapper objectMapper;

  @Override
  public List<TenantBot> getActiveTenants() {
    return bots.findByActiveTrueOrderByIdAsc().stream().map(JpaTenantConfigStore::toBot).toList();
  }

  @Override
  public Optional<TenantBot> findByCorrelationToken(String token) {
    if (token == null || token.isBlank()) {
      return Optional.empty();
    }
    return bots.findFirstByBackOfficeTokenAndActiveTrue(token).map(JpaTenantConfigStore::toBot);
  }

  @Override
  public Optional<TenantBot> findByTenantId(long tenantId) {
    return bots.findById(tenantId).map(JpaTenantConfigStore::toBot);
  }

  @Override
  public List<ScheduleConfig> getScheduleConfigs() {
    List<ScheduleConfig> out = new ArrayList<>();
    for (BotScheduleEntity row : schedules.findAllByOrderByIdAsc()) {
      toConfig(row).ifPresent(out::add);
    }
    return out;
  }

  @Override
  public Optional<ScheduleConfig> getScheduleConfig(long id) {
    return schedules.findById(id).flatMap(this::toConfig);
  }

  @Override
  public TenantSettings getTenantSettings(long tenantId) {
    return settings
        .findById(tenantId)
        .map(JpaTenantConfigStore::toSettings)
        .orElseGet(() -> TenantSettings.defaults(tenantId));
  }

  private Optional<ScheduleConfig> toConfig(BotScheduleEntity row) {
    try {
      return Optional.of(parse(row));
    } catch (ScheduleConfigException e) {
      log.warn("Skipping schedule {}: {}", row.getId(), e.getMessage());
      return Optional.empty();
    }
  }

  ScheduleConfig parse(BotScheduleEntity row) {
    ScheduleTaskKind kind = ScheduleTaskKind.fromWire(row.getScheduleType());
    RecurrenceSpec recurrence =
        RecurrenceSpec.parse(
            row.getRecurrenceMode(), row.getTimeOfDay(), parseDays(row.getRecurrenceDays()));
    return new ScheduleConfig(row.getId(), row.getBotId(), kind, recurrence, row.isEnabled());
  }

  private List<Integer> parseDays(String json) {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    try {
      List<Integer> days = objectMapper.readValue(json, DAY_LIST);
      return days == null ? List.of() : days;
    } catch (JsonProcessingException e) {
      throw new ScheduleConfigException("recurrence days are not a JSON int array: " + json, e);
    }
  }

  private static TenantBot toBot(BotEntity e) {
    return new TenantBot(
        e.getId(), e.getCredential(), e.getDisplayName(), e.getBackOfficeToken(), e.isActive());
  }

  private static TenantSettings toSettings(BotSettingsEntity e) {
    return new TenantSettings(
        e.getBotId(),
        e.isSelfRegistrationAllowed(),
        e.getPartnerGroupId(),
        e.getStockId(),
        e.getCurrencyId(),
        e.getCurrencyName(),
        e.getLanguageCode());
  }
}
