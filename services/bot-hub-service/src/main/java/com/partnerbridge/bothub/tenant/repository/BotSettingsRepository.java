package com.partnerbridge.bothub.tenant.repository;

import com.partnerbridge.bothub.tenant.domain.BotSettingsEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BotSettingsRepository extends JpaRepository<BotSettingsEntity, Long> {}
