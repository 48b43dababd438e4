package com.partnerbridge.bothub.tenant.repository;

import com.partnerbridge.bothub.tenant.domain.BotEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BotRepository extends JpaRepository<BotEntity, Long> {

  List<BotEntity> findByActiveTrueOrderByIdAsc();

  Optional<BotEntity> findFirstByBackOfficeTokenAndActiveTrue(String backOfficeToken);
}
