package com.partnerbridge.bothub.tenant.repository;

import com.partnerbridge.bothub.tenant.domain.BotScheduleEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BotScheduleRepository extends JpaRepository<BotScheduleEntity, Long> {

  List<BotScheduleEntity> findAllByOrderByIdAsc();
}
