package com.partnerbridge.bothub.api;

import com.partnerbridge.bothub.registry.BotRegistry;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class HealthController {

  private final BotRegistry registry;

  @GetMapping("/health")
  public Map<String, Object> health() {
    return Map.of("status", "ok", "botsRegistered", registry.size());
  }
}
