package com.partnerbridge.bothub.events;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** Ids of back-office events seen within the retention window. */
@Component
public class ProcessedEventCache {

  private final Cache<String, Instant> seen;

  @Autowired
  public ProcessedEventCache(
      @Value("${bothub.events.retention:PT1H}") Duration retention,
      @Value("${bothub.events.max-size:100000}") long maxSize) {
    this(retention, maxSize, Ticker.systemTicker());
  }

  ProcessedEventCache(Duration retention, long maxSize, Ticker ticker) {
    this.seen =
        Caffeine.newBuilder()
            .expireAfterWrite(retention)
            .maximumSize(maxSize)
            .ticker(ticker)
            .build();
  }

  /**
   * Records {@code eventId} as seen.
   *
   * @return true for the first caller within the window, false for a duplicate
   */
  public boolean markIfNew(String eventId) {
    return seen.asMap().putIfAbsent(eventId, Instant.now()) == null;
  }

  public Optional<Instant> firstSeen(String eventId) {
    return Optional.ofNullable(seen.getIfPresent(eventId));
  }

  public long size() {
    seen.cleanUp();
    return seen.estimatedSize();
  }
}
