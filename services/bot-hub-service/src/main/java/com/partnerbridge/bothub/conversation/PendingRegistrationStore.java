package com.partnerbridge.bothub.conversation;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Pending registrations keyed by (tenant, chat), at most one per key, with explicit expiry.
 * Expired entries are dropped when read and swept on every insert.
 */
@Component
public class PendingRegistrationStore {

  private final ConcurrentMap<Key, Entry> map = new ConcurrentHashMap<>();
  private final Duration ttl;

  public PendingRegistrationStore(
      @Value("${bothub.conversation.pending-ttl:PT15M}") Duration ttl) {
    this.ttl = ttl;
  }

  /** Stores {@code registration}, replacing any earlier entry for the same chat. */
  public void put(PendingRegistration registration) {
    Instant now = Instant.now();
    map.values().removeIf(e -> e.isExpired(now));
    map.put(
        new Key(registration.tenantId(), registration.chatId()),
        new Entry(registration, now.plus(ttl)));
  }

  public Optional<PendingRegistration> get(long tenantId, long chatId) {
    Key key = new Key(tenantId, chatId);
    Entry e = map.get(key);
    if (e == null) {
      return Optional.empty();
    }
    if (e.isExpired(Instant.now())) {
      map.remove(key, e);
      return Optional.empty();
    }
    return Optional.of(e.value());
  }

  /** Removes and returns the entry; of two concurrent callers only one gets it. */
  public Optional<PendingRegistration> take(long tenantId, long chatId) {
    Entry e = map.remove(new Key(tenantId, chatId));
    if (e == null || e.isExpired(Instant.now())) {
      return Optional.empty();
    }
    return Optional.of(e.value());
  }

  public void remove(long tenantId, long chatId) {
    map.remove(new Key(tenantId, chatId));
  }

  public int size() {
    Instant now = Instant.now();
    map.values().removeIf(e -> e.isExpired(now));
    return map.size();
  }

  private record Key(long tenantId, long chatId) {}

  private record Entry(PendingRegistration value, Instant expiresAt) {

    boolean isExpired(Instant now) {
      return !expiresAt.isAfter(now);
    }
  }
}
