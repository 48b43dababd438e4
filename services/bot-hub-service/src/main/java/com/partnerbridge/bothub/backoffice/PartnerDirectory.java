package com.partnerbridge.bothub.backoffice;

import com.fasterxml.jackson.databind.JsonNode;
import com.partnerbridge.bothub.client.BackOfficeClient;
import com.partnerbridge.bothub.client.BackOfficeResponse;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Counterparty lookups and write-through of the chat link. The back office has no server-side
 * phone or chat-id filter, so searches list all non-deleted partners and match locally.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PartnerDirectory {

  /** Subscriber number length; shorter stored values never match. */
  static final int PHONE_MATCH_DIGITS = 9;

  private static final Pattern PHONE_SEPARATORS = Pattern.compile("[,;/]");

  private final BackOfficeClient client;
  private final ChatIdProperty chatIdProperty;

  public Optional<Partner> findByPhone(String token, String phone) {
    String wanted = normalizePhone(phone);
    if (wanted.length() < PHONE_MATCH_DIGITS) {
      return Optional.empty();
    }
    for (Partner p : listAll(token)) {
      for (String stored : PHONE_SEPARATORS.split(p.phones())) {
        if (samePhone(wanted, normalizePhone(stored))) {
          log.info("Partner {} matched phone search", p.id());
          return Optional.of(p);
        }
      }
    }
    log.info("No partner matched phone search");
    return Optional.empty();
  }

  public Optional<Partner> findByChatId(String token, long chatId) {
    return listAll(token).stream().filter(p -> p.isLinkedTo(chatId)).findFirst();
  }

  /** Partners whose chat-id property parses to a chat id. */
  public List<Partner> listChatLinked(String token) {
    return listAll(token).stream().filter(p -> p.linkedChatId().isPresent()).toList();
  }

  /** Stores {@code chatId} in the partner's chat-id property. */
  public boolean linkChat(String token, long partnerId, long chatId) {
    Map<String, Object> body = new HashMap<>();
    body.put("id", partnerId);
    body.put(chatIdProperty.name(), String.valueOf(chatId));
    BackOfficeResponse resp = client.call("Partner/Edit", body, token);
    if (resp.ok()) {
      log.info("Partner {} linked to chat {}", partnerId, chatId);
    }
    return resp.ok();
  }

  /**
   * @return id of the created partner, or empty when the back office refused it
   */
  public OptionalLong register(String token, NewPartner partner) {
    Map<String, Object> body = new HashMap<>();
    body.put("group_id", partner.groupId());
    body.put("legal_status", "Legal");
    body.put("name", partner.name());
    body.put("fullName", partner.name());
    body.put("phones", partner.phone());
    body.put(chatIdProperty.name(), String.valueOf(partner.chatId()));
    BackOfficeResponse resp = client.call("Partner/Add", body, token);
    if (!resp.ok()) {
      return OptionalLong.empty();
    }
    JsonNode newId = resp.result().path("new_id");
    if (!newId.canConvertToLong() || newId.asLong() <= 0) {
      log.warn("Partner/Add succeeded without new_id");
      return OptionalLong.empty();
    }
    log.info("Registered partner {} for chat {}", newId.asLong(), partner.chatId());
    return OptionalLong.of(newId.asLong());
  }

  private List<Partner> listAll(String token) {
    BackOfficeResponse resp = client.call("Partner/Get", Map.of("deleted_mark", false), token);
    List<Partner> out = new ArrayList<>();
    for (JsonNode n : resp.resultList()) {
      long id = n.path("id").asLong(0);
      if (id <= 0) continue;
      out.add(
          new Partner(
              id,
              n.path("name").asText(null),
              n.path("phones").asText(""),
              chatIdProperty.read(n)));
    }
    return out;
  }

  /** Digits only; "+998 (90) 123-45-67" and "998901234567" compare equal. */
  public static String normalizePhone(String phone) {
    if (phone == null) return "";
    StringBuilder sb = new StringBuilder(phone.length());
    for (int i = 0; i < phone.length(); i++) {
      char c = phone.charAt(i);
      if (c >= '0' && c <= '9') sb.append(c);
    }
    return sb.toString();
  }

  /** Same subscriber: the last {@value #PHONE_MATCH_DIGITS} digits agree. */
  static boolean samePhone(String a, String b) {
    if (a.length() < PHONE_MATCH_DIGITS || b.length() < PHONE_MATCH_DIGITS) {
      return false;
    }
    return a.regionMatches(
        a.length() - PHONE_MATCH_DIGITS, b, b.length() - PHONE_MATCH_DIGITS, PHONE_MATCH_DIGITS);
  }
}
