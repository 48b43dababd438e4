package com.partnerbridge.bothub.backoffice;

import com.fasterxml.jackson.databind.JsonNode;
import com.partnerbridge.bothub.client.BackOfficeClient;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** Firm and currency directories plus per-partner balance statements. */
@Service
@RequiredArgsConstructor
public class BalanceGateway {

  private final BackOfficeClient client;

  public List<Reference> firms(String token) {
    return references(client.call("Firm/Get", Map.of(), token).resultList(), "Firm");
  }

  public List<Reference> currencies(String token) {
    return references(client.call("Currency/Get", Map.of(), token).resultList(), "Currency");
  }

  /** Statement rows for the inclusive date range, bounds taken as whole days in {@code zone}. */
  public List<BalanceEntry> partnerBalance(
      String token,
      long partnerId,
      long firmId,
      long currencyId,
      LocalDate from,
      LocalDate to,
      ZoneId zone) {
    Map<String, Object> body = new HashMap<>();
    body.put("partner_id", partnerId);
    body.put("firm_id", firmId);
    body.put("currency_id", currencyId);
    body.put("start_date", from.atStartOfDay(zone).toEpochSecond());
    body.put("end_date", to.atTime(LocalTime.of(23, 59, 59)).atZone(zone).toEpochSecond());
    List<BalanceEntry> out = new ArrayList<>();
    for (JsonNode n : client.call("PartnerBalance/Get", body, token).resultList()) {
      JsonNode firm = n.path("firm");
      JsonNode currency = n.path("currency");
      out.add(
          new BalanceEntry(
              firm.path("id").asLong(firmId),
              firm.path("name").asText(null),
              currency.path("id").asLong(currencyId),
              currency.path("name").asText(null),
              n.path("date").asLong(0),
              n.path("document_code").asText(""),
              n.path("document_type").path("name").asText(""),
              JsonValues.decimal(n.path("start_amount")),
              JsonValues.decimal(n.path("debit")),
              JsonValues.decimal(n.path("credit"))));
    }
    return out;
  }

  private static List<Reference> references(List<JsonNode> nodes, String fallbackPrefix) {
    List<Reference> out = new ArrayList<>();
    for (JsonNode n : nodes) {
      long id = n.path("id").asLong(0);
      if (id <= 0) continue;
      String name = n.path("name").asText("");
      out.add(new Reference(id, name.isBlank() ? fallbackPrefix + " " + id : name));
    }
    return out;
  }
}
