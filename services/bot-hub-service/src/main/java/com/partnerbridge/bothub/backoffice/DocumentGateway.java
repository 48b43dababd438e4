package com.partnerbridge.bothub.backoffice;

import com.fasterxml.jackson.databind.JsonNode;
import com.partnerbridge.bothub.client.BackOfficeClient;
import com.partnerbridge.bothub.client.UpstreamException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Reads documents, their lines and warehouse names from the back office. */
@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentGateway {

  private static final String PAYMENT_ENDPOINT = "DocPayment/Get";

  private final BackOfficeClient client;

  public Optional<JsonNode> fetchDocument(String token, DocumentKind kind, long documentId) {
    return client.call(kind.documentEndpoint(), Map.of("ids", List.of(documentId)), token)
        .firstResult();
  }

  public List<JsonNode> fetchOperations(String token, DocumentKind kind, long documentId) {
    return client
        .call(kind.operationsEndpoint(), Map.of("document_ids", List.of(documentId)), token)
        .resultList();
  }

  public Optional<JsonNode> fetchPayment(String token, long documentId) {
    return client.call(PAYMENT_ENDPOINT, Map.of("ids", List.of(documentId)), token).firstResult();
  }

  /** Warehouse name; empty on any lookup failure, the caller picks a fallback label. */
  public Optional<String> stockName(String token, long stockId) {
    try {
      return client
          .call("Stock/Get", Map.of("id", stockId), token)
          .firstResult()
          .map(s -> s.path("name").asText(""))
          .filter(name -> !name.isBlank());
    } catch (UpstreamException e) {
      log.warn("Stock {} lookup failed: {}", stockId, e.getMessage());
      return Optional.empty();
    }
  }
}
