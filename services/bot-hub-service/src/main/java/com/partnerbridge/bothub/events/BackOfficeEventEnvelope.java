package com.partnerbridge.bothub.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.util.OptionalLong;

/**
 * A back-office webhook call. Accepts the flat form ({@code eventId, tenantCorrelationToken,
 * eventKind, eventData}, camelCase or snake_case) and the back office's native form, where kind
 * and data sit under {@code data: {action, data}} and the token is {@code
 * connected_integration_id}.
 */
public record BackOfficeEventEnvelope(
    String eventId,
    String occurredAt,
    String correlationToken,
    String eventKind,
    JsonNode eventData) {

  public static BackOfficeEventEnvelope from(JsonNode body) {
    if (body == null || !body.isObject()) {
      throw new IllegalArgumentException("event body must be a JSON object");
    }
    String kind = text(body, "eventKind", "event_kind");
    JsonNode data = node(body, "eventData", "event_data");
    JsonNode nested = body.path("data");
    if (kind == null && nested.isObject()) {
      kind = text(nested, "action", "eventKind");
      data = nested.path("data");
    }
    return new BackOfficeEventEnvelope(
        text(body, "eventId", "event_id"),
        text(body, "occurredAt", "occurred_at"),
        text(body, "tenantCorrelationToken", "connected_integration_id"),
        kind,
        data);
  }

  /** The {@code id} of the document the event is about. */
  public OptionalLong documentId() {
    JsonNode id = eventData == null ? null : eventData.get("id");
    if (id == null || id.isNull()) {
      return OptionalLong.empty();
    }
    if (id.canConvertToLong() && id.asLong() > 0) {
      return OptionalLong.of(id.asLong());
    }
    if (id.isTextual()) {
      try {
        long parsed = Long.parseLong(id.asText().trim());
        return parsed > 0 ? OptionalLong.of(parsed) : OptionalLong.empty();
      } catch (NumberFormatException e) {
        return OptionalLong.empty();
      }
    }
    return OptionalLong.empty();
  }

  private static String text(JsonNode n, String camel, String snake) {
    JsonNode v = node(n, camel, snake);
    if (v.isMissingNode() || v.isNull()) {
      return null;
    }
    String s = v.asText();
    return s.isBlank() ? null : s;
  }

  private static JsonNode node(JsonNode n, String camel, String snake) {
    JsonNode v = n.get(camel);
    if (v == null || v.isNull()) {
      v = n.get(snake);
    }
    return v == null ? MissingNode.getInstance() : v;
  }
}
