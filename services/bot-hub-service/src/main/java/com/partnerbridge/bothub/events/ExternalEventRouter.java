package com.partnerbridge.bothub.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.partnerbridge.bothub.backoffice.ChatIdProperty;
import com.partnerbridge.bothub.backoffice.DocumentGateway;
import com.partnerbridge.bothub.backoffice.DocumentKind;
import com.partnerbridge.bothub.client.UpstreamException;
import com.partnerbridge.bothub.outbound.DeliveryReport;
import com.partnerbridge.bothub.outbound.OutboundChannel;
import com.partnerbridge.bothub.registry.BotHandle;
import com.partnerbridge.bothub.registry.BotRegistry;
import com.partnerbridge.bothub.tenant.TenantBot;
import com.partnerbridge.bothub.tenant.TenantConfigStore;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns back-office document events into receipts for the counterparty's Telegram chat. Each event
 * id is acted on at most once: it is marked as seen before any processing starts.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ExternalEventRouter {

  private final ProcessedEventCache processedEvents;
  private final TenantConfigStore tenants;
  private final BotRegistry registry;
  private final DocumentGateway documents;
  private final ChatIdProperty chatIdProperty;
  private final ReceiptFormatter receipts;
  private final OutboundChannel outbound;

  public RouteResult handle(BackOfficeEventEnvelope event) {
    if (event.eventId() != null && !processedEvents.markIfNew(event.eventId())) {
      log.info("Event {} already processed, skipping", event.eventId());
      return RouteResult.of(RouteOutcome.DUPLICATE, event.eventId());
    }

    Optional<TenantBot> tenant =
        event.correlationToken() == null
            ? Optional.empty()
            : tenants.findByCorrelationToken(event.correlationToken());
    Optional<BotHandle> bot = tenant.flatMap(t -> registry.lookupByTenant(t.tenantId()));
    if (tenant.isEmpty() || bot.isEmpty()) {
      log.warn("No registered bot for event {} ({})", event.eventId(), event.eventKind());
      return RouteResult.of(RouteOutcome.NO_MATCHING_TENANT);
    }

    EventKind kind = EventKind.fromWire(event.eventKind());
    if (kind == EventKind.UNKNOWN) {
      log.info("Ignoring event {} of kind {}", event.eventId(), event.eventKind());
      return RouteResult.of(RouteOutcome.IGNORED, event.eventKind());
    }
    OptionalLong documentId = event.documentId();
    if (documentId.isEmpty()) {
      log.warn("Event {} ({}) carries no document id", event.eventId(), kind.wireName());
      return RouteResult.of(RouteOutcome.IGNORED, "no document id");
    }

    String token = tenant.get().backOfficeToken();
    try {
      return kind.isPayment()
          ? routePayment(bot.get(), token, documentId.getAsLong(), kind.isCancellation())
          : routeDocument(
              bot.get(),
              token,
              kind.documentKind().orElseThrow(),
              documentId.getAsLong(),
              kind.isCancellation());
    } catch (UpstreamException e) {
      log.error(
          "Back office call {} failed for event {}: {}",
          e.getOperation(),
          event.eventId(),
          e.getMessage());
      return RouteResult.of(RouteOutcome.UPSTREAM_ERROR, e.getOperation());
    }
  }

  private RouteResult routeDocument(
      BotHandle bot, String token, DocumentKind kind, long documentId, boolean cancelled) {
    Optional<JsonNode> document = documents.fetchDocument(token, kind, documentId);
    if (document.isEmpty()) {
      log.warn("{} document {} not found", kind, documentId);
      return RouteResult.of(RouteOutcome.NO_DOCUMENT, String.valueOf(documentId));
    }
    OptionalLong chatId = recipient(document.get(), documentId);
    if (chatId.isEmpty()) {
      return RouteResult.of(RouteOutcome.NO_RECIPIENT);
    }
    List<JsonNode> operations = documents.fetchOperations(token, kind, documentId);
    String text =
        receipts.formatDocument(
            kind, document.get(), operations, warehouse(token, document.get()), cancelled);
    return deliver(bot, chatId.getAsLong(), text, documentId);
  }

  private RouteResult routePayment(
      BotHandle bot, String token, long documentId, boolean cancelled) {
    Optional<JsonNode> document = documents.fetchPayment(token, documentId);
    if (document.isEmpty()) {
      log.warn("Payment document {} not found", documentId);
      return RouteResult.of(RouteOutcome.NO_DOCUMENT, String.valueOf(documentId));
    }
    OptionalLong chatId = recipient(document.get(), documentId);
    if (chatId.isEmpty()) {
      return RouteResult.of(RouteOutcome.NO_RECIPIENT);
    }
    String text =
        receipts.formatPayment(document.get(), warehouse(token, document.get()), cancelled);
    return deliver(bot, chatId.getAsLong(), text, documentId);
  }

  private OptionalLong recipient(JsonNode document, long documentId) {
    JsonNode partner = document.path("partner");
    OptionalLong chatId = chatIdProperty.read(partner);
    if (chatId.isEmpty()) {
      log.info(
          "Partner {} of document {} has no usable {} value",
          partner.path("id").asText("?"),
          documentId,
          chatIdProperty.name());
    }
    return chatId;
  }

  private String warehouse(String token, JsonNode document) {
    JsonNode stock = document.path("stock");
    long stockId =
        stock.isObject() ? stock.path("id").asLong(0) : document.path("stock_id").asLong(0);
    if (stockId <= 0) {
      return ReceiptFormatter.DEFAULT_WAREHOUSE;
    }
    return documents.stockName(token, stockId).orElse(ReceiptFormatter.DEFAULT_WAREHOUSE);
  }

  private RouteResult deliver(BotHandle bot, long chatId, String text, long documentId) {
    DeliveryReport report = outbound.sendText(bot, chatId, text, OutboundChannel.MARKDOWN, null);
    if (report.anyDelivered()) {
      log.info("Receipt for document {} sent to chat {}", documentId, chatId);
      return RouteResult.of(RouteOutcome.DELIVERED);
    }
    return RouteResult.of(RouteOutcome.DELIVERY_FAILED, String.valueOf(chatId));
  }
}
