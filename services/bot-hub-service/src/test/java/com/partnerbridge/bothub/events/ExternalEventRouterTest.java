package com.partnerbridge.bothub.events;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.partnerbridge.bothub.backoffice.ChatIdProperty;
import com.partnerbridge.bothub.backoffice.DocumentGateway;
import com.partnerbridge.bothub.backoffice.DocumentKind;
import com.partnerbridge.bothub.client.UpstreamException;
import com.partnerbridge.bothub.config.BackOfficeProperties;
import com.partnerbridge.bothub.config.BotHubProperties;
import com.partnerbridge.bothub.outbound.DeliveryReport;
import com.partnerbridge.bothub.outbound.OutboundChannel;
import com.partnerbridge.bothub.registry.BotHandle;
import com.partnerbridge.bothub.registry.BotRegistry;
import com.partnerbridge.bothub.tenant.TenantBot;
import com.partnerbridge.bothub.tenant.TenantConfigStore;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ExternalEventRouterTest {

  private static final String TOKEN = "integration-7";

  private final ObjectMapper json = new ObjectMapper();
  private final BotHandle shop =
      new BotHandle("111111111:aaaa", "Shop", 7L, "shop_bot", Instant.now(), "111111111:");

  @Mock TenantConfigStore tenants;
  @Mock BotRegistry registry;
  @Mock DocumentGateway documents;
  @Mock OutboundChannel outbound;

  private ExternalEventRouter router;

  @BeforeEach
  void setUp() {
    router =
        new ExternalEventRouter(
            new ProcessedEventCache(Duration.ofHours(1), 1000),
            tenants,
            registry,
            documents,
            new ChatIdProperty(new BackOfficeProperties(null, null, "oked")),
            new ReceiptFormatter(new BotHubProperties("", "", "UTC")),
            outbound);
    lenient()
        .when(tenants.findByCorrelationToken(TOKEN))
        .thenReturn(Optional.of(new TenantBot(7L, shop.credential(), "Shop", TOKEN, true)));
    lenient().when(registry.lookupByTenant(7L)).thenReturn(Optional.of(shop));
    lenient()
        .when(outbound.sendText(any(), anyLong(), anyString(), anyString(), isNull()))
        .thenReturn(new DeliveryReport(1, 1));
  }

  private BackOfficeEventEnvelope event(String id, String kind, long documentId) {
    return new BackOfficeEventEnvelope(
        id, null, TOKEN, kind, json.createObjectNode().put("id", documentId));
  }

  private JsonNode shipment(String oked) throws Exception {
    String partner =
        oked == null
            ? "{\"id\":3,\"name\":\"Ali\"}"
            : "{\"id\":3,\"name\":\"Ali\",\"oked\":\"" + oked + "\"}";
    return json.readTree(
        "{\"id\":50,\"code\":\"WS-50\",\"date\":1700000000,\"stock\":{\"id\":2},"
            + "\"partner\":"
            + partner
            + "}");
  }

  private void shipmentExists(String oked) throws Exception {
    when(documents.fetchDocument(TOKEN, DocumentKind.SHIPMENT, 50L))
        .thenReturn(Optional.of(shipment(oked)));
  }

  @Test
  void sameEventTwice_deliversOnce() throws Exception {
    shipmentExists("555");
    when(documents.fetchOperations(TOKEN, DocumentKind.SHIPMENT, 50L)).thenReturn(List.of());
    when(documents.stockName(TOKEN, 2L)).thenReturn(Optional.of("Main"));

    RouteResult first = router.handle(event("evt-1", "DocWholeSalePerformed", 50L));
    RouteResult second = router.handle(event("evt-1", "DocWholeSalePerformed", 50L));

    assertThat(first.outcome()).isEqualTo(RouteOutcome.DELIVERED);
    assertThat(second.outcome()).isEqualTo(RouteOutcome.DUPLICATE);
    assertThat(second.ok()).isTrue();
    verify(outbound, times(1))
        .sendText(eq(shop), eq(555L), contains("Main"), eq(OutboundChannel.MARKDOWN), isNull());
  }

  @Test
  void shipmentReceipt_usesPartnerTerminology() throws Exception {
    shipmentExists("555");
    when(documents.fetchOperations(TOKEN, DocumentKind.SHIPMENT, 50L)).thenReturn(List.of());
    when(documents.stockName(TOKEN, 2L)).thenReturn(Optional.empty());

    router.handle(event("evt-2", "DocWholeSalePerformCanceled", 50L));

    verify(outbound)
        .sendText(
            eq(shop), eq(555L), contains("Чек закупки"), eq(OutboundChannel.MARKDOWN), isNull());
    verify(outbound)
        .sendText(eq(shop), eq(555L), contains("ОТМЕНЕНО"), anyString(), isNull());
  }

  @Test
  void unknownCorrelationToken_hasNoMatchingTenant() {
    RouteResult result =
        router.handle(
            new BackOfficeEventEnvelope(
                "evt-3", null, "stranger", "DocWholeSalePerformed", json.createObjectNode()));

    assertThat(result.outcome()).isEqualTo(RouteOutcome.NO_MATCHING_TENANT);
    assertThat(result.ok()).isFalse();
    verifyNoInteractions(documents, outbound);
  }

  @Test
  void tenantWithoutRegisteredBot_hasNoMatchingTenant() {
    when(registry.lookupByTenant(7L)).thenReturn(Optional.empty());

    RouteResult result = router.handle(event("evt-4", "DocWholeSalePerformed", 50L));

    assertThat(result.outcome()).isEqualTo(RouteOutcome.NO_MATCHING_TENANT);
  }

  @Test
  void unknownEventKind_isIgnored() {
    RouteResult result = router.handle(event("evt-5", "DocInventoryPerformed", 50L));

    assertThat(result.outcome()).isEqualTo(RouteOutcome.IGNORED);
    assertThat(result.ok()).isTrue();
    verifyNoInteractions(documents, outbound);
  }

  @Test
  void eventWithoutDocumentId_isIgnored() {
    RouteResult result =
        router.handle(
            new BackOfficeEventEnvelope(
                "evt-6", null, TOKEN, "DocPaymentPerformed", json.createObjectNode()));

    assertThat(result.outcome()).isEqualTo(RouteOutcome.IGNORED);
    verifyNoInteractions(documents);
  }

  @Test
  void unparsableRecipient_isNoRecipient() throws Exception {
    shipmentExists("not a chat id");

    RouteResult result = router.handle(event("evt-7", "DocWholeSalePerformed", 50L));

    assertThat(result.outcome()).isEqualTo(RouteOutcome.NO_RECIPIENT);
    assertThat(result.ok()).isTrue();
    verifyNoInteractions(outbound);
  }

  @Test
  void missingRecipient_isNoRecipient() throws Exception {
    shipmentExists(null);

    RouteResult result = router.handle(event("evt-8", "DocWholeSalePerformed", 50L));

    assertThat(result.outcome()).isEqualTo(RouteOutcome.NO_RECIPIENT);
  }

  @Test
  void missingDocument_isNoDocument() {
    when(documents.fetchDocument(TOKEN, DocumentKind.PURCHASE, 50L)).thenReturn(Optional.empty());

    RouteResult result = router.handle(event("evt-9", "DocPurchasePerformed", 50L));

    assertThat(result.outcome()).isEqualTo(RouteOutcome.NO_DOCUMENT);
  }

  @Test
  void backOfficeFailure_isUpstreamError() {
    when(documents.fetchDocument(TOKEN, DocumentKind.SHIPMENT, 50L))
        .thenThrow(
            new UpstreamException(UpstreamException.Kind.TIMEOUT, "DocWholeSale/Get", "slow"));

    RouteResult result = router.handle(event("evt-10", "DocWholeSalePerformed", 50L));

    assertThat(result.outcome()).isEqualTo(RouteOutcome.UPSTREAM_ERROR);
    assertThat(result.ok()).isFalse();
  }

  @Test
  void undeliveredReceipt_isDeliveryFailed() throws Exception {
    shipmentExists("555");
    when(documents.fetchOperations(TOKEN, DocumentKind.SHIPMENT, 50L)).thenReturn(List.of());
    when(documents.stockName(TOKEN, 2L)).thenReturn(Optional.of("Main"));
    when(outbound.sendText(any(), anyLong(), anyString(), anyString(), isNull()))
        .thenReturn(new DeliveryReport(1, 0));

    RouteResult result = router.handle(event("evt-11", "DocWholeSalePerformed", 50L));

    assertThat(result.outcome()).isEqualTo(RouteOutcome.DELIVERY_FAILED);
  }

  @Test
  void payment_isDeliveredToPartner() throws Exception {
    when(documents.fetchPayment(TOKEN, 60L))
        .thenReturn(
            Optional.of(
                json.readTree(
                    "{\"id\":60,\"code\":\"P-60\",\"amount\":1500,"
                        + "\"category\":{\"positive\":true},"
                        + "\"partner\":{\"id\":3,\"oked\":555}}")));

    RouteResult result = router.handle(event("evt-12", "DocPaymentPerformed", 60L));

    assertThat(result.outcome()).isEqualTo(RouteOutcome.DELIVERED);
    verify(outbound)
        .sendText(eq(shop), eq(555L), contains("1 500"), eq(OutboundChannel.MARKDOWN), isNull());
  }
}
