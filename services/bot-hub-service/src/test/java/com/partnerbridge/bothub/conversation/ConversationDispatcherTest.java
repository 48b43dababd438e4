package com.partnerbridge.bothub.conversation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.partnerbridge.bothub.backoffice.NewPartner;
import com.partnerbridge.bothub.backoffice.Partner;
import com.partnerbridge.bothub.backoffice.PartnerDirectory;
import com.partnerbridge.bothub.client.UpstreamException;
import com.partnerbridge.bothub.model.ContactRequestKeyboard;
import com.partnerbridge.bothub.model.InlineKeyboard;
import com.partnerbridge.bothub.outbound.OutboundChannel;
import com.partnerbridge.bothub.registry.BotHandle;
import com.partnerbridge.bothub.registry.BotRegistry;
import com.partnerbridge.bothub.tenant.TenantBot;
import com.partnerbridge.bothub.tenant.TenantConfigStore;
import com.partnerbridge.bothub.tenant.TenantSettings;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ConversationDispatcherTest {

  private static final long CHAT = 555L;
  private static final String PHONE = "998901234567";

  private final ObjectMapper json = new ObjectMapper();
  private final BotMessageTemplates messages = new BotMessageTemplates();
  private final BotHandle shop =
      new BotHandle("111111111:aaaa", "Shop", 7L, "shop_bot", Instant.now(), "111111111:");
  private final BotHandle other =
      new BotHandle("222222222:bbbb", "Other", 8L, "other_bot", Instant.now(), "222222222:");

  @Mock BotRegistry registry;
  @Mock TenantConfigStore tenants;
  @Mock PartnerDirectory partners;
  @Mock OutboundChannel outbound;

  private PendingRegistrationStore pending;
  private ConversationDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    pending = new PendingRegistrationStore(Duration.ofMinutes(15));
    dispatcher =
        new ConversationDispatcher(registry, tenants, partners, pending, outbound, messages);
    lenient().when(registry.lookupByWebhookKey("111111111:")).thenReturn(Optional.of(shop));
    lenient().when(registry.lookupByWebhookKey("222222222:")).thenReturn(Optional.of(other));
    lenient()
        .when(tenants.findByTenantId(7L))
        .thenReturn(Optional.of(new TenantBot(7L, shop.credential(), "Shop", "tok-7", true)));
  }

  private JsonNode update(String raw) throws Exception {
    return json.readTree(raw);
  }

  private JsonNode start() throws Exception {
    return update(
        "{\"message\":{\"chat\":{\"id\":555},\"from\":{\"id\":555},\"text\":\"/start\"}}");
  }

  private JsonNode ownContact() throws Exception {
    return update(
        "{\"message\":{\"chat\":{\"id\":555},\"from\":{\"id\":555,\"first_name\":\"Ali\"},"
            + "\"contact\":{\"phone_number\":\"+998 90 123-45-67\",\"user_id\":555,"
            + "\"first_name\":\"Ali\",\"last_name\":\"Valiev\"}}}");
  }

  private JsonNode callback(String data) throws Exception {
    return update(
        "{\"callback_query\":{\"id\":\"cb-1\",\"from\":{\"id\":555},"
            + "\"message\":{\"chat\":{\"id\":555}},\"data\":\""
            + data
            + "\"}}");
  }

  private void selfRegistration(boolean allowed, Long groupId) {
    when(tenants.getTenantSettings(7L))
        .thenReturn(new TenantSettings(7L, allowed, groupId, null, null, null, "ru"));
  }

  @Test
  void unknownWebhookKey_isDropped() throws Exception {
    DispatchOutcome outcome = dispatcher.dispatch("nope", start());

    assertThat(outcome.status()).isEqualTo(DispatchOutcome.Status.DROPPED);
    verifyNoInteractions(partners, outbound);
  }

  @Test
  void updateWithoutMessage_isIgnored() throws Exception {
    DispatchOutcome outcome = dispatcher.dispatch("111111111:", update("{\"poll\":{}}"));

    assertThat(outcome.status()).isEqualTo(DispatchOutcome.Status.IGNORED);
    verifyNoInteractions(outbound);
  }

  @Test
  void start_linkedChat_greetsPartner() throws Exception {
    when(partners.findByChatId("tok-7", CHAT))
        .thenReturn(Optional.of(new Partner(3L, "Ali", PHONE, OptionalLong.of(CHAT))));

    DispatchOutcome outcome = dispatcher.dispatch("111111111:", start());

    assertThat(outcome.state()).isEqualTo(ChatState.VERIFIED);
    verify(outbound)
        .sendText(shop, CHAT, messages.text(BotMessageTemplates.GREETING_LINKED, "Ali"));
  }

  @Test
  void start_unlinkedChat_asksForContact() throws Exception {
    when(partners.findByChatId("tok-7", CHAT)).thenReturn(Optional.empty());

    DispatchOutcome outcome = dispatcher.dispatch("111111111:", start());

    assertThat(outcome.state()).isEqualTo(ChatState.AWAITING_CONTACT);
    verify(outbound)
        .sendText(
            eq(shop),
            eq(CHAT),
            eq(messages.text(BotMessageTemplates.REQUEST_CONTACT)),
            any(ContactRequestKeyboard.class));
  }

  @Test
  void someoneElsesContact_isRefused() throws Exception {
    JsonNode foreign =
        update(
            "{\"message\":{\"chat\":{\"id\":555},\"from\":{\"id\":555},"
                + "\"contact\":{\"phone_number\":\"998901234567\",\"user_id\":999}}}");

    DispatchOutcome outcome = dispatcher.dispatch("111111111:", foreign);

    assertThat(outcome.state()).isEqualTo(ChatState.AWAITING_CONTACT);
    verify(partners, never()).findByPhone(anyString(), anyString());
    verify(outbound)
        .sendText(
            eq(shop),
            eq(CHAT),
            eq(messages.text(BotMessageTemplates.CONTACT_NOT_OWN)),
            any(ContactRequestKeyboard.class));
  }

  @Test
  void knownPhone_linksChat() throws Exception {
    when(partners.findByPhone("tok-7", PHONE))
        .thenReturn(Optional.of(new Partner(3L, "Ali", PHONE, OptionalLong.empty())));
    when(partners.linkChat("tok-7", 3L, CHAT)).thenReturn(true);

    DispatchOutcome outcome = dispatcher.dispatch("111111111:", ownContact());

    assertThat(outcome.state()).isEqualTo(ChatState.VERIFIED);
    verify(outbound).sendText(shop, CHAT, messages.text(BotMessageTemplates.LINKED, "Ali"));
  }

  @Test
  void knownPhone_alreadyLinkedToThisChat_saysSo() throws Exception {
    when(partners.findByPhone("tok-7", PHONE))
        .thenReturn(Optional.of(new Partner(3L, "Ali", PHONE, OptionalLong.of(CHAT))));

    DispatchOutcome outcome = dispatcher.dispatch("111111111:", ownContact());

    assertThat(outcome.state()).isEqualTo(ChatState.VERIFIED);
    verify(outbound).sendText(shop, CHAT, messages.text(BotMessageTemplates.ALREADY_REGISTERED));
    verify(partners, never()).linkChat(anyString(), anyLong(), anyLong());
  }

  @Test
  void freeText_pointsToStart_andLeavesStateAlone() throws Exception {
    JsonNode hello =
        update("{\"message\":{\"chat\":{\"id\":555},\"from\":{\"id\":555},\"text\":\"hi\"}}");

    DispatchOutcome outcome = dispatcher.dispatch("111111111:", hello);

    assertThat(outcome.state()).isEqualTo(ChatState.UNKNOWN);
    verify(outbound).sendText(shop, CHAT, messages.text(BotMessageTemplates.USE_START));
    verifyNoInteractions(partners);
  }

  @Test
  void freeText_whilePending_keepsTheRegistrationOpen() throws Exception {
    pending.put(new PendingRegistration(CHAT, PHONE, "Ali", 7L, Instant.now()));
    JsonNode hello =
        update("{\"message\":{\"chat\":{\"id\":555},\"from\":{\"id\":555},\"text\":\"ok?\"}}");

    DispatchOutcome outcome = dispatcher.dispatch("111111111:", hello);

    assertThat(outcome.state()).isEqualTo(ChatState.AWAITING_REGISTRATION_CONFIRM);
    assertThat(pending.get(7L, CHAT)).isPresent();
    verify(outbound).sendText(shop, CHAT, messages.text(BotMessageTemplates.USE_START));
  }

  @Test
  void unknownPhone_withoutSelfRegistration_isNotFound() throws Exception {
    when(partners.findByPhone("tok-7", PHONE)).thenReturn(Optional.empty());
    selfRegistration(false, null);

    DispatchOutcome outcome = dispatcher.dispatch("111111111:", ownContact());

    assertThat(outcome.state()).isEqualTo(ChatState.UNKNOWN);
    assertThat(pending.get(7L, CHAT)).isEmpty();
    verify(outbound).sendText(shop, CHAT, messages.text(BotMessageTemplates.NOT_FOUND, PHONE));
  }

  @Test
  void pendingRegistration_confirmed_createsPartnerWithChatId() throws Exception {
    when(partners.findByPhone("tok-7", PHONE)).thenReturn(Optional.empty());
    selfRegistration(true, 4L);
    NewPartner expected = new NewPartner(4L, "Ali Valiev", PHONE, CHAT);
    when(partners.register("tok-7", expected)).thenReturn(OptionalLong.of(99L));

    DispatchOutcome asked = dispatcher.dispatch("111111111:", ownContact());
    assertThat(asked.state()).isEqualTo(ChatState.AWAITING_REGISTRATION_CONFIRM);
    assertThat(pending.get(7L, CHAT)).isPresent();
    verify(outbound)
        .sendText(
            eq(shop),
            eq(CHAT),
            eq(messages.text(BotMessageTemplates.CONFIRM_REGISTRATION, PHONE)),
            any(InlineKeyboard.class));

    DispatchOutcome confirmed =
        dispatcher.dispatch("111111111:", callback(ConversationDispatcher.CALLBACK_YES));

    assertThat(confirmed.state()).isEqualTo(ChatState.VERIFIED);
    assertThat(pending.get(7L, CHAT)).isEmpty();
    verify(partners).register("tok-7", expected);
    verify(outbound).answerCallback(shop, "cb-1", null);
    verify(outbound)
        .sendText(shop, CHAT, messages.text(BotMessageTemplates.REGISTERED, "Ali Valiev"));
  }

  @Test
  void secondConfirmation_doesNotRegisterTwice() throws Exception {
    when(partners.findByPhone("tok-7", PHONE)).thenReturn(Optional.empty());
    selfRegistration(true, 4L);
    when(partners.register(eq("tok-7"), any(NewPartner.class))).thenReturn(OptionalLong.of(99L));
    dispatcher.dispatch("111111111:", ownContact());

    dispatcher.dispatch("111111111:", callback(ConversationDispatcher.CALLBACK_YES));
    DispatchOutcome again =
        dispatcher.dispatch("111111111:", callback(ConversationDispatcher.CALLBACK_YES));

    assertThat(again.state()).isEqualTo(ChatState.UNKNOWN);
    verify(partners, times(1)).register(eq("tok-7"), any(NewPartner.class));
  }

  @Test
  void confirmationWithoutPendingEntry_asksToRestart() throws Exception {
    DispatchOutcome outcome =
        dispatcher.dispatch("111111111:", callback(ConversationDispatcher.CALLBACK_YES));

    assertThat(outcome.state()).isEqualTo(ChatState.UNKNOWN);
    verify(outbound).sendText(shop, CHAT, messages.text(BotMessageTemplates.REGISTRATION_EXPIRED));
    verify(partners, never()).register(anyString(), any(NewPartner.class));
  }

  @Test
  void pendingEntryOfOneTenant_isInvisibleToAnother() throws Exception {
    pending.put(new PendingRegistration(CHAT, PHONE, "Ali", 7L, Instant.now()));

    DispatchOutcome outcome =
        dispatcher.dispatch("222222222:", callback(ConversationDispatcher.CALLBACK_YES));

    assertThat(outcome.state()).isEqualTo(ChatState.UNKNOWN);
    assertThat(pending.get(7L, CHAT)).isPresent();
    verify(outbound)
        .sendText(other, CHAT, messages.text(BotMessageTemplates.REGISTRATION_EXPIRED));
  }

  @Test
  void declining_dropsPendingEntry() throws Exception {
    pending.put(new PendingRegistration(CHAT, PHONE, "Ali", 7L, Instant.now()));

    DispatchOutcome outcome =
        dispatcher.dispatch("111111111:", callback(ConversationDispatcher.CALLBACK_NO));

    assertThat(outcome.state()).isEqualTo(ChatState.UNKNOWN);
    assertThat(pending.get(7L, CHAT)).isEmpty();
  }

  @Test
  void failedRegistration_keepsPendingEntryForRetry() throws Exception {
    pending.put(new PendingRegistration(CHAT, PHONE, "Ali", 7L, Instant.now()));
    selfRegistration(true, 4L);
    when(partners.register(eq("tok-7"), any(NewPartner.class)))
        .thenThrow(new UpstreamException(UpstreamException.Kind.TIMEOUT, "Partner/Add", "slow"));

    DispatchOutcome outcome =
        dispatcher.dispatch("111111111:", callback(ConversationDispatcher.CALLBACK_YES));

    assertThat(outcome.status()).isEqualTo(DispatchOutcome.Status.FAILED);
    assertThat(pending.get(7L, CHAT)).isPresent();
    verify(outbound).sendText(shop, CHAT, messages.text(BotMessageTemplates.APOLOGY));
  }

  @Test
  void backOfficeFailure_sendsApology() throws Exception {
    when(partners.findByChatId(anyString(), anyLong()))
        .thenThrow(new UpstreamException(UpstreamException.Kind.ERROR, "Partner/Get", "500"));

    DispatchOutcome outcome = dispatcher.dispatch("111111111:", start());

    assertThat(outcome.status()).isEqualTo(DispatchOutcome.Status.FAILED);
    verify(outbound).sendText(shop, CHAT, messages.text(BotMessageTemplates.APOLOGY));
  }
}
