package com.partnerbridge.bothub.conversation;

import static com.partnerbridge.bothub.conversation.BotMessageTemplates.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.partnerbridge.bothub.backoffice.NewPartner;
import com.partnerbridge.bothub.backoffice.Partner;
import com.partnerbridge.bothub.backoffice.PartnerDirectory;
import com.partnerbridge.bothub.model.ContactRequestKeyboard;
import com.partnerbridge.bothub.model.InlineKeyboard;
import com.partnerbridge.bothub.outbound.OutboundChannel;
import com.partnerbridge.bothub.registry.BotHandle;
import com.partnerbridge.bothub.registry.BotRegistry;
import com.partnerbridge.bothub.tenant.TenantBot;
import com.partnerbridge.bothub.tenant.TenantConfigStore;
import com.partnerbridge.bothub.tenant.TenantSettings;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Routes Telegram updates of one bot: {@code /start}, shared contacts and the sign-up
 * confirmation buttons. The back office is the source of truth for whether a chat is linked.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConversationDispatcher {

  static final String CALLBACK_YES = "reg:yes";
  static final String CALLBACK_NO = "reg:no";

  private final BotRegistry registry;
  private final TenantConfigStore tenants;
  private final PartnerDirectory partners;
  private final PendingRegistrationStore pending;
  private final OutboundChannel outbound;
  private final BotMessageTemplates messages;

  public DispatchOutcome dispatch(String webhookKey, JsonNode update) {
    Optional<BotHandle> bot = registry.lookupByWebhookKey(webhookKey);
    if (bot.isEmpty()) {
      log.warn("Update for unknown webhook key {} dropped", webhookKey);
      return DispatchOutcome.dropped();
    }
    BotHandle handle = bot.get();
    IncomingUpdate u = IncomingUpdate.parse(update);
    if (u.kind() == IncomingUpdate.Kind.OTHER) {
      return DispatchOutcome.ignored();
    }
    try {
      ChatState state =
          switch (u.kind()) {
            case START -> onStart(handle, u);
            case CONTACT -> onContact(handle, u);
            case CALLBACK -> onCallback(handle, u);
            default -> onText(handle, u);
          };
      return DispatchOutcome.handled(state);
    } catch (RuntimeException e) {
      log.error(
          "Update {} for chat {} of tenant {} failed", u.kind(), u.chatId(), handle.tenantId(), e);
      outbound.sendText(handle, u.chatId(), messages.text(APOLOGY));
      return DispatchOutcome.failed();
    }
  }

  private ChatState onStart(BotHandle bot, IncomingUpdate u) {
    Optional<Partner> linked = partners.findByChatId(backOfficeToken(bot), u.chatId());
    if (linked.isPresent()) {
      outbound.sendText(
          bot, u.chatId(), messages.text(GREETING_LINKED, linked.get().displayName()));
      return ChatState.VERIFIED;
    }
    requestContact(bot, u.chatId(), REQUEST_CONTACT);
    return ChatState.AWAITING_CONTACT;
  }

  private ChatState onContact(BotHandle bot, IncomingUpdate u) {
    IncomingUpdate.SharedContact contact = u.contact();
    if (contact.userId() != null && contact.userId() != u.senderId()) {
      requestContact(bot, u.chatId(), CONTACT_NOT_OWN);
      return ChatState.AWAITING_CONTACT;
    }
    String phone = PartnerDirectory.normalizePhone(contact.phone());
    if (phone.isEmpty()) {
      requestContact(bot, u.chatId(), REQUEST_CONTACT);
      return ChatState.AWAITING_CONTACT;
    }

    String token = backOfficeToken(bot);
    Optional<Partner> found = partners.findByPhone(token, phone);
    if (found.isPresent()) {
      Partner partner = found.get();
      if (partner.isLinkedTo(u.chatId())) {
        outbound.sendText(bot, u.chatId(), messages.text(ALREADY_REGISTERED));
        return ChatState.VERIFIED;
      }
      if (!partners.linkChat(token, partner.id(), u.chatId())) {
        outbound.sendText(bot, u.chatId(), messages.text(LINK_FAILED));
        return ChatState.AWAITING_CONTACT;
      }
      outbound.sendText(bot, u.chatId(), messages.text(LINKED, partner.displayName()));
      return ChatState.VERIFIED;
    }

    TenantSettings settings = tenants.getTenantSettings(bot.tenantId());
    if (!settings.selfRegistrationAllowed()) {
      outbound.sendText(bot, u.chatId(), messages.text(NOT_FOUND, phone));
      return ChatState.UNKNOWN;
    }
    String name = contact.fullName().isEmpty() ? u.senderName() : contact.fullName();
    pending.put(new PendingRegistration(u.chatId(), phone, name, bot.tenantId(), Instant.now()));
    InlineKeyboard confirm =
        InlineKeyboard.singleRow(
            new InlineKeyboard.Button(messages.text(CONFIRM_YES), CALLBACK_YES),
            new InlineKeyboard.Button(messages.text(CONFIRM_NO), CALLBACK_NO));
    outbound.sendText(bot, u.chatId(), messages.text(CONFIRM_REGISTRATION, phone), confirm);
    return ChatState.AWAITING_REGISTRATION_CONFIRM;
  }

  private ChatState onCallback(BotHandle bot, IncomingUpdate u) {
    outbound.answerCallback(bot, u.callbackId(), null);
    String data = u.callbackData();
    if (CALLBACK_NO.equals(data)) {
      pending.remove(bot.tenantId(), u.chatId());
      outbound.sendText(bot, u.chatId(), messages.text(REGISTRATION_CANCELLED));
      return ChatState.UNKNOWN;
    }
    if (!CALLBACK_YES.equals(data)) {
      log.debug("Ignoring callback data {} in chat {}", data, u.chatId());
      return stateOf(bot, u.chatId());
    }

    // taken, not read: a double tap must not create two partners
    Optional<PendingRegistration> entry = pending.take(bot.tenantId(), u.chatId());
    if (entry.isEmpty()) {
      outbound.sendText(bot, u.chatId(), messages.text(REGISTRATION_EXPIRED));
      return ChatState.UNKNOWN;
    }
    PendingRegistration registration = entry.get();
    Long groupId = tenants.getTenantSettings(bot.tenantId()).defaultPartnerGroupId();
    if (groupId == null) {
      log.warn("Tenant {} allows sign-up but has no default partner group", bot.tenantId());
      pending.put(registration);
      outbound.sendText(bot, u.chatId(), messages.text(REGISTRATION_UNAVAILABLE));
      return ChatState.AWAITING_REGISTRATION_CONFIRM;
    }

    String name =
        registration.displayName() == null || registration.displayName().isBlank()
            ? registration.phone()
            : registration.displayName();
    OptionalLong partnerId;
    try {
      partnerId =
          partners.register(
              backOfficeToken(bot),
              new NewPartner(groupId, name, registration.phone(), registration.chatId()));
    } catch (RuntimeException e) {
      pending.put(registration);
      throw e;
    }
    if (partnerId.isEmpty()) {
      pending.put(registration);
      outbound.sendText(bot, u.chatId(), messages.text(APOLOGY));
      return ChatState.AWAITING_REGISTRATION_CONFIRM;
    }
    outbound.sendText(bot, u.chatId(), messages.text(REGISTERED, name));
    return ChatState.VERIFIED;
  }

  private ChatState onText(BotHandle bot, IncomingUpdate u) {
    outbound.sendText(bot, u.chatId(), messages.text(USE_START));
    return stateOf(bot, u.chatId());
  }

  private ChatState stateOf(BotHandle bot, long chatId) {
    return pending.get(bot.tenantId(), chatId).isPresent()
        ? ChatState.AWAITING_REGISTRATION_CONFIRM
        : ChatState.UNKNOWN;
  }

  private void requestContact(BotHandle bot, long chatId, String messageKey) {
    outbound.sendText(
        bot,
        chatId,
        messages.text(messageKey),
        new ContactRequestKeyboard(messages.text(CONTACT_BUTTON)));
  }

  private String backOfficeToken(BotHandle bot) {
    return tenants
        .findByTenantId(bot.tenantId())
        .filter(TenantBot::hasBackOfficeToken)
        .map(TenantBot::backOfficeToken)
        .orElseThrow(
            () ->
                new IllegalStateException(
                    "tenant " + bot.tenantId() + " has no back-office integration token"));
  }
}
