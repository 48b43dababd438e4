package com.partnerbridge.bothub.conversation;

import java.util.HashMap;
import java.util.IllegalFormatException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * User-facing texts. Built-in Russian defaults can be overridden per key under {@code
 * bothub.messages.templates}.
 */
@Component
@ConfigurationProperties(prefix = "bothub.messages")
@Slf4j
public class BotMessageTemplates {

  public static final String GREETING_LINKED = "greeting-linked";
  public static final String REQUEST_CONTACT = "request-contact";
  public static final String CONTACT_BUTTON = "contact-button";
  public static final String CONTACT_NOT_OWN = "contact-not-own";
  public static final String ALREADY_REGISTERED = "already-registered";
  public static final String LINKED = "linked";
  public static final String LINK_FAILED = "link-failed";
  public static final String NOT_FOUND = "not-found";
  public static final String CONFIRM_REGISTRATION = "confirm-registration";
  public static final String CONFIRM_YES = "confirm-yes";
  public static final String CONFIRM_NO = "confirm-no";
  public static final String REGISTERED = "registered";
  public static final String REGISTRATION_CANCELLED = "registration-cancelled";
  public static final String REGISTRATION_EXPIRED = "registration-expired";
  public static final String REGISTRATION_UNAVAILABLE = "registration-unavailable";
  public static final String USE_START = "use-start";
  public static final String APOLOGY = "apology";
  public static final String MENU_BUTTON = "menu-button";
  public static final String BALANCE_ALERT = "balance-alert";
  public static final String BALANCE_LINE = "balance-line";
  public static final String BALANCE_FOOTER = "balance-footer";
  public static final String BALANCE_CAPTION = "balance-caption";

  private static final Map<String, String> DEFAULTS =
      Map.ofEntries(
          Map.entry(GREETING_LINKED, "Здравствуйте, %s! Вы уже зарегистрированы."),
          Map.entry(
              REQUEST_CONTACT,
              "Добро пожаловать! Чтобы продолжить, поделитесь своим номером телефона."),
          Map.entry(CONTACT_BUTTON, "📱 Поделиться контактом"),
          Map.entry(
              CONTACT_NOT_OWN,
              "Пожалуйста, отправьте свой собственный контакт кнопкой ниже."),
          Map.entry(ALREADY_REGISTERED, "Вы уже зарегистрированы."),
          Map.entry(LINKED, "✅ Готово, %s! Теперь вы будете получать уведомления здесь."),
          Map.entry(LINK_FAILED, "Не удалось привязать аккаунт. Попробуйте позже."),
          Map.entry(NOT_FOUND, "Партнёр с номером %s не найден. Обратитесь к менеджеру."),
          Map.entry(
              CONFIRM_REGISTRATION,
              "Партнёр с номером %s не найден. Зарегистрироваться как новый партнёр?"),
          Map.entry(CONFIRM_YES, "Да"),
          Map.entry(CONFIRM_NO, "Нет"),
          Map.entry(REGISTERED, "✅ Регистрация завершена. Добро пожаловать, %s!"),
          Map.entry(REGISTRATION_CANCELLED, "Регистрация отменена."),
          Map.entry(
              REGISTRATION_EXPIRED, "Запрос на регистрацию устарел. Отправьте /start ещё раз."),
          Map.entry(
              REGISTRATION_UNAVAILABLE,
              "Регистрация сейчас недоступна. Обратитесь к менеджеру."),
          Map.entry(USE_START, "Отправьте /start, чтобы начать."),
          Map.entry(APOLOGY, "Извините, произошла ошибка. Попробуйте позже."),
          Map.entry(MENU_BUTTON, "Открыть"),
          Map.entry(BALANCE_ALERT, "⚠️ Уведомление о балансе\n\nОтрицательный баланс:\n"),
          Map.entry(BALANCE_LINE, "🏢 %s (%s): %s"),
          Map.entry(BALANCE_FOOTER, "Подробная информация в прикреплённом файле."),
          Map.entry(BALANCE_CAPTION, "📊 Баланс партнёра"));

  private Map<String, String> templates = new HashMap<>();

  public String text(String key, Object... args) {
    String template = templates.get(key);
    if (template == null || template.isBlank()) {
      template = DEFAULTS.get(key);
    }
    if (template == null) {
      throw new IllegalArgumentException("unknown message key: " + key);
    }
    if (args == null || args.length == 0) {
      return template;
    }
    try {
      return String.format(template, args);
    } catch (IllegalFormatException e) {
      log.warn("Message template {} does not fit its arguments: {}", key, e.getMessage());
      return template;
    }
  }

  public Map<String, String> getTemplates() {
    return templates;
  }

  public void setTemplates(Map<String, String> templates) {
    this.templates = templates == null ? new HashMap<>() : templates;
  }
}
