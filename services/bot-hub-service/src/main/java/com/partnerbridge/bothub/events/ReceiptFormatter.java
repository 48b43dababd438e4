package com.partnerbridge.bothub.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.partnerbridge.bothub.backoffice.DocumentKind;
import com.partnerbridge.bothub.backoffice.JsonValues;
import com.partnerbridge.bothub.config.BotHubProperties;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/** Telegram Markdown texts for document and payment notifications, in the partner's terms. */
@Component
public class ReceiptFormatter {

  public static final String DEFAULT_WAREHOUSE = "Склад";

  private static final DateTimeFormatter DATE_TIME =
      DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm");
  private static final String CANCELLED = "❌ *ОТМЕНЕНО*";
  private static final String RULE = "─".repeat(20);

  private final ZoneId zone;

  public ReceiptFormatter(BotHubProperties properties) {
    this.zone = properties.zoneId();
  }

  public String formatDocument(
      DocumentKind kind,
      JsonNode document,
      List<JsonNode> operations,
      String warehouse,
      boolean cancelled) {
    List<String> lines = new ArrayList<>();
    if (cancelled) {
      lines.add(CANCELLED);
      lines.add("");
    }
    lines.add("🧾 *" + PartnerTerminology.receiptTitle(kind) + "*");
    lines.add("📄 *Документ №" + escape(document.path("code").asText("N/A")) + "*");
    lines.add("📅 Дата: " + formatDate(document.path("date")));
    lines.add("🏢 Склад: " + escape(warehouse));
    lines.add("");
    lines.add("📦 *Товары:*");
    lines.add("");

    BigDecimal totalQuantity = BigDecimal.ZERO;
    BigDecimal totalToPay = BigDecimal.ZERO;
    int index = 1;
    for (JsonNode op : operations) {
      BigDecimal quantity = JsonValues.decimal(op.path("quantity"));
      BigDecimal unit = JsonValues.decimal(op.path(kind.pricedByCost() ? "cost" : "price"));
      BigDecimal lineTotal = quantity.multiply(unit);
      totalQuantity = totalQuantity.add(quantity);
      totalToPay = totalToPay.add(lineTotal);

      lines.add(index++ + ". *" + escape(itemName(op.path("item"))) + "*");
      lines.add(
          "   "
              + AmountFormatter.format(quantity)
              + " × "
              + AmountFormatter.format(unit)
              + " = "
              + AmountFormatter.format(lineTotal));
      String note = op.path("description").asText("");
      if (!note.isBlank()) {
        lines.add("   Примечание: " + escape(note));
      }
      lines.add("");
    }
    lines.add(RULE);
    lines.add("📊 Всего товаров: " + AmountFormatter.format(totalQuantity));
    lines.add("💵 *Итого к оплате: " + AmountFormatter.format(totalToPay) + "*");
    return String.join("\n", lines);
  }

  /**
   * Payment notice. A payment the tenant books as positive is money paid out to the partner.
   */
  public String formatPayment(JsonNode document, String warehouse, boolean cancelled) {
    List<String> lines = new ArrayList<>();
    if (cancelled) {
      lines.add(CANCELLED);
      lines.add("");
    }
    boolean paidOut = document.path("category").path("positive").asBoolean(false);
    lines.add(paidOut ? "⬆️ *Выплачено*" : "⬇️ *Получено*");
    lines.add("📄 *Документ № " + escape(document.path("code").asText("N/A")) + "*");
    lines.add("📅 Дата: " + formatDate(document.path("date")));
    lines.add("🏢 Склад: " + escape(warehouse));
    lines.add("");

    String type = document.path("type").path("name").asText("");
    lines.add("💳 Тип платежа: " + (type.isBlank() ? "Неизвестный тип" : escape(type)));
    String currency = document.path("currency").path("name").asText("");
    String amount = AmountFormatter.format(JsonValues.decimal(document.path("amount")));
    lines.add("💵 Сумма: " + amount + (currency.isBlank() ? "" : " " + escape(currency)));

    JsonNode rateNode = document.path("exchange_rate");
    BigDecimal rate = rateNode.isMissingNode() ? BigDecimal.ONE : JsonValues.decimal(rateNode);
    if (rate.signum() != 0 && rate.compareTo(BigDecimal.ONE) != 0) {
      lines.add("📊 Курс обмена: " + AmountFormatter.format(rate, 4));
    }
    String note = document.path("description").asText("");
    if (!note.isBlank()) {
      lines.add("📝 Примечание: " + escape(note));
    }
    return String.join("\n", lines);
  }

  String formatDate(JsonNode date) {
    if (date.canConvertToLong() && date.asLong() > 0) {
      return DATE_TIME.format(Instant.ofEpochSecond(date.asLong()).atZone(zone));
    }
    String text = date.asText("");
    return text.isBlank() ? "-" : escape(text);
  }

  private static String itemName(JsonNode item) {
    if (item.isObject()) {
      String name = item.path("name").asText("");
      return name.isBlank() ? "Неизвестный товар" : name;
    }
    String text = item.asText("");
    return text.isBlank() ? "Неизвестный товар" : text;
  }

  /** Escapes the characters legacy Telegram Markdown treats as markup. */
  static String escape(String text) {
    if (text == null) {
      return "";
    }
    StringBuilder sb = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '_' || c == '*' || c == '`' || c == '[') {
        sb.append('\\');
      }
      sb.append(c);
    }
    return sb.toString();
  }
}
