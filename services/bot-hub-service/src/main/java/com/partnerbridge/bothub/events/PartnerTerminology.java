package com.partnerbridge.bothub.events;

import com.partnerbridge.bothub.backoffice.DocumentKind;
import java.util.Locale;
import java.util.Map;

/**
 * Document and ledger wording as the counterparty sees it. What the tenant books as a shipment is a
 * purchase for the partner and vice versa; debit and credit swap the same way.
 */
public final class PartnerTerminology {

  private static final Map<String, String> INVERTED =
      Map.of(
          "закупка", "Отгрузка",
          "отгрузка", "Закупка",
          "возврат закупки", "Возврат отгрузки",
          "возврат отгрузки", "Возврат закупки",
          "чек закупки", "Чек отгрузки",
          "чек отгрузки", "Чек закупки",
          "чек возврата закупки", "Чек возврата отгрузки",
          "чек возврата отгрузки", "Чек возврата закупки");

  private PartnerTerminology() {}

  /** Partner-side name for a tenant-side document name; unknown names pass through. */
  public static String invert(String systemName) {
    if (systemName == null) {
      return null;
    }
    String mapped = INVERTED.get(systemName.trim().toLowerCase(Locale.ROOT));
    return mapped == null ? systemName : mapped;
  }

  /** Receipt title shown to the partner. */
  public static String receiptTitle(DocumentKind kind) {
    String systemName =
        switch (kind) {
          case SHIPMENT -> "Чек отгрузки";
          case SHIPMENT_RETURN -> "Чек возврата отгрузки";
          case PURCHASE -> "Чек закупки";
          case PURCHASE_RETURN -> "Чек возврата закупки";
        };
    return invert(systemName);
  }

  /** Column label for the tenant's debit column, seen from the partner's side. */
  public static String debitLabel() {
    return "Кредит";
  }

  /** Column label for the tenant's credit column, seen from the partner's side. */
  public static String creditLabel() {
    return "Дебет";
  }
}
