package com.partnerbridge.bothub.backoffice;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;

/** Lenient readers for back-office JSON, which mixes numbers and numeric strings. */
public final class JsonValues {

  private JsonValues() {}

  /** A JSON number or numeric string; anything else is zero. */
  public static BigDecimal decimal(JsonNode n) {
    if (n == null || n.isMissingNode() || n.isNull()) {
      return BigDecimal.ZERO;
    }
    if (n.isNumber()) {
      return n.decimalValue();
    }
    try {
      return new BigDecimal(n.asText().trim());
    } catch (NumberFormatException e) {
      return BigDecimal.ZERO;
    }
  }
}
