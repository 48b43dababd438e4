package com.partnerbridge.bothub.events;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Space-grouped amounts without trailing zeros: 60000.00 is "60 000", 60000.05 "60 000.05". */
public final class AmountFormatter {

  private AmountFormatter() {}

  public static String format(BigDecimal value) {
    return format(value, 2);
  }

  public static String format(BigDecimal value, int maxDecimals) {
    if (value == null) {
      return "0";
    }
    BigDecimal scaled = value.setScale(maxDecimals, RoundingMode.HALF_UP).stripTrailingZeros();
    if (scaled.signum() == 0) {
      return "0";
    }
    String plain = scaled.toPlainString();
    boolean negative = plain.startsWith("-");
    if (negative) {
      plain = plain.substring(1);
    }
    int dot = plain.indexOf('.');
    String integer = dot < 0 ? plain : plain.substring(0, dot);
    String fraction = dot < 0 ? "" : plain.substring(dot);

    StringBuilder grouped = new StringBuilder();
    int lead = integer.length() % 3;
    for (int i = 0; i < integer.length(); i++) {
      if (i > 0 && (i - lead) % 3 == 0) {
        grouped.append(' ');
      }
      grouped.append(integer.charAt(i));
    }
    return (negative ? "-" : "") + grouped + fraction;
  }
}
