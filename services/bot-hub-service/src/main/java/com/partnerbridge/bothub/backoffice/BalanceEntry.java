package com.partnerbridge.bothub.backoffice;

import java.math.BigDecimal;

/**
 * One row of a partner's balance statement for a (firm, currency) pair. {@code startAmount} is the
 * balance carried into the row, so the latest row alone gives the current balance.
 */
public record BalanceEntry(
    long firmId,
    String firmName,
    long currencyId,
    String currencyName,
    long date,
    String documentCode,
    String documentType,
    BigDecimal startAmount,
    BigDecimal debit,
    BigDecimal credit) {

  public BigDecimal closingBalance() {
    return startAmount.add(debit).subtract(credit);
  }
}
