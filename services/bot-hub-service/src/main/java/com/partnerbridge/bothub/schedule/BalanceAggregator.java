package com.partnerbridge.bothub.schedule;

import com.partnerbridge.bothub.backoffice.BalanceEntry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class BalanceAggregator {

  private BalanceAggregator() {}

  /**
   * Current balance per (firm, currency): the latest entry's {@code start + debit - credit}. Only
   * negative balances are returned, ordered by firm then currency name. Names missing on the
   * entries are taken from the given directories.
   */
  public static List<NegativeBalance> negativeBalances(
      List<BalanceEntry> entries, Map<Long, String> firmNames, Map<Long, String> currencyNames) {
    Map<List<Long>, BalanceEntry> latest = new LinkedHashMap<>();
    for (BalanceEntry e : entries) {
      latest.merge(
          List.of(e.firmId(), e.currencyId()), e, (a, b) -> b.date() >= a.date() ? b : a);
    }
    List<NegativeBalance> out = new ArrayList<>();
    for (BalanceEntry e : latest.values()) {
      if (e.closingBalance().signum() < 0) {
        out.add(
            new NegativeBalance(
                name(e.firmName(), firmNames.get(e.firmId()), "Firm " + e.firmId()),
                name(
                    e.currencyName(),
                    currencyNames.get(e.currencyId()),
                    "Currency " + e.currencyId()),
                e.closingBalance()));
      }
    }
    out.sort(
        Comparator.comparing(NegativeBalance::firmName)
            .thenComparing(NegativeBalance::currencyName));
    return out;
  }

  private static String name(String own, String fromDirectory, String fallback) {
    if (own != null && !own.isBlank()) {
      return own;
    }
    return fromDirectory != null ? fromDirectory : fallback;
  }
}
