package com.partnerbridge.bothub.tenant;

/** Per-tenant switches and back-office defaults. Nullable ids mean "not configured". */
public record TenantSettings(
    long tenantId,
    boolean selfRegistrationAllowed,
    Long defaultPartnerGroupId,
    Long defaultStockId,
    Long defaultCurrencyId,
    String currencyName,
    String languageCode) {

  public static TenantSettings defaults(long tenantId) {
    return new TenantSettings(tenantId, false, null, null, null, null, "ru");
  }
}
