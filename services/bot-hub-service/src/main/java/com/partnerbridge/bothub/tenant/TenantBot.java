package com.partnerbridge.bothub.tenant;

import com.partnerbridge.bothub.registry.Credentials;

/**
 * A persisted bot; the tenant id is the bot row id.
 *
 * @param backOfficeToken integration token; also the correlation token on back-office events
 */
public record TenantBot(
    long tenantId, String credential, String displayName, String backOfficeToken, boolean active) {

  public boolean hasBackOfficeToken() {
    return backOfficeToken != null && !backOfficeToken.isBlank();
  }

  @Override
  public String toString() {
    return "TenantBot[tenantId="
        + tenantId
        + ", credential="
        + Credentials.mask(credential)
        + ", displayName="
        + displayName
        + ", active="
        + active
        + "]";
  }
}
