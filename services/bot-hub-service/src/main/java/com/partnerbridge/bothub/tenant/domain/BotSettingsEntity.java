package com.partnerbridge.bothub.tenant.domain;

import jakarta.persistence.*;

@Entity
@Table(name = "bot_settings")
public class BotSettingsEntity {

  @Id
  @Column(name = "bot_id")
  private Long botId;

  @Column(name = "self_registration_allowed", nullable = false)
  private boolean selfRegistrationAllowed;

  @Column(name = "partner_group_id")
  private Long partnerGroupId;

  @Column(name = "stock_id")
  private Long stockId;

  @Column(name = "currency_id")
  private Long currencyId;

  @Column(name = "currency_name", length = 32)
  private String currencyName;

  @Column(name = "language_code", nullable = false, length = 8)
  private String languageCode;

  protected BotSettingsEntity() {
    // for JPA
  }

  public BotSettingsEntity(Long botId, boolean selfRegistrationAllowed, Long partnerGroupId) {
    this.botId = botId;
    this.selfRegistrationAllowed = selfRegistrationAllowed;
    this.partnerGroupId = partnerGroupId;
    this.languageCode = "ru";
  }

  public Long getBotId() {
    return botId;
  }

  public boolean isSelfRegistrationAllowed() {
    return selfRegistrationAllowed;
  }

  public Long getPartnerGroupId() {
    return partnerGroupId;
  }

  public Long getStockId() {
    return stockId;
  }

  public void setStockId(Long stockId) {
    this.stockId = stockId;
  }

  public Long getCurrencyId() {
    return currencyId;
  }

  public void setCurrencyId(Long currencyId) {
    this.currencyId = currencyId;
  }

  public String getCurrencyName() {
    return currencyName;
  }

  public void setCurrencyName(String currencyName) {
    this.currencyName = currencyName;
  }

  public String getLanguageCode() {
    return languageCode;
  }
}
