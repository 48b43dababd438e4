package com.partnerbridge.bothub.backoffice;

/** Goods documents the back office notifies about, with the endpoints that read them. */
public enum DocumentKind {
  SHIPMENT("DocWholeSale/Get", "WholeSaleOperation/Get", false, false),
  SHIPMENT_RETURN("DocWholeSaleReturn/Get", "WholeSaleReturnOperation/Get", false, true),
  PURCHASE("DocPurchase/Get", "PurchaseOperation/Get", true, false),
  PURCHASE_RETURN("DocReturnsToPartner/Get", "ReturnsToPartnerOperation/Get", true, true);

  private final String documentEndpoint;
  private final String operationsEndpoint;
  private final boolean pricedByCost;
  private final boolean isReturn;

  DocumentKind(
      String documentEndpoint, String operationsEndpoint, boolean pricedByCost, boolean isReturn) {
    this.documentEndpoint = documentEndpoint;
    this.operationsEndpoint = operationsEndpoint;
    this.pricedByCost = pricedByCost;
    this.isReturn = isReturn;
  }

  public String documentEndpoint() {
    return documentEndpoint;
  }

  public String operationsEndpoint() {
    return operationsEndpoint;
  }

  /** Purchase lines carry {@code cost}; sale lines carry {@code price}. */
  public boolean pricedByCost() {
    return pricedByCost;
  }

  public boolean isReturn() {
    return isReturn;
  }
}
