package com.partnerbridge.bothub.events;

import com.partnerbridge.bothub.backoffice.DocumentKind;
import java.util.Optional;

/** Back-office event names the router acts on. */
public enum EventKind {
  SHIPMENT_PERFORMED("DocWholeSalePerformed", DocumentKind.SHIPMENT, false),
  SHIPMENT_CANCELED("DocWholeSalePerformCanceled", DocumentKind.SHIPMENT, true),
  SHIPMENT_RETURN_PERFORMED("DocWholeSaleReturnPerformed", DocumentKind.SHIPMENT_RETURN, false),
  SHIPMENT_RETURN_CANCELED("DocWholeSaleReturnPerformCanceled", DocumentKind.SHIPMENT_RETURN, true),
  PURCHASE_PERFORMED("DocPurchasePerformed", DocumentKind.PURCHASE, false),
  PURCHASE_CANCELED("DocPurchasePerformCanceled", DocumentKind.PURCHASE, true),
  PURCHASE_RETURN_PERFORMED("DocReturnsToPartnerPerformed", DocumentKind.PURCHASE_RETURN, false),
  PURCHASE_RETURN_CANCELED(
      "DocReturnsToPartnerPerformCanceled", DocumentKind.PURCHASE_RETURN, true),
  PAYMENT_PERFORMED("DocPaymentPerformed", null, false),
  PAYMENT_CANCELED("DocPaymentPerformCanceled", null, true),
  /** Anything else; logged and ignored. */
  UNKNOWN(null, null, false);

  private final String wireName;
  private final DocumentKind documentKind;
  private final boolean cancellation;

  EventKind(String wireName, DocumentKind documentKind, boolean cancellation) {
    this.wireName = wireName;
    this.documentKind = documentKind;
    this.cancellation = cancellation;
  }

  public static EventKind fromWire(String name) {
    if (name == null) {
      return UNKNOWN;
    }
    for (EventKind k : values()) {
      if (name.equals(k.wireName)) {
        return k;
      }
    }
    return UNKNOWN;
  }

  public String wireName() {
    return wireName;
  }

  /** Goods document kind; empty for payments and unknown events. */
  public Optional<DocumentKind> documentKind() {
    return Optional.ofNullable(documentKind);
  }

  public boolean isPayment() {
    return this == PAYMENT_PERFORMED || this == PAYMENT_CANCELED;
  }

  public boolean isCancellation() {
    return cancellation;
  }
}
