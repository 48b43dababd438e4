package com.partnerbridge.bothub.outbound;

/** Outcome of sending one logical message, possibly as several chunks. */
public record DeliveryReport(int attempted, int delivered) {

  public static final DeliveryReport NOTHING = new DeliveryReport(0, 0);

  public boolean fullyDelivered() {
    return attempted > 0 && delivered == attempted;
  }

  public boolean anyDelivered() {
    return delivered > 0;
  }
}
