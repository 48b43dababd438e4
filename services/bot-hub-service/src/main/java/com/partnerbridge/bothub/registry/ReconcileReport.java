package com.partnerbridge.bothub.registry;

/**
 * Outcome of one reconciliation pass.
 *
 * @param live bots registered after the pass
 */
public record ReconcileReport(int registered, int unregistered, int failed, int live) {}
