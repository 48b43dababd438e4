package com.partnerbridge.bothub.backoffice;

/** Data for a self-registered counterparty. */
public record NewPartner(long groupId, String name, String phone, long chatId) {}
