package com.partnerbridge.bothub.backoffice;

/** Id/name pair of a back-office directory entry (firm, currency). */
public record Reference(long id, String name) {}
