package com.partnerbridge.bothub.schedule;

import java.math.BigDecimal;

public record NegativeBalance(String firmName, String currencyName, BigDecimal balance) {}
