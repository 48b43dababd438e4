package com.partnerbridge.bothub.schedule;

import java.util.List;

public record EngineStatus(boolean running, int armedJobCount, List<String> jobIds) {}
