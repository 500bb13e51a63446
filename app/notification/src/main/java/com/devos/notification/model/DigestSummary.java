package com.devos.notification.model;

import java.util.Map;

public record DigestSummary(String title, String body, int count, Map<String, Integer> byType) {}
