package com.retail.storeintel.dto;

public record ReorderRecommendation(
        String category,
        int currentStock,
        double averageDailyConsumption,
        double daysOfCover,
        int suggestedQuantity,
        InsightPriority urgency
) {}
