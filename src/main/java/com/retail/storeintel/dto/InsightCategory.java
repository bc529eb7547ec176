package com.retail.storeintel.dto;

public enum InsightCategory {
    SALES,
    INVENTORY,
    WEATHER,
    COMPETITION
}
