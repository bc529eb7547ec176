package com.retail.storeintel.dto;

/**
 * Declared most urgent first; ordinal order is the sort order of insights.
 */
public enum InsightPriority {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW
}
