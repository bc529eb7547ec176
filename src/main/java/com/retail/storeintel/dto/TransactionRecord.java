package com.retail.storeintel.dto;

import com.retail.storeintel.entity.DayPeriod;

import java.time.LocalDate;

/**
 * One point of the transaction/inventory series: units sold for a category in
 * a day period, and the stock level left afterwards (null when not reported).
 */
public record TransactionRecord(
        LocalDate date,
        DayPeriod period,
        String category,
        double value,
        Integer stockLevel
) {}
