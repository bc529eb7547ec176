package com.retail.storeintel.service;

import com.retail.storeintel.dto.TransactionRecord;
import com.retail.storeintel.exception.ProviderUnavailableException;

import java.time.LocalDate;
import java.util.List;

/**
 * Read-only feed of per-period sales and stock readings.
 */
public interface TransactionSource {

    /**
     * Records for the store dated within {@code [from, to]}, in any order.
     *
     * @throws ProviderUnavailableException if the feed cannot be read
     */
    List<TransactionRecord> fetchSeries(String storeId, LocalDate from, LocalDate to);
}
