package com.retail.storeintel.service;

import com.retail.storeintel.dto.TransactionRecord;
import com.retail.storeintel.entity.SalesTransaction;
import com.retail.storeintel.exception.ProviderUnavailableException;
import com.retail.storeintel.repository.SalesTransactionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class JpaTransactionSource implements TransactionSource {

    private final SalesTransactionRepository repository;

    @Override
    public List<TransactionRecord> fetchSeries(String storeId, LocalDate from, LocalDate to) {
        try {
            return repository.findByStoreIdAndSaleDateBetweenOrderBySaleDateAscPeriodAsc(storeId, from, to)
                    .stream()
                    .map(JpaTransactionSource::toRecord)
                    .collect(Collectors.toList());
        } catch (DataAccessException e) {
            throw new ProviderUnavailableException("transactions", "Could not read sales for " + storeId, e);
        }
    }

    private static TransactionRecord toRecord(SalesTransaction row) {
        return new TransactionRecord(row.getSaleDate(), row.getPeriod(), row.getCategory(),
                row.getValue() != null ? row.getValue() : 0.0, row.getStockLevel());
    }
}
