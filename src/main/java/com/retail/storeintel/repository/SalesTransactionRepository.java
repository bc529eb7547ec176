package com.retail.storeintel.repository;

import com.retail.storeintel.entity.SalesTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface SalesTransactionRepository extends JpaRepository<SalesTransaction, Long> {

    List<SalesTransaction> findByStoreIdAndSaleDateBetweenOrderBySaleDateAscPeriodAsc(String storeId, LocalDate from, LocalDate to);
}
