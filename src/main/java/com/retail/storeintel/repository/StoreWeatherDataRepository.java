package com.retail.storeintel.repository;

import com.retail.storeintel.entity.DayPeriod;
import com.retail.storeintel.entity.StoreWeatherData;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface StoreWeatherDataRepository extends JpaRepository<StoreWeatherData, Long> {

    Optional<StoreWeatherData> findByStoreIdAndObservedDateAndPeriod(String storeId, LocalDate observedDate, DayPeriod period);

    /**
     * Same calendar month and day period across all years, used for the seasonal average.
     */
    List<StoreWeatherData> findByStoreIdAndObservedMonthAndPeriod(String storeId, Integer observedMonth, DayPeriod period);


    @Modifying
    @Transactional
    @Query("DELETE FROM StoreWeatherData w WHERE w.observedDate < :cutoff")
    int deleteOlderThan(@Param("cutoff") LocalDate cutoff);
}
