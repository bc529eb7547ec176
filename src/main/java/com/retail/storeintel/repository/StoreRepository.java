package com.retail.storeintel.repository;

import com.retail.storeintel.entity.Store;
import com.retail.storeintel.entity.StoreChain;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface StoreRepository extends JpaRepository<Store, String> {

    /**
     * Active stores of one chain, e.g. all own-brand stores.
     */
    List<Store> findByChainAndActiveTrueOrderByIdAsc(StoreChain chain);

    /**
     * Active competitor stores (every chain except the own brand).
     */
    List<Store> findByChainNotAndActiveTrueOrderByIdAsc(StoreChain chain);

    List<Store> findByCityIgnoreCaseAndActiveTrueOrderByIdAsc(String city);

    long countByChainAndActiveTrue(StoreChain chain);

    @Query("SELECT s.chain, COUNT(s) FROM Store s WHERE s.active = true AND s.chain <> :ownChain GROUP BY s.chain")
    List<Object[]> countCompetitorsByChain(@Param("ownChain") StoreChain ownChain);

    @Query("SELECT s.city, COUNT(s) FROM Store s WHERE s.active = true AND s.chain = :chain GROUP BY s.city ORDER BY COUNT(s) DESC, s.city ASC")
    List<Object[]> countByCityForChain(@Param("chain") StoreChain chain);
}
