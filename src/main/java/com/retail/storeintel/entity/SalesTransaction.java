package com.retail.storeintel.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * One bucket of the transaction/inventory feed: units sold for a category
 * during a day period, with the stock level observed at the end of it.
 */
@Entity
@Table(name = "sales_transactions",
       indexes = {
           @Index(name = "idx_sales_store_date", columnList = "storeId,saleDate")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SalesTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 50)
    private String storeId;

    @Column(nullable = false)
    private LocalDate saleDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DayPeriod period;

    @Column(nullable = false, length = 100)
    private String category;

    @Column(name = "sale_value", nullable = false)
    private Double value;

    private Integer stockLevel;
}
