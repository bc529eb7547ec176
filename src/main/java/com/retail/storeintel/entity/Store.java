package com.retail.storeintel.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A physical retail location, either an own-brand store or a competitor.
 * Stores are never deleted; {@link #active} is cleared instead.
 */
@Entity
@Table(name = "stores",
       indexes = {
           @Index(name = "idx_store_chain", columnList = "chain"),
           @Index(name = "idx_store_city", columnList = "city"),
           @Index(name = "idx_store_active", columnList = "active"),
           @Index(name = "idx_store_location", columnList = "latitude,longitude")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Store {

    @Id
    @Column(length = 50, updatable = false)
    private String id;

    @Column(nullable = false, length = 200)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    private StoreChain chain;

    @Column(nullable = false)
    private Double latitude;

    @Column(nullable = false)
    private Double longitude;

    @Column(columnDefinition = "TEXT")
    private String address;

    @Column(length = 100)
    private String city;

    @Column(length = 100)
    private String state;

    @Column(length = 10)
    private String postalCode;

    // Contact metadata
    @Column(length = 20)
    private String phone;

    @Column(length = 100)
    private String email;

    @Column(length = 100)
    private String managerName;

    @Column(length = 100)
    private String openingHours;

    private Integer storeSizeSqft;

    @Column(nullable = false)
    @Builder.Default
    private Boolean active = true;

    private LocalDateTime openedDate;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdDate;

    private LocalDateTime lastUpdated;

    @PrePersist
    protected void onCreate() {
        createdDate = LocalDateTime.now();
        lastUpdated = createdDate;
        if (active == null) {
            active = true;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        lastUpdated = LocalDateTime.now();
    }

    @JsonIgnore
    public boolean isActiveStore() {
        return Boolean.TRUE.equals(active);
    }
}
