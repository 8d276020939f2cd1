package com.leverageloop.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the reserved_balances table, keyed by asset id.
 * position_ids holds a JSON array of the positions backing the reservation.
 */
@Entity
@Table(name = "reserved_balances")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReservedBalanceEntity {

    @Id
    @Column(name = "asset_id", length = 100)
    private String assetId;

    @Column(name = "reserved_amount", precision = 30, scale = 12)
    private BigDecimal reservedAmount;

    @Column(name = "reserved_amount_usd", precision = 24, scale = 8)
    private BigDecimal reservedAmountUsd;

    @Column(length = 50)
    private String reason;

    @Column(name = "position_ids", columnDefinition = "TEXT")
    private String positionIds;

    @Column(name = "last_updated")
    private LocalDateTime lastUpdated;
}
