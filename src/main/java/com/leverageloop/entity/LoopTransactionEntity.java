package com.leverageloop.entity;

import com.leverageloop.domain.enums.LedgerAction;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
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
 * JPA entity for the loop_transactions table. Append-only.
 */
@Entity
@Table(name = "loop_transactions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LoopTransactionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private LedgerAction action;

    @Column(name = "asset_id", length = 100)
    private String assetId;

    @Column(precision = 30, scale = 12)
    private BigDecimal amount;

    @Column(name = "amount_usd", precision = 24, scale = 8)
    private BigDecimal amountUsd;

    @Column(length = 50)
    private String protocol;

    @Column(name = "agent_tag", length = 20)
    private String agentTag;

    @Column(name = "loop_id", length = 64)
    private String loopId;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
