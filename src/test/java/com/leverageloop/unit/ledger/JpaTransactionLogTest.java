package com.leverageloop.unit.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.leverageloop.domain.enums.CollateralToken;
import com.leverageloop.domain.enums.LedgerAction;
import com.leverageloop.domain.model.LoopTransaction;
import com.leverageloop.entity.LoopTransactionEntity;
import com.leverageloop.ledger.JpaTransactionLog;
import com.leverageloop.ledger.TransactionLog;
import com.leverageloop.repository.jpa.LoopTransactionJpaRepository;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for JpaTransactionLog: row contents and write failures.
 */
@ExtendWith(MockitoExtension.class)
class JpaTransactionLogTest {

    @Mock
    private LoopTransactionJpaRepository loopTransactionJpaRepository;

    private JpaTransactionLog transactionLog;

    @BeforeEach
    void setUp() {
        transactionLog = new JpaTransactionLog(loopTransactionJpaRepository);
    }

    @Test
    @DisplayName("Borrow is written as a USDC row tagged with the loop")
    void writesRow() {
        transactionLog.recordTransaction(
                LedgerAction.BORROW,
                CollateralToken.USDC.getAssetId(),
                new BigDecimal("750"),
                new BigDecimal("750"),
                "solend",
                TransactionLog.AGENT_TAG,
                "loop_1");

        ArgumentCaptor<LoopTransactionEntity> captor = ArgumentCaptor.forClass(LoopTransactionEntity.class);
        verify(loopTransactionJpaRepository).save(captor.capture());
        LoopTransactionEntity saved = captor.getValue();
        assertThat(saved.getAction()).isEqualTo(LedgerAction.BORROW);
        assertThat(saved.getAssetId()).isEqualTo(CollateralToken.USDC.getAssetId());
        assertThat(saved.getAmountUsd()).isEqualByComparingTo("750");
        assertThat(saved.getProtocol()).isEqualTo("solend");
        assertThat(saved.getAgentTag()).isEqualTo("defi");
        assertThat(saved.getLoopId()).isEqualTo("loop_1");
        assertThat(saved.getCreatedAt()).isNotNull();
    }

    @Test
    @DisplayName("A failed write is logged and does not propagate")
    void writeFailureDoesNotPropagate() {
        when(loopTransactionJpaRepository.save(any(LoopTransactionEntity.class)))
                .thenThrow(new IllegalStateException("disk full"));

        assertThatCode(() -> transactionLog.recordTransaction(
                        LedgerAction.REPAY,
                        CollateralToken.USDC.getAssetId(),
                        BigDecimal.TEN,
                        BigDecimal.TEN,
                        "solend",
                        TransactionLog.AGENT_TAG,
                        "loop_1"))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Rows for a loop come back in insertion order as domain objects")
    void readsLoopRows() {
        when(loopTransactionJpaRepository.findByLoopIdOrderByIdAsc("loop_1"))
                .thenReturn(List.of(
                        LoopTransactionEntity.builder()
                                .id(1L)
                                .action(LedgerAction.BORROW)
                                .amountUsd(new BigDecimal("750"))
                                .loopId("loop_1")
                                .build(),
                        LoopTransactionEntity.builder()
                                .id(2L)
                                .action(LedgerAction.SWAP)
                                .assetId(CollateralToken.SOL.getAssetId())
                                .amountUsd(new BigDecimal("746.25"))
                                .loopId("loop_1")
                                .build()));

        List<LoopTransaction> rows = transactionLog.getTransactionsForLoop("loop_1");

        assertThat(rows).extracting(LoopTransaction::getAction).containsExactly(LedgerAction.BORROW, LedgerAction.SWAP);
        assertThat(rows.get(1).getAssetId()).isEqualTo(CollateralToken.SOL.getAssetId());
    }
}
