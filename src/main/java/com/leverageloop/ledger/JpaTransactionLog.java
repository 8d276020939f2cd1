package com.leverageloop.ledger;

import com.leverageloop.domain.enums.LedgerAction;
import com.leverageloop.domain.model.LoopTransaction;
import com.leverageloop.mapper.LoopTransactionMapper;
import com.leverageloop.repository.jpa.LoopTransactionJpaRepository;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Writes loop transactions to the loop_transactions table.
 *
 * <p>The ledger is an audit trail, not the source of truth for loop state: a failed
 * write is logged and never aborts the protocol flow that produced it.
 */
@Service
public class JpaTransactionLog implements TransactionLog {

    private static final Logger log = LoggerFactory.getLogger(JpaTransactionLog.class);

    private final LoopTransactionJpaRepository loopTransactionJpaRepository;
    private final LoopTransactionMapper loopTransactionMapper = Mappers.getMapper(LoopTransactionMapper.class);

    public JpaTransactionLog(LoopTransactionJpaRepository loopTransactionJpaRepository) {
        this.loopTransactionJpaRepository = loopTransactionJpaRepository;
    }

    @Override
    public void recordTransaction(
            LedgerAction action,
            String assetId,
            BigDecimal amount,
            BigDecimal amountUsd,
            String protocol,
            String agentTag,
            String loopId) {
        LoopTransaction transaction = LoopTransaction.builder()
                .action(action)
                .assetId(assetId)
                .amount(amount)
                .amountUsd(amountUsd)
                .protocol(protocol)
                .agentTag(agentTag)
                .loopId(loopId)
                .createdAt(LocalDateTime.now())
                .build();
        try {
            loopTransactionJpaRepository.save(loopTransactionMapper.toEntity(transaction));
            log.info("Ledger {} {} USD on {} (loop={})", action, amountUsd, protocol, loopId);
        } catch (Exception e) {
            log.error("Failed to record {} transaction for loop {}: {}", action, loopId, e.getMessage(), e);
        }
    }

    @Override
    public List<LoopTransaction> getTransactionsForLoop(String loopId) {
        return loopTransactionMapper.toDomainList(loopTransactionJpaRepository.findByLoopIdOrderByIdAsc(loopId));
    }
}
