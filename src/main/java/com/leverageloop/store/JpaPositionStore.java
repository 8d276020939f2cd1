package com.leverageloop.store;

import com.leverageloop.domain.enums.LoopStatus;
import com.leverageloop.domain.enums.PositionStatus;
import com.leverageloop.domain.model.LeverageLoop;
import com.leverageloop.domain.model.LeveragePosition;
import com.leverageloop.domain.model.ReservedBalance;
import com.leverageloop.entity.LeveragePositionEntity;
import com.leverageloop.mapper.LeverageLoopMapper;
import com.leverageloop.mapper.LeveragePositionMapper;
import com.leverageloop.mapper.ReservedBalanceMapper;
import com.leverageloop.repository.jpa.LeverageLoopJpaRepository;
import com.leverageloop.repository.jpa.LeveragePositionJpaRepository;
import com.leverageloop.repository.jpa.ReservedBalanceJpaRepository;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link PositionStore} backed by Spring Data JPA repositories over H2.
 */
@Service
public class JpaPositionStore implements PositionStore {

    private static final Logger log = LoggerFactory.getLogger(JpaPositionStore.class);

    private final LeverageLoopJpaRepository leverageLoopJpaRepository;
    private final LeveragePositionJpaRepository leveragePositionJpaRepository;
    private final ReservedBalanceJpaRepository reservedBalanceJpaRepository;

    private final LeverageLoopMapper leverageLoopMapper = Mappers.getMapper(LeverageLoopMapper.class);
    private final LeveragePositionMapper leveragePositionMapper = Mappers.getMapper(LeveragePositionMapper.class);
    private final ReservedBalanceMapper reservedBalanceMapper = Mappers.getMapper(ReservedBalanceMapper.class);

    public JpaPositionStore(
            LeverageLoopJpaRepository leverageLoopJpaRepository,
            LeveragePositionJpaRepository leveragePositionJpaRepository,
            ReservedBalanceJpaRepository reservedBalanceJpaRepository) {
        this.leverageLoopJpaRepository = leverageLoopJpaRepository;
        this.leveragePositionJpaRepository = leveragePositionJpaRepository;
        this.reservedBalanceJpaRepository = reservedBalanceJpaRepository;
    }

    @Override
    @Transactional
    public void saveLoop(LeverageLoop loop) {
        leverageLoopJpaRepository.save(leverageLoopMapper.toEntity(loop));
    }

    @Override
    @Transactional
    public void recordIteration(LeveragePosition position, LeverageLoop loop, ReservedBalance reservedBalance) {
        leveragePositionJpaRepository.save(leveragePositionMapper.toEntity(position));
        leverageLoopJpaRepository.save(leverageLoopMapper.toEntity(loop));
        if (reservedBalance != null) {
            reservedBalanceJpaRepository.save(reservedBalanceMapper.toEntity(reservedBalance));
        }
        log.debug(
                "Persisted iteration {} of loop {} (reserved {} USD of {})",
                position.getIteration(),
                loop.getLoopId(),
                reservedBalance != null ? reservedBalance.getReservedAmountUsd() : null,
                reservedBalance != null ? reservedBalance.getAssetId() : null);
    }

    @Override
    @Transactional
    public void saveFinalizedLoop(LeverageLoop loop, ReservedBalance reservedBalance) {
        leverageLoopJpaRepository.save(leverageLoopMapper.toEntity(loop));
        if (reservedBalance != null) {
            reservedBalanceJpaRepository.save(reservedBalanceMapper.toEntity(reservedBalance));
        }
    }

    @Override
    @Transactional
    public void updatePositionStatus(String positionId, PositionStatus status) {
        Optional<LeveragePositionEntity> found = leveragePositionJpaRepository.findById(positionId);
        if (found.isEmpty()) {
            log.warn("Cannot update status of unknown position {}", positionId);
            return;
        }
        LeveragePositionEntity entity = found.get();
        entity.setStatus(status);
        entity.setUpdatedAt(LocalDateTime.now());
        leveragePositionJpaRepository.save(entity);
    }

    @Override
    @Transactional
    public void retireLoop(
            LeverageLoop loop, List<ReservedBalance> remainingReservations, Collection<String> clearedAssetIds) {
        leverageLoopJpaRepository.save(leverageLoopMapper.toEntity(loop));
        for (ReservedBalance reservation : remainingReservations) {
            reservedBalanceJpaRepository.save(reservedBalanceMapper.toEntity(reservation));
        }
        for (String assetId : clearedAssetIds) {
            if (reservedBalanceJpaRepository.existsById(assetId)) {
                reservedBalanceJpaRepository.deleteById(assetId);
            }
        }
        log.info(
                "Loop {} retired as {}, cleared reservations for {}",
                loop.getLoopId(),
                loop.getStatus(),
                clearedAssetIds);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<LeverageLoop> findLoop(String loopId) {
        return leverageLoopJpaRepository.findById(loopId).map(leverageLoopMapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<LeverageLoop> getActiveLoops() {
        return leverageLoopMapper.toDomainList(leverageLoopJpaRepository.findByStatusIn(LoopStatus.LIVE));
    }

    @Override
    @Transactional(readOnly = true)
    public List<LeveragePosition> getActivePositions() {
        return leveragePositionMapper.toDomainList(leveragePositionJpaRepository.findByStatus(PositionStatus.ACTIVE));
    }

    @Override
    @Transactional(readOnly = true)
    public List<LeveragePosition> getPositionsForLoop(String loopId) {
        return leveragePositionMapper.toDomainList(leveragePositionJpaRepository.findByLoopIdOrderByIterationAsc(loopId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<ReservedBalance> getReservedBalances() {
        return reservedBalanceMapper.toDomainList(reservedBalanceJpaRepository.findAll());
    }
}
