package com.leverageloop.repository.jpa;

import com.leverageloop.domain.enums.PositionStatus;
import com.leverageloop.entity.LeveragePositionEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface LeveragePositionJpaRepository extends JpaRepository<LeveragePositionEntity, String> {

    List<LeveragePositionEntity> findByStatus(PositionStatus status);

    List<LeveragePositionEntity> findByLoopIdOrderByIterationAsc(String loopId);
}
