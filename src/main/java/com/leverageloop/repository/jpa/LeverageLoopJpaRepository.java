package com.leverageloop.repository.jpa;

import com.leverageloop.domain.enums.LoopStatus;
import com.leverageloop.entity.LeverageLoopEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the leverage_loops table.
 * Restart recovery loads every loop whose status is still live.
 */
@Repository
public interface LeverageLoopJpaRepository extends JpaRepository<LeverageLoopEntity, String> {

    List<LeverageLoopEntity> findByStatusIn(List<LoopStatus> statuses);
}
