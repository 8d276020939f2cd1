package com.leverageloop.repository.jpa;

import com.leverageloop.entity.LoopTransactionEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface LoopTransactionJpaRepository extends JpaRepository<LoopTransactionEntity, Long> {

    List<LoopTransactionEntity> findByLoopIdOrderByIdAsc(String loopId);
}
