package com.leverageloop.repository.jpa;

import com.leverageloop.entity.ReservedBalanceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ReservedBalanceJpaRepository extends JpaRepository<ReservedBalanceEntity, String> {}
