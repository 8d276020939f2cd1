package com.leverageloop.mapper;

import com.leverageloop.domain.model.LoopTransaction;
import com.leverageloop.entity.LoopTransactionEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface LoopTransactionMapper {

    LoopTransactionEntity toEntity(LoopTransaction transaction);

    LoopTransaction toDomain(LoopTransactionEntity entity);

    List<LoopTransaction> toDomainList(List<LoopTransactionEntity> entities);
}
