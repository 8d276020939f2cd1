package com.leverageloop.mapper;

import com.leverageloop.domain.model.LeverageLoop;
import com.leverageloop.entity.LeverageLoopEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between LeverageLoop and LeverageLoopEntity.
 * Positions live in their own table and are attached by the store.
 */
@Mapper
public interface LeverageLoopMapper {

    LeverageLoopEntity toEntity(LeverageLoop loop);

    @Mapping(target = "positions", ignore = true)
    LeverageLoop toDomain(LeverageLoopEntity entity);

    List<LeverageLoop> toDomainList(List<LeverageLoopEntity> entities);
}
