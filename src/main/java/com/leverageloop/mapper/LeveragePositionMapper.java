package com.leverageloop.mapper;

import com.leverageloop.domain.model.LeveragePosition;
import com.leverageloop.entity.LeveragePositionEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface LeveragePositionMapper {

    LeveragePositionEntity toEntity(LeveragePosition position);

    LeveragePosition toDomain(LeveragePositionEntity entity);

    List<LeveragePosition> toDomainList(List<LeveragePositionEntity> entities);
}
