package com.leverageloop.mapper;

import com.leverageloop.domain.model.ReservedBalance;
import com.leverageloop.entity.ReservedBalanceEntity;
import java.util.ArrayList;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between ReservedBalance and ReservedBalanceEntity.
 * The position id list is stored as a JSON array string.
 */
@Mapper
public interface ReservedBalanceMapper {

    @Mapping(source = "positionIds", target = "positionIds", qualifiedByName = "positionIdsToJson")
    ReservedBalanceEntity toEntity(ReservedBalance reservedBalance);

    @Mapping(source = "positionIds", target = "positionIds", qualifiedByName = "jsonToPositionIds")
    ReservedBalance toDomain(ReservedBalanceEntity entity);

    List<ReservedBalance> toDomainList(List<ReservedBalanceEntity> entities);

    @Named("positionIdsToJson")
    default String positionIdsToJson(List<String> positionIds) {
        return JsonHelper.toJson(positionIds);
    }

    @Named("jsonToPositionIds")
    default List<String> jsonToPositionIds(String json) {
        return new ArrayList<>(JsonHelper.fromJsonList(json, String.class));
    }
}
