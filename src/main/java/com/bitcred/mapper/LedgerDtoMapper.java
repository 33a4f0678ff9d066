package com.bitcred.mapper;

import com.bitcred.api.dto.response.PoolStatusResponse;
import com.bitcred.api.dto.response.PositionResponse;
import com.bitcred.api.dto.response.ScoreResponse;
import com.bitcred.domain.enums.ScoreTier;
import com.bitcred.domain.model.PoolState;
import com.bitcred.domain.model.PositionSnapshot;
import com.bitcred.domain.model.ScoreRecord;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper from ledger models to API response DTOs.
 * Tier and ratio are derived from the score; pool metadata is filled in by the controller.
 */
@Mapper(componentModel = "spring", imports = ScoreTier.class)
public interface LedgerDtoMapper {

    @Mapping(target = "tier", expression = "java(ScoreTier.forScore(scoreRecord.getScore()).getLevel())")
    @Mapping(
            target = "collateralRatioBps",
            expression = "java(ScoreTier.forScore(scoreRecord.getScore()).getCollateralRatioBps())")
    @Mapping(target = "registered", expression = "java(scoreRecord.getScore() != 0)")
    ScoreResponse toResponse(ScoreRecord scoreRecord);

    PositionResponse toResponse(PositionSnapshot snapshot);

    List<PositionResponse> toResponseList(List<PositionSnapshot> snapshots);

    @Mapping(target = "collateralSymbol", ignore = true)
    @Mapping(target = "borrowSymbol", ignore = true)
    @Mapping(target = "poolAccount", ignore = true)
    @Mapping(target = "admin", ignore = true)
    @Mapping(target = "positionCount", ignore = true)
    PoolStatusResponse toResponse(PoolState poolState);
}
