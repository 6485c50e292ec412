package com.tradejournal.mapper;

import com.tradejournal.api.dto.response.TradeResponse;
import com.tradejournal.domain.model.Trade;
import com.tradejournal.entity.TradeEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between the Trade domain model, TradeEntity and TradeResponse.
 *
 * <p>The response exposes the side as the venue's single-letter code.
 */
@Mapper
public interface TradeMapper {

    @Mapping(target = "id", ignore = true)
    TradeEntity toEntity(Trade trade);

    List<TradeEntity> toEntityList(List<Trade> trades);

    Trade toDomain(TradeEntity entity);

    List<Trade> toDomainList(List<TradeEntity> entities);

    @Mapping(target = "side", expression = "java(trade.getSide().getVenueCode())")
    TradeResponse toResponse(Trade trade);

    List<TradeResponse> toResponseList(List<Trade> trades);
}
