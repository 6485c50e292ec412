package com.tradejournal.mapper;

import com.tradejournal.domain.enums.Side;
import com.tradejournal.domain.model.Fill;
import com.tradejournal.entity.FillEntity;
import com.tradejournal.venue.HyperliquidFill;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper for fills: venue DTO to domain, and domain to the fills table.
 *
 * <p>The venue sends decimals as strings and omits {@code startPosition}, {@code closedPnl} and
 * {@code fee} on some historical fills; those default to zero. A missing trade id falls back to
 * the order id, and a missing direction tag becomes the empty string.
 */
@Mapper(imports = Side.class)
public interface FillMapper {

    @Mapping(target = "id", expression = "java(fill.getTid() != null ? fill.getTid() : fill.getOid())")
    @Mapping(target = "coin", source = "fill.coin")
    @Mapping(target = "price", source = "fill.px")
    @Mapping(target = "size", source = "fill.sz")
    @Mapping(target = "side", expression = "java(Side.fromVenueCode(fill.getSide()))")
    @Mapping(target = "directionTag", source = "fill.dir", defaultValue = "")
    @Mapping(target = "time", source = "fill.time")
    @Mapping(target = "startPosition", source = "fill.startPosition", defaultValue = "0")
    @Mapping(target = "closedPnl", source = "fill.closedPnl", defaultValue = "0")
    @Mapping(target = "fee", source = "fill.fee", defaultValue = "0")
    @Mapping(target = "orderId", source = "fill.oid")
    @Mapping(target = "hash", source = "fill.hash")
    @Mapping(target = "crossed", expression = "java(Boolean.TRUE.equals(fill.getCrossed()))")
    @Mapping(target = "account", source = "account")
    Fill fromVenue(HyperliquidFill fill, String account);

    FillEntity toEntity(Fill fill);
}
