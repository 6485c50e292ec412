package com.tradejournal.service;

import com.tradejournal.domain.model.Fill;
import com.tradejournal.domain.model.Trade;
import com.tradejournal.entity.FillEntity;
import com.tradejournal.mapper.FillMapper;
import com.tradejournal.mapper.TradeMapper;
import com.tradejournal.repository.jpa.FillJpaRepository;
import com.tradejournal.repository.jpa.TradeJpaRepository;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.mapstruct.factory.Mappers;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Database side of a trade sync. Each method is its own short transaction, so callers can do
 * venue I/O and candle enrichment without holding a connection.
 */
@Service
public class TradeStore {

    private final FillJpaRepository fillJpaRepository;
    private final TradeJpaRepository tradeJpaRepository;
    private final FillMapper fillMapper = Mappers.getMapper(FillMapper.class);
    private final TradeMapper tradeMapper = Mappers.getMapper(TradeMapper.class);

    public TradeStore(FillJpaRepository fillJpaRepository, TradeJpaRepository tradeJpaRepository) {
        this.fillJpaRepository = fillJpaRepository;
        this.tradeJpaRepository = tradeJpaRepository;
    }

    /** Stored trades for the wallet ordered by open time. */
    @Transactional(readOnly = true)
    public List<Trade> loadTrades(String wallet) {
        return tradeMapper.toDomainList(tradeJpaRepository.findByAccountOrderByOpenTimeAsc(wallet));
    }

    /** Inserts fills whose ids are not stored yet and returns how many were new. */
    @Transactional
    public int cacheNewFills(List<Fill> fills) {
        Set<Long> existing = new HashSet<>(
                fillJpaRepository.findExistingIds(fills.stream().map(Fill::getId).toList()));
        List<FillEntity> fresh = fills.stream()
                .filter(fill -> !existing.contains(fill.getId()))
                .map(fillMapper::toEntity)
                .toList();
        fillJpaRepository.saveAll(fresh);
        return fresh.size();
    }

    /**
     * Swaps the wallet's stored trades for the given set. Readers never see the wallet with
     * its old trades deleted and the new ones missing.
     */
    @Transactional
    public List<Trade> replaceTrades(String wallet, List<Trade> trades) {
        tradeJpaRepository.deleteByAccount(wallet);
        tradeJpaRepository.saveAll(tradeMapper.toEntityList(trades));
        return loadTrades(wallet);
    }
}
