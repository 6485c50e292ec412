package com.tradejournal.repository.jpa;

import com.tradejournal.entity.TradeEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** JPA repository for the trades table. */
@Repository
public interface TradeJpaRepository extends JpaRepository<TradeEntity, Long> {

    List<TradeEntity> findByAccountOrderByOpenTimeAsc(String account);

    @Modifying
    @Query("DELETE FROM TradeEntity t WHERE t.account = :account")
    int deleteByAccount(@Param("account") String account);
}
