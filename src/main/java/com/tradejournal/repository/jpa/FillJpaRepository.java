package com.tradejournal.repository.jpa;

import com.tradejournal.entity.FillEntity;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the fills table.
 * Fill ids are venue-assigned, so inserts skip ids that are already stored.
 */
@Repository
public interface FillJpaRepository extends JpaRepository<FillEntity, Long> {

    @Query("SELECT f.id FROM FillEntity f WHERE f.id IN :ids")
    List<Long> findExistingIds(@Param("ids") Collection<Long> ids);
}
