package com.example.poscore.promotion;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;

public interface PromotionRepository extends JpaRepository<Promotion, Long> {

    List<Promotion> findByActiveTrueOrderByIdAsc();

    List<Promotion> findAllByOrderByIdAsc();

    /*
     * Compare-and-increment against max_uses in a single statement. Returns 0
     * when the cap has been reached or the promotion is inactive or outside
     * [start_date, end_date) at :now.
     */
    @Modifying
    @Transactional
    @Query("update Promotion p set p.currentUses = p.currentUses + 1 "
            + "where p.id = :id and p.active = true and p.startDate <= :now and p.endDate > :now "
            + "and (p.maxUses is null or p.currentUses < p.maxUses)")
    int claimUsage(@Param("id") Long id, @Param("now") OffsetDateTime now);
}
