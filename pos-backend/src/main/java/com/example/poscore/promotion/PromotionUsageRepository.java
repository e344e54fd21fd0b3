package com.example.poscore.promotion;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PromotionUsageRepository extends JpaRepository<PromotionUsage, Long> {

    List<PromotionUsage> findByPromotionId(Long promotionId);

    List<PromotionUsage> findBySaleId(Long saleId);

    long countByPromotionId(Long promotionId);
}
