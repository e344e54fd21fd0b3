package com.example.poscore.promotion;

import com.example.poscore.common.NotFoundException;
import com.example.poscore.common.TtlCache;
import com.example.poscore.common.ValidationException;
import com.example.poscore.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/**
 * Owns promotion persistence: the cached list of active promotions used for
 * pricing, administrator edits, and the usage counter the sale commit claims.
 */
@Service
public class PromotionCatalog {

    private static final Logger log = LoggerFactory.getLogger(PromotionCatalog.class);
    private static final String ACTIVE_KEY = "active";
    private static final String PROMOTION = "Promotion";

    private final PromotionRepository promotionRepository;
    private final PromotionUsageRepository usageRepository;
    private final PromotionValidator validator;
    private final Clock clock;
    private final TtlCache<String, List<Promotion>> activeCache;

    public PromotionCatalog(PromotionRepository promotionRepository, PromotionUsageRepository usageRepository,
            PromotionValidator validator, AppProperties props, Clock clock) {
        this.promotionRepository = promotionRepository;
        this.usageRepository = usageRepository;
        this.validator = validator;
        this.clock = clock;
        this.activeCache = new TtlCache<>(props.getCatalog().getPromotionCacheTtl(), clock);
    }

    /** Active promotions in id order; the order decides ties during evaluation. */
    @Transactional(readOnly = true)
    public List<Promotion> activePromotions() {
        return activeCache
                .get(ACTIVE_KEY, k -> Optional.of(List.copyOf(promotionRepository.findByActiveTrueOrderByIdAsc())))
                .orElse(List.of());
    }

    @Transactional(readOnly = true)
    public List<Promotion> listAll() {
        return promotionRepository.findAllByOrderByIdAsc();
    }

    @Transactional(readOnly = true)
    public Promotion getRequired(Long id) {
        return promotionRepository.findById(id).orElseThrow(() -> NotFoundException.of(PROMOTION, id));
    }

    @Transactional
    public Promotion create(PromotionRequest req) {
        validator.validate(req);
        OffsetDateTime now = OffsetDateTime.now(clock);
        Promotion p = Promotion.builder().currentUses(0).createdAt(now).build();
        apply(p, req);
        p.setUpdatedAt(now);
        Promotion saved = promotionRepository.save(p);
        activeCache.invalidateAll();
        log.info("Promotion created id={} kind={} value={}", saved.getId(), saved.getKind().getCode(),
                saved.getValue());
        return saved;
    }

    @Transactional
    public Promotion update(Long id, PromotionRequest req) {
        validator.validate(req);
        Promotion p = getRequired(id);
        if (req.getMaxUses() != null && p.getCurrentUses() != null && req.getMaxUses() < p.getCurrentUses()) {
            throw new ValidationException("max_uses cannot be lower than current uses (" + p.getCurrentUses() + ")");
        }
        apply(p, req);
        p.setUpdatedAt(OffsetDateTime.now(clock));
        Promotion saved = promotionRepository.save(p);
        activeCache.invalidateAll();
        log.info("Promotion updated id={}", id);
        return saved;
    }

    @Transactional
    public Promotion setActive(Long id, boolean active) {
        Promotion p = getRequired(id);
        p.setActive(active);
        p.setUpdatedAt(OffsetDateTime.now(clock));
        activeCache.invalidateAll();
        return promotionRepository.save(p);
    }

    /** Only never-used promotions can be deleted; used ones are deactivated instead. */
    @Transactional
    public void delete(Long id) {
        Promotion p = getRequired(id);
        if (p.getCurrentUses() != null && p.getCurrentUses() > 0) {
            throw new ValidationException("Promotion " + id + " has already been used; deactivate it instead");
        }
        promotionRepository.delete(p);
        activeCache.invalidateAll();
        log.info("Promotion deleted id={}", id);
    }

    /**
     * Atomically takes one use of the promotion. Returns false when its usage
     * cap is already reached, or it was deactivated or expired since pricing.
     */
    @Transactional
    public boolean claimUsage(Long promotionId) {
        int updated;
        try {
            updated = promotionRepository.claimUsage(promotionId, OffsetDateTime.now(clock));
        } catch (DataIntegrityViolationException e) {
            log.warn("Usage constraint rejected claim for promotion {}: {}", promotionId, e.getMessage());
            updated = 0;
        }
        activeCache.invalidateAll();
        return updated == 1;
    }

    @Transactional
    public PromotionUsage recordUsage(Long promotionId, Long saleId, BigDecimal discount) {
        return usageRepository.save(PromotionUsage.builder()
                .promotionId(promotionId)
                .saleId(saleId)
                .discountAmount(discount)
                .createdAt(OffsetDateTime.now(clock))
                .build());
    }

    public void evictCache() {
        activeCache.invalidateAll();
    }

    private void apply(Promotion p, PromotionRequest req) {
        PromotionKind kind = PromotionKind.fromCode(req.getKind());
        p.setName(req.getName().trim());
        p.setDescription(req.getDescription() == null ? "" : req.getDescription());
        p.setKind(kind);
        p.setValue(req.getValue());
        p.setStartDate(req.getStartDate());
        p.setEndDate(req.getEndDate());
        p.setActive(req.getActive() == null || req.getActive());
        p.setMinPurchaseAmount(req.getMinPurchaseAmount() == null ? BigDecimal.ZERO : req.getMinPurchaseAmount());
        p.setMaxUses(req.getMaxUses());
        p.setProductIds(new HashSet<>(nullSafe(req.getProductIds())));
        p.setCategoryIds(new HashSet<>(nullSafe(req.getCategoryIds())));
        p.setBuyQuantity(kind == PromotionKind.BUY_X_GET_Y ? req.getBuyQuantity() : null);
        p.setGetQuantity(kind == PromotionKind.BUY_X_GET_Y ? req.getGetQuantity() : null);
        p.setBundleProductIds(kind == PromotionKind.BUNDLE ? new HashSet<>(nullSafe(req.getBundleProductIds()))
                : new HashSet<>());
    }

    private static List<Long> nullSafe(List<Long> ids) {
        return ids == null ? List.of() : ids;
    }
}
