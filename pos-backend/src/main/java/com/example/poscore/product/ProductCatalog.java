package com.example.poscore.product;

import com.example.poscore.common.NotFoundException;
import com.example.poscore.common.TtlCache;
import com.example.poscore.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Read path for products (price, cost, category, stock) plus the single
 * write the sale commit needs: the atomic stock decrement.
 */
@Service
public class ProductCatalog {

    private static final Logger log = LoggerFactory.getLogger(ProductCatalog.class);
    private static final String PRODUCT = "Product";

    private final ProductRepository productRepository;
    private final TtlCache<Long, CatalogProduct> cache;

    public ProductCatalog(ProductRepository productRepository, AppProperties props, Clock clock) {
        this.productRepository = productRepository;
        this.cache = new TtlCache<>(props.getCatalog().getProductCacheTtl(), clock);
    }

    @Transactional(readOnly = true)
    public Optional<CatalogProduct> find(Long id) {
        if (id == null)
            return Optional.empty();
        return cache.get(id, key -> productRepository.findById(key)
                .filter(p -> Boolean.TRUE.equals(p.getActive()))
                .map(CatalogProduct::from));
    }

    public CatalogProduct getRequired(Long id) {
        return find(id).orElseThrow(() -> NotFoundException.of(PRODUCT, id));
    }

    @Transactional(readOnly = true)
    public List<CatalogProduct> listActive() {
        return productRepository.findByActiveTrueOrderByNameAsc().stream().map(CatalogProduct::from).toList();
    }

    /** Uncached read of the stored stock level. */
    @Transactional(readOnly = true)
    public int currentStock(Long id) {
        return productRepository.findStockQuantityById(id).orElseThrow(() -> NotFoundException.of(PRODUCT, id));
    }

    /**
     * Atomically removes {@code qty} units. Returns false, leaving stock as it
     * was, when fewer than {@code qty} units remain.
     */
    @Transactional
    public boolean decrementStock(Long id, int qty) {
        int updated;
        try {
            updated = productRepository.decrementStockIfAvailable(id, qty);
        } catch (DataIntegrityViolationException e) {
            // non-negative stock constraint
            log.warn("Stock constraint rejected decrement for product {}: {}", id, e.getMessage());
            updated = 0;
        }
        cache.invalidate(id);
        if (updated == 0) {
            log.warn("Stock decrement refused for product {} (qty={})", id, qty);
            return false;
        }
        return true;
    }

    public void evictAll() {
        cache.invalidateAll();
    }
}
