package com.example.poscore.product;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/products")
@RequiredArgsConstructor
public class ProductController {

    private final ProductCatalog productCatalog;

    private static final String KEY_ID = "id";
    private static final String KEY_NAME = "name";
    private static final String KEY_SKU = "sku";
    private static final String KEY_PRICE = "price";
    private static final String KEY_CATEGORY_ID = "category_id";
    private static final String KEY_STOCK = "stock_quantity";
    private static final String KEY_LOW_STOCK = "low_stock";

    @GetMapping
    public List<Map<String, Object>> getAll() {
        return productCatalog.listActive().stream().map(this::toBody).toList();
    }

    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> getById(@PathVariable Long id) {
        return ResponseEntity.ok(toBody(productCatalog.getRequired(id)));
    }

    private Map<String, Object> toBody(CatalogProduct p) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(KEY_ID, p.getId());
        body.put(KEY_NAME, p.getName());
        body.put(KEY_SKU, p.getSku());
        body.put(KEY_PRICE, p.getPrice());
        body.put(KEY_CATEGORY_ID, p.getCategoryId()); // pode ser null
        body.put(KEY_STOCK, p.getStockQuantity());
        body.put(KEY_LOW_STOCK, p.isLowStock());
        return body;
    }
}
