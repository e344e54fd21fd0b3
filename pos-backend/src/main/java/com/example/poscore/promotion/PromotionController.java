package com.example.poscore.promotion;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/promotions")
@RequiredArgsConstructor
public class PromotionController {

    private final PromotionCatalog promotionCatalog;

    private static final String KEY_MESSAGE = "message";

    @GetMapping
    public List<Map<String, Object>> listAll() {
        return promotionCatalog.listAll().stream().map(PromotionController::toBody).toList();
    }

    @GetMapping("/active")
    public List<Map<String, Object>> listActive() {
        return promotionCatalog.activePromotions().stream().map(PromotionController::toBody).toList();
    }

    @GetMapping("/{id}")
    public Map<String, Object> getById(@PathVariable Long id) {
        return toBody(promotionCatalog.getRequired(id));
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> create(@RequestBody PromotionRequest req) {
        return ResponseEntity.status(201).body(toBody(promotionCatalog.create(req)));
    }

    @PutMapping("/{id}")
    public Map<String, Object> update(@PathVariable Long id, @RequestBody PromotionRequest req) {
        return toBody(promotionCatalog.update(id, req));
    }

    @PatchMapping("/{id}/active")
    public Map<String, Object> setActive(@PathVariable Long id, @RequestBody Map<String, Boolean> body) {
        boolean active = Boolean.TRUE.equals(body.get("active"));
        return toBody(promotionCatalog.setActive(id, active));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable Long id) {
        promotionCatalog.delete(id);
        return ResponseEntity.ok(Map.of(KEY_MESSAGE, "Promotion deleted"));
    }

    static Map<String, Object> toBody(Promotion p) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", p.getId());
        m.put("name", p.getName());
        m.put("description", p.getDescription());
        m.put("kind", p.getKind().getCode());
        m.put("value", p.getValue());
        m.put("start_date", p.getStartDate());
        m.put("end_date", p.getEndDate());
        m.put("active", Boolean.TRUE.equals(p.getActive()));
        m.put("min_purchase_amount", p.getMinPurchaseAmount());
        m.put("max_uses", p.getMaxUses());
        m.put("current_uses", p.getCurrentUses());
        m.put("product_ids", p.getProductIds().stream().sorted().toList());
        m.put("category_ids", p.getCategoryIds().stream().sorted().toList());
        if (p.getKind() == PromotionKind.BUY_X_GET_Y) {
            m.put("buy_quantity", p.getBuyQuantity());
            m.put("get_quantity", p.getGetQuantity());
        }
        if (p.getKind() == PromotionKind.BUNDLE) {
            m.put("bundle_product_ids", p.getBundleProductIds().stream().sorted().toList());
        }
        m.put("preview", PromotionTexts.preview(p));
        return m;
    }
}
