package com.example.poscore.promotion;

import com.example.poscore.common.ValidationException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks a promotion definition before it is saved. All problems are
 * collected and reported together.
 */
@Component
public class PromotionValidator {

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    public void validate(PromotionRequest req) {
        List<String> errors = new ArrayList<>();

        if (req.getName() == null || req.getName().isBlank()) {
            errors.add("Promotion name is required");
        }

        PromotionKind kind = null;
        if (req.getKind() == null || req.getKind().isBlank()) {
            errors.add("Promotion kind is required");
        } else {
            try {
                kind = PromotionKind.fromCode(req.getKind());
            } catch (ValidationException e) {
                errors.add(e.getMessage());
            }
        }

        if (req.getValue() == null || req.getValue().signum() <= 0) {
            errors.add("Promotion value must be greater than zero");
        } else if (kind == PromotionKind.PERCENTAGE && req.getValue().compareTo(ONE_HUNDRED) > 0) {
            errors.add("Percentage discount cannot exceed 100%");
        }

        if (req.getStartDate() == null) {
            errors.add("Start date is required");
        }
        if (req.getEndDate() == null) {
            errors.add("End date is required");
        }
        if (req.getStartDate() != null && req.getEndDate() != null
                && !req.getStartDate().isBefore(req.getEndDate())) {
            errors.add("End date must be after start date");
        }

        if (req.getMinPurchaseAmount() != null && req.getMinPurchaseAmount().signum() < 0) {
            errors.add("Minimum purchase amount cannot be negative");
        }
        if (req.getMaxUses() != null && req.getMaxUses() <= 0) {
            errors.add("Usage limit must be greater than zero");
        }

        if (kind != null) {
            try {
                PromotionConditions.of(kind, req.getBuyQuantity(), req.getGetQuantity(), req.getBundleProductIds());
            } catch (ValidationException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }
}
