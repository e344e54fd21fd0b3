package com.example.poscore.cart;

import com.example.poscore.common.ValidationException;
import com.example.poscore.product.CatalogProduct;
import com.example.poscore.utils.MoneyUtils;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Candidate lines of a sale, one per product, in insertion order.
 * <p>
 * Every quantity change is checked against the product's stock: a line may
 * never hold more units than the catalog reported for that product. Not
 * thread-safe; a cart belongs to a single cashier session.
 */
public class CartModel {

    private final Map<Long, CartLine> lines = new LinkedHashMap<>();
    private final Map<Long, Integer> stockCeilings = new LinkedHashMap<>();

    /**
     * Adds {@code qty} units of {@code product}, merging into the existing line
     * for that product if there is one.
     */
    public CartLine addLine(CatalogProduct product, int qty) {
        if (product == null) {
            throw new ValidationException("Product is required");
        }
        if (qty <= 0) {
            throw new ValidationException("Quantity must be greater than zero");
        }
        CartLine existing = lines.get(product.getId());
        int alreadyHeld = existing == null ? 0 : existing.getQuantity();
        int available = product.getStockQuantity() - alreadyHeld;
        if (qty > available) {
            throw new InsufficientStockException(product.getId(), alreadyHeld + qty, product.getStockQuantity());
        }
        CartLine line = existing == null
                ? new CartLine(product.getId(), product.getName(), product.getCategoryId(), qty, product.getPrice())
                : existing.withQuantity(alreadyHeld + qty);
        lines.put(product.getId(), line);
        stockCeilings.put(product.getId(), product.getStockQuantity());
        return line;
    }

    /**
     * Replaces the quantity of an existing line. Zero removes the line. The
     * line's own current quantity does not count against the new value.
     */
    public void setQuantity(Long productId, int qty) {
        if (qty < 0) {
            throw new ValidationException("Quantity cannot be negative");
        }
        CartLine existing = lines.get(productId);
        if (existing == null) {
            throw new ValidationException("Product " + productId + " is not in the cart");
        }
        if (qty == 0) {
            removeLine(productId);
            return;
        }
        int ceiling = stockCeilings.getOrDefault(productId, 0);
        if (qty > ceiling) {
            throw new InsufficientStockException(productId, qty, ceiling);
        }
        lines.put(productId, existing.withQuantity(qty));
    }

    public void removeLine(Long productId) {
        lines.remove(productId);
        stockCeilings.remove(productId);
    }

    /** Sum of line totals, recomputed from the lines on every call. */
    public BigDecimal subtotal() {
        BigDecimal sum = BigDecimal.ZERO;
        for (CartLine line : lines.values()) {
            sum = sum.add(line.getLineTotal());
        }
        return MoneyUtils.money(sum);
    }

    public List<CartLine> lines() {
        return List.copyOf(lines.values());
    }

    public int quantityOf(Long productId) {
        CartLine line = lines.get(productId);
        return line == null ? 0 : line.getQuantity();
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public void clear() {
        lines.clear();
        stockCeilings.clear();
    }
}
