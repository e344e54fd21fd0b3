package com.example.poscore.product;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

public interface ProductRepository extends JpaRepository<Product, Long> {

    Optional<Product> findBySku(String sku);

    List<Product> findByActiveTrueOrderByNameAsc();

    @Query("select p.stockQuantity from Product p where p.id = :id")
    Optional<Integer> findStockQuantityById(@Param("id") Long id);

    /*
     * Check and decrement in one statement: returns 0 when the row does not have
     * enough stock, so two sales can never both take the last unit.
     */
    @Modifying
    @Transactional
    @Query("update Product p set p.stockQuantity = p.stockQuantity - :qty "
            + "where p.id = :id and p.stockQuantity >= :qty")
    int decrementStockIfAvailable(@Param("id") Long id, @Param("qty") int qty);
}
