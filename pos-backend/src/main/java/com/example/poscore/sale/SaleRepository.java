package com.example.poscore.sale;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface SaleRepository extends JpaRepository<Sale, Long> {

    @Query("select distinct s from Sale s left join fetch s.lines where s.id = :id")
    Optional<Sale> findWithLinesById(@Param("id") Long id);

    List<Sale> findAllByOrderByIdDesc(Pageable pageable);

    List<Sale> findByStatusOrderByIdAsc(SaleStatus status);

    long countByStatus(SaleStatus status);
}
