package com.example.poscore.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;

public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, Long> {

    List<LedgerEntry> findAllByOrderByIdAsc();

    @Query("select e from LedgerEntry e where e.createdAt >= :from and e.createdAt < :to order by e.id asc")
    List<LedgerEntry> findInRange(@Param("from") OffsetDateTime from, @Param("to") OffsetDateTime to);

    @Query("select e from LedgerEntry e where e.kind = :kind and e.createdAt >= :from and e.createdAt < :to "
            + "order by e.id asc")
    List<LedgerEntry> findInRangeByKind(@Param("kind") LedgerEntryKind kind, @Param("from") OffsetDateTime from,
            @Param("to") OffsetDateTime to);

    List<LedgerEntry> findByKindOrderByIdAsc(LedgerEntryKind kind);

    List<LedgerEntry> findByReferenceIdAndKindOrderByIdAsc(Long referenceId, LedgerEntryKind kind);

    @Query("select e.kind as kind, sum(e.amount) as total from LedgerEntry e group by e.kind")
    List<KindTotal> totalsByKind();

    @Query("select e.kind as kind, sum(e.amount) as total from LedgerEntry e "
            + "where e.createdAt >= :from and e.createdAt < :to group by e.kind")
    List<KindTotal> totalsByKindInRange(@Param("from") OffsetDateTime from, @Param("to") OffsetDateTime to);

    interface KindTotal {
        LedgerEntryKind getKind();

        BigDecimal getTotal();
    }
}
