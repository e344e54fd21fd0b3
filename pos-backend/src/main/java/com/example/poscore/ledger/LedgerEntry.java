package com.example.poscore.ledger;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * One cash movement. Rows are only ever inserted; the amount is stored
 * positive and the kind decides its sign.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Entity
@Immutable
@Table(name = "cash_ledger_entry")
public class LedgerEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Convert(converter = LedgerEntryKindConverter.class)
    @Column(nullable = false)
    private LedgerEntryKind kind;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    // sale id for kind = sale
    @Column(name = "reference_id")
    private Long referenceId;

    @lombok.Builder.Default
    private String description = "";

    @Column(name = "created_by")
    private Long createdBy;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    public BigDecimal signedAmount() {
        return kind.signed(amount);
    }
}
