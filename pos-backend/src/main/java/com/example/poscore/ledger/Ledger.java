package com.example.poscore.ledger;

import com.example.poscore.common.ValidationException;
import com.example.poscore.utils.DateTimeUtils;
import com.example.poscore.utils.MoneyUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only record of cash movements. Entries are never updated or
 * deleted; the balance is the signed sum of every entry.
 */
@Service
public class Ledger {

    private static final Logger log = LoggerFactory.getLogger(Ledger.class);

    private final LedgerEntryRepository repository;
    private final Clock clock;
    private final ZoneId storeZone;

    public Ledger(LedgerEntryRepository repository, Clock clock, ZoneId storeZone) {
        this.repository = repository;
        this.clock = clock;
        this.storeZone = storeZone;
    }

    /**
     * Appends one movement. Joins the caller's transaction when there is one,
     * so a sale's entry commits or rolls back with the sale.
     */
    @Transactional
    public LedgerEntry append(LedgerEntryKind kind, BigDecimal amount, String description, Long referenceId,
            Long createdBy) {
        if (kind == null) {
            throw new ValidationException("Movement kind is required");
        }
        if (amount == null || !MoneyUtils.isPositive(MoneyUtils.money(amount))) {
            throw new ValidationException("Amount must be greater than zero");
        }
        LedgerEntry entry = LedgerEntry.builder()
                .kind(kind)
                .amount(MoneyUtils.money(amount))
                .description(description == null ? "" : description)
                .referenceId(referenceId)
                .createdBy(createdBy)
                .createdAt(OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS))
                .build();
        return repository.save(entry);
    }

    public LedgerEntry append(LedgerEntryKind kind, BigDecimal amount, String description, Long referenceId) {
        return append(kind, amount, description, referenceId, null);
    }

    @Transactional
    public LedgerEntry recordDeposit(BigDecimal amount, String description, Long userId) {
        return recordManual(LedgerEntryKind.DEPOSIT, amount, description, userId);
    }

    @Transactional
    public LedgerEntry recordWithdrawal(BigDecimal amount, String description, Long userId) {
        return recordManual(LedgerEntryKind.WITHDRAWAL, amount, description, userId);
    }

    @Transactional
    public LedgerEntry recordExpense(BigDecimal amount, String description, Long userId) {
        return recordManual(LedgerEntryKind.EXPENSE, amount, description, userId);
    }

    /** Movements a user enters by hand; sale entries are refused here. */
    @Transactional
    public LedgerEntry recordManual(LedgerEntryKind kind, BigDecimal amount, String description, Long userId) {
        if (kind == null || !kind.isManual()) {
            throw new ValidationException("Manual movements must be deposit, withdrawal or expense");
        }
        LedgerEntry entry = append(kind, amount, description, null, userId);
        log.info("LEDGER manual movement id={} kind={} amount={} user={}", entry.getId(), kind.getCode(),
                entry.getAmount(), userId);
        return entry;
    }

    /** Signed sum of all entries. */
    @Transactional(readOnly = true)
    public BigDecimal balance() {
        BigDecimal total = BigDecimal.ZERO;
        for (LedgerEntryRepository.KindTotal t : repository.totalsByKind()) {
            if (t.getTotal() != null) {
                total = total.add(t.getKind().signed(t.getTotal()));
            }
        }
        return MoneyUtils.money(total);
    }

    /** Entries with {@code start <= createdAt < end}, in append order. */
    @Transactional(readOnly = true)
    public List<LedgerEntry> movementsInRange(OffsetDateTime start, OffsetDateTime end) {
        checkRange(start, end);
        return repository.findInRange(start, end);
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> movementsInRange(OffsetDateTime start, OffsetDateTime end, LedgerEntryKind kind) {
        if (kind == null) {
            return movementsInRange(start, end);
        }
        checkRange(start, end);
        return repository.findInRangeByKind(kind, start, end);
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> movementsOfKind(LedgerEntryKind kind) {
        return repository.findByKindOrderByIdAsc(kind);
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> findBySaleReference(Long saleId) {
        return repository.findByReferenceIdAndKindOrderByIdAsc(saleId, LedgerEntryKind.SALE);
    }

    /** Totals of one calendar day in the store's zone. */
    @Transactional(readOnly = true)
    public DailyTotals dailyTotals(LocalDate date) {
        OffsetDateTime from = DateTimeUtils.startOfDay(date, storeZone);
        OffsetDateTime to = DateTimeUtils.startOfDay(date.plusDays(1), storeZone);
        Map<LedgerEntryKind, BigDecimal> byKind = new EnumMap<>(LedgerEntryKind.class);
        for (LedgerEntryRepository.KindTotal t : repository.totalsByKindInRange(from, to)) {
            byKind.put(t.getKind(), t.getTotal() == null ? BigDecimal.ZERO : t.getTotal());
        }
        BigDecimal income = BigDecimal.ZERO;
        BigDecimal expenses = BigDecimal.ZERO;
        for (Map.Entry<LedgerEntryKind, BigDecimal> e : byKind.entrySet()) {
            if (e.getKey().isIncome()) {
                income = income.add(e.getValue());
            } else {
                expenses = expenses.add(e.getValue());
            }
        }
        return new DailyTotals(date, MoneyUtils.money(income), MoneyUtils.money(expenses));
    }

    public LocalDate today() {
        return LocalDate.now(clock.withZone(storeZone));
    }

    private static void checkRange(OffsetDateTime start, OffsetDateTime end) {
        if (start == null || end == null) {
            throw new ValidationException("Both range bounds are required");
        }
        if (end.isBefore(start)) {
            throw new ValidationException("Range end must not be before its start");
        }
    }
}
