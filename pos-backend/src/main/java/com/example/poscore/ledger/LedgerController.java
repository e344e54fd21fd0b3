package com.example.poscore.ledger;

import com.example.poscore.common.ValidationException;
import com.example.poscore.user.UserRepository;
import com.example.poscore.utils.DateTimeUtils;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
public class LedgerController {

    private final Ledger ledger;
    private final UserRepository userRepository;
    private final ZoneId storeZone;

    private static final String KEY_ERROR = "error";
    private static final String MSG_NOT_AUTHENTICATED = "Not authenticated";
    private static final String MSG_PERMISSION_DENIED = "Permission denied";

    /**
     * Movements in {@code [from, to)}. Both bounds accept an ISO timestamp, a
     * local date-time or a date; missing bounds default to the current day.
     */
    @GetMapping("/movements")
    public Map<String, Object> movements(@RequestParam(required = false) String from,
            @RequestParam(required = false) String to,
            @RequestParam(required = false) String kind) {
        LocalDate today = ledger.today();
        OffsetDateTime start = parseBound(from, DateTimeUtils.startOfDay(today, storeZone));
        OffsetDateTime end = parseBound(to, DateTimeUtils.startOfDay(today.plusDays(1), storeZone));
        LedgerEntryKind k = kind == null || kind.isBlank() ? null : LedgerEntryKind.fromCode(kind);

        List<LedgerEntry> entries = ledger.movementsInRange(start, end, k);
        BigDecimal net = entries.stream().map(LedgerEntry::signedAmount).reduce(BigDecimal.ZERO, BigDecimal::add);

        Map<String, Object> resp = new LinkedHashMap<>();
        resp.put("from", start);
        resp.put("to", end);
        resp.put("items", entries.stream().map(LedgerController::toBody).toList());
        resp.put("count", entries.size());
        resp.put("net", net);
        return resp;
    }

    @GetMapping("/balance")
    public Map<String, Object> balance() {
        return Map.of("balance", ledger.balance());
    }

    @GetMapping("/daily")
    public Map<String, Object> daily(@RequestParam(required = false) String date) {
        LocalDate day;
        try {
            day = date == null || date.isBlank() ? ledger.today() : LocalDate.parse(date);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid date: " + date);
        }
        DailyTotals totals = ledger.dailyTotals(day);
        Map<String, Object> resp = new LinkedHashMap<>();
        resp.put("date", totals.getDate());
        resp.put("income", totals.getIncome());
        resp.put("expenses", totals.getExpenses());
        resp.put("net", totals.getNet());
        return resp;
    }

    @PostMapping("/movements")
    public ResponseEntity<Map<String, Object>> addMovement(
            @RequestAttribute(name = "userId", required = false) Long userId,
            @RequestBody MovementRequest req) {
        if (userId == null)
            return ResponseEntity.status(401).body(Map.of(KEY_ERROR, MSG_NOT_AUTHENTICATED));

        var user = userRepository.findById(userId).orElse(null);
        if (user == null || !user.mayManageLedger()) {
            return ResponseEntity.status(403).body(Map.of(KEY_ERROR, MSG_PERMISSION_DENIED));
        }

        LedgerEntryKind kind = LedgerEntryKind.fromCode(req.getKind());
        LedgerEntry entry = ledger.recordManual(kind, req.getAmount(), req.getDescription(), userId);
        return ResponseEntity.status(201).body(toBody(entry));
    }

    static Map<String, Object> toBody(LedgerEntry e) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", e.getId());
        m.put("kind", e.getKind().getCode());
        m.put("amount", e.getAmount());
        m.put("signed_amount", e.signedAmount());
        m.put("description", e.getDescription());
        m.put("reference_id", e.getReferenceId());
        m.put("created_by", e.getCreatedBy());
        m.put("created_at", e.getCreatedAt());
        return m;
    }

    private OffsetDateTime parseBound(String value, OffsetDateTime fallback) {
        if (value == null || value.isBlank())
            return fallback;
        OffsetDateTime parsed = DateTimeUtils.parseToOffsetDateTimeOrNull(value, storeZone);
        if (parsed == null)
            throw new ValidationException("Invalid date/time: " + value);
        return parsed;
    }

    @Data
    public static class MovementRequest {
        private String kind;
        private BigDecimal amount;
        private String description;
    }
}
