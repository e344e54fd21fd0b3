package com.example.poscore.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class ApiController {

    private static final Logger log = LoggerFactory.getLogger(ApiController.class);

    private static final String KEY_MESSAGE = "message";
    private static final String KEY_VERSION = "version";
    private static final String KEY_STATUS = "status";
    private static final String KEY_TIMESTAMP = "timestamp";
    private static final String VERSION_VALUE = "1.0.0";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public ApiController(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    /** Liveness plus a database ping; 503 when the database does not answer. */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean dbUp;
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            dbUp = true;
        } catch (DataAccessException e) {
            log.warn("Health check: database unavailable: {}", e.getMessage());
            dbUp = false;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(KEY_STATUS, dbUp ? "healthy" : "degraded");
        body.put("database", dbUp ? "up" : "down");
        body.put(KEY_VERSION, VERSION_VALUE);
        body.put(KEY_TIMESTAMP, OffsetDateTime.now(clock).toString());
        return dbUp ? ResponseEntity.ok(body) : ResponseEntity.status(503).body(body);
    }

    @GetMapping("/api")
    public Map<String, Object> api() {
        return Map.of(
                KEY_MESSAGE, "Point of sale API",
                KEY_VERSION, VERSION_VALUE,
                KEY_STATUS, "online",
                KEY_TIMESTAMP, OffsetDateTime.now(clock).toString());
    }
}
