package com.controlactas.repository;

import com.controlactas.model.PriceReferenceEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Reference price store (table "precios").
 *
 * Reconciliation only reads it, once per run, through {@link #findAll()}.
 * The write methods back the administrative path: insert-or-update keyed by activity,
 * last write wins, every effective change logged in "precios_log".
 */
@Repository
@Slf4j
public class PriceReferenceRepository {

    private static final RowMapper<PriceReferenceEntry> ENTRY_MAPPER = (rs, rowNum) -> {
        Timestamp updatedAt = rs.getTimestamp("updated_at");
        return new PriceReferenceEntry(
                rs.getString("actividad"),
                rs.getBigDecimal("precio"),
                rs.getString("unidad"),
                updatedAt != null ? updatedAt.toLocalDateTime() : null
        );
    };

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final int maxRetries;
    private final long retryDelayMs;
    private final SqlTemplateLoader sqlLoader;

    public PriceReferenceRepository(
            NamedParameterJdbcTemplate jdbcTemplate,
            @Value("${control-actas.db.max-retries:2}") int maxRetries,
            @Value("${control-actas.db.retry-delay-ms:100}") long retryDelayMs,
            SqlTemplateLoader sqlLoader) {
        this.jdbcTemplate = jdbcTemplate;
        this.maxRetries = maxRetries;
        this.retryDelayMs = retryDelayMs;
        this.sqlLoader = sqlLoader;
        log.info("PriceReferenceRepository initialized with maxRetries: {}, retryDelayMs: {}ms",
                maxRetries, retryDelayMs);
    }

    /**
     * All prices, oldest update first, so that a consumer folding them into a map keeps
     * the most recent row when normalized keys collide.
     */
    public List<PriceReferenceEntry> findAll() {
        return withRetry("findAllPrices", () ->
                jdbcTemplate.query(sqlLoader.load("findAllPrices"), new MapSqlParameterSource(), ENTRY_MAPPER));
    }

    public Optional<PriceReferenceEntry> findByActivity(String activity) {
        String key = activity == null ? "" : activity.trim();
        if (key.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(withRetry("findPriceByActivity", () ->
                    jdbcTemplate.queryForObject(sqlLoader.load("findPriceByActivity"),
                            new MapSqlParameterSource("activity", key), ENTRY_MAPPER)));
        } catch (EmptyResultDataAccessException e) {
            log.debug("No reference price for activity: {}", key);
            return Optional.empty();
        }
    }

    public Optional<BigDecimal> findPrice(String activity) {
        return findByActivity(activity).map(PriceReferenceEntry::price);
    }

    /**
     * Inserts or updates one activity. Returns the stored entry.
     */
    @Transactional
    public PriceReferenceEntry upsert(String activity, BigDecimal price, String unit) {
        String key = activity == null ? "" : activity.trim();
        if (key.isEmpty()) {
            throw new IllegalArgumentException("Activity must not be blank");
        }
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("Reference price must be positive for activity: " + key);
        }
        String cleanUnit = unit == null || unit.isBlank() ? null : unit.trim();
        LocalDateTime now = LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS);

        Optional<PriceReferenceEntry> previous = findByActivity(key);

        jdbcTemplate.update(sqlLoader.load("upsertPrice"), new MapSqlParameterSource()
                .addValue("activity", key)
                .addValue("price", price)
                .addValue("unit", cleanUnit)
                .addValue("updatedAt", Timestamp.valueOf(now)));

        boolean changed = previous
                .map(p -> p.price().compareTo(price) != 0 || !Objects.equals(p.unit(), cleanUnit))
                .orElse(true);
        if (changed) {
            jdbcTemplate.update(sqlLoader.load("insertPriceLog"), new MapSqlParameterSource()
                    .addValue("activity", key)
                    .addValue("priceOld", previous.map(PriceReferenceEntry::price).orElse(null))
                    .addValue("priceNew", price)
                    .addValue("unitOld", previous.map(PriceReferenceEntry::unit).orElse(null))
                    .addValue("unitNew", cleanUnit)
                    .addValue("changedAt", Timestamp.valueOf(now)));
        }
        log.debug("Upserted reference price: {} = {} {} (changed={})", key, price, cleanUnit, changed);
        return new PriceReferenceEntry(key, price, cleanUnit, now);
    }

    /**
     * Removes an activity, logging its last values. Returns false when it did not exist.
     */
    @Transactional
    public boolean delete(String activity) {
        Optional<PriceReferenceEntry> previous = findByActivity(activity);
        if (previous.isEmpty()) {
            return false;
        }
        PriceReferenceEntry old = previous.get();
        jdbcTemplate.update(sqlLoader.load("insertPriceLog"), new MapSqlParameterSource()
                .addValue("activity", old.activity())
                .addValue("priceOld", old.price())
                .addValue("priceNew", null)
                .addValue("unitOld", old.unit())
                .addValue("unitNew", null)
                .addValue("changedAt", Timestamp.valueOf(LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS))));
        jdbcTemplate.update(sqlLoader.load("deletePrice"), new MapSqlParameterSource("activity", old.activity()));
        return true;
    }

    public int countChanges(String activity) {
        Integer count = jdbcTemplate.queryForObject(sqlLoader.load("countPriceLog"),
                new MapSqlParameterSource("activity", activity), Integer.class);
        return count == null ? 0 : count;
    }

    /**
     * Retry wrapper for transient DB failures.
     * Retries up to `maxRetries` times with exponential backoff and jitter.
     */
    private <T> T withRetry(String operationName, Supplier<T> operation) {
        int attempt = 0;
        final int totalAttempts = maxRetries + 1;
        while (true) {
            try {
                attempt++;
                return operation.get();
            } catch (EmptyResultDataAccessException e) {
                throw e;
            } catch (DataAccessException e) {
                if (attempt > maxRetries) {
                    log.error("Operation '{}' failed after {} attempts: {}",
                            operationName, attempt, e.getMessage());
                    throw e;
                }

                long baseDelay = retryDelayMs * (1L << (attempt - 1));
                long jitter = ThreadLocalRandom.current().nextLong(0, Math.max(1L, Math.min(1000L, baseDelay)));
                long delay = Math.min(baseDelay + jitter, 60000L);

                log.warn("Operation '{}' failed (attempt {}/{}), retrying in {}ms: {}",
                        operationName, attempt, totalAttempts, delay, e.getMessage());
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }
}
