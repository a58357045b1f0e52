package com.greencover.repository.impl;

import com.greencover.exception.CacheUnavailableException;
import com.greencover.model.CacheEntry;
import com.greencover.model.CalculationType;
import com.greencover.model.result.CacheStats;
import com.greencover.repository.CacheStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Durable cache store on the {@code coverage_cache} table. Timestamps are epoch
 * milliseconds. Every data-access failure surfaces as {@link CacheUnavailableException}.
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "greencover.cache", name = "store", havingValue = "jdbc", matchIfMissing = true)
public class JdbcCacheStore implements CacheStore {

    static final String TABLE = "coverage_cache";

    private static final String COLUMNS =
            "cache_key, calculation_type, city_id, city_name, cached_data, created_at, expires_at";

    private static final String LIVE = "(expires_at IS NULL OR expires_at > ?)";

    private static final RowMapper<CacheEntry> ROW_MAPPER = JdbcCacheStore::mapRow;

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public JdbcCacheStore(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    public void put(CacheEntry entry) {
        execute("put " + entry.getKey(), () -> {
            Object[] args = {entry.getCalculationType().getTag(), entry.getCityId(), entry.getCityName(),
                    entry.getPayload(), toMillis(entry.getCreatedAt()), toMillis(entry.getExpiresAt()),
                    entry.getKey()};
            int[] types = {Types.VARCHAR, Types.BIGINT, Types.VARCHAR, Types.CLOB, Types.BIGINT, Types.BIGINT,
                    Types.VARCHAR};
            String update = "UPDATE " + TABLE + " SET calculation_type = ?, city_id = ?, city_name = ?, "
                    + "cached_data = ?, created_at = ?, expires_at = ? WHERE cache_key = ?";
            if (jdbcTemplate.update(update, args, types) > 0) {
                return null;
            }
            try {
                jdbcTemplate.update("INSERT INTO " + TABLE + " (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?)",
                        new Object[]{entry.getKey(), entry.getCalculationType().getTag(), entry.getCityId(),
                                entry.getCityName(), entry.getPayload(), toMillis(entry.getCreatedAt()),
                                toMillis(entry.getExpiresAt())},
                        new int[]{Types.VARCHAR, Types.VARCHAR, Types.BIGINT, Types.VARCHAR, Types.CLOB,
                                Types.BIGINT, Types.BIGINT});
            } catch (DuplicateKeyException e) {
                // a concurrent writer inserted first; overwrite it
                jdbcTemplate.update(update, args, types);
            }
            return null;
        });
    }

    @Override
    public Optional<CacheEntry> get(String key) {
        return execute("get " + key, () -> {
            List<CacheEntry> rows = jdbcTemplate.query(
                    "SELECT " + COLUMNS + " FROM " + TABLE + " WHERE cache_key = ? AND " + LIVE,
                    ROW_MAPPER, key, now());
            return rows.stream().findFirst();
        });
    }

    @Override
    public boolean delete(String key) {
        return execute("delete " + key,
                () -> jdbcTemplate.update("DELETE FROM " + TABLE + " WHERE cache_key = ?", key) > 0);
    }

    @Override
    public int deleteExpired() {
        int removed = execute("deleteExpired", () -> jdbcTemplate.update(
                "DELETE FROM " + TABLE + " WHERE expires_at IS NOT NULL AND expires_at <= ?", now()));
        if (removed > 0) {
            log.debug("Removed {} expired cache rows", removed);
        }
        return removed;
    }

    @Override
    public int deleteByCity(String cityName, Collection<CalculationType> types, String keepKey) {
        StringBuilder sql = new StringBuilder("DELETE FROM " + TABLE + " WHERE LOWER(city_name) = LOWER(?)");
        List<Object> args = new ArrayList<>();
        args.add(cityName.trim());
        if (types != null && !types.isEmpty()) {
            sql.append(" AND calculation_type IN (")
                    .append(types.stream().map(t -> "?").collect(Collectors.joining(", ")))
                    .append(')');
            types.forEach(t -> args.add(t.getTag()));
        }
        if (keepKey != null) {
            sql.append(" AND cache_key <> ?");
            args.add(keepKey);
        }
        return execute("deleteByCity " + cityName, () -> jdbcTemplate.update(sql.toString(), args.toArray()));
    }

    @Override
    public int deleteByType(Collection<CalculationType> types) {
        if (types.isEmpty()) {
            return 0;
        }
        String placeholders = types.stream().map(t -> "?").collect(Collectors.joining(", "));
        Object[] args = types.stream().map(CalculationType::getTag).toArray();
        return execute("deleteByType " + types, () -> jdbcTemplate.update(
                "DELETE FROM " + TABLE + " WHERE calculation_type IN (" + placeholders + ")", args));
    }

    @Override
    public List<String> cityNames() {
        return execute("cityNames", () -> jdbcTemplate.queryForList(
                "SELECT MIN(city_name) FROM " + TABLE + " WHERE city_name IS NOT NULL "
                        + "GROUP BY LOWER(city_name) ORDER BY LOWER(city_name)",
                String.class));
    }

    @Override
    public CacheStats stats() {
        long now = now();
        return execute("stats", () -> {
            Map<String, Long> byType = new TreeMap<>();
            long[] totals = new long[2];
            jdbcTemplate.query("SELECT calculation_type, COUNT(*) AS total, "
                            + "SUM(CASE WHEN expires_at IS NOT NULL AND expires_at <= ? THEN 1 ELSE 0 END) AS expired "
                            + "FROM " + TABLE + " GROUP BY calculation_type",
                    rs -> {
                        long total = rs.getLong("total");
                        byType.put(rs.getString("calculation_type"), total);
                        totals[0] += total;
                        totals[1] += rs.getLong("expired");
                    }, now);
            return CacheStats.builder()
                    .totalEntries(totals[0])
                    .validEntries(totals[0] - totals[1])
                    .expiredEntries(totals[1])
                    .entriesByType(byType)
                    .build();
        });
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("Cache store operation '" + operation + "' failed: "
                    + e.getMostSpecificCause().getMessage(), e);
        }
    }

    private long now() {
        return clock.millis();
    }

    private static Long toMillis(Instant instant) {
        return instant == null ? null : instant.toEpochMilli();
    }

    private static Instant toInstant(ResultSet rs, String column) throws SQLException {
        long millis = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(millis);
    }

    private static CacheEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
        long cityId = rs.getLong("city_id");
        Long nullableCityId = rs.wasNull() ? null : cityId;
        return CacheEntry.builder()
                .id(rs.getString("cache_key"))
                .calculationType(CalculationType.of(rs.getString("calculation_type")))
                .cityId(nullableCityId)
                .cityName(rs.getString("city_name"))
                .payload(rs.getString("cached_data"))
                .createdAt(toInstant(rs, "created_at"))
                .expiresAt(toInstant(rs, "expires_at"))
                .build();
    }
}
