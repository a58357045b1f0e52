package com.greencover.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.greencover.exception.ErrorKind;
import com.greencover.exception.GreenCoverageException;
import com.greencover.model.CalculationType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives cache keys: parameters are normalized into a sorted tree, serialized
 * as JSON and hashed with SHA-256. Equal parameters give equal keys whatever
 * their insertion order or numeric representation; any change gives a new key.
 * <p>
 * The canonical form keeps the calculation type apart from the caller's
 * parameters and tags every scalar with its kind, so {@code 2024} and
 * {@code "2024"} never share a key.
 */
@Slf4j
@Component
public class CacheKeyGenerator {

    static final String TYPE_MEMBER = "calculation_type";
    static final String PARAMS_MEMBER = "params";

    private static final String NUMBER_TAG = "n";
    private static final String TEXT_TAG = "s";
    private static final String BOOLEAN_TAG = "b";

    private final ObjectMapper objectMapper;

    public CacheKeyGenerator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return 64 hex characters
     */
    public String generate(CalculationType type, Map<String, ?> params) {
        Map<String, Object> normalizedParams = new TreeMap<>();
        if (params != null) {
            params.forEach((name, value) -> normalizedParams.put(name, normalize(value)));
        }
        Map<String, Object> normalized = new TreeMap<>();
        normalized.put(TYPE_MEMBER, type.getTag());
        normalized.put(PARAMS_MEMBER, normalizedParams);

        String canonical;
        try {
            canonical = objectMapper.writeValueAsString(normalized);
        } catch (JsonProcessingException e) {
            throw new GreenCoverageException(ErrorKind.INVALID_INPUT,
                    "Cache key parameters are not serializable: " + e.getOriginalMessage(), e);
        }
        String key = sha256(canonical);
        log.debug("Derived cache key {} from {}", key, canonical);
        return key;
    }

    static Object normalize(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean) {
            return Map.of(BOOLEAN_TAG, value);
        }
        if (value instanceof Double && (((Double) value).isNaN() || ((Double) value).isInfinite())
                || value instanceof Float && (((Float) value).isNaN() || ((Float) value).isInfinite())) {
            return Map.of(NUMBER_TAG, value.toString());
        }
        if (value instanceof Number) {
            BigDecimal decimal = new BigDecimal(value.toString());
            return Map.of(NUMBER_TAG, decimal.signum() == 0 ? "0" : decimal.stripTrailingZeros().toPlainString());
        }
        if (value instanceof CharSequence) {
            return Map.of(TEXT_TAG, value.toString());
        }
        if (value instanceof Enum<?>) {
            return Map.of(TEXT_TAG, ((Enum<?>) value).name());
        }
        if (value instanceof CalculationType) {
            return Map.of(TEXT_TAG, ((CalculationType) value).getTag());
        }
        if (value instanceof Path) {
            return Map.of(TEXT_TAG, ((Path) value).toAbsolutePath().normalize().toString());
        }
        if (value instanceof TemporalAccessor) {
            return Map.of(TEXT_TAG, value.toString());
        }
        if (value instanceof Map<?, ?>) {
            Map<String, Object> nested = new TreeMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> nested.put(String.valueOf(k), normalize(v)));
            return nested;
        }
        if (value instanceof Collection<?>) {
            List<Object> items = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                items.add(normalize(item));
            }
            return items;
        }
        if (value instanceof Object[]) {
            List<Object> items = new ArrayList<>();
            for (Object item : (Object[]) value) {
                items.add(normalize(item));
            }
            return items;
        }
        return Map.of(TEXT_TAG, value.toString());
    }

    static String sha256(String text) {
        return HexFormat.of().formatHex(digest().digest(text.getBytes(StandardCharsets.UTF_8)));
    }

    static MessageDigest digest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
