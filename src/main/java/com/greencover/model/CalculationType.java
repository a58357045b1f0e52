package com.greencover.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.util.Locale;

/**
 * Kind of cached calculation. The three built-in kinds have fixed tags;
 * {@link #custom(String)} carries a caller-supplied tag.
 */
@EqualsAndHashCode
public final class CalculationType {

    public enum Kind {
        SATELLITE, STATS, STORED, CUSTOM
    }

    public static final CalculationType SATELLITE = new CalculationType(Kind.SATELLITE, "satellite");
    public static final CalculationType STATS = new CalculationType(Kind.STATS, "stats");
    public static final CalculationType STORED = new CalculationType(Kind.STORED, "stored");

    private final Kind kind;
    private final String tag;

    private CalculationType(Kind kind, String tag) {
        this.kind = kind;
        this.tag = tag;
    }

    /**
     * Caller-defined calculation type. Tags of the built-in kinds resolve to those kinds.
     */
    public static CalculationType custom(String tag) {
        return of(tag);
    }

    @JsonCreator
    public static CalculationType of(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Calculation type tag must not be blank");
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "satellite":
                return SATELLITE;
            case "stats":
                return STATS;
            case "stored":
                return STORED;
            default:
                return new CalculationType(Kind.CUSTOM, normalized);
        }
    }

    public Kind getKind() {
        return kind;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    @Override
    public String toString() {
        return tag;
    }
}
