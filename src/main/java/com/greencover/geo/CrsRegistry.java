package com.greencover.geo;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Registry of the EPSG systems met in city boundary and imagery data:
 * WGS84, NAD83 and ETRS89 geographic, Web Mercator, UTM zones on those datums,
 * plus a few national grids that are identified but not transformed.
 */
public final class CrsRegistry {

    public static final String WGS84 = "EPSG:4326";

    static final double WGS84_A = 6378137.0;
    static final double WGS84_INV_F = 298.257223563;
    static final double GRS80_INV_F = 298.257222101;

    private static final String DATUM_WGS84 = "WGS84";

    private static final Pattern TRAILING_CODE = Pattern.compile("(\\d+)\\s*$");

    private CrsRegistry() {
    }

    /**
     * Normalize identifiers such as {@code urn:ogc:def:crs:EPSG::32633},
     * {@code epsg:4326}, {@code CRS84} or {@code 3857} to {@code EPSG:nnnn}.
     * Unrecognized identifiers are trimmed and upper-cased. Null or blank yields null.
     */
    public static String normalize(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return null;
        }
        String trimmed = identifier.trim();
        String upper = trimmed.toUpperCase(Locale.ROOT);
        if (upper.endsWith("CRS84") || upper.equals("WGS84") || upper.equals("WGS 84")) {
            return WGS84;
        }
        if (upper.contains("EPSG") || upper.chars().allMatch(Character::isDigit)) {
            Matcher matcher = TRAILING_CODE.matcher(upper);
            if (matcher.find()) {
                int code = Integer.parseInt(matcher.group(1));
                return "EPSG:" + canonicalCode(code);
            }
        }
        return upper;
    }

    public static Optional<CrsDefinition> lookup(String identifier) {
        String normalized = normalize(identifier);
        if (normalized == null || !normalized.startsWith("EPSG:")) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(byCode(Integer.parseInt(normalized.substring(5))));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public static Optional<CrsDefinition> lookup(int code) {
        return Optional.ofNullable(byCode(canonicalCode(code)));
    }

    private static int canonicalCode(int code) {
        // legacy Web Mercator codes
        if (code == 900913 || code == 102100 || code == 102113 || code == 3785) {
            return 3857;
        }
        return code;
    }

    private static CrsDefinition byCode(int code) {
        switch (code) {
            case 4326:
                return geographic(code, "WGS 84", DATUM_WGS84, WGS84_INV_F);
            case 4269:
                return geographic(code, "NAD83", DATUM_WGS84, GRS80_INV_F);
            case 4258:
                return geographic(code, "ETRS89", DATUM_WGS84, GRS80_INV_F);
            case 3857:
                return CrsDefinition.builder()
                        .id("EPSG:3857")
                        .code(3857)
                        .name("WGS 84 / Pseudo-Mercator")
                        .kind(CrsDefinition.Kind.PROJECTED)
                        .projection(CrsDefinition.Projection.WEB_MERCATOR)
                        .datum(DATUM_WGS84)
                        .unit("metre")
                        .unitToMetre(1.0)
                        .semiMajorAxis(WGS84_A)
                        .inverseFlattening(WGS84_INV_F)
                        .scaleFactor(1.0)
                        .build();
            case 2263:
                return unsupportedProjected(code, "NAD83 / New York Long Island (ftUS)", "NAD83",
                        "US survey foot", 1200.0 / 3937.0);
            case 27700:
                return unsupportedProjected(code, "OSGB36 / British National Grid", "OSGB36", "metre", 1.0);
            default:
                break;
        }
        if (code >= 32601 && code <= 32660) {
            return utm(code, "WGS 84 / UTM zone " + (code - 32600) + "N", code - 32600, false, WGS84_INV_F);
        }
        if (code >= 32701 && code <= 32760) {
            return utm(code, "WGS 84 / UTM zone " + (code - 32700) + "S", code - 32700, true, WGS84_INV_F);
        }
        if (code >= 26901 && code <= 26923) {
            return utm(code, "NAD83 / UTM zone " + (code - 26900) + "N", code - 26900, false, GRS80_INV_F);
        }
        if (code >= 25828 && code <= 25838) {
            return utm(code, "ETRS89 / UTM zone " + (code - 25800) + "N", code - 25800, false, GRS80_INV_F);
        }
        return null;
    }

    private static CrsDefinition geographic(int code, String name, String datum, double inverseFlattening) {
        return CrsDefinition.builder()
                .id("EPSG:" + code)
                .code(code)
                .name(name)
                .kind(CrsDefinition.Kind.GEOGRAPHIC)
                .projection(CrsDefinition.Projection.NONE)
                .datum(datum)
                .unit("degree")
                .unitToMetre(Double.NaN)
                .semiMajorAxis(WGS84_A)
                .inverseFlattening(inverseFlattening)
                .build();
    }

    private static CrsDefinition utm(int code, String name, int zone, boolean south, double inverseFlattening) {
        return CrsDefinition.builder()
                .id("EPSG:" + code)
                .code(code)
                .name(name)
                .kind(CrsDefinition.Kind.PROJECTED)
                .projection(CrsDefinition.Projection.TRANSVERSE_MERCATOR)
                .datum(DATUM_WGS84)
                .unit("metre")
                .unitToMetre(1.0)
                .semiMajorAxis(WGS84_A)
                .inverseFlattening(inverseFlattening)
                .centralMeridian(zone * 6.0 - 183.0)
                .latitudeOfOrigin(0.0)
                .scaleFactor(0.9996)
                .falseEasting(500000.0)
                .falseNorthing(south ? 10000000.0 : 0.0)
                .build();
    }

    private static CrsDefinition unsupportedProjected(int code, String name, String datum, String unit,
                                                      double unitToMetre) {
        return CrsDefinition.builder()
                .id("EPSG:" + code)
                .code(code)
                .name(name)
                .kind(CrsDefinition.Kind.PROJECTED)
                .projection(CrsDefinition.Projection.UNSUPPORTED)
                .datum(datum)
                .unit(unit)
                .unitToMetre(unitToMetre)
                .build();
    }
}
