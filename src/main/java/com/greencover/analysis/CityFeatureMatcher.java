package com.greencover.analysis;

import com.greencover.exception.AmbiguousCityException;
import com.greencover.exception.CityNotFoundException;
import com.greencover.model.BoundaryCollection;
import com.greencover.model.BoundaryGeometry;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Finds the boundary feature of a city by name: case-insensitive exact match
 * first, then a unique contains-match. Duplicates are an error, never a guess.
 */
public final class CityFeatureMatcher {

    private static final int MAX_LISTED_NAMES = 10;

    private CityFeatureMatcher() {
    }

    public static BoundaryGeometry match(BoundaryCollection boundaries, String cityName) {
        if (cityName == null || cityName.isBlank()) {
            throw new IllegalArgumentException("City name must not be blank");
        }
        String wanted = cityName.trim().toLowerCase(Locale.ROOT);

        List<BoundaryGeometry> exact = boundaries.getFeatures().stream()
                .filter(f -> f.getName() != null && f.getName().trim().toLowerCase(Locale.ROOT).equals(wanted))
                .collect(Collectors.toList());
        if (exact.size() == 1) {
            return exact.get(0);
        }
        if (exact.size() > 1) {
            throw new AmbiguousCityException(cityName, names(exact));
        }

        List<BoundaryGeometry> partial = boundaries.getFeatures().stream()
                .filter(f -> f.getName() != null && f.getName().toLowerCase(Locale.ROOT).contains(wanted))
                .collect(Collectors.toList());
        if (partial.size() == 1) {
            return partial.get(0);
        }
        if (partial.size() > 1) {
            throw new AmbiguousCityException(cityName, names(partial));
        }

        List<String> available = boundaries.names();
        throw new CityNotFoundException(cityName,
                available.subList(0, Math.min(MAX_LISTED_NAMES, available.size())));
    }

    private static List<String> names(List<BoundaryGeometry> features) {
        return features.stream().map(BoundaryGeometry::getName).collect(Collectors.toList());
    }
}
