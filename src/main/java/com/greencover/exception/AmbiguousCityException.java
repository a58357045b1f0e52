package com.greencover.exception;

import java.util.List;

/**
 * Thrown when a city name matches more than one boundary feature
 */
public class AmbiguousCityException extends GreenCoverageException {

    private static final long serialVersionUID = 1L;

    private final List<String> candidates;

    public AmbiguousCityException(String cityName, List<String> candidates) {
        super(ErrorKind.AMBIGUOUS_CITY,
              "City name '" + cityName + "' matches " + candidates.size() + " features: " + candidates);
        this.candidates = List.copyOf(candidates);
    }

    public List<String> getCandidates() {
        return candidates;
    }
}
