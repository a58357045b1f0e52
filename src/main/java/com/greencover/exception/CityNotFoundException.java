package com.greencover.exception;

import java.util.List;

/**
 * Thrown when a named city is absent from the boundary source or the city registry
 */
public class CityNotFoundException extends GreenCoverageException {

    private static final long serialVersionUID = 1L;

    private final String cityName;

    public CityNotFoundException(String cityName) {
        super(ErrorKind.CITY_NOT_FOUND, "City '" + cityName + "' not found");
        this.cityName = cityName;
    }

    public CityNotFoundException(String cityName, List<String> availableNames) {
        super(ErrorKind.CITY_NOT_FOUND,
              "City '" + cityName + "' not found. Available cities: " + availableNames);
        this.cityName = cityName;
    }

    public String getCityName() {
        return cityName;
    }
}
