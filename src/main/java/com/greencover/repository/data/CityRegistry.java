package com.greencover.repository.data;

import com.greencover.model.CityRecord;

import java.util.List;
import java.util.Optional;

/**
 * Known cities and the imagery and boundary files available for them
 */
public interface CityRegistry {

    List<CityRecord> findAll();

    /**
     * Cities with both a raster and a boundary file
     */
    default List<CityRecord> findAvailable() {
        return findAll().stream().filter(CityRecord::hasImagery).toList();
    }

    /**
     * Case-insensitive lookup by name
     */
    default Optional<CityRecord> findByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String wanted = name.trim();
        return findAll().stream().filter(city -> city.getName().equalsIgnoreCase(wanted)).findFirst();
    }
}
