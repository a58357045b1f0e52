package com.greencover.repository.data.impl;

import com.greencover.config.GreenCoverProperties;
import com.greencover.model.CityRecord;
import com.greencover.repository.data.CityRegistry;
import com.greencover.repository.data.SourceFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * City registry over the configured city list, resolving each city's files by
 * name in the satellite and boundary directories. A file whose name contains the
 * city name (lower case, spaces kept or replaced by '_' or '-') belongs to that
 * city; otherwise the first regional file of the directory is used.
 */
@Slf4j
@Component
public class FileSystemCityRegistry implements CityRegistry {

    static final List<String> RASTER_EXTENSIONS = SourceFormat.GEOTIFF.getExtensions();
    static final List<String> BOUNDARY_EXTENSIONS = List.of("geojson", "json", "shp");

    private final GreenCoverProperties properties;

    public FileSystemCityRegistry(GreenCoverProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<CityRecord> findAll() {
        GreenCoverProperties.DataDirs data = properties.getData();
        List<Path> rasters = listFiles(Paths.get(data.getSatelliteDir()), RASTER_EXTENSIONS);
        List<Path> boundaries = listFiles(Paths.get(data.getBoundaryDir()), BOUNDARY_EXTENSIONS);

        List<CityRecord> cities = new ArrayList<>();
        for (GreenCoverProperties.City city : data.getCities()) {
            if (city.getName() == null || city.getName().isBlank()) {
                continue;
            }
            cities.add(CityRecord.builder()
                    .id(city.getId())
                    .name(city.getName().trim())
                    .rasterPath(resolve(city.getName(), rasters, RASTER_EXTENSIONS).orElse(null))
                    .boundaryPath(resolve(city.getName(), boundaries, BOUNDARY_EXTENSIONS).orElse(null))
                    .build());
        }
        return cities;
    }

    static List<String> namePatterns(String cityName) {
        String lower = cityName.trim().toLowerCase(Locale.ROOT);
        return Stream.of(lower.replace(' ', '_'), lower.replace(' ', '-'), lower)
                .distinct()
                .collect(Collectors.toList());
    }

    private Optional<Path> resolve(String cityName, List<Path> files, List<String> extensionPreference) {
        for (String pattern : namePatterns(cityName)) {
            Optional<Path> match = files.stream()
                    .filter(file -> file.getFileName().toString().toLowerCase(Locale.ROOT).contains(pattern))
                    .min(preferring(extensionPreference));
            if (match.isPresent()) {
                return match;
            }
        }
        Optional<Path> regional = files.stream().min(preferring(extensionPreference));
        regional.ifPresent(path -> log.debug("No file named after {}, using regional file {}", cityName, path));
        return regional;
    }

    private static Comparator<Path> preferring(List<String> extensions) {
        return Comparator.<Path>comparingInt(path -> extensions.indexOf(SourceFormat.extension(path)))
                .thenComparing(path -> path.getFileName().toString());
    }

    private static List<Path> listFiles(Path directory, List<String> extensions) {
        if (!Files.isDirectory(directory)) {
            log.debug("Data directory {} does not exist", directory);
            return List.of();
        }
        try (Stream<Path> stream = Files.list(directory)) {
            return stream.filter(Files::isRegularFile)
                    .filter(path -> extensions.contains(SourceFormat.extension(path)))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("Cannot list data directory {}: {}", directory, e.getMessage());
            return List.of();
        }
    }
}
