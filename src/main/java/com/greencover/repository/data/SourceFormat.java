package com.greencover.repository.data;

import com.greencover.exception.UnsupportedFormatException;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Boundary and raster file formats, recognized by file extension
 */
public enum SourceFormat {

    GEOJSON(Category.BOUNDARY, "geojson", "json"),
    SHAPEFILE(Category.BOUNDARY, "shp"),
    GEOPACKAGE(Category.BOUNDARY, "gpkg"),
    GEOTIFF(Category.RASTER, "tif", "tiff"),
    ERDAS_IMAGINE(Category.RASTER, "img"),
    JPEG2000(Category.RASTER, "jp2");

    public enum Category {
        BOUNDARY,
        RASTER
    }

    private final Category category;
    private final List<String> extensions;

    SourceFormat(Category category, String... extensions) {
        this.category = category;
        this.extensions = List.of(extensions);
    }

    public Category getCategory() {
        return category;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    /**
     * Detect the format of a file from its extension
     *
     * @throws UnsupportedFormatException for unknown extensions
     */
    public static SourceFormat fromPath(Path path) {
        String extension = extension(path);
        return Arrays.stream(values())
                .filter(format -> format.extensions.contains(extension))
                .findFirst()
                .orElseThrow(() -> new UnsupportedFormatException(
                        "Unrecognized file type '." + extension + "' for " + path.getFileName()));
    }

    public static String extension(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
