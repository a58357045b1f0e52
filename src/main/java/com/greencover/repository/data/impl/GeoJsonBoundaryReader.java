package com.greencover.repository.data.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.greencover.exception.InvalidInputException;
import com.greencover.geo.CrsRegistry;
import com.greencover.model.BoundaryCollection;
import com.greencover.model.BoundaryGeometry;
import com.greencover.repository.data.BoundaryReader;
import com.greencover.repository.data.SourceFormat;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reads city boundaries from GeoJSON FeatureCollection or Feature files.
 * Polygon and MultiPolygon features are kept; other geometry types are skipped.
 * The CRS comes from the legacy {@code crs} member and defaults to WGS 84.
 */
@Component
public class GeoJsonBoundaryReader implements BoundaryReader {

    private static final Logger logger = LoggerFactory.getLogger(GeoJsonBoundaryReader.class);

    private final ObjectMapper objectMapper;
    private final GeometryFactory geometryFactory;

    public GeoJsonBoundaryReader(ObjectMapper objectMapper, GeometryFactory geometryFactory) {
        this.objectMapper = objectMapper;
        this.geometryFactory = geometryFactory;
    }

    @Override
    public boolean supports(SourceFormat format) {
        return format == SourceFormat.GEOJSON;
    }

    @Override
    public BoundaryCollection read(Path path, String nameProperty) {
        if (!Files.isReadable(path)) {
            throw new InvalidInputException("Boundary file not readable: " + path);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new InvalidInputException("Malformed GeoJSON in " + path.getFileName() + ": " + e.getMessage(), e);
        }
        if (root == null || !root.has("type")) {
            throw new InvalidInputException("Invalid GeoJSON in " + path.getFileName()
                    + ": expected FeatureCollection or Feature");
        }

        String crs = parseCrs(root);
        BoundaryCollection.BoundaryCollectionBuilder collection = BoundaryCollection.builder()
                .source(path.getFileName().toString())
                .crs(crs)
                .nameProperty(nameProperty);

        String type = root.get("type").asText();
        int skipped = 0;
        if ("FeatureCollection".equals(type)) {
            JsonNode features = root.get("features");
            if (features != null && features.isArray()) {
                for (JsonNode feature : features) {
                    BoundaryGeometry boundary = parseFeature(feature, nameProperty, crs);
                    if (boundary == null) {
                        skipped++;
                    } else {
                        collection.feature(boundary);
                    }
                }
            }
        } else if ("Feature".equals(type)) {
            BoundaryGeometry boundary = parseFeature(root, nameProperty, crs);
            if (boundary == null) {
                skipped++;
            } else {
                collection.feature(boundary);
            }
        } else {
            throw new InvalidInputException("Invalid GeoJSON in " + path.getFileName()
                    + ": expected FeatureCollection or Feature, got " + type);
        }

        BoundaryCollection result = collection.build();
        logger.info("Loaded {} boundary features from {} (crs {}, {} skipped)",
                result.getFeatures().size(), path.getFileName(), crs, skipped);
        return result;
    }

    private String parseCrs(JsonNode root) {
        JsonNode name = root.path("crs").path("properties").path("name");
        if (name.isTextual()) {
            return CrsRegistry.normalize(name.asText());
        }
        return CrsRegistry.WGS84;
    }

    private BoundaryGeometry parseFeature(JsonNode feature, String nameProperty, String crs) {
        Map<String, Object> properties = new LinkedHashMap<>();
        JsonNode props = feature.get("properties");
        if (props != null && props.isObject()) {
            props.fields().forEachRemaining(entry -> {
                JsonNode value = entry.getValue();
                if (value.isTextual()) {
                    properties.put(entry.getKey(), value.asText());
                } else if (value.isNumber()) {
                    properties.put(entry.getKey(), value.numberValue());
                } else if (value.isBoolean()) {
                    properties.put(entry.getKey(), value.asBoolean());
                } else if (!value.isNull()) {
                    properties.put(entry.getKey(), value.toString());
                }
            });
        }

        JsonNode geometryNode = feature.get("geometry");
        if (geometryNode == null || geometryNode.isNull()) {
            logger.warn("Skipping feature with no geometry: {}", properties);
            return null;
        }
        Geometry geometry;
        try {
            geometry = parseGeometry(geometryNode);
        } catch (RuntimeException e) {
            logger.warn("Skipping feature with malformed geometry: {}", e.getMessage());
            return null;
        }
        if (geometry == null) {
            return null;
        }
        if (!geometry.isValid()) {
            geometry = geometry.buffer(0);
        }

        return BoundaryGeometry.builder()
                .name(featureName(properties, nameProperty))
                .geometry(geometry)
                .crs(crs)
                .properties(properties)
                .build();
    }

    private static String featureName(Map<String, Object> properties, String nameProperty) {
        Object name = nameProperty == null ? null : properties.get(nameProperty);
        if (name == null) {
            for (Map.Entry<String, Object> entry : properties.entrySet()) {
                if (entry.getKey().equalsIgnoreCase(nameProperty) || entry.getKey().equalsIgnoreCase("name")) {
                    name = entry.getValue();
                    break;
                }
            }
        }
        return name == null ? null : name.toString();
    }

    private Geometry parseGeometry(JsonNode geometry) {
        String type = geometry.path("type").asText();
        JsonNode coordinates = geometry.get("coordinates");
        switch (type.toLowerCase(Locale.ROOT)) {
            case "polygon":
                return parsePolygon(coordinates);
            case "multipolygon":
                Polygon[] polygons = new Polygon[coordinates.size()];
                for (int i = 0; i < coordinates.size(); i++) {
                    polygons[i] = parsePolygon(coordinates.get(i));
                }
                return geometryFactory.createMultiPolygon(polygons);
            default:
                logger.warn("Unsupported boundary geometry type: {}", type);
                return null;
        }
    }

    private Polygon parsePolygon(JsonNode rings) {
        if (rings == null || !rings.isArray() || rings.isEmpty()) {
            throw new IllegalArgumentException("Polygon without rings");
        }
        LinearRing shell = parseRing(rings.get(0));
        LinearRing[] holes = new LinearRing[rings.size() - 1];
        for (int i = 1; i < rings.size(); i++) {
            holes[i - 1] = parseRing(rings.get(i));
        }
        return geometryFactory.createPolygon(shell, holes);
    }

    private LinearRing parseRing(JsonNode ring) {
        if (!ring.isArray() || ring.size() < 3) {
            throw new IllegalArgumentException("Ring needs at least 3 positions");
        }
        int size = ring.size();
        Coordinate first = position(ring.get(0));
        Coordinate last = position(ring.get(size - 1));
        boolean closed = first.equals2D(last);
        Coordinate[] coords = new Coordinate[closed ? size : size + 1];
        Iterator<JsonNode> positions = ring.elements();
        int i = 0;
        while (positions.hasNext()) {
            coords[i++] = position(positions.next());
        }
        if (!closed) {
            coords[size] = first.copy();
        }
        if (coords.length < 4) {
            throw new IllegalArgumentException("Ring needs at least 4 positions once closed");
        }
        return geometryFactory.createLinearRing(coords);
    }

    private static Coordinate position(JsonNode coord) {
        if (!coord.isArray() || coord.size() < 2) {
            throw new IllegalArgumentException("Position needs two ordinates: " + coord);
        }
        return new Coordinate(coord.get(0).asDouble(), coord.get(1).asDouble());
    }
}
