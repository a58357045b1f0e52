package com.greencover.raster;

import com.greencover.exception.InvalidInputException;
import com.greencover.geo.GeoTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.metadata.IIOInvalidTreeException;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;
import javax.imageio.stream.ImageInputStream;
import java.awt.Rectangle;
import java.awt.image.DataBuffer;
import java.awt.image.Raster;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;

/**
 * GeoTIFF read through the JDK Image I/O TIFF plugin. Georeferencing comes from
 * the ModelTransformation tag, or ModelTiepoint with ModelPixelScale, or a world
 * file next to the image. Samples are read per region, never the whole image.
 */
public class GeoTiffRasterSource implements RasterSource {

    private static final Logger logger = LoggerFactory.getLogger(GeoTiffRasterSource.class);

    static final int TAG_MODEL_PIXEL_SCALE = 33550;
    static final int TAG_MODEL_TIEPOINT = 33922;
    static final int TAG_MODEL_TRANSFORMATION = 34264;
    static final int TAG_GEO_KEY_DIRECTORY = 34735;
    static final int TAG_GDAL_NODATA = 42113;

    static final int KEY_RASTER_TYPE = 1025;
    static final int KEY_GEOGRAPHIC_TYPE = 2048;
    static final int KEY_PROJECTED_CS_TYPE = 3072;

    private static final int RASTER_PIXEL_IS_POINT = 2;
    private static final int USER_DEFINED = 32767;

    private static final List<String> WORLD_FILE_EXTENSIONS = List.of("tfw", "tifw", "tiffw", "wld");

    private final Path path;
    private final ImageInputStream input;
    private final ImageReader reader;
    private final int width;
    private final int height;
    private final int bandCount;
    private final GeoTransform geoTransform;
    private final String crs;
    private final Double noDataValue;
    private final boolean singlePrecision;

    private GeoTiffRasterSource(Path path, ImageInputStream input, ImageReader reader, int width, int height,
                                int bandCount, GeoTransform geoTransform, String crs, Double noDataValue,
                                boolean singlePrecision) {
        this.path = path;
        this.input = input;
        this.reader = reader;
        this.width = width;
        this.height = height;
        this.bandCount = bandCount;
        this.geoTransform = geoTransform;
        this.crs = crs;
        this.noDataValue = noDataValue;
        this.singlePrecision = singlePrecision;
    }

    /**
     * Open a GeoTIFF for region reads
     *
     * @param defaultCrs CRS assumed when the file declares none, may be null
     * @throws InvalidInputException when the file is not a readable, georeferenced TIFF
     */
    public static GeoTiffRasterSource open(Path path, String defaultCrs) throws IOException {
        if (!Files.isReadable(path)) {
            throw new InvalidInputException("Raster file not readable: " + path);
        }
        ImageInputStream input = ImageIO.createImageInputStream(path.toFile());
        if (input == null) {
            throw new InvalidInputException("Cannot open raster file: " + path);
        }
        ImageReader reader = null;
        try {
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                throw new InvalidInputException("Not a TIFF image: " + path);
            }
            reader = readers.next();
            reader.setInput(input, true, false);

            int width = reader.getWidth(0);
            int height = reader.getHeight(0);
            int bandCount = bandCount(reader);

            TIFFDirectory directory = directory(reader.getImageMetadata(0));
            int[] geoKeys = geoKeys(directory);
            GeoTransform transform = geoTransformFromTags(directory, geoKeys);
            if (transform == null) {
                transform = readWorldFile(path);
            }
            if (transform == null) {
                throw new InvalidInputException("Raster " + path.getFileName()
                        + " has no georeferencing tags and no world file");
            }

            String crs = crsFromGeoKeys(geoKeys);
            if (crs == null && defaultCrs != null) {
                logger.debug("Raster {} declares no CRS, assuming {}", path.getFileName(), defaultCrs);
                crs = defaultCrs;
            }

            Double noData = noData(directory);
            logger.debug("Opened raster {}: {}x{}, {} bands, crs={}, nodata={}",
                    path.getFileName(), width, height, bandCount, crs, noData);
            return new GeoTiffRasterSource(path, input, reader, width, height, bandCount, transform, crs, noData,
                    sampleDataType(reader) == DataBuffer.TYPE_FLOAT);
        } catch (IOException | RuntimeException e) {
            if (reader != null) {
                reader.dispose();
            }
            input.close();
            throw e;
        }
    }

    private static int bandCount(ImageReader reader) throws IOException {
        ImageTypeSpecifier raw = reader.getRawImageType(0);
        if (raw != null) {
            return raw.getSampleModel().getNumBands();
        }
        ImageReadParam param = reader.getDefaultReadParam();
        param.setSourceRegion(new Rectangle(0, 0, 1, 1));
        return reader.readRaster(0, param).getNumBands();
    }

    private static int sampleDataType(ImageReader reader) throws IOException {
        ImageTypeSpecifier raw = reader.getRawImageType(0);
        return raw == null ? DataBuffer.TYPE_UNDEFINED : raw.getSampleModel().getDataType();
    }

    private static TIFFDirectory directory(IIOMetadata metadata) {
        if (metadata == null) {
            return null;
        }
        try {
            return TIFFDirectory.createFromMetadata(metadata);
        } catch (IIOInvalidTreeException | IllegalArgumentException e) {
            logger.warn("Unreadable TIFF metadata, ignoring GeoTIFF tags: {}", e.getMessage());
            return null;
        }
    }

    private static int[] geoKeys(TIFFDirectory directory) {
        TIFFField field = directory == null ? null : directory.getTIFFField(TAG_GEO_KEY_DIRECTORY);
        if (field == null) {
            return new int[0];
        }
        int[] keys = new int[field.getCount()];
        for (int i = 0; i < keys.length; i++) {
            keys[i] = field.getAsInt(i);
        }
        return keys;
    }

    /**
     * Inline value of a GeoKey, or -1 when absent or stored in another tag
     */
    static int geoKeyValue(int[] geoKeys, int keyId) {
        if (geoKeys.length < 4) {
            return -1;
        }
        int count = geoKeys[3];
        for (int i = 0; i < count; i++) {
            int base = 4 + i * 4;
            if (base + 3 >= geoKeys.length) {
                break;
            }
            if (geoKeys[base] == keyId && geoKeys[base + 1] == 0) {
                return geoKeys[base + 3];
            }
        }
        return -1;
    }

    static String crsFromGeoKeys(int[] geoKeys) {
        int projected = geoKeyValue(geoKeys, KEY_PROJECTED_CS_TYPE);
        if (projected > 0 && projected != USER_DEFINED) {
            return "EPSG:" + projected;
        }
        int geographic = geoKeyValue(geoKeys, KEY_GEOGRAPHIC_TYPE);
        if (geographic > 0 && geographic != USER_DEFINED) {
            return "EPSG:" + geographic;
        }
        return null;
    }

    static GeoTransform geoTransformFromTags(TIFFDirectory directory, int[] geoKeys) {
        if (directory == null) {
            return null;
        }
        TIFFField matrix = directory.getTIFFField(TAG_MODEL_TRANSFORMATION);
        if (matrix != null && matrix.getCount() >= 16) {
            return adjustForPixelIsPoint(new GeoTransform(
                    matrix.getAsDouble(3), matrix.getAsDouble(0), matrix.getAsDouble(1),
                    matrix.getAsDouble(7), matrix.getAsDouble(4), matrix.getAsDouble(5)), geoKeys);
        }
        TIFFField scale = directory.getTIFFField(TAG_MODEL_PIXEL_SCALE);
        TIFFField tiepoint = directory.getTIFFField(TAG_MODEL_TIEPOINT);
        if (scale != null && tiepoint != null && scale.getCount() >= 2 && tiepoint.getCount() >= 6) {
            double scaleX = scale.getAsDouble(0);
            double scaleY = scale.getAsDouble(1);
            double i = tiepoint.getAsDouble(0);
            double j = tiepoint.getAsDouble(1);
            double x = tiepoint.getAsDouble(3);
            double y = tiepoint.getAsDouble(4);
            return adjustForPixelIsPoint(
                    new GeoTransform(x - i * scaleX, scaleX, 0.0, y + j * scaleY, 0.0, -scaleY), geoKeys);
        }
        return null;
    }

    private static GeoTransform adjustForPixelIsPoint(GeoTransform t, int[] geoKeys) {
        if (geoKeyValue(geoKeys, KEY_RASTER_TYPE) != RASTER_PIXEL_IS_POINT) {
            return t;
        }
        return new GeoTransform(
                t.getOriginX() - 0.5 * t.getPixelWidth() - 0.5 * t.getRowRotation(), t.getPixelWidth(),
                t.getRowRotation(),
                t.getOriginY() - 0.5 * t.getColRotation() - 0.5 * t.getPixelHeight(), t.getColRotation(),
                t.getPixelHeight());
    }

    /**
     * Read a world file sidecar. Its six lines are A, D, B, E, C, F where (C, F) is
     * the centre of the upper-left pixel.
     */
    static GeoTransform readWorldFile(Path imagePath) throws IOException {
        String fileName = imagePath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot < 0 ? fileName : fileName.substring(0, dot);
        for (String extension : WORLD_FILE_EXTENSIONS) {
            for (String candidate : List.of(stem + "." + extension, stem + "." + extension.toUpperCase())) {
                Path worldFile = imagePath.resolveSibling(candidate);
                if (Files.isRegularFile(worldFile)) {
                    return parseWorldFile(worldFile);
                }
            }
        }
        return null;
    }

    private static GeoTransform parseWorldFile(Path worldFile) throws IOException {
        List<String> lines = Files.readAllLines(worldFile, StandardCharsets.US_ASCII).stream()
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .toList();
        if (lines.size() < 6) {
            throw new InvalidInputException("World file " + worldFile.getFileName() + " needs six values");
        }
        try {
            double a = Double.parseDouble(lines.get(0));
            double d = Double.parseDouble(lines.get(1));
            double b = Double.parseDouble(lines.get(2));
            double e = Double.parseDouble(lines.get(3));
            double c = Double.parseDouble(lines.get(4));
            double f = Double.parseDouble(lines.get(5));
            return new GeoTransform(c - a / 2 - b / 2, a, b, f - d / 2 - e / 2, d, e);
        } catch (NumberFormatException ex) {
            throw new InvalidInputException("Malformed world file " + worldFile.getFileName(), ex);
        }
    }

    private static Double noData(TIFFDirectory directory) {
        TIFFField field = directory == null ? null : directory.getTIFFField(TAG_GDAL_NODATA);
        if (field == null || field.getCount() == 0) {
            return null;
        }
        String text = field.getAsString(0).trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Double.valueOf(text);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring unparseable GDAL_NODATA value '{}'", text);
            return null;
        }
    }

    @Override
    public int getWidth() {
        return width;
    }

    @Override
    public int getHeight() {
        return height;
    }

    @Override
    public int getBandCount() {
        return bandCount;
    }

    @Override
    public String getCrs() {
        return crs;
    }

    @Override
    public GeoTransform getGeoTransform() {
        return geoTransform;
    }

    @Override
    public Double getNoDataValue() {
        return noDataValue;
    }

    @Override
    public boolean isSinglePrecision() {
        return singlePrecision;
    }

    @Override
    public String getDescription() {
        return path.getFileName().toString();
    }

    @Override
    public synchronized double[][] readBands(Rectangle region, int... bands) throws IOException {
        ImageReadParam param = reader.getDefaultReadParam();
        param.setSourceRegion(region);
        Raster tile = reader.readRaster(0, param);
        double[][] result = new double[bands.length][];
        for (int i = 0; i < bands.length; i++) {
            result[i] = tile.getSamples(tile.getMinX(), tile.getMinY(), region.width, region.height,
                    bands[i], new double[region.width * region.height]);
        }
        return result;
    }

    @Override
    public synchronized void close() throws IOException {
        reader.dispose();
        input.close();
    }
}
