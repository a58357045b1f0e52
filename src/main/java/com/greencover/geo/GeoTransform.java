package com.greencover.geo;

import com.greencover.exception.InvalidInputException;
import lombok.Value;
import org.locationtech.jts.geom.util.AffineTransformation;
import org.locationtech.jts.geom.util.NoninvertibleTransformationException;

/**
 * Affine pixel-to-map mapping in the GDAL coefficient order:
 * <pre>
 * x = originX + col * pixelWidth + row * rowRotation
 * y = originY + col * colRotation + row * pixelHeight
 * </pre>
 * (col, row) is the upper-left corner of a pixel; its centre is (col + 0.5, row + 0.5).
 */
@Value
public class GeoTransform {

    double originX;
    double pixelWidth;
    double rowRotation;
    double originY;
    double colRotation;
    double pixelHeight;

    public static GeoTransform northUp(double originX, double originY, double pixelWidth, double pixelHeight) {
        return new GeoTransform(originX, pixelWidth, 0.0, originY, 0.0, -Math.abs(pixelHeight));
    }

    public AffineTransformation toMapTransformation() {
        return new AffineTransformation(pixelWidth, rowRotation, originX, colRotation, pixelHeight, originY);
    }

    /**
     * Map-to-pixel mapping
     *
     * @throws InvalidInputException when the geotransform is degenerate
     */
    public AffineTransformation toPixelTransformation() {
        try {
            return toMapTransformation().getInverse();
        } catch (NoninvertibleTransformationException e) {
            throw new InvalidInputException("Raster geotransform is not invertible: " + this, e);
        }
    }

    public double determinant() {
        return pixelWidth * pixelHeight - rowRotation * colRotation;
    }

    public double mapY(double col, double row) {
        return originY + col * colRotation + row * pixelHeight;
    }
}
