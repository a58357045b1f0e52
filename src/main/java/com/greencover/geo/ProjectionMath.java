package com.greencover.geo;

import org.locationtech.jts.geom.Coordinate;

/**
 * Forward and inverse formulas for the projections the registry can transform.
 * Transverse Mercator follows the USGS series expansion (Snyder, Map Projections
 * A Working Manual, 1987), accurate to the millimetre within a UTM zone.
 */
final class ProjectionMath {

    private ProjectionMath() {
    }

    /**
     * Convert projected coordinates of {@code crs} to longitude/latitude in degrees, in place
     */
    static void toGeographic(CrsDefinition crs, Coordinate c) {
        switch (crs.getProjection()) {
            case NONE:
                return;
            case WEB_MERCATOR:
                inverseWebMercator(crs, c);
                return;
            case TRANSVERSE_MERCATOR:
                inverseTransverseMercator(crs, c);
                return;
            default:
                throw new IllegalStateException("No transform for " + crs.getId());
        }
    }

    /**
     * Convert longitude/latitude in degrees to projected coordinates of {@code crs}, in place
     */
    static void fromGeographic(CrsDefinition crs, Coordinate c) {
        switch (crs.getProjection()) {
            case NONE:
                return;
            case WEB_MERCATOR:
                forwardWebMercator(crs, c);
                return;
            case TRANSVERSE_MERCATOR:
                forwardTransverseMercator(crs, c);
                return;
            default:
                throw new IllegalStateException("No transform for " + crs.getId());
        }
    }

    private static void forwardWebMercator(CrsDefinition crs, Coordinate c) {
        double r = crs.getSemiMajorAxis();
        double lat = Math.max(-85.06, Math.min(85.06, c.y));
        c.x = r * Math.toRadians(c.x);
        c.y = r * Math.log(Math.tan(Math.PI / 4 + Math.toRadians(lat) / 2));
    }

    private static void inverseWebMercator(CrsDefinition crs, Coordinate c) {
        double r = crs.getSemiMajorAxis();
        double lon = Math.toDegrees(c.x / r);
        double lat = Math.toDegrees(2 * Math.atan(Math.exp(c.y / r)) - Math.PI / 2);
        c.x = lon;
        c.y = lat;
    }

    private static void forwardTransverseMercator(CrsDefinition crs, Coordinate c) {
        double a = crs.getSemiMajorAxis();
        double f = 1.0 / crs.getInverseFlattening();
        double e2 = f * (2 - f);
        double ep2 = e2 / (1 - e2);
        double k0 = crs.getScaleFactor();

        double phi = Math.toRadians(c.y);
        double lambda = Math.toRadians(c.x);
        double lambda0 = Math.toRadians(crs.getCentralMeridian());

        double sinPhi = Math.sin(phi);
        double cosPhi = Math.cos(phi);
        double tanPhi = Math.tan(phi);

        double n = a / Math.sqrt(1 - e2 * sinPhi * sinPhi);
        double t = tanPhi * tanPhi;
        double cc = ep2 * cosPhi * cosPhi;
        double aa = cosPhi * (lambda - lambda0);

        double m = meridianArc(a, e2, phi);
        double m0 = meridianArc(a, e2, Math.toRadians(crs.getLatitudeOfOrigin()));

        double x = k0 * n * (aa
                + (1 - t + cc) * Math.pow(aa, 3) / 6
                + (5 - 18 * t + t * t + 72 * cc - 58 * ep2) * Math.pow(aa, 5) / 120);
        double y = k0 * (m - m0 + n * tanPhi * (aa * aa / 2
                + (5 - t + 9 * cc + 4 * cc * cc) * Math.pow(aa, 4) / 24
                + (61 - 58 * t + t * t + 600 * cc - 330 * ep2) * Math.pow(aa, 6) / 720));

        c.x = x + crs.getFalseEasting();
        c.y = y + crs.getFalseNorthing();
    }

    private static void inverseTransverseMercator(CrsDefinition crs, Coordinate c) {
        double a = crs.getSemiMajorAxis();
        double f = 1.0 / crs.getInverseFlattening();
        double e2 = f * (2 - f);
        double e4 = e2 * e2;
        double e6 = e4 * e2;
        double ep2 = e2 / (1 - e2);
        double k0 = crs.getScaleFactor();

        double m0 = meridianArc(a, e2, Math.toRadians(crs.getLatitudeOfOrigin()));
        double m = m0 + (c.y - crs.getFalseNorthing()) / k0;
        double mu = m / (a * (1 - e2 / 4 - 3 * e4 / 64 - 5 * e6 / 256));
        double sqrt = Math.sqrt(1 - e2);
        double e1 = (1 - sqrt) / (1 + sqrt);

        double phi1 = mu
                + (3 * e1 / 2 - 27 * Math.pow(e1, 3) / 32) * Math.sin(2 * mu)
                + (21 * e1 * e1 / 16 - 55 * Math.pow(e1, 4) / 32) * Math.sin(4 * mu)
                + (151 * Math.pow(e1, 3) / 96) * Math.sin(6 * mu)
                + (1097 * Math.pow(e1, 4) / 512) * Math.sin(8 * mu);

        double sinPhi1 = Math.sin(phi1);
        double cosPhi1 = Math.cos(phi1);
        double tanPhi1 = Math.tan(phi1);
        double c1 = ep2 * cosPhi1 * cosPhi1;
        double t1 = tanPhi1 * tanPhi1;
        double denom = 1 - e2 * sinPhi1 * sinPhi1;
        double n1 = a / Math.sqrt(denom);
        double r1 = a * (1 - e2) / Math.pow(denom, 1.5);
        double d = (c.x - crs.getFalseEasting()) / (n1 * k0);

        double phi = phi1 - (n1 * tanPhi1 / r1) * (d * d / 2
                - (5 + 3 * t1 + 10 * c1 - 4 * c1 * c1 - 9 * ep2) * Math.pow(d, 4) / 24
                + (61 + 90 * t1 + 298 * c1 + 45 * t1 * t1 - 252 * ep2 - 3 * c1 * c1) * Math.pow(d, 6) / 720);
        double lambda = Math.toRadians(crs.getCentralMeridian()) + (d
                - (1 + 2 * t1 + c1) * Math.pow(d, 3) / 6
                + (5 - 2 * c1 + 28 * t1 - 3 * c1 * c1 + 8 * ep2 + 24 * t1 * t1) * Math.pow(d, 5) / 120) / cosPhi1;

        c.x = Math.toDegrees(lambda);
        c.y = Math.toDegrees(phi);
    }

    private static double meridianArc(double a, double e2, double phi) {
        double e4 = e2 * e2;
        double e6 = e4 * e2;
        return a * ((1 - e2 / 4 - 3 * e4 / 64 - 5 * e6 / 256) * phi
                - (3 * e2 / 8 + 3 * e4 / 32 + 45 * e6 / 1024) * Math.sin(2 * phi)
                + (15 * e4 / 256 + 45 * e6 / 1024) * Math.sin(4 * phi)
                - (35 * e6 / 3072) * Math.sin(6 * phi));
    }
}
