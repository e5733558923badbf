package org.Aayush.geomatch.geometry;

import lombok.experimental.UtilityClass;

/**
 * Numeric helpers for great-circle and radian-plane distance computations.
 */
@UtilityClass
public final class GeometryDistance {
    /**
     * Mean Earth radius in kilometers.
     */
    public static final double EARTH_MEAN_RADIUS_KM = 6_371.0d;

    /**
     * Computes great-circle distance in kilometers using the haversine formulation.
     *
     * <p>Inputs are decimal degrees. The haversine term is clamped into {@code [0, 1]}
     * so near-identical and near-antipodal pairs never leave the square-root domain.</p>
     */
    public static double haversineKm(double lat1Deg, double lon1Deg, double lat2Deg, double lon2Deg) {
        double lat1Rad = Math.toRadians(lat1Deg);
        double lat2Rad = Math.toRadians(lat2Deg);
        double deltaLatRad = Math.toRadians(lat2Deg - lat1Deg);
        double deltaLonRad = Math.toRadians(lon2Deg - lon1Deg);

        double sinHalfLat = Math.sin(deltaLatRad * 0.5d);
        double sinHalfLon = Math.sin(deltaLonRad * 0.5d);

        double a = sinHalfLat * sinHalfLat
                + Math.cos(lat1Rad) * Math.cos(lat2Rad) * sinHalfLon * sinHalfLon;
        double clampedA = clamp(a, 0.0d, 1.0d);
        double c = 2.0d * Math.atan2(Math.sqrt(clampedA), Math.sqrt(1.0d - clampedA));
        return EARTH_MEAN_RADIUS_KM * c;
    }

    /**
     * Squared Euclidean distance in a planar coordinate space.
     */
    public static double squaredEuclidean(double x1, double y1, double x2, double y2) {
        double dx = x2 - x1;
        double dy = y2 - y1;
        return dx * dx + dy * dy;
    }

    /**
     * Clamps a value into inclusive {@code [min, max]} bounds.
     */
    static double clamp(double value, double min, double max) {
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }
}
