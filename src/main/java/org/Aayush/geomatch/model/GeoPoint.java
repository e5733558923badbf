package org.Aayush.geomatch.model;

/**
 * Validated latitude/longitude pair in decimal degrees.
 *
 * <p>Construction fails fast when either component is non-finite or outside
 * {@code [-90, 90]} / {@code [-180, 180]}.</p>
 */
public record GeoPoint(double latitude, double longitude) {
    public static final double MIN_LATITUDE = -90.0d;
    public static final double MAX_LATITUDE = 90.0d;
    public static final double MIN_LONGITUDE = -180.0d;
    public static final double MAX_LONGITUDE = 180.0d;

    public GeoPoint {
        if (!Double.isFinite(latitude) || !Double.isFinite(longitude)) {
            throw new GeoMatchException(
                    GeoMatchException.REASON_NON_FINITE_COORDINATES,
                    "coordinates must be finite, got (" + latitude + ", " + longitude + ")"
            );
        }
        if (latitude < MIN_LATITUDE || latitude > MAX_LATITUDE) {
            throw new GeoMatchException(
                    GeoMatchException.REASON_LATITUDE_RANGE,
                    "latitude must be in [-90, 90], got " + latitude
            );
        }
        if (longitude < MIN_LONGITUDE || longitude > MAX_LONGITUDE) {
            throw new GeoMatchException(
                    GeoMatchException.REASON_LONGITUDE_RANGE,
                    "longitude must be in [-180, 180], got " + longitude
            );
        }
    }

    /**
     * Creates a validated point.
     */
    public static GeoPoint of(double latitude, double longitude) {
        return new GeoPoint(latitude, longitude);
    }

    /**
     * Latitude in radians.
     */
    public double latitudeRadians() {
        return Math.toRadians(latitude);
    }

    /**
     * Longitude in radians.
     */
    public double longitudeRadians() {
        return Math.toRadians(longitude);
    }
}
