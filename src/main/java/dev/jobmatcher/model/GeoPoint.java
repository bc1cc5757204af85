package dev.jobmatcher.model;

/**
 * A location in decimal degrees.
 */
public record GeoPoint(double latitude, double longitude) {

    public GeoPoint {
        if (!isValid(latitude, longitude)) {
            throw new IllegalArgumentException(
                    "Invalid coordinates: (" + latitude + ", " + longitude + ")");
        }
    }

    /**
     * Check that both coordinates are finite and inside the WGS84 ranges.
     */
    public static boolean isValid(double latitude, double longitude) {
        return Double.isFinite(latitude) && Double.isFinite(longitude)
                && latitude >= -90.0 && latitude <= 90.0
                && longitude >= -180.0 && longitude <= 180.0;
    }
}
