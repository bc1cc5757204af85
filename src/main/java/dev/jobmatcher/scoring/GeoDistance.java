package dev.jobmatcher.scoring;

import dev.jobmatcher.model.GeoPoint;

/**
 * Great-circle distance on a spherical Earth using the haversine formula.
 */
public final class GeoDistance {

    // Mean Earth radius in kilometres
    public static final double EARTH_RADIUS_KM = 6371.0088;

    private GeoDistance() {
    }

    /**
     * Distance between two points in kilometres.
     * The haversine term is clamped to [0,1] so rounding near antipodal or
     * polar points cannot push asin out of its domain.
     */
    public static double kilometers(GeoPoint from, GeoPoint to) {
        double phi1 = Math.toRadians(from.latitude());
        double phi2 = Math.toRadians(to.latitude());
        double dPhi = Math.toRadians(to.latitude() - from.latitude());
        double dLambda = Math.toRadians(to.longitude() - from.longitude());

        double sinHalfPhi = Math.sin(dPhi / 2);
        double sinHalfLambda = Math.sin(dLambda / 2);
        double h = sinHalfPhi * sinHalfPhi
                + Math.cos(phi1) * Math.cos(phi2) * sinHalfLambda * sinHalfLambda;
        h = Math.min(1.0, Math.max(0.0, h));

        return 2 * EARTH_RADIUS_KM * Math.asin(Math.sqrt(h));
    }
}
