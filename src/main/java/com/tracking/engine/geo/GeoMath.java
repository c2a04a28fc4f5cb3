package com.tracking.engine.geo;

/**
 * Great-circle helpers on the WGS84 sphere approximation.
 */
public final class GeoMath {

    /** Mean earth radius in meters. */
    public static final double EARTH_RADIUS_METERS = 6_371_008.8;

    private GeoMath() {
    }

    /**
     * Haversine distance between two coordinates, in meters.
     */
    public static double distanceMeters(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double dPhi = Math.toRadians(lat2 - lat1);
        double dLambda = Math.toRadians(lon2 - lon1);

        double a = Math.sin(dPhi / 2) * Math.sin(dPhi / 2)
                + Math.cos(phi1) * Math.cos(phi2) * Math.sin(dLambda / 2) * Math.sin(dLambda / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_METERS * c;
    }

    /**
     * Latitude offset, in degrees, of a point {@code meters} north of the origin.
     * Used to place points at known distances.
     */
    public static double metersToLatitudeDegrees(double meters) {
        return Math.toDegrees(meters / EARTH_RADIUS_METERS);
    }
}
