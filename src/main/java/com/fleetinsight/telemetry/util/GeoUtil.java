package com.fleetinsight.telemetry.util;

/**
 * Utility class for great-circle calculations on GPS coordinates.
 *
 * Used by:
 *  - trip distance fallback when the odometer is unusable
 *  - health features (impossible jumps, GPS drift)
 *  - learned location matching and proximity lookups
 */
public final class GeoUtil {

    // Earth's radius in meters
    private static final double EARTH_RADIUS_METERS = 6371000;

    // Meters per degree of latitude (and of longitude at the equator)
    private static final double METERS_PER_DEGREE = 111320.0;

    private GeoUtil() {
    }

    /**
     * Calculate distance between two GPS coordinates using Haversine formula
     *
     * @param lat1 Latitude of first point
     * @param lon1 Longitude of first point
     * @param lat2 Latitude of second point
     * @param lon2 Longitude of second point
     * @return Distance in meters
     */
    public static double calculateDistance(double lat1, double lon1, double lat2, double lon2) {
        double lat1Rad = Math.toRadians(lat1);
        double lat2Rad = Math.toRadians(lat2);
        double deltaLat = lat2Rad - lat1Rad;
        double deltaLon = Math.toRadians(lon2) - Math.toRadians(lon1);

        double a = Math.sin(deltaLat / 2) * Math.sin(deltaLat / 2) +
                   Math.cos(lat1Rad) * Math.cos(lat2Rad) *
                   Math.sin(deltaLon / 2) * Math.sin(deltaLon / 2);

        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

        return EARTH_RADIUS_METERS * c;
    }

    /** Same as {@link #calculateDistance} but in kilometers */
    public static double distanceKm(double lat1, double lon1, double lat2, double lon2) {
        return calculateDistance(lat1, lon1, lat2, lon2) / 1000.0;
    }

    /**
     * Check if a point is within a radius of a center point
     *
     * @param lat          Latitude of point to check
     * @param lon          Longitude of point to check
     * @param centerLat    Latitude of center
     * @param centerLon    Longitude of center
     * @param radiusMeters Radius in meters
     * @return true if point is within radius, false otherwise
     */
    public static boolean isWithinRadius(double lat, double lon, double centerLat, double centerLon,
                                         double radiusMeters) {
        return calculateDistance(lat, lon, centerLat, centerLon) <= radiusMeters;
    }

    /**
     * Equal-weight midpoint of two coordinates.
     * Plain coordinate averaging; clusters are tens of meters wide so the
     * spherical correction is far below GPS noise.
     *
     * @return {latitude, longitude}
     */
    public static double[] midpoint(double lat1, double lon1, double lat2, double lon2) {
        return new double[]{(lat1 + lat2) / 2.0, (lon1 + lon2) / 2.0};
    }

    /**
     * Degree offsets that enclose a circle of the given radius around a latitude,
     * for cheap bounding-box prefilters before the exact Haversine check.
     *
     * @return {latitudeDelta, longitudeDelta}
     */
    public static double[] boundingDeltas(double latitude, double radiusMeters) {
        double latDelta = radiusMeters / METERS_PER_DEGREE;
        double cosLat = Math.max(Math.cos(Math.toRadians(latitude)), 0.01);
        double lonDelta = radiusMeters / (METERS_PER_DEGREE * cosLat);
        return new double[]{latDelta, lonDelta};
    }
}
