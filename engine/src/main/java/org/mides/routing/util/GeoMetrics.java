package org.mides.routing.util;

import org.mides.routing.exception.InvalidSpeedException;
import org.mides.routing.model.GeoPoint;

/**
 * Great-circle geometry between coordinates. Distances are a metric (symmetric,
 * zero only for identical points, triangle inequality holds), so the solver can use
 * them as lower bounds when pruning insertions.
 */
public final class GeoMetrics {

    public static final double EARTH_RADIUS_KM = 6371.0;

    private GeoMetrics() {
    }

    /**
     * Haversine distance in kilometres.
     */
    public static double distanceKm(GeoPoint a, GeoPoint b) {
        double lat1 = Math.toRadians(a.getLatitude());
        double lat2 = Math.toRadians(b.getLatitude());
        double dLat = lat2 - lat1;
        double dLng = Math.toRadians(b.getLongitude() - a.getLongitude());

        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2) +
            Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLng / 2) * Math.sin(dLng / 2);

        return 2 * EARTH_RADIUS_KM * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
    }

    /**
     * Minutes needed to drive from {@code a} to {@code b} at a constant speed.
     *
     * @throws InvalidSpeedException if {@code speedKmh} is not positive
     */
    public static double travelMinutes(GeoPoint a, GeoPoint b, double speedKmh) {
        return travelMinutes(distanceKm(a, b), speedKmh);
    }

    public static double travelMinutes(double distanceKm, double speedKmh) {
        if (!(speedKmh > 0))
            throw new InvalidSpeedException(speedKmh);

        return distanceKm / speedKmh * 60.0;
    }
}
