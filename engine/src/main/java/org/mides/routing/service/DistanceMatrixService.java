package org.mides.routing.service;

import org.mides.routing.config.EngineConfig;
import org.mides.routing.model.DistanceMatrixResponse;
import org.mides.routing.model.GeoPoint;
import org.mides.routing.util.ArrayUtils;
import org.mides.routing.util.GeoMetrics;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class DistanceMatrixService implements IDistanceMatrixService {

    private final EngineConfig engineConfig;

    @Autowired
    public DistanceMatrixService(EngineConfig engineConfig) {
        this.engineConfig = engineConfig;
    }

    /**
     * Pairwise great-circle distances (km) and travel times (minutes).
     * Speed falls back to the configured default when {@code speedKmh} is null.
     */
    @Override
    public DistanceMatrixResponse queryMatrix(List<GeoPoint> points, Double speedKmh) {
        double speed = speedKmh != null ? speedKmh : engineConfig.getDefaultSpeedKmh();
        int size = points.size();
        double[][] distances = new double[size][size];
        double[][] times = new double[size][size];

        for (int i = 0; i < size; i++) {
            for (int j = i + 1; j < size; j++) {
                double km = GeoMetrics.distanceKm(points.get(i), points.get(j));
                double minutes = GeoMetrics.travelMinutes(km, speed);
                distances[i][j] = km;
                distances[j][i] = km;
                times[i][j] = minutes;
                times[j][i] = minutes;
            }
        }

        return new DistanceMatrixResponse(
            ArrayUtils.convertToNestedList(distances),
            ArrayUtils.convertToNestedList(times),
            points
        );
    }
}
