package org.mides.routing.service;

import org.mides.routing.model.DistanceMatrixResponse;
import org.mides.routing.model.GeoPoint;

import java.util.List;

public interface IDistanceMatrixService {
    DistanceMatrixResponse queryMatrix(List<GeoPoint> points, Double speedKmh);
}
