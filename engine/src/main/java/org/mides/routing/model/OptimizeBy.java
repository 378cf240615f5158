package org.mides.routing.model;

/**
 * Objective a route is built for. Each variant carries the per-step score used when
 * choosing the next delivery (higher is better) and the travel cost minimized afterwards.
 */
public enum OptimizeBy {

    DISTANCE {
        @Override
        public double score(double legDistanceKm, double legMinutes, double priorityWeight) {
            return -legDistanceKm;
        }
    },

    TIME {
        @Override
        public double score(double legDistanceKm, double legMinutes, double priorityWeight) {
            return -legMinutes;
        }

        @Override
        public double travelCost(double distanceKm, double elapsedMinutes) {
            return elapsedMinutes;
        }
    },

    PRIORITY {
        @Override
        public double score(double legDistanceKm, double legMinutes, double priorityWeight) {
            return priorityWeight / (1.0 + legDistanceKm);
        }

        @Override
        public boolean allowsReordering() {
            return false;
        }
    };

    public abstract double score(double legDistanceKm, double legMinutes, double priorityWeight);

    public double travelCost(double distanceKm, double elapsedMinutes) {
        return distanceKm;
    }

    /* Priority routes keep their construction order unless reordering reaches more HIGH deliveries. */
    public boolean allowsReordering() {
        return true;
    }
}
