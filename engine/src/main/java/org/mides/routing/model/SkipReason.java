package org.mides.routing.model;

/**
 * Why a delivery is left out of the route. The first four are hard-constraint violations,
 * declared in the order they are checked.
 */
public enum SkipReason {
    TIME_WINDOW_VIOLATED,
    MAX_DISTANCE_EXCEEDED,
    MAX_TIME_EXCEEDED,
    RETURN_INFEASIBLE,
    NOT_BENEFICIAL
}
