package org.mides.routing.model;

import java.util.List;

/**
 * Ready-made requests for trying the API by hand.
 */
public final class ExampleRequests {

    private ExampleRequests() {
    }

    /**
     * A warehouse in Mumbai with one delivery per priority tier.
     */
    public static RouteRequest mumbai() {
        var pickup = new Pickup("Warehouse, Mumbai", "400001", 18.9356, 72.8376, TimeWindow.of("09:00", "18:00"));
        var settings = new Settings(true, 10, 40.0, OptimizeBy.PRIORITY);

        return new RouteRequest(pickup, settings, List.of(
            new Delivery("Client A", "400020", 18.9447, 72.8235, Priority.HIGH, TimeWindow.of("10:00", "13:00")),
            new Delivery("Client B", "400028", 18.9894, 72.8295, Priority.MEDIUM, TimeWindow.of("12:00", "17:00")),
            new Delivery("Client C", "400033", 19.0158, 72.8438, Priority.LOW, TimeWindow.of("09:00", "11:30"))
        ));
    }
}
