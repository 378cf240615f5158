package org.mides.routing.solver;

import org.junit.jupiter.api.Test;
import org.mides.routing.config.EngineConfig;
import org.mides.routing.converter.DurationSerializer;
import org.mides.routing.model.OptimizeBy;
import org.mides.routing.model.Priority;
import org.mides.routing.model.RouteRequest;
import org.mides.routing.model.SkipReason;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mides.routing.RequestFixtures.delivery;
import static org.mides.routing.RequestFixtures.initialized;

class ResultAssemblerTest {

    private final EngineConfig config = EngineConfig.defaults();
    private final RouteSolver solver = new RouteSolver(config);
    private final ResultAssembler assembler = new ResultAssembler();

    private static String hhmm(Duration duration) {
        return DurationSerializer.format(duration);
    }

    @Test
    void assemble_withReturn_addsDepotAtBothEnds() {
        RouteRequest request = initialized(config, true, OptimizeBy.PRIORITY,
            delivery("A", 0.1, 0.0, Priority.MEDIUM, "09:00", "12:00"));

        var result = assembler.assemble(request, solver.solve(request), 0.25);
        var route = result.getRoute();

        assertEquals(3, route.size());

        var origin = route.get(0);
        assertTrue(origin.isDepot());
        assertEquals("Depot", origin.getStop());
        assertEquals("09:00", hhmm(origin.getArrivalTime()));
        assertEquals("09:00", hhmm(origin.getDepartureTime()));
        assertNull(origin.getPriority());

        var stop = route.get(1);
        assertFalse(stop.isDepot());
        assertEquals("A", stop.getStop());
        assertEquals(Priority.MEDIUM, stop.getPriority());
        assertEquals("09:11", hhmm(stop.getArrivalTime()));
        assertEquals("09:21", hhmm(stop.getDepartureTime()));

        var back = route.get(2);
        assertTrue(back.isDepot());
        assertEquals("Depot (Return)", back.getStop());
        assertEquals("Depot", back.getAddress());
        assertEquals("09:32", hhmm(back.getArrivalTime()));
        assertEquals(back.getArrivalTime(), back.getDepartureTime());

        assertEquals(22.239, result.getTotalDistanceKm(), 1e-9);
        assertEquals(32.239, result.getTotalTimeMinutes(), 1e-9);
        assertTrue(result.isFeasible());
        assertTrue(result.getSkippedDeliveries().isEmpty());

        var metrics = result.getOptimizationMetrics();
        assertEquals(0.25, metrics.getProcessingTimeSeconds());
        assertEquals(OptimizeBy.PRIORITY, metrics.getOptimizationMethod());
        assertEquals(3, metrics.getTotalStops());
        assertEquals(0, metrics.getSkippedStops());
    }

    @Test
    void assemble_withoutReturn_endsAtLastDeparture() {
        RouteRequest request = initialized(config, false, OptimizeBy.DISTANCE,
            delivery("A", 0.1, 0.0, Priority.LOW, "10:00", "12:00"));

        var result = assembler.assemble(request, solver.solve(request), 0.0);

        assertEquals(2, result.getRoute().size());
        var stop = result.getRoute().get(1);
        assertEquals("10:00", hhmm(stop.getArrivalTime()));
        assertEquals("10:10", hhmm(stop.getDepartureTime()));
        assertEquals(11.119, result.getTotalDistanceKm(), 1e-9);
        assertEquals(70.0, result.getTotalTimeMinutes(), 1e-9);
    }

    @Test
    void assemble_allSkipped_reportsSkipsAndInfeasibility() {
        RouteRequest request = initialized(config, true, OptimizeBy.PRIORITY,
            delivery("B", 1.0, 0.0, Priority.HIGH, "09:00", "10:00"));

        var result = assembler.assemble(request, solver.solve(request), 0.0);

        assertEquals(2, result.getRoute().size());
        assertEquals("Depot (Return)", result.getRoute().get(1).getStop());
        assertEquals(0.0, result.getTotalDistanceKm());
        assertEquals(0.0, result.getTotalTimeMinutes());
        assertFalse(result.isFeasible());
        assertEquals(1, result.getSkippedDeliveries().size());
        assertEquals(SkipReason.TIME_WINDOW_VIOLATED, result.getSkippedDeliveries().get(0).getReason());
        assertEquals(1, result.getOptimizationMetrics().getSkippedStops());
    }

    @Test
    void assemble_consecutiveStopsNeverOverlap() {
        RouteRequest request = initialized(config, true, OptimizeBy.DISTANCE,
            delivery("N", 0.1, 0.0, Priority.HIGH),
            delivery("E", 0.0, 0.1, Priority.MEDIUM, "10:30", "12:00"),
            delivery("S", -0.1, 0.0, Priority.LOW));

        var route = assembler.assemble(request, solver.solve(request), 0.0).getRoute();

        for (int i = 0; i + 1 < route.size(); i++)
            assertTrue(route.get(i).getDepartureTime().compareTo(route.get(i + 1).getArrivalTime()) <= 0);
        for (int i = 1; i + 1 < route.size(); i++)
            assertEquals(route.get(i).getArrivalTime().plusMinutes(10), route.get(i).getDepartureTime());
    }
}
