package org.mides.routing.controller;

import org.junit.jupiter.api.Test;
import org.mides.routing.model.OptimizationMetrics;
import org.mides.routing.model.OptimizationResult;
import org.mides.routing.model.OptimizeBy;
import org.mides.routing.model.Priority;
import org.mides.routing.model.RouteRequest;
import org.mides.routing.model.SkipReason;
import org.mides.routing.model.SkippedDelivery;
import org.mides.routing.model.Stop;
import org.mides.routing.service.IRouteSolverService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;

import java.time.Duration;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mides.routing.RequestFixtures.delivery;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
public class RoutingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private IRouteSolverService routeSolverService;

    private static String body(String pickupStart, String deliveries, String settings) {
        return "{"
            + "\"pickup\": {\"address\": \"Depot\", \"zipcode\": \"400001\", \"lat\": 19.0760, \"lng\": 72.8777,"
            + " \"start_time\": \"" + pickupStart + "\", \"end_time\": \"18:00\"},"
            + "\"settings\": " + settings + ","
            + "\"deliveries\": " + deliveries
            + "}";
    }

    private static String deliveryJson(double lat, int priority, String start, String end) {
        return "{\"address\": \"Bandra\", \"zipcode\": \"400050\", \"lat\": " + lat + ", \"lng\": 72.8400,"
            + " \"priority\": " + priority + ", \"time_window\": {\"start\": \"" + start + "\", \"end\": \"" + end + "\"}}";
    }

    private static final String DEFAULT_SETTINGS =
        "{\"return_to_origin\": true, \"time_per_stop_minutes\": 10, \"vehicle_speed_kmph\": 30, \"optimize_by\": \"priority\"}";

    @Test
    void contextLoads() {
    }

    @Test
    void optimizeRoute_validRequest_returnsSolverResult() throws Exception {
        var result = new OptimizationResult();
        result.setRoute(List.of(
            Stop.builder().stop("Depot").arrivalTime(Duration.ofHours(9)).departureTime(Duration.ofHours(9)).build(),
            Stop.builder().stop("Bandra").arrivalTime(Duration.ofMinutes(9 * 60 + 25))
                .departureTime(Duration.ofMinutes(9 * 60 + 35)).priority(Priority.HIGH).build()));
        result.setTotalDistanceKm(12.5);
        result.setTotalTimeMinutes(35.0);
        result.setFeasible(false);
        result.setSkippedDeliveries(List.of(SkippedDelivery.of(
            delivery("Colaba", 18.9, 72.8, Priority.HIGH, "09:00", "09:10"), SkipReason.TIME_WINDOW_VIOLATED)));
        result.setOptimizationMetrics(new OptimizationMetrics(0.012, OptimizeBy.PRIORITY, 2, 1));
        when(routeSolverService.solve(any(RouteRequest.class))).thenReturn(result);

        var mvcResult = mockMvc.perform(MockMvcRequestBuilders.post("/routing/v1/optimize-route")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("09:00", "[" + deliveryJson(19.0596, 1, "09:00", "12:00") + "]", DEFAULT_SETTINGS)))
            .andExpect(request().asyncStarted())
            .andReturn();

        mockMvc.perform(asyncDispatch(mvcResult))
            .andExpect(status().isOk())
            .andExpect(content().contentType(MediaType.APPLICATION_JSON))
            .andExpect(jsonPath("$.route[0].stop").value("Depot"))
            .andExpect(jsonPath("$.route[0].priority").doesNotExist())
            .andExpect(jsonPath("$.route[1].arrival_time").value("09:25"))
            .andExpect(jsonPath("$.route[1].departure_time").value("09:35"))
            .andExpect(jsonPath("$.route[1].priority").value(1))
            .andExpect(jsonPath("$.total_distance_km").value(12.5))
            .andExpect(jsonPath("$.is_feasible").value(false))
            .andExpect(jsonPath("$.skipped_deliveries[0].reason").value("time_window_violated"))
            .andExpect(jsonPath("$.optimization_metrics.optimization_method").value("priority"))
            .andExpect(jsonPath("$.optimization_metrics.total_stops").value(2))
            .andExpect(jsonPath("$.optimization_metrics.skipped_stops").value(1));
    }

    @Test
    void optimizeRoute_solverFailure_returnsServerError() throws Exception {
        when(routeSolverService.solve(any(RouteRequest.class))).thenThrow(new IllegalStateException("boom"));

        var mvcResult = mockMvc.perform(MockMvcRequestBuilders.post("/routing/v1/optimize-route")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("09:00", "[" + deliveryJson(19.0596, 2, "09:00", "12:00") + "]", DEFAULT_SETTINGS)))
            .andExpect(request().asyncStarted())
            .andReturn();

        mockMvc.perform(asyncDispatch(mvcResult))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.code").value(500))
            .andExpect(jsonPath("$.message").value("Route solver failed"));
    }

    @Test
    void optimizeRoute_latitudeOutOfRange_returnsBadRequest() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post("/routing/v1/optimize-route")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("09:00", "[" + deliveryJson(95.0, 1, "09:00", "12:00") + "]", DEFAULT_SETTINGS)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(400))
            .andExpect(jsonPath("$.message").value(containsString("deliveries[0].lat")));

        verify(routeSolverService, never()).solve(any(RouteRequest.class));
    }

    @Test
    void optimizeRoute_noDeliveries_returnsBadRequest() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post("/routing/v1/optimize-route")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("09:00", "[]", DEFAULT_SETTINGS)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value(containsString("deliveries")));
    }

    @Test
    void optimizeRoute_serviceTimeOutOfRange_returnsBadRequest() throws Exception {
        var settings = "{\"time_per_stop_minutes\": 0, \"optimize_by\": \"time\"}";

        mockMvc.perform(MockMvcRequestBuilders.post("/routing/v1/optimize-route")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("09:00", "[" + deliveryJson(19.0596, 1, "09:00", "12:00") + "]", settings)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value(containsString("settings.timePerStopMinutes")));
    }

    @Test
    void optimizeRoute_malformedTime_returnsBadRequest() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post("/routing/v1/optimize-route")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("9am", "[" + deliveryJson(19.0596, 1, "09:00", "12:00") + "]", DEFAULT_SETTINGS)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value(containsString("Malformed request")));
    }

    @Test
    void optimizeRoute_unknownPriority_returnsBadRequest() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post("/routing/v1/optimize-route")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("09:00", "[" + deliveryJson(19.0596, 5, "09:00", "12:00") + "]", DEFAULT_SETTINGS)))
            .andExpect(status().isBadRequest());
    }

    @Test
    void optimizeRoute_reversedWindow_returnsBadRequest() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post("/routing/v1/optimize-route")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("09:00", "[" + deliveryJson(19.0596, 1, "12:00", "10:00") + "]", DEFAULT_SETTINGS)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value(containsString("time window from delivery 0")));
    }

    @Test
    void distanceMatrix_singlePoint_returnsBadRequest() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post("/routing/v1/distance-matrix")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"points\": [{\"latitude\": 19.07, \"longitude\": 72.87}]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value(containsString("At least 2 points are required")));
    }

    @Test
    void distanceMatrix_twoPoints_returnsMatrices() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post("/routing/v1/distance-matrix")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"points\": [{\"latitude\": 0.0, \"longitude\": 0.0}, {\"latitude\": 0.1, \"longitude\": 0.0}],"
                    + " \"speed_kmph\": 60}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.distances[0][0]").value(0.0))
            .andExpect(jsonPath("$.distances[0][1]").value(11.119))
            .andExpect(jsonPath("$.times[1][0]").value(11.119))
            .andExpect(jsonPath("$.points[1].latitude").value(0.1));
    }

    @Test
    void distanceMatrix_calculatePath_returnsSameMatrices() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post("/routing/v1/calculate-distance-matrix")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"points\": [{\"latitude\": 0.0, \"longitude\": 0.0}, {\"latitude\": 0.1, \"longitude\": 0.0}],"
                    + " \"speed_kmph\": 60}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.distances[1][0]").value(11.119))
            .andExpect(jsonPath("$.times[0][1]").value(11.119));
    }

    @Test
    void info_listsEndpoints() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.get("/routing/v1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("Delivery Routing API"))
            .andExpect(jsonPath("$.version").value("1.0.0"))
            .andExpect(jsonPath("$.endpoints['/optimize-route']").value(containsString("POST")))
            .andExpect(jsonPath("$.endpoints['/health']").value(containsString("GET")))
            .andExpect(jsonPath("$.endpoints['/example-data']").exists());
    }

    @Test
    void health_reportsStatusAndKeySettings() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.get("/routing/v1/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("healthy"))
            .andExpect(jsonPath("$.timestamp").isNumber())
            .andExpect(jsonPath("$.config.max_travel_time_hours").value(4.0))
            .andExpect(jsonPath("$.config.default_speed_kmh").value(50.0))
            .andExpect(jsonPath("$.config.high_priority_weight").value(1000.0));

        verify(routeSolverService, never()).solve(any(RouteRequest.class));
    }

    @Test
    void exampleData_returnsSampleRequest() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.get("/routing/v1/example-data"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.pickup.address").value("Warehouse, Mumbai"))
            .andExpect(jsonPath("$.pickup.start_time").value("09:00"))
            .andExpect(jsonPath("$.pickup.end_time").value("18:00"))
            .andExpect(jsonPath("$.settings.optimize_by").value("priority"))
            .andExpect(jsonPath("$.settings.vehicle_speed_kmph").value(40.0))
            .andExpect(jsonPath("$.deliveries.length()").value(3))
            .andExpect(jsonPath("$.deliveries[0].priority").value(1))
            .andExpect(jsonPath("$.deliveries[2].time_window.end").value("11:30"))
            .andExpect(jsonPath("$.deliveries[0].index").doesNotExist());
    }

    @Test
    void config_returnsEffectiveConfiguration() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.get("/routing/v1/config"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.default_speed_kmh").value(50.0))
            .andExpect(jsonPath("$.max_route_distance_km").value(200.0))
            .andExpect(jsonPath("$.penalty_missing_high_priority").value(10000.0));
    }
}
