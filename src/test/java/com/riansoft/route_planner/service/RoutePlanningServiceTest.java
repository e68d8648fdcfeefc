package com.riansoft.route_planner.service;

import com.riansoft.route_planner.cache.TtlCache;
import com.riansoft.route_planner.config.RoutePlannerProperties;
import com.riansoft.route_planner.dto.ImprovementDto;
import com.riansoft.route_planner.dto.OptimizationSuggestionDto;
import com.riansoft.route_planner.dto.PlanningRequestDto;
import com.riansoft.route_planner.dto.PlanningResultDto;
import com.riansoft.route_planner.dto.RouteAssignmentDto;
import com.riansoft.route_planner.dto.RoutePlanDto;
import com.riansoft.route_planner.dto.WaypointDto;
import com.riansoft.route_planner.exception.PlanningException;
import com.riansoft.route_planner.model.Driver;
import com.riansoft.route_planner.model.GeoPoint;
import com.riansoft.route_planner.model.Stop;
import com.riansoft.route_planner.model.WaypointKind;
import com.riansoft.route_planner.service.analysis.RouteAnalysisService;
import com.riansoft.route_planner.service.assembly.RouteAssemblyService;
import com.riansoft.route_planner.service.assignment.DriverAssignmentService;
import com.riansoft.route_planner.service.clustering.ClusteringService;
import com.riansoft.route_planner.service.distance.DistanceService;
import com.riansoft.route_planner.service.parking.ParkingResolverService;
import com.riansoft.route_planner.service.sequencing.OrToolsSequencingStrategy;
import com.riansoft.route_planner.service.sequencing.RouteSequencingService;
import com.riansoft.route_planner.testutil.FakeParkingPoiClient;
import com.riansoft.route_planner.testutil.FakeRoadNetworkClient;
import com.riansoft.route_planner.testutil.TestFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class RoutePlanningServiceTest {

    private final GeoPoint townB = TestFixtures.offset(TestFixtures.DEPOT, 90, 50);

    private ExecutorService executor;
    private RoutePlanningService planner;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        RoutePlannerProperties properties = TestFixtures.properties();
        DistanceService distanceService = TestFixtures.distanceService(FakeRoadNetworkClient.down());
        ParkingResolverService parking = new ParkingResolverService(FakeParkingPoiClient.unavailable(),
                new TtlCache<>(Duration.ofSeconds(300), TestFixtures.fixedClock()), distanceService, executor,
                properties);
        planner = new RoutePlanningService(
                new ClusteringService(distanceService, properties),
                new DriverAssignmentService(),
                parking,
                new RouteSequencingService(distanceService, new OrToolsSequencingStrategy(properties), properties),
                new RouteAssemblyService(distanceService, executor),
                new RouteAnalysisService(),
                properties);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private List<Stop> twoTowns() {
        List<Stop> orders = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            GeoPoint a = TestFixtures.offset(TestFixtures.DEPOT, i * 60, 1 + i * 0.2);
            GeoPoint b = TestFixtures.offset(townB, i * 60, 1 + i * 0.2);
            orders.add(new Stop("a" + i, a, "A" + i, null));
            orders.add(new Stop("b" + i, b, "B" + i, null));
        }
        return orders;
    }

    private PlanningRequestDto request(List<Stop> orders, Driver... drivers) {
        PlanningRequestDto request = new PlanningRequestDto();
        request.setDepot(TestFixtures.depot());
        request.setOrders(orders);
        request.setDrivers(List.of(drivers));
        return request;
    }

    @Test
    @DisplayName("two towns, two drivers: one depot-to-depot route per town")
    void plansTwoTowns() {
        PlanningRequestDto request = request(twoTowns(), new Driver(1, "Anna Schmidt"), new Driver(2, "Ben"));
        request.setMaxClusterSize(10);
        request.setStartTime(LocalDateTime.of(2024, 5, 1, 8, 0));

        PlanningResultDto result = planner.plan(request);

        assertEquals(2, result.getAssignments().size());
        assertEquals(2, result.getRoutePlans().size());
        Set<Long> drivers = new HashSet<>();
        for (RouteAssignmentDto assignment : result.getAssignments()) {
            assertEquals(6, assignment.getOrderCount());
            Set<Character> towns = new HashSet<>();
            assignment.getOrderIds().forEach(id -> towns.add(id.charAt(0)));
            assertEquals(1, towns.size());
            drivers.add(assignment.getDriverId());
        }
        assertEquals(Set.of(1L, 2L), drivers);

        for (RoutePlanDto plan : result.getRoutePlans()) {
            List<WaypointDto> waypoints = plan.getWaypoints();
            assertEquals(8, waypoints.size());
            assertEquals(WaypointKind.DEPOT, waypoints.get(0).getKind());
            assertEquals(WaypointKind.DEPOT, waypoints.get(7).getKind());
            assertEquals("great-circle-estimate", plan.getDistanceProvenance());
            assertEquals("two-opt", plan.getSequencingTier());
            assertNotNull(plan.getRouteName());
            assertNotNull(waypoints.get(7).getEstimatedArrival());
        }
        assertEquals(12, result.getStatistics().getTotalOrders());
        assertEquals(0, result.getStatistics().getUnscheduledOrders());
        assertEquals(2, result.getStatistics().getDriversUsed());
    }

    @Test
    @DisplayName("orders without coordinates are left out of the plan")
    void skipsUnlocatedOrders() {
        List<Stop> orders = new ArrayList<>(twoTowns().subList(0, 4));
        orders.add(new Stop("nowhere", null));

        PlanningResultDto result = planner.plan(request(orders, new Driver(1, "Anna")));

        int delivered = 0;
        for (RoutePlanDto plan : result.getRoutePlans()) {
            for (WaypointDto waypoint : plan.getWaypoints()) {
                assertNotEquals("nowhere", waypoint.getStopId());
                if (waypoint.getKind() == WaypointKind.DELIVERY) {
                    delivered++;
                }
            }
        }
        assertEquals(4, delivered);
    }

    @Test
    @DisplayName("parking-aware plans drive to a parking spot before each delivery")
    void parkingAware() {
        List<Stop> orders = List.of(
                new Stop("p0", TestFixtures.offset(TestFixtures.DEPOT, 0, 2), "P0", null),
                new Stop("p1", TestFixtures.offset(TestFixtures.DEPOT, 90, 2), "P1", null),
                new Stop("p2", TestFixtures.offset(TestFixtures.DEPOT, 180, 2), "P2", null));
        List<Stop> garages = new ArrayList<>();
        for (Stop order : orders) {
            garages.add(new Stop("garage-" + order.id, TestFixtures.offset(order.point, 45, 0.2), "Garage", null));
        }
        PlanningRequestDto request = request(orders, new Driver(1, "Anna"));
        request.setStaticParking(garages);
        request.setParkingAware(true);

        RoutePlanDto plan = planner.plan(request).getRoutePlans().get(0);

        List<WaypointDto> waypoints = plan.getWaypoints();
        assertEquals(8, waypoints.size());
        for (int i = 1; i < waypoints.size() - 1; i += 2) {
            assertEquals(WaypointKind.PARKING, waypoints.get(i).getKind());
            assertEquals("cached", waypoints.get(i).getParkingSource());
            assertEquals(WaypointKind.DELIVERY, waypoints.get(i + 1).getKind());
            assertEquals(waypoints.get(i).getStopId(), waypoints.get(i + 1).getStopId());
        }
    }

    @Test
    @DisplayName("infeasible requests are rejected with a reason")
    void infeasibleInput() {
        PlanningRequestDto noDepot = request(twoTowns(), new Driver(1, "Anna"));
        noDepot.setDepot(new Stop("depot", null));
        assertEquals(PlanningException.Reason.DEPOT_MISSING,
                assertThrows(PlanningException.class, () -> planner.plan(noDepot)).getReason());

        PlanningRequestDto noStops = request(List.of(new Stop("x", null)), new Driver(1, "Anna"));
        assertEquals(PlanningException.Reason.NO_STOPS,
                assertThrows(PlanningException.class, () -> planner.plan(noStops)).getReason());

        PlanningRequestDto noDrivers = request(twoTowns());
        assertEquals(PlanningException.Reason.NO_DRIVERS,
                assertThrows(PlanningException.class, () -> planner.plan(noDrivers)).getReason());
    }

    @Test
    @DisplayName("a zig-zag route gets a shorter order suggested")
    void suggestsShorterOrder() {
        List<Stop> route = List.of(
                new Stop("3", TestFixtures.offset(TestFixtures.DEPOT, 0, 3), "3", null),
                new Stop("1", TestFixtures.offset(TestFixtures.DEPOT, 0, 1), "1", null),
                new Stop("2", TestFixtures.offset(TestFixtures.DEPOT, 0, 2), "2", null));

        OptimizationSuggestionDto suggestion = planner.suggestOptimization(TestFixtures.depot(), route, null);

        assertEquals(List.of("1", "2", "3"), suggestion.getOptimizedStopIds());
        assertEquals(2.0, suggestion.getImprovement().getDistanceSavedKm(), 0.01);
        assertEquals("Optimization can save 2.00 km (25.0%)", suggestion.getSuggestion());
        assertEquals(5, suggestion.getOptimizedPlan().getWaypoints().size());
    }

    @Test
    @DisplayName("an already good route is left as it is")
    void keepsGoodRoute() {
        List<Stop> route = List.of(
                new Stop("1", TestFixtures.offset(TestFixtures.DEPOT, 0, 1), "1", null),
                new Stop("2", TestFixtures.offset(TestFixtures.DEPOT, 0, 2), "2", null));

        OptimizationSuggestionDto suggestion = planner.suggestOptimization(TestFixtures.depot(), route, null);

        assertEquals(List.of(0, 1), suggestion.getOptimizedOrder());
        assertEquals("Current route is already well optimized", suggestion.getSuggestion());
        assertThrows(PlanningException.class,
                () -> planner.suggestOptimization(TestFixtures.depot(), List.of(), null));
    }

    @Test
    @DisplayName("suggestion wording follows the saving")
    void suggestionWording() {
        assertEquals("Route optimization complete",
                RoutePlanningService.suggestionText(new ImprovementDto(100, 97)));
        assertEquals("Current route is already well optimized",
                RoutePlanningService.suggestionText(new ImprovementDto(100, 99.5)));
        assertEquals("Optimization can save 10.00 km (10.0%)",
                RoutePlanningService.suggestionText(new ImprovementDto(100, 90)));
    }
}
