package com.riansoft.route_planner.service.parking;

import com.riansoft.route_planner.cache.TtlCache;
import com.riansoft.route_planner.config.RoutePlannerProperties;
import com.riansoft.route_planner.model.GeoPoint;
import com.riansoft.route_planner.model.ParkingCandidate;
import com.riansoft.route_planner.model.ParkingSource;
import com.riansoft.route_planner.model.Stop;
import com.riansoft.route_planner.model.StreetSegment;
import com.riansoft.route_planner.testutil.FakeParkingPoiClient;
import com.riansoft.route_planner.testutil.FakeRoadNetworkClient;
import com.riansoft.route_planner.testutil.TestFixtures;
import com.riansoft.route_planner.util.GeoUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class ParkingResolverServiceTest {

    private static final GeoPoint DELIVERY = new GeoPoint(48.7758, 9.1829);

    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final RoutePlannerProperties properties = TestFixtures.properties();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private ParkingResolverService resolver(ParkingPoiClient poi, FakeRoadNetworkClient road) {
        TtlCache<String, List<Stop>> cache = new TtlCache<>(Duration.ofSeconds(300), TestFixtures.fixedClock());
        return new ParkingResolverService(poi, cache, TestFixtures.distanceService(road), executor, properties);
    }

    private static Stop parkingAt(String id, double bearing, double km) {
        return new Stop(id, TestFixtures.offset(DELIVERY, bearing, km), "Parking " + id, null);
    }

    @Test
    @DisplayName("a static candidate within the radius wins without asking the POI service")
    void staticWithinRadius() {
        FakeParkingPoiClient poi = new FakeParkingPoiClient(List.of());
        ParkingResolverService resolver = resolver(poi, FakeRoadNetworkClient.down());

        ParkingCandidate found = resolver.resolve(DELIVERY,
                List.of(parkingAt("far", 0, 1.5), parkingAt("near", 90, 0.4))).orElseThrow();

        assertEquals(ParkingSource.CACHED, found.source);
        assertEquals("Parking near", found.name);
        assertEquals(400, found.distanceToTargetMeters, 1.0);
        assertEquals(0, poi.nearbyCalls.get());
    }

    @Test
    @DisplayName("live POI results pick the nearest and are cached by rounded coordinate")
    void livePoiIsCached() {
        FakeParkingPoiClient poi = new FakeParkingPoiClient(List.of(parkingAt("p1", 0, 0.3), parkingAt("p2", 180, 0.1)));
        ParkingResolverService resolver = resolver(poi, FakeRoadNetworkClient.down());

        ParkingCandidate first = resolver.resolve(DELIVERY, List.of()).orElseThrow();
        ParkingCandidate second = resolver.resolve(new GeoPoint(48.77581, 9.18291), List.of()).orElseThrow();

        assertEquals(ParkingSource.LIVE_POI, first.source);
        assertEquals("Parking p2", first.name);
        assertEquals(first.point, second.point);
        assertEquals(1, poi.nearbyCalls.get());
    }

    @Test
    @DisplayName("too-far static, no POI service: synthetic road-snap is preferred over the far candidate")
    void fallsThroughToSynthetic() {
        FakeParkingPoiClient poi = FakeParkingPoiClient.unavailable();
        ParkingResolverService resolver = resolver(poi, FakeRoadNetworkClient.down());
        Stop farAway = parkingAt("far", 45, 3.0);

        ParkingCandidate found = resolver.resolve(DELIVERY, List.of(farAway)).orElseThrow();

        assertEquals(ParkingSource.SYNTHETIC_ROAD_SNAP, found.source);
        assertEquals(500, found.distanceToTargetMeters, 1.0);
        assertEquals(500, GeoUtils.haversineMeters(DELIVERY, found.point), 1.0);
    }

    @Test
    @DisplayName("when synthetic generation is off too, the far static candidate is the last resort")
    void lastResortStatic() {
        ParkingResolverService resolver = resolver(FakeParkingPoiClient.unavailable(), FakeRoadNetworkClient.down());
        Stop farAway = parkingAt("far", 45, 3.0);
        ParkingOptions options = resolver.defaultOptions();
        options.setSyntheticEnabled(false);

        ParkingCandidate found = resolver.resolve(DELIVERY, List.of(farAway), options).orElseThrow();

        assertEquals(ParkingSource.CACHED, found.source);
        assertEquals(farAway.point, found.point);
        assertEquals(3000, found.distanceToTargetMeters, 5.0);
    }

    @Test
    @DisplayName("nothing anywhere gives no parking")
    void nothingFound() {
        ParkingResolverService resolver = resolver(FakeParkingPoiClient.unavailable(), FakeRoadNetworkClient.down());
        ParkingOptions options = resolver.defaultOptions();
        options.setSyntheticEnabled(false);

        assertTrue(resolver.resolve(DELIVERY, List.of(), options).isEmpty());
    }

    @Test
    @DisplayName("failed POI lookups are not cached")
    void failuresNotCached() {
        FakeParkingPoiClient poi = FakeParkingPoiClient.unavailable();
        ParkingResolverService resolver = resolver(poi, FakeRoadNetworkClient.down());
        ParkingOptions options = resolver.defaultOptions();
        options.setSyntheticEnabled(false);

        resolver.resolve(DELIVERY, List.of(), options);
        poi.setParks(List.of(parkingAt("p", 0, 0.2)));
        ParkingCandidate found = resolver.resolve(DELIVERY, List.of(), options).orElseThrow();

        assertEquals(ParkingSource.LIVE_POI, found.source);
        assertEquals(2, poi.nearbyCalls.get());
    }

    @Test
    @DisplayName("synthetic candidates are snapped to the road and the one nearest the target radius is kept")
    void syntheticUsesSnappedPoints() {
        FakeRoadNetworkClient road = FakeRoadNetworkClient.up();
        road.setSnapOffset(new GeoPoint(0.001, 0.0));
        ParkingResolverService resolver = resolver(FakeParkingPoiClient.unavailable(), road);

        ParkingCandidate found = resolver.resolve(DELIVERY, List.of()).orElseThrow();

        assertEquals(ParkingSource.SYNTHETIC_ROAD_SNAP, found.source);
        // east/west points moved ~111 m north end up ~512 m out, the closest to 500 m
        assertEquals(512, found.distanceToTargetMeters, 5.0);
        assertEquals(8, road.nearestCalls.get());
    }

    @Test
    @DisplayName("resolveAll keys results by stop index")
    void resolveAllConcurrently() {
        ParkingResolverService resolver = resolver(FakeParkingPoiClient.unavailable(), FakeRoadNetworkClient.down());
        List<Stop> stops = List.of(
                TestFixtures.stop("a", 48.7600, 9.1600),
                TestFixtures.stop("b", 48.7900, 9.2000),
                TestFixtures.stop("c", 48.7400, 9.1000));
        List<Stop> staticParking = List.of(new Stop("p-b", new GeoPoint(48.7905, 9.2005), "Parking b", null));

        Map<Integer, ParkingCandidate> byStop = resolver.resolveAll(stops, staticParking, resolver.defaultOptions());

        assertEquals(3, byStop.size());
        assertEquals(ParkingSource.CACHED, byStop.get(1).source);
        assertEquals(ParkingSource.SYNTHETIC_ROAD_SNAP, byStop.get(0).source);
        assertEquals(ParkingSource.SYNTHETIC_ROAD_SNAP, byStop.get(2).source);
    }

    @Test
    @DisplayName("a stop whose lookup blows up is delivered without parking; the others keep theirs")
    void failedLookupLeavesStopWithoutParking() {
        ParkingPoiClient broken = new ParkingPoiClient() {
            @Override
            public Optional<List<Stop>> fetchParkingNearby(GeoPoint point, int radiusMeters, int limit) {
                throw new IllegalStateException("unexpected answer");
            }

            @Override
            public List<StreetSegment> fetchParkingSegments(double south, double west, double north, double east,
                                                            List<String> tags) {
                return List.of();
            }
        };
        ParkingResolverService resolver = resolver(broken, FakeRoadNetworkClient.down());
        List<Stop> stops = List.of(
                TestFixtures.stop("c", 48.7400, 9.1000),
                TestFixtures.stop("b", 48.7900, 9.2000));
        List<Stop> staticParking = List.of(new Stop("p-b", new GeoPoint(48.7905, 9.2005), "Parking b", null));

        Map<Integer, ParkingCandidate> byStop = resolver.resolveAll(stops, staticParking, resolver.defaultOptions());

        assertEquals(1, byStop.size());
        assertFalse(byStop.containsKey(0));
        assertEquals(ParkingSource.CACHED, byStop.get(1).source);
    }
}
