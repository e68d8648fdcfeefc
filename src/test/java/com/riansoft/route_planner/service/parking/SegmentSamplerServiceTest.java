package com.riansoft.route_planner.service.parking;

import com.riansoft.route_planner.model.GeoPoint;
import com.riansoft.route_planner.model.Stop;
import com.riansoft.route_planner.model.StreetSegment;
import com.riansoft.route_planner.testutil.FakeParkingPoiClient;
import com.riansoft.route_planner.testutil.TestFixtures;
import com.riansoft.route_planner.util.GeoUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClientException;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SegmentSamplerServiceTest {

    private static final GeoPoint START = new GeoPoint(48.7758, 9.1829);
    private static final GeoPoint END = GeoUtils.destination(START, 90, 105);

    private final FakeParkingPoiClient poi = new FakeParkingPoiClient(List.of());
    private final SegmentSamplerService sampler = new SegmentSamplerService(poi, TestFixtures.properties());

    @Test
    @DisplayName("a 105 m street sampled every 10 m gives 11 evenly spaced points, both ends included")
    void samplesEvenly() {
        StreetSegment street = new StreetSegment(42, "Königstraße", null, List.of(START, END));

        List<Stop> points = sampler.sample(List.of(street), 10, 5, null);

        assertEquals(11, points.size());
        assertEquals(START.lat, points.get(0).point.lat, 1e-9);
        assertEquals(END.lon, points.get(10).point.lon, 1e-9);
        for (int i = 1; i < points.size(); i++) {
            assertEquals(10.5, GeoUtils.haversineMeters(points.get(i - 1).point, points.get(i).point), 0.1);
        }
        assertEquals("Königstraße", points.get(3).name);
        assertEquals("OSM parking way 42", points.get(3).address);
    }

    @Test
    @DisplayName("points that round to the same coordinate are emitted once")
    void deduplicates() {
        StreetSegment one = new StreetSegment(1, "A", null, List.of(START, END));
        StreetSegment same = new StreetSegment(2, "B", null, List.of(START, END));

        List<Stop> points = sampler.sample(List.of(one, same), 10, 5, null);

        assertEquals(11, points.size());
        Set<String> keys = new HashSet<>();
        for (Stop point : points) {
            assertTrue(keys.add(GeoUtils.round(point.point.lat, 5) + ":" + GeoUtils.round(point.point.lon, 5)));
        }
    }

    @Test
    @DisplayName("degenerate ways are skipped and the point cap is honoured")
    void degenerateAndCapped() {
        StreetSegment single = new StreetSegment(1, "A", null, List.of(START));
        StreetSegment zeroLength = new StreetSegment(2, "B", null, List.of(START, START));
        StreetSegment real = new StreetSegment(3, "C", "Somewhere 1", List.of(START, END));

        assertTrue(sampler.sample(List.of(single, zeroLength), 10, 5, null).isEmpty());
        List<Stop> capped = sampler.sample(List.of(real), 10, 5, 4);
        assertEquals(4, capped.size());
        assertEquals("Somewhere 1", capped.get(0).address);
    }

    @Test
    @DisplayName("a way shorter than the spacing still yields its two end points")
    void shortWay() {
        GeoPoint close = GeoUtils.destination(START, 0, 4);

        List<Stop> points = sampler.sample(List.of(new StreetSegment(7, "D", null, List.of(START, close))), 10, 5, null);

        assertEquals(2, points.size());
    }

    @Test
    @DisplayName("import propagates transport failures")
    void importPropagatesFailures() {
        SegmentSamplerService offline = new SegmentSamplerService(FakeParkingPoiClient.unavailable(),
                TestFixtures.properties());

        assertThrows(RestClientException.class, () -> offline.importSegments(47.5, 7.5, 49.8, 10.5, null));

        poi.addSegment(new StreetSegment(9, "E", null, List.of(START, END)));
        assertEquals(11, sampler.importSegments(47.5, 7.5, 49.8, 10.5, null).size());
    }
}
