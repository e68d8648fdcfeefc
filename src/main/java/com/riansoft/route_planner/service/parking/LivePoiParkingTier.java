package com.riansoft.route_planner.service.parking;

import com.riansoft.route_planner.cache.TtlCache;
import com.riansoft.route_planner.model.GeoPoint;
import com.riansoft.route_planner.model.ParkingCandidate;
import com.riansoft.route_planner.model.ParkingSource;
import com.riansoft.route_planner.model.Stop;
import com.riansoft.route_planner.util.GeoUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Asks the POI service for parking amenities around the delivery point.
 * Answers are cached by rounded coordinate and radius; failures are not cached.
 */
public class LivePoiParkingTier implements ParkingTier {

    private static final Logger log = LoggerFactory.getLogger(LivePoiParkingTier.class);

    private final ParkingPoiClient client;
    private final TtlCache<String, List<Stop>> cache;

    public LivePoiParkingTier(ParkingPoiClient client, TtlCache<String, List<Stop>> cache) {
        this.client = client;
        this.cache = cache;
    }

    @Override
    public ParkingSource source() {
        return ParkingSource.LIVE_POI;
    }

    @Override
    public Optional<ParkingCandidate> attempt(GeoPoint deliveryPoint, List<Stop> staticCandidates, ParkingOptions options) {
        if (!options.isLiveEnabled()) {
            return Optional.empty();
        }
        String key = cacheKey(deliveryPoint, options.getLiveRadiusMeters());
        Optional<List<Stop>> parks = cache.get(key);
        if (parks.isPresent()) {
            log.debug("[PARKING] POI cache hit {}", key);
        } else {
            parks = client.fetchParkingNearby(deliveryPoint, options.getLiveRadiusMeters(), options.getLiveLimit());
            parks.ifPresent(found -> cache.put(key, List.copyOf(found)));
        }
        return parks.flatMap(found -> nearest(deliveryPoint, found));
    }

    static String cacheKey(GeoPoint point, int radiusMeters) {
        return String.format(Locale.ROOT, "%.4f:%.4f:%d",
                GeoUtils.round(point.lat, 4), GeoUtils.round(point.lon, 4), radiusMeters);
    }

    private Optional<ParkingCandidate> nearest(GeoPoint target, List<Stop> parks) {
        Optional<ParkingCandidate> cached = StaticParkingTier.nearest(target, parks, Double.POSITIVE_INFINITY);
        return cached.map(c -> new ParkingCandidate(c.point, ParkingSource.LIVE_POI, c.distanceToTargetMeters, c.name));
    }
}
