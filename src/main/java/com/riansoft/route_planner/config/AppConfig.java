package com.riansoft.route_planner.config;

import com.riansoft.route_planner.cache.AvailabilityProbe;
import com.riansoft.route_planner.cache.TtlCache;
import com.riansoft.route_planner.model.Stop;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @Qualifier("osrmRestTemplate")
    public RestTemplate osrmRestTemplate(RestTemplateBuilder builder, RoutePlannerProperties properties) {
        RoutePlannerProperties.Osrm osrm = properties.getOsrm();
        return builder
                .setConnectTimeout(Duration.ofMillis(osrm.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(osrm.getReadTimeoutMs()))
                .build();
    }

    @Bean
    @Qualifier("overpassRestTemplate")
    public RestTemplate overpassRestTemplate(RestTemplateBuilder builder, RoutePlannerProperties properties) {
        RoutePlannerProperties.Overpass overpass = properties.getOverpass();
        return builder
                .setConnectTimeout(Duration.ofMillis(overpass.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(overpass.getReadTimeoutMs()))
                .build();
    }

    @Bean
    public AvailabilityProbe roadNetworkProbe(RoutePlannerProperties properties, Clock clock) {
        return new AvailabilityProbe(Duration.ofSeconds(properties.getOsrm().getProbeTtlSeconds()), clock);
    }

    @Bean
    public TtlCache<String, List<Stop>> parkingPoiCache(RoutePlannerProperties properties, Clock clock) {
        return new TtlCache<>(Duration.ofSeconds(properties.getOverpass().getCacheTtlSeconds()), clock);
    }

    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("plannerExecutor")
    public ExecutorService plannerExecutor(RoutePlannerProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "planner-io-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, properties.getExecutor().getPoolSize()), factory);
    }
}
