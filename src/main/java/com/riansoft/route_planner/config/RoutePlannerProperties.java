package com.riansoft.route_planner.config;

import com.riansoft.route_planner.model.ClusteringMethod;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables of the planner, bound from {@code route-planner.*}.
 */
@ConfigurationProperties(prefix = "route-planner")
public class RoutePlannerProperties {

    private final Osrm osrm = new Osrm();
    private final Estimate estimate = new Estimate();
    private final Overpass overpass = new Overpass();
    private final Parking parking = new Parking();
    private final Clustering clustering = new Clustering();
    private final Sequencing sequencing = new Sequencing();
    private final Executor executor = new Executor();

    public Osrm getOsrm() { return osrm; }
    public Estimate getEstimate() { return estimate; }
    public Overpass getOverpass() { return overpass; }
    public Parking getParking() { return parking; }
    public Clustering getClustering() { return clustering; }
    public Sequencing getSequencing() { return sequencing; }
    public Executor getExecutor() { return executor; }

    public static class Osrm {
        private boolean enabled = true;
        private String baseUrl = "http://localhost:5000";
        private String profile = "driving";
        private long probeTtlSeconds = 30;
        private long connectTimeoutMs = 2000;
        private long readTimeoutMs = 10000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getProfile() { return profile; }
        public void setProfile(String profile) { this.profile = profile; }
        public long getProbeTtlSeconds() { return probeTtlSeconds; }
        public void setProbeTtlSeconds(long probeTtlSeconds) { this.probeTtlSeconds = probeTtlSeconds; }
        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
        public long getReadTimeoutMs() { return readTimeoutMs; }
        public void setReadTimeoutMs(long readTimeoutMs) { this.readTimeoutMs = readTimeoutMs; }
    }

    public static class Estimate {
        private double averageSpeedKmh = 50.0;
        // traffic lights, stop-and-go, turning
        private double urbanBufferMultiplier = 1.3;

        public double getAverageSpeedKmh() { return averageSpeedKmh; }
        public void setAverageSpeedKmh(double averageSpeedKmh) { this.averageSpeedKmh = averageSpeedKmh; }
        public double getUrbanBufferMultiplier() { return urbanBufferMultiplier; }
        public void setUrbanBufferMultiplier(double urbanBufferMultiplier) { this.urbanBufferMultiplier = urbanBufferMultiplier; }
    }

    public static class Overpass {
        private boolean enabled = true;
        private String url = "https://overpass-api.de/api/interpreter";
        private long connectTimeoutMs = 5000;
        private long readTimeoutMs = 30000;
        private long cacheTtlSeconds = 300;
        private int radiusMeters = 600;
        private int limit = 10;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
        public long getReadTimeoutMs() { return readTimeoutMs; }
        public void setReadTimeoutMs(long readTimeoutMs) { this.readTimeoutMs = readTimeoutMs; }
        public long getCacheTtlSeconds() { return cacheTtlSeconds; }
        public void setCacheTtlSeconds(long cacheTtlSeconds) { this.cacheTtlSeconds = cacheTtlSeconds; }
        public int getRadiusMeters() { return radiusMeters; }
        public void setRadiusMeters(int radiusMeters) { this.radiusMeters = radiusMeters; }
        public int getLimit() { return limit; }
        public void setLimit(int limit) { this.limit = limit; }
    }

    public static class Parking {
        private double maxStaticRadiusMeters = 2000;
        private boolean liveEnabled = true;
        private boolean syntheticEnabled = true;
        private double syntheticRadiusMeters = 500;
        private int syntheticCandidateCount = 8;
        private double segmentSpacingMeters = 10;
        private int segmentDedupeDecimals = 5;

        public double getMaxStaticRadiusMeters() { return maxStaticRadiusMeters; }
        public void setMaxStaticRadiusMeters(double maxStaticRadiusMeters) { this.maxStaticRadiusMeters = maxStaticRadiusMeters; }
        public boolean isLiveEnabled() { return liveEnabled; }
        public void setLiveEnabled(boolean liveEnabled) { this.liveEnabled = liveEnabled; }
        public boolean isSyntheticEnabled() { return syntheticEnabled; }
        public void setSyntheticEnabled(boolean syntheticEnabled) { this.syntheticEnabled = syntheticEnabled; }
        public double getSyntheticRadiusMeters() { return syntheticRadiusMeters; }
        public void setSyntheticRadiusMeters(double syntheticRadiusMeters) { this.syntheticRadiusMeters = syntheticRadiusMeters; }
        public int getSyntheticCandidateCount() { return syntheticCandidateCount; }
        public void setSyntheticCandidateCount(int syntheticCandidateCount) { this.syntheticCandidateCount = syntheticCandidateCount; }
        public double getSegmentSpacingMeters() { return segmentSpacingMeters; }
        public void setSegmentSpacingMeters(double segmentSpacingMeters) { this.segmentSpacingMeters = segmentSpacingMeters; }
        public int getSegmentDedupeDecimals() { return segmentDedupeDecimals; }
        public void setSegmentDedupeDecimals(int segmentDedupeDecimals) { this.segmentDedupeDecimals = segmentDedupeDecimals; }
    }

    public static class Clustering {
        private ClusteringMethod method = ClusteringMethod.DENSITY;
        private double radiusKm = 10.0;
        private int maxClusterSize = 40;
        private int minClusterSize = 3;
        private double centroidThresholdMeters = 10.0;
        private int maxIterations = 100;

        public ClusteringMethod getMethod() { return method; }
        public void setMethod(ClusteringMethod method) { this.method = method; }
        public double getRadiusKm() { return radiusKm; }
        public void setRadiusKm(double radiusKm) { this.radiusKm = radiusKm; }
        public int getMaxClusterSize() { return maxClusterSize; }
        public void setMaxClusterSize(int maxClusterSize) { this.maxClusterSize = maxClusterSize; }
        public int getMinClusterSize() { return minClusterSize; }
        public void setMinClusterSize(int minClusterSize) { this.minClusterSize = minClusterSize; }
        public double getCentroidThresholdMeters() { return centroidThresholdMeters; }
        public void setCentroidThresholdMeters(double centroidThresholdMeters) { this.centroidThresholdMeters = centroidThresholdMeters; }
        public int getMaxIterations() { return maxIterations; }
        public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }
    }

    public static class Sequencing {
        private boolean exactSolverEnabled = true;
        private long timeLimitSeconds = 5;
        // stops guided local search after this many improving solutions, independent of machine speed
        private long solutionLimit = 2000;
        private int twoOptMaxPasses = 1000;

        public boolean isExactSolverEnabled() { return exactSolverEnabled; }
        public void setExactSolverEnabled(boolean exactSolverEnabled) { this.exactSolverEnabled = exactSolverEnabled; }
        public long getSolutionLimit() { return solutionLimit; }
        public void setSolutionLimit(long solutionLimit) { this.solutionLimit = solutionLimit; }
        public long getTimeLimitSeconds() { return timeLimitSeconds; }
        public void setTimeLimitSeconds(long timeLimitSeconds) { this.timeLimitSeconds = timeLimitSeconds; }
        public int getTwoOptMaxPasses() { return twoOptMaxPasses; }
        public void setTwoOptMaxPasses(int twoOptMaxPasses) { this.twoOptMaxPasses = twoOptMaxPasses; }
    }

    public static class Executor {
        private int poolSize = 8;

        public int getPoolSize() { return poolSize; }
        public void setPoolSize(int poolSize) { this.poolSize = poolSize; }
    }
}
