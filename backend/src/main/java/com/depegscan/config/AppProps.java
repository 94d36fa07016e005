package com.depegscan.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Configuration
@ConfigurationProperties(prefix = "app")
@Data
public class AppProps {
    private Api api = new Api();
    private Map<String, Network> network = new LinkedHashMap<>();
    private Toxic toxic = new Toxic();
    private Crisis crisis = new Crisis();
    private Classify classify = new Classify();
    private Output output = new Output();
    private Pipeline pipeline = new Pipeline();

    /**
     * Reverse lookup chainId -> configured network name.
     */
    public Optional<String> networkName(long chainId) {
        if (network == null) return Optional.empty();
        return network.entrySet().stream()
                .filter(e -> e.getValue().getChainId() == chainId)
                .map(Map.Entry::getKey)
                .findFirst();
    }

    @Data
    public static class Network {
        private long chainId;
    }

    @Data
    public static class Api {
        private String url = "https://blue-api.morpho.org/graphql";
        private int connectTimeoutSec = 10;
        private int readTimeoutSec = 60;
        private String userAgent = "depeg-scan/0.1";
        /** Minimum pause between two requests, shared by every caller. */
        private long requestDelayMs = 300;
        private Retry retry = new Retry();
        private int pageSize = 100;
        private int reallocationPageSize = 500;
        private int adminEventPageSize = 25;
        /** Max keys / addresses per `_in` filter. */
        private int batchSize = 50;
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private long baseDelayMs = 1000;
        private double jitterFactor = 0.2;
    }

    @Data
    public static class Toxic {
        private List<String> symbols = new ArrayList<>();
        private List<String> falsePositives = new ArrayList<>();
    }

    @Data
    public static class Crisis {
        private Instant timestamp = Instant.parse("2025-11-04T00:00:00Z");
        private Instant preCrisisStart = Instant.parse("2025-10-28T00:00:00Z");
        private Instant windowStart = Instant.parse("2025-09-01T00:00:00Z");
        private Instant windowEnd = Instant.parse("2026-01-31T00:00:00Z");
    }

    @Data
    public static class Classify {
        private double mispricingThreshold = 0.10;
        private double fullUtilization = 0.99;
        private double zeroAllocationUsd = 1.0;
    }

    @Data
    public static class Output {
        private String dir = "data";
    }

    @Data
    public static class Pipeline {
        private boolean runOnStartup = false;
        /** Spring cron; "-" disables the scheduled run. */
        private String cron = "-";
    }
}
