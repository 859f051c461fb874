package com.feedwarden.gate.config;

import com.feedwarden.gate.model.ErrorKind;
import com.feedwarden.gate.model.SourceDefinition;
import com.feedwarden.gate.model.SourceType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "ingestion-gate")
@Data
public class IngestionGateProperties {

    private Scheduling scheduling = new Scheduling();
    private Behavior behavior = new Behavior();
    private Health health = new Health();
    private Circuit circuit = new Circuit();
    private Client client = new Client();
    private Identity identity = new Identity();
    private Proxy proxy = new Proxy();
    private Store store = new Store();
    private Output output = new Output();
    private List<SourceDefinition> sources = new ArrayList<>();

    @Data
    public static class Scheduling {
        private Duration tickInterval = Duration.ofSeconds(60);
        private boolean runOnStartup = false;
        private int workerThreads = 8;
    }

    @Data
    public static class Behavior {
        private Duration defaultAverageInterval = Duration.ofMinutes(30);
        private Map<SourceType, Duration> typeIntervals = new EnumMap<>(SourceType.class);
        private double jitterFactor = 0.4;
        private Duration minimumInterval = Duration.ofMinutes(5);

        // Skip ("inattention") model
        private double skipProbabilityBaseline = 0.05;
        private double skipHealthThreshold = 0.8;
        private double skipHealthFactor = 0.5;
        private Duration skipDelayMin = Duration.ofMinutes(10);
        private Duration skipDelayMax = Duration.ofMinutes(60);

        // Think time before the request is issued
        private Duration thinkTimeMin = Duration.ofMillis(500);
        private Duration thinkTimeMax = Duration.ofMillis(3000);

        // Occasional extended silence
        private double longPauseProbability = 0.01;
        private Duration longPauseMin = Duration.ofMinutes(60);
        private Duration longPauseMax = Duration.ofMinutes(240);
    }

    @Data
    public static class Health {
        private double recoveryIncrement = 0.05;
        private Duration slowResponseThreshold = Duration.ofSeconds(10);
        private double latencyPenalty = 0.05;
        private Map<ErrorKind, Double> penalties = defaultPenalties();
        private double defaultPenalty = 0.1;
        private double repeatMultiplierStep = 0.5;
        private int maxRepeats = 4;
        private int historySize = 10;
        /** Score a source is lifted to when a half-open probe succeeds. */
        private double probeRecoveryFloor = 0.5;

        private static Map<ErrorKind, Double> defaultPenalties() {
            Map<ErrorKind, Double> penalties = new EnumMap<>(ErrorKind.class);
            penalties.put(ErrorKind.NETWORK_TIMEOUT, 0.10);
            penalties.put(ErrorKind.SERVER_ERROR, 0.15);
            penalties.put(ErrorKind.CLIENT_ERROR, 0.20);
            penalties.put(ErrorKind.SOFT_BLOCK, 0.30);
            penalties.put(ErrorKind.HARD_BLOCK, 1.00);
            penalties.put(ErrorKind.CONTENT_EMPTY, 0.10);
            penalties.put(ErrorKind.PARSE_ERROR, 0.05);
            return penalties;
        }
    }

    @Data
    public static class Circuit {
        /** Cooldown per open cycle; the last entry is the ceiling. */
        private List<Duration> cooldowns = new ArrayList<>(List.of(
                Duration.ofHours(1), Duration.ofHours(6), Duration.ofHours(24), Duration.ofHours(48)));
    }

    @Data
    public static class Client {
        private Duration requestTimeout = Duration.ofSeconds(30);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration slowResponseThreshold = Duration.ofSeconds(15);
        private int minBodyChars = 100;
        private int challengeWindowChars = 5000;
        private int jsRequiredWindowChars = 2000;
        private List<String> challengeMarkers = new ArrayList<>(List.of(
                "captcha",
                "please verify you are a human",
                "access denied",
                "security check",
                "cloudflare-ray"));
        private List<String> jsRequiredMarkers = new ArrayList<>(List.of(
                "need to enable javascript",
                "javascript is required",
                "enable js to continue",
                "requires javascript"));
        private Duration softBlockCooldown = Duration.ofMinutes(15);
        private Duration hardBlockCooldown = Duration.ofHours(24);
        private Duration transientCooldown = Duration.ofMinutes(5);
        private int failureLockoutThreshold = 5;
        private Duration failureLockout = Duration.ofHours(24);
        /** How long a second caller for the same source waits for the first; zero rejects. */
        private Duration maxConcurrentWait = Duration.ZERO;
    }

    @Data
    public static class Identity {
        private Duration sessionLifetimeMin = Duration.ofHours(24);
        private Duration sessionLifetimeMax = Duration.ofHours(72);
    }

    @Data
    public static class Proxy {
        private List<String> residential = new ArrayList<>();
        private List<String> datacenter = new ArrayList<>();
    }

    @Data
    public static class Store {
        private StoreMode mode = StoreMode.JDBC;

        public enum StoreMode {
            JDBC, MEMORY
        }
    }

    @Data
    public static class Output {
        private DiagnosticsCsv diagnosticsCsv = new DiagnosticsCsv();

        @Data
        public static class DiagnosticsCsv {
            private boolean enabled = false;
            private String outputDir = "/data/output";
        }
    }
}
