package com.khaounen.guard.security;

import com.khaounen.guard.security.decision.DecisionFailurePolicy;
import com.khaounen.guard.security.decision.DecisionSettings;
import com.khaounen.guard.security.decision.LadderPolicy;
import com.khaounen.guard.security.decision.TrafficRule;
import com.khaounen.guard.security.decision.TrafficRules;
import com.khaounen.guard.security.identity.IdentityMode;
import com.khaounen.guard.security.mitigation.MitigationSettings;
import com.khaounen.guard.security.reputation.DecayFunction;
import com.khaounen.guard.security.reputation.DecayType;
import com.khaounen.guard.security.store.StoreFailurePolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Data
@ConfigurationProperties(prefix = "abuse-guard")
public class AbuseGuardProperties {

    private boolean enabled = true;
    private IdentityMode identityMode = IdentityMode.TOKEN_OR_ADDRESS;
    private List<String> excludedPaths = new ArrayList<>();
    private Window window = new Window();
    private Ladder ladder = new Ladder();
    private FastPath fastPath = new FastPath();
    private Reputation reputation = new Reputation();
    private Cache cache = new Cache();
    private Failure failure = new Failure();
    private Intake intake = new Intake();
    private Mitigation mitigation = new Mitigation();
    private Cloudflare cloudflare = new Cloudflare();
    private Admin admin = new Admin();
    private Rule defaultRule = new Rule();
    private List<Rule> rules = new ArrayList<>();

    /**
     * Fails startup when a choice the starter refuses to make for the application is missing.
     */
    public void validate() {
        if (failure.getStorePolicy() == null) {
            throw new IllegalStateException(
                    "abuse-guard.failure.store-policy must be set (LOCAL_FALLBACK or FAIL_CLOSED)");
        }
        if (failure.getDecisionPolicy() == null) {
            throw new IllegalStateException(
                    "abuse-guard.failure.decision-policy must be set (FAIL_OPEN or FAIL_CLOSED)");
        }
        if (window.getSeconds() <= 0) {
            throw new IllegalStateException("abuse-guard.window.seconds must be > 0");
        }
    }

    public LadderPolicy toLadderPolicy() {
        return new LadderPolicy(
                ladder.getWatchAfterWindows(),
                ladder.getPromoteAfterWindows(),
                ladder.getDemoteAfterCleanWindows(),
                Duration.ofSeconds(ladder.getThrottleHoldSeconds()),
                Duration.ofSeconds(ladder.getChallengeHoldSeconds()),
                Duration.ofSeconds(ladder.getBlockHoldSeconds()),
                fastPath.isEnabled() ? fastPath.getBlockMultiple() : 0.0
        );
    }

    public DecisionSettings toDecisionSettings() {
        return DecisionSettings.builder()
                .ladder(toLadderPolicy())
                .reputationWeight(reputation.getWeight())
                .penaltyPerSeverity(reputation.getPenaltyPerSeverity())
                .recoveryReward(reputation.getRecoveryReward())
                .verdictTtl(Duration.ofSeconds(cache.getVerdictTtlSeconds()))
                .grace(Duration.ofSeconds(cache.getGraceSeconds()))
                .lease(Duration.ofMillis(cache.getLeaseMillis()))
                .lockWait(Duration.ofMillis(intake.getDecisionTimeoutMillis()))
                .failurePolicy(failure.getDecisionPolicy())
                .failClosedThrottle(Duration.ofSeconds(failure.getThrottleSeconds()))
                .blacklistBlock(Duration.ofSeconds(ladder.getBlockHoldSeconds()))
                .maximumIdentities(cache.getMaximumIdentities())
                .build();
    }

    public DecayFunction toDecayFunction() {
        if (reputation.getDecay() == DecayType.EXPONENTIAL) {
            return DecayFunction.exponential(Duration.ofSeconds(reputation.getHalfLifeSeconds()));
        }
        return DecayFunction.linear(reputation.getPointsPerMinute());
    }

    public MitigationSettings toMitigationSettings() {
        return new MitigationSettings(
                Duration.ofMillis(mitigation.getInitialBackoffMillis()),
                Duration.ofMillis(mitigation.getMaxBackoffMillis()),
                mitigation.getMaxAttempts(),
                Duration.ofSeconds(mitigation.getSweepIntervalSeconds()),
                Duration.ofMillis(500),
                cache.getMaximumIdentities(),
                retention()
        );
    }

    public TrafficRules toTrafficRules() {
        List<TrafficRule> variants = rules.stream()
                .map(Rule::toTrafficRule)
                .collect(Collectors.toList());
        Rule fallback = defaultRule;
        TrafficRule catchAll = new TrafficRule(
                fallback.getName() == null ? "default" : fallback.getName(),
                "",
                List.of(),
                Map.of(),
                Integer.MIN_VALUE,
                fallback.getThreshold(),
                fallback.getCost()
        );
        return new TrafficRules(variants, catchAll);
    }

    public Duration retention() {
        return Duration.ofHours(reputation.getRetentionHours());
    }

    @Data
    public static class Window {
        private int seconds = 60;
    }

    @Data
    public static class Ladder {
        private int watchAfterWindows = 1;
        private int promoteAfterWindows = 3;
        private int demoteAfterCleanWindows = 4;
        private int throttleHoldSeconds = 600;
        private int challengeHoldSeconds = 900;
        private int blockHoldSeconds = 3600;
    }

    @Data
    public static class FastPath {
        /** Rule {@code extreme-rate}: jump straight to Blocked at this multiple of the threshold. */
        private boolean enabled = true;
        private double blockMultiple = 10.0;
    }

    @Data
    public static class Reputation {
        private DecayType decay = DecayType.LINEAR;
        private double pointsPerMinute = 1.0;
        private int halfLifeSeconds = 3600;
        private double weight = 0.5;
        private int penaltyPerSeverity = 5;
        private int recoveryReward = 5;
        private int retentionHours = 24;
    }

    @Data
    public static class Cache {
        private int verdictTtlSeconds = 5;
        private int graceSeconds = 30;
        private long leaseMillis = 250;
        private long maximumIdentities = 100_000;
    }

    @Data
    public static class Failure {
        private StoreFailurePolicy storePolicy;
        private DecisionFailurePolicy decisionPolicy;
        private int throttleSeconds = 60;
        private long storeTimeoutMillis = 50;
        private int storeThreads = 16;
        private int storeQueueCapacity = 1024;
    }

    @Data
    public static class Intake {
        private int workerThreads = 8;
        private int queueCapacity = 2048;
        private long decisionTimeoutMillis = 100;
    }

    @Data
    public static class Mitigation {
        private boolean enabled = true;
        private int queueCapacity = 10_000;
        private long initialBackoffMillis = 200;
        private long maxBackoffMillis = 10_000;
        private int maxAttempts = 5;
        private int sweepIntervalSeconds = 30;
        private int dedupeRetentionMinutes = 60;
    }

    @Data
    public static class Cloudflare {
        private boolean enabled = false;
        private String baseUrl = "https://api.cloudflare.com/client/v4";
        private String zoneId;
        private String apiToken;
        private int connectTimeoutMillis = 2000;
        private int requestTimeoutMillis = 5000;
    }

    @Data
    public static class Admin {
        private boolean enabled = false;
    }

    @Data
    public static class Rule {
        private String name;
        private String path = "";
        private List<String> methods = new ArrayList<>();
        private Map<String, String> tags = new LinkedHashMap<>();
        private int priority = 0;
        private long threshold = 100;
        private long cost = 1;

        public TrafficRule toTrafficRule() {
            String ruleName = name != null && !name.isBlank() ? name : path;
            return new TrafficRule(ruleName, path, methods, tags, priority, threshold, cost);
        }
    }
}
