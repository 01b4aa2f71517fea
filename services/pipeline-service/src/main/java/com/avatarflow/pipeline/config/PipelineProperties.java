package com.avatarflow.pipeline.config;

import com.avatarflow.pipeline.model.BorderlinePolicy;
import com.avatarflow.pipeline.model.ContentTier;
import com.avatarflow.platform.connector.model.Platform;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Strongly typed configuration for the generation and distribution pipeline.
 */
@Data
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    private Store store = new Store();
    private Generation generation = new Generation();
    private Safety safety = new Safety();
    private Scheduling scheduling = new Scheduling();
    private Dispatch dispatch = new Dispatch();
    private Health health = new Health();

    /**
     * Base URL of the connector service per platform. Platforms without an entry publish
     * to the in-memory adapter.
     */
    private Map<Platform, String> connectorUrls = new EnumMap<>(Platform.class);

    public enum StoreType { MEMORY, JPA }

    public enum LockType { LOCAL, REDIS }

    @Data
    public static class Store {
        /**
         * Backing store for artifacts, batches, posts and account health.
         */
        private StoreType type = StoreType.MEMORY;
    }

    @Data
    public static class Generation {
        /**
         * Worker threads shared by all running batches.
         */
        private int workerPoolSize = 4;

        /**
         * Calls per unit before a transient failure becomes final.
         */
        private int maxAttempts = 3;

        /**
         * Delay before the next attempt, multiplied by the attempt number.
         */
        private Duration retryBackoff = Duration.ofMillis(500);

        /**
         * Timeout handed to the generation provider on every call.
         */
        private Duration callTimeout = Duration.ofSeconds(120);

        /**
         * Inference endpoint used by the HTTP generation provider.
         */
        private String providerUrl = "http://localhost:8090";
    }

    @Data
    public static class Safety {
        private BorderlinePolicy borderlinePolicy = BorderlinePolicy.MANUAL;

        /**
         * Age after which AUTO_APPROVE promotes a borderline artifact.
         */
        private Duration autoApproveAfter = Duration.ofHours(24);

        private String moderationUrl = "https://api.openai.com";

        private String moderationModel = "omni-moderation-latest";

        /**
         * API key for the moderation endpoint. Without one every artifact is held as borderline.
         */
        private String apiKey;

        private Duration timeout = Duration.ofSeconds(30);

        /**
         * Interval of the sweep that applies the borderline policy.
         */
        private long reviewSweepMs = 300_000;
    }

    @Data
    public static class Scheduling {
        /**
         * Jitter as a fraction of the account's base spacing, per platform.
         */
        private Map<Platform, Double> jitterRatio = new EnumMap<>(Platform.class);

        private double defaultJitterRatio = 0.2;

        /**
         * How far past the anchor the slot search may look.
         */
        private int maxLookaheadDays = 14;

        /**
         * Content tiers each platform accepts.
         */
        private Map<Platform, Set<ContentTier>> allowedTiers = defaultAllowedTiers();

        public double jitterRatioFor(Platform platform) {
            return jitterRatio.getOrDefault(platform, defaultJitterRatio);
        }

        public boolean isTierAllowed(Platform platform, ContentTier tier) {
            Set<ContentTier> allowed = allowedTiers.get(platform);
            return allowed != null && allowed.contains(tier);
        }

        private static Map<Platform, Set<ContentTier>> defaultAllowedTiers() {
            Map<Platform, Set<ContentTier>> tiers = new EnumMap<>(Platform.class);
            tiers.put(Platform.INSTAGRAM, EnumSet.of(ContentTier.BASIC));
            tiers.put(Platform.TIKTOK, EnumSet.of(ContentTier.BASIC));
            tiers.put(Platform.TWITTER, EnumSet.of(ContentTier.BASIC, ContentTier.PREMIUM));
            tiers.put(Platform.ONLYFANS, EnumSet.allOf(ContentTier.class));
            return tiers;
        }
    }

    @Data
    public static class Dispatch {
        private long tickMs = 30_000;

        private long initialDelayMs = 10_000;

        /**
         * Due posts examined per tick.
         */
        private int batchSize = 50;

        /**
         * Publish attempts per post before it is marked FAILED.
         */
        private int maxAttempts = 5;

        /**
         * A post left in PUBLISHING longer than this is treated as interrupted.
         */
        private Duration stallTimeout = Duration.ofMinutes(10);

        private Duration publishTimeout = Duration.ofSeconds(60);

        private LockType lock = LockType.LOCAL;

        /**
         * Lease on the shared dispatch lock. Must exceed the longest tick.
         */
        private Duration lockLease = Duration.ofMinutes(2);
    }

    @Data
    public static class Health {
        private Duration baseBackoff = Duration.ofMinutes(1);

        /**
         * Largest exponent applied to the base backoff.
         */
        private int backoffExponentCap = 6;

        private int degradedThreshold = 5;

        private int suspendedThreshold = 10;

        /**
         * Re-read attempts when a health update loses a concurrent race.
         */
        private int maxUpdateAttempts = 5;
    }
}
