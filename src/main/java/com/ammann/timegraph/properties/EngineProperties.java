/* (C)2026 */
package com.ammann.timegraph.properties;

/**
 * Centralized registry of configuration keys read by the engine.
 *
 * <p>Organizes keys by component so that {@code @ConfigProperty} injection points and
 * {@code application.properties} stay consistent.
 */
public final class EngineProperties {

    private EngineProperties() {}

    /** Common prefix of all engine settings. */
    public static final String PREFIX = "timegraph";

    /** Name of the managed executor used for off-thread work. */
    public static final String EXECUTOR_NAME = "timegraph-engine-executor";

    /**
     * Normalizer settings
     */
    public static final class Normalizer {
        private Normalizer() {}

        public static final String NULL_MARKERS = PREFIX + ".null-markers";
        public static final String DEFAULT_NULL_MARKERS = "NULL,NA,NaN,None,N/A,-";
    }

    /**
     * Time-axis settings
     */
    public static final class Time {
        private Time() {}

        public static final String FALLBACK_RATE_HZ = PREFIX + ".time.fallback-rate-hz";
        public static final String ZONE = PREFIX + ".time.zone";
    }

    /**
     * Downsampling settings
     */
    public static final class Downsample {
        private Downsample() {}

        public static final String STRATEGY = PREFIX + ".downsample.strategy";
        public static final String DEFAULT_MAX_POINTS = PREFIX + ".downsample.default-max-points";
    }

    /**
     * Filter settings
     */
    public static final class Filter {
        private Filter() {}

        public static final String BLOCK_SIZE = PREFIX + ".filter.block-size";
    }

    /**
     * Correlation settings
     */
    public static final class Correlation {
        private Correlation() {}

        public static final String BLOCK_SIZE = PREFIX + ".correlation.block-size";
    }

    /**
     * Statistics cache settings
     */
    public static final class Statistics {
        private Statistics() {}

        public static final String CACHE_CAPACITY = PREFIX + ".statistics.cache-capacity";
    }

    /**
     * Executor settings
     */
    public static final class Executor {
        private Executor() {}

        public static final String MAX_ASYNC = PREFIX + ".executor.max-async";
        public static final String MAX_QUEUED = PREFIX + ".executor.max-queued";
    }
}
