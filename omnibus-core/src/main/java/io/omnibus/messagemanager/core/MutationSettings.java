package io.omnibus.messagemanager.core;

import java.util.Properties;

/**
 * Immutable tuning of the mutation engine, the bulk coordinator and the connection registry. Use
 * {@link #defaults()}, {@link #builder()}, or {@link #fromProperties(Properties)} for configuration from the composing
 * application, reading the <code>omnibus.*</code> keys listed on the constants.
 */
public final class MutationSettings implements Statics {
    public static final String PROP_DRAIN_BATCH_SIZE = "omnibus.drainBatchSize";
    public static final String PROP_CHUNK_SIZE = "omnibus.chunkSize";
    public static final String PROP_CHUNK_RETRIES = "omnibus.chunkRetries";
    public static final String PROP_CHUNK_RETRY_BASE_DELAY_MILLIS = "omnibus.chunkRetryBaseDelayMillis";
    public static final String PROP_PAUSE_BETWEEN_CHUNKS_MILLIS = "omnibus.pauseBetweenChunksMillis";
    public static final String PROP_RECEIPT_RETRIES = "omnibus.receiptRetries";
    public static final String PROP_MAX_DRAIN_ROUNDS = "omnibus.maxDrainRounds";
    public static final String PROP_PURGE_MAX_ITERATIONS = "omnibus.purgeMaxIterations";
    public static final String PROP_REPUBLISH_PARALLELISM = "omnibus.republishParallelism";
    public static final String PROP_CONNECT_TIMEOUT_MILLIS = "omnibus.connectTimeoutMillis";
    public static final String PROP_DUPLICATE_ID_POLICY = "omnibus.duplicateIdPolicy";

    private final int _drainBatchSize;
    private final int _chunkSize;
    private final int _chunkRetries;
    private final long _chunkRetryBaseDelayMillis;
    private final long _pauseBetweenChunksMillis;
    private final int _receiptRetries;
    private final int _maxDrainRounds;
    private final int _purgeMaxIterations;
    private final int _republishParallelism;
    private final long _connectTimeoutMillis;
    private final DuplicateIdPolicy _duplicateIdPolicy;

    private MutationSettings(Builder builder) {
        _drainBatchSize = builder._drainBatchSize;
        _chunkSize = builder._chunkSize;
        _chunkRetries = builder._chunkRetries;
        _chunkRetryBaseDelayMillis = builder._chunkRetryBaseDelayMillis;
        _pauseBetweenChunksMillis = builder._pauseBetweenChunksMillis;
        _receiptRetries = builder._receiptRetries;
        _maxDrainRounds = builder._maxDrainRounds;
        _purgeMaxIterations = builder._purgeMaxIterations;
        _republishParallelism = builder._republishParallelism;
        _connectTimeoutMillis = builder._connectTimeoutMillis;
        _duplicateIdPolicy = builder._duplicateIdPolicy;
    }

    public static MutationSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the <code>omnibus.*</code> keys, using the default for each key not present.
     *
     * @throws IllegalArgumentException
     *             if a present value is not a valid number, or not a {@link DuplicateIdPolicy} name.
     */
    public static MutationSettings fromProperties(Properties properties) {
        if (properties == null) {
            throw new NullPointerException("properties");
        }
        Builder builder = builder();
        builder.drainBatchSize(intProp(properties, PROP_DRAIN_BATCH_SIZE, DEFAULT_DRAIN_BATCH_SIZE));
        builder.chunkSize(intProp(properties, PROP_CHUNK_SIZE, DEFAULT_CHUNK_SIZE));
        builder.chunkRetries(intProp(properties, PROP_CHUNK_RETRIES, DEFAULT_CHUNK_RETRIES));
        builder.chunkRetryBaseDelayMillis(longProp(properties, PROP_CHUNK_RETRY_BASE_DELAY_MILLIS,
                DEFAULT_CHUNK_RETRY_BASE_DELAY_MILLIS));
        builder.pauseBetweenChunksMillis(longProp(properties, PROP_PAUSE_BETWEEN_CHUNKS_MILLIS,
                DEFAULT_PAUSE_BETWEEN_CHUNKS_MILLIS));
        builder.receiptRetries(intProp(properties, PROP_RECEIPT_RETRIES, DEFAULT_RECEIPT_RETRIES));
        builder.maxDrainRounds(intProp(properties, PROP_MAX_DRAIN_ROUNDS, DEFAULT_MAX_DRAIN_ROUNDS));
        builder.purgeMaxIterations(intProp(properties, PROP_PURGE_MAX_ITERATIONS, DEFAULT_PURGE_MAX_ITERATIONS));
        builder.republishParallelism(intProp(properties, PROP_REPUBLISH_PARALLELISM,
                DEFAULT_REPUBLISH_PARALLELISM));
        builder.connectTimeoutMillis(longProp(properties, PROP_CONNECT_TIMEOUT_MILLIS,
                DEFAULT_CONNECT_TIMEOUT_MILLIS));
        String policy = properties.getProperty(PROP_DUPLICATE_ID_POLICY);
        if (policy != null) {
            try {
                builder.duplicateIdPolicy(DuplicateIdPolicy.valueOf(policy.trim().toUpperCase()));
            }
            catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Property [" + PROP_DUPLICATE_ID_POLICY
                        + "] has unknown value [" + policy + "].", e);
            }
        }
        return builder.build();
    }

    private static int intProp(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property [" + key + "] is not an integer [" + value + "].", e);
        }
    }

    private static long longProp(Properties properties, String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property [" + key + "] is not an integer [" + value + "].", e);
        }
    }

    public int getDrainBatchSize() {
        return _drainBatchSize;
    }

    public int getChunkSize() {
        return _chunkSize;
    }

    public int getChunkRetries() {
        return _chunkRetries;
    }

    public long getChunkRetryBaseDelayMillis() {
        return _chunkRetryBaseDelayMillis;
    }

    public long getPauseBetweenChunksMillis() {
        return _pauseBetweenChunksMillis;
    }

    public int getReceiptRetries() {
        return _receiptRetries;
    }

    public int getMaxDrainRounds() {
        return _maxDrainRounds;
    }

    public int getPurgeMaxIterations() {
        return _purgeMaxIterations;
    }

    public int getRepublishParallelism() {
        return _republishParallelism;
    }

    public long getConnectTimeoutMillis() {
        return _connectTimeoutMillis;
    }

    public DuplicateIdPolicy getDuplicateIdPolicy() {
        return _duplicateIdPolicy;
    }

    @Override
    public String toString() {
        return "MutationSettings{drainBatchSize=" + _drainBatchSize + ", chunkSize=" + _chunkSize
                + ", chunkRetries=" + _chunkRetries + ", chunkRetryBaseDelayMillis=" + _chunkRetryBaseDelayMillis
                + ", pauseBetweenChunksMillis=" + _pauseBetweenChunksMillis + ", receiptRetries=" + _receiptRetries
                + ", maxDrainRounds=" + _maxDrainRounds + ", purgeMaxIterations=" + _purgeMaxIterations
                + ", republishParallelism=" + _republishParallelism + ", connectTimeoutMillis="
                + _connectTimeoutMillis + ", duplicateIdPolicy=" + _duplicateIdPolicy + "}";
    }

    public static final class Builder {
        private int _drainBatchSize = DEFAULT_DRAIN_BATCH_SIZE;
        private int _chunkSize = DEFAULT_CHUNK_SIZE;
        private int _chunkRetries = DEFAULT_CHUNK_RETRIES;
        private long _chunkRetryBaseDelayMillis = DEFAULT_CHUNK_RETRY_BASE_DELAY_MILLIS;
        private long _pauseBetweenChunksMillis = DEFAULT_PAUSE_BETWEEN_CHUNKS_MILLIS;
        private int _receiptRetries = DEFAULT_RECEIPT_RETRIES;
        private int _maxDrainRounds = DEFAULT_MAX_DRAIN_ROUNDS;
        private int _purgeMaxIterations = DEFAULT_PURGE_MAX_ITERATIONS;
        private int _republishParallelism = DEFAULT_REPUBLISH_PARALLELISM;
        private long _connectTimeoutMillis = DEFAULT_CONNECT_TIMEOUT_MILLIS;
        private DuplicateIdPolicy _duplicateIdPolicy = DuplicateIdPolicy.FIRST_OCCURRENCE;

        private Builder() {
        }

        public Builder drainBatchSize(int drainBatchSize) {
            _drainBatchSize = positive("drainBatchSize", drainBatchSize);
            return this;
        }

        public Builder chunkSize(int chunkSize) {
            _chunkSize = positive("chunkSize", chunkSize);
            return this;
        }

        public Builder chunkRetries(int chunkRetries) {
            _chunkRetries = notNegative("chunkRetries", chunkRetries);
            return this;
        }

        public Builder chunkRetryBaseDelayMillis(long chunkRetryBaseDelayMillis) {
            _chunkRetryBaseDelayMillis = notNegative("chunkRetryBaseDelayMillis", chunkRetryBaseDelayMillis);
            return this;
        }

        public Builder pauseBetweenChunksMillis(long pauseBetweenChunksMillis) {
            _pauseBetweenChunksMillis = notNegative("pauseBetweenChunksMillis", pauseBetweenChunksMillis);
            return this;
        }

        public Builder receiptRetries(int receiptRetries) {
            _receiptRetries = notNegative("receiptRetries", receiptRetries);
            return this;
        }

        public Builder maxDrainRounds(int maxDrainRounds) {
            _maxDrainRounds = positive("maxDrainRounds", maxDrainRounds);
            return this;
        }

        public Builder purgeMaxIterations(int purgeMaxIterations) {
            _purgeMaxIterations = positive("purgeMaxIterations", purgeMaxIterations);
            return this;
        }

        public Builder republishParallelism(int republishParallelism) {
            _republishParallelism = positive("republishParallelism", republishParallelism);
            return this;
        }

        public Builder connectTimeoutMillis(long connectTimeoutMillis) {
            _connectTimeoutMillis = positive("connectTimeoutMillis", connectTimeoutMillis);
            return this;
        }

        public Builder duplicateIdPolicy(DuplicateIdPolicy duplicateIdPolicy) {
            if (duplicateIdPolicy == null) {
                throw new NullPointerException("duplicateIdPolicy");
            }
            _duplicateIdPolicy = duplicateIdPolicy;
            return this;
        }

        public MutationSettings build() {
            return new MutationSettings(this);
        }

        private static int positive(String what, int value) {
            if (value <= 0) {
                throw new IllegalArgumentException(what + " must be positive [" + value + "]");
            }
            return value;
        }

        private static long positive(String what, long value) {
            if (value <= 0) {
                throw new IllegalArgumentException(what + " must be positive [" + value + "]");
            }
            return value;
        }

        private static int notNegative(String what, int value) {
            if (value < 0) {
                throw new IllegalArgumentException(what + " must be >= 0 [" + value + "]");
            }
            return value;
        }

        private static long notNegative(String what, long value) {
            if (value < 0) {
                throw new IllegalArgumentException(what + " must be >= 0 [" + value + "]");
            }
            return value;
        }
    }
}
