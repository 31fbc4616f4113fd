package com.softcheck.analysis;

import java.util.Objects;
import java.util.Properties;

/**
 * Configuration of a {@link SemanticAnalyzer}.
 *
 * <p>Statements are independent of each other, so they may be checked on several
 * threads; the reported errors are identical in either mode.
 *
 * <p>System properties:
 * <ul>
 *   <li>{@code softcheck.analysis.mode} - {@code sequential} (default) or {@code parallel}</li>
 *   <li>{@code softcheck.analysis.threads} - worker threads in parallel mode</li>
 * </ul>
 */
public final class AnalyzerConfig {

    public static final String MODE_PROPERTY = "softcheck.analysis.mode";
    public static final String THREADS_PROPERTY = "softcheck.analysis.threads";

    /** Default worker threads in parallel mode */
    public static final int DEFAULT_THREADS = 4;

    public static final int MIN_THREADS = 1;

    public static final int MAX_THREADS = 64;

    /**
     * How statements are scheduled.
     */
    public enum ExecutionMode {
        SEQUENTIAL,
        PARALLEL;

        /**
         * Parse a mode string (case-insensitive).
         *
         * @param value "sequential" or "parallel"; null means sequential
         * @return the parsed mode
         * @throws IllegalArgumentException if value is not recognized
         */
        public static ExecutionMode parse(String value) {
            if (value == null) {
                return SEQUENTIAL;
            }
            return switch (value.trim().toLowerCase()) {
                case "sequential" -> SEQUENTIAL;
                case "parallel" -> PARALLEL;
                default -> throw new IllegalArgumentException(
                    "Unknown analysis mode: '%s'. Valid values: sequential, parallel".formatted(value));
            };
        }
    }

    private static final AnalyzerConfig DEFAULTS = new AnalyzerConfig(ExecutionMode.SEQUENTIAL, DEFAULT_THREADS);

    private final ExecutionMode mode;
    private final int threads;

    private AnalyzerConfig(ExecutionMode mode, int threads) {
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.threads = normalizeThreads(threads);
    }

    public static AnalyzerConfig defaults() {
        return DEFAULTS;
    }

    public static AnalyzerConfig sequential() {
        return DEFAULTS;
    }

    public static AnalyzerConfig parallel(int threads) {
        return new AnalyzerConfig(ExecutionMode.PARALLEL, threads);
    }

    /**
     * Reads the configuration from system properties.
     */
    public static AnalyzerConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Reads the configuration from {@code properties}; missing keys fall back to defaults.
     *
     * @param properties the properties
     * @return the configuration
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static AnalyzerConfig fromProperties(Properties properties) {
        ExecutionMode mode = ExecutionMode.parse(properties.getProperty(MODE_PROPERTY));
        String threadsValue = properties.getProperty(THREADS_PROPERTY);
        int threads = DEFAULT_THREADS;
        if (threadsValue != null) {
            try {
                threads = Integer.parseInt(threadsValue.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                    "Invalid value for " + THREADS_PROPERTY + ": '" + threadsValue + "'", e);
            }
        }
        return new AnalyzerConfig(mode, threads);
    }

    /**
     * Validate and normalize a thread count to be within allowed bounds.
     *
     * @param requested the requested count
     * @return normalized count within [MIN_THREADS, MAX_THREADS]
     */
    public static int normalizeThreads(int requested) {
        if (requested <= 0) return DEFAULT_THREADS;
        if (requested < MIN_THREADS) return MIN_THREADS;
        if (requested > MAX_THREADS) return MAX_THREADS;
        return requested;
    }

    public ExecutionMode mode() {
        return mode;
    }

    public int threads() {
        return threads;
    }

    public boolean isParallel() {
        return mode == ExecutionMode.PARALLEL;
    }

    @Override
    public String toString() {
        return "AnalyzerConfig(" + mode + ", threads=" + threads + ")";
    }
}
