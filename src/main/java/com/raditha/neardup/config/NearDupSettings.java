package com.raditha.neardup.config;

import com.raditha.neardup.hash.HashStrategy;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads near-duplicate configuration from a YAML settings file with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > neardup.yml > defaults.
 * All keys live under the {@code near_duplicate} section:
 * <pre>
 * near_duplicate:
 *   preset: strict
 *   ngram_size: 10
 *   threshold: 0.6
 *   hash_strategy: auto
 *   search_dir: /data/pythia
 *   query_path: /data/query.jsonl
 * </pre>
 */
public class NearDupSettings {

    private static final Logger logger = LoggerFactory.getLogger(NearDupSettings.class);

    public static final String CONFIG_KEY = "near_duplicate";
    public static final String DEFAULT_CONFIG_FILE = "neardup.yml";

    private NearDupSettings() {
    }

    /**
     * Values supplied on the command line. Zero or null means "not given".
     *
     * @param ngramSize        CLI n (0 = use YAML/default)
     * @param threshold        CLI threshold, a fraction 0-1 or a percentage above 1 (null = use YAML/default)
     * @param preset           CLI preset name (null = use YAML/default)
     * @param hashStrategy     CLI hash strategy (null = use YAML/default)
     * @param workers          CLI worker count (0 = use YAML/default)
     * @param countSpans       Count matching spans instead of documents
     */
    public record CliOverrides(
            int ngramSize,
            @Nullable Double threshold,
            @Nullable String preset,
            @Nullable HashStrategy hashStrategy,
            int workers,
            boolean countSpans) {

        public static CliOverrides none() {
            return new CliOverrides(0, null, null, null, 0, false);
        }
    }

    /**
     * Read a YAML settings file. A missing file yields an empty map.
     *
     * @throws ConfigurationException if the file exists but is not valid YAML
     */
    public static Map<String, Object> loadSettings(@Nullable Path file) throws IOException {
        if (file == null || !Files.exists(file)) {
            return Map.of();
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Object loaded = new Yaml().load(reader);
            if (loaded == null) {
                return Map.of();
            }
            if (!(loaded instanceof Map)) {
                throw new ConfigurationException("Settings file must contain a YAML mapping: " + file);
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> settings = (Map<String, Object>) loaded;
            logger.debug("Loaded settings from {}", file);
            return settings;
        } catch (YAMLException e) {
            throw new ConfigurationException("Cannot parse settings file " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Threshold as a fraction. Values in [0, 1] are taken as they are, values in (1, 100]
     * as a percentage.
     *
     * @throws ConfigurationException for anything outside [0, 100]
     */
    public static double normalizeThreshold(double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 100.0) {
            throw new ConfigurationException(
                    "Threshold must be between 0 and 1 (or a percentage up to 100), got: " + value);
        }
        return value > 1.0 ? value / 100.0 : value;
    }

    /**
     * Build the matching configuration, applying CLI overrides where provided.
     *
     * @param settings Parsed settings file (may be empty)
     * @param cli      Command line values
     * @return Complete configuration
     */
    public static NearDupConfig loadConfig(Map<String, Object> settings, CliOverrides cli) {
        Map<String, Object> section = section(settings);

        // Determine preset (CLI > YAML)
        String preset = cli.preset() != null ? cli.preset() : getString(section, "preset", null);
        NearDupConfig base = NearDupConfig.forPreset(preset);

        int ngramSize = cli.ngramSize() != 0 ? cli.ngramSize() : getInt(section, "ngram_size", base.ngramSize());
        double threshold = cli.threshold() != null
                ? normalizeThreshold(cli.threshold())
                : getDouble(section, "threshold", base.threshold());

        HashStrategy strategy = cli.hashStrategy() != null
                ? cli.hashStrategy()
                : parseStrategy(getString(section, "hash_strategy", null), base.hashStrategy());

        int breakEven = getInt(section, "rolling_break_even", base.rollingBreakEven());
        int workers = cli.workers() != 0 ? cli.workers() : getInt(section, "workers", base.workers());

        AggregationMode aggregation = cli.countSpans()
                ? AggregationMode.SPANS
                : parseAggregation(getString(section, "aggregation", null));

        boolean collectMatches = getBoolean(section, "collect_matches", base.collectMatches());

        return new NearDupConfig(
                ngramSize,
                threshold,
                strategy,
                breakEven,
                workers,
                aggregation,
                collectMatches);
    }

    /**
     * Corpus directory from the settings file, or null if not specified.
     */
    public static @Nullable String getSearchDir(Map<String, Object> settings) {
        return getString(section(settings), "search_dir", null);
    }

    /**
     * Query file from the settings file, or null if not specified.
     */
    public static @Nullable String getQueryPath(Map<String, Object> settings) {
        return getString(section(settings), "query_path", null);
    }

    public static int getStartFileIdx(Map<String, Object> settings) {
        return getInt(section(settings), "start_file_idx", -1);
    }

    public static int getEndFileIdx(Map<String, Object> settings) {
        return getInt(section(settings), "end_file_idx", -1);
    }

    private static Map<String, Object> section(Map<String, Object> settings) {
        Object raw = settings.get(CONFIG_KEY);
        if (raw instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> section = (Map<String, Object>) raw;
            return section;
        }
        return Map.of();
    }

    private static HashStrategy parseStrategy(@Nullable String value, HashStrategy defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        try {
            return HashStrategy.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    private static AggregationMode parseAggregation(@Nullable String value) {
        if (value == null) {
            return AggregationMode.DOCUMENTS;
        }
        try {
            return AggregationMode.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Setting " + key + " must be an integer, got: " + value, e);
            }
        }
        return defaultValue;
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Setting " + key + " must be a number, got: " + value, e);
            }
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean(((String) value).trim());
        }
        return defaultValue;
    }

    private static @Nullable String getString(Map<String, Object> map, String key, @Nullable String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }
}
