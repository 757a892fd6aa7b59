package io.stelli.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.stelli.core.error.ConfigLoadException;
import io.stelli.core.validation.RatingPrecision;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link EngineConfig} from a YAML file, then applies environment variable overrides.
 *
 * <pre>
 * validation:
 *   stars-minimum: 0.5            # STELLI_STARS_MINIMUM
 *   stars-precision: any          # STELLI_STARS_PRECISION
 *   points-precision: integer     # STELLI_POINTS_PRECISION
 *   scale-precision: integer      # STELLI_SCALE_PRECISION
 *   scale-max-from-config: true   # STELLI_SCALE_MAX_FROM_CONFIG
 * filters:
 *   zone: UTC                     # STELLI_ZONE
 *   default-date-window-days: 30  # STELLI_DATE_WINDOW_DAYS
 * cache:
 *   max-entries: 64               # STELLI_CACHE_MAX_ENTRIES
 * </pre>
 *
 * <p>Missing keys keep the {@link EngineConfig.Builder} defaults. An env var is "set" only if it
 * is defined and its trimmed value is non-empty; blank values leave the YAML value in place.
 */
public final class EngineConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(EngineConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private EngineConfigLoader() {
        // utility class
    }

    /** Loads the file at {@code configPath} with overrides from {@link System#getenv}. */
    public static EngineConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the file at {@code configPath} with overrides from {@code envLookup}, which returns
     * {@code null} for undefined variables.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or holds a bad value
     */
    public static EngineConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            EngineConfig config = mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
            LOG.info(
                    "config.loaded path={} zone={} date_window_days={} cache_max_entries={}",
                    configPath,
                    config.zone(),
                    config.dateWindowDays(),
                    config.cacheMaxEntries());
            return config;
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (IllegalArgumentException | DateTimeException e) {
            throw new ConfigLoadException("Invalid configuration in " + configPath + ": " + e.getMessage(), e);
        }
    }

    private static EngineConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        EngineConfig.Builder builder = EngineConfig.builder();

        JsonNode validation = root.path("validation");
        if (validation.has("stars-minimum"))
            builder.starsMinimum(validation.get("stars-minimum").asDouble());
        if (validation.has("stars-precision"))
            builder.starsPrecision(precision(validation.get("stars-precision").asText()));
        if (validation.has("points-precision"))
            builder.pointsPrecision(precision(validation.get("points-precision").asText()));
        if (validation.has("scale-precision"))
            builder.scalePrecision(precision(validation.get("scale-precision").asText()));
        if (validation.has("scale-max-from-config"))
            builder.scaleMaxFromConfig(validation.get("scale-max-from-config").asBoolean());

        JsonNode filters = root.path("filters");
        if (filters.has("zone")) builder.zone(ZoneId.of(filters.get("zone").asText()));
        if (filters.has("default-date-window-days"))
            builder.dateWindowDays(filters.get("default-date-window-days").asInt());

        JsonNode cache = root.path("cache");
        if (cache.has("max-entries")) builder.cacheMaxEntries(cache.get("max-entries").asInt());

        // --- Environment variable overlay ---
        env(envLookup, "STELLI_STARS_MINIMUM", v -> builder.starsMinimum(parseDouble("STELLI_STARS_MINIMUM", v)));
        env(envLookup, "STELLI_STARS_PRECISION", v -> builder.starsPrecision(precision(v)));
        env(envLookup, "STELLI_POINTS_PRECISION", v -> builder.pointsPrecision(precision(v)));
        env(envLookup, "STELLI_SCALE_PRECISION", v -> builder.scalePrecision(precision(v)));
        env(envLookup, "STELLI_SCALE_MAX_FROM_CONFIG", v -> builder.scaleMaxFromConfig(Boolean.parseBoolean(v)));
        env(envLookup, "STELLI_ZONE", v -> builder.zone(ZoneId.of(v)));
        env(envLookup, "STELLI_DATE_WINDOW_DAYS", v -> builder.dateWindowDays(parseInt("STELLI_DATE_WINDOW_DAYS", v)));
        env(envLookup, "STELLI_CACHE_MAX_ENTRIES",
                v -> builder.cacheMaxEntries(parseInt("STELLI_CACHE_MAX_ENTRIES", v)));

        return builder.build();
    }

    /** Applies an env var override if set. */
    private static void env(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        String value = envLookup.apply(envVar);
        if (value != null && !value.trim().isEmpty()) {
            setter.accept(value.trim());
        }
    }

    private static RatingPrecision precision(String name) {
        return RatingPrecision.fromWireName(name)
                .orElseThrow(() -> new ConfigLoadException(
                        "Unknown rating precision '" + name + "', expected any, one-decimal or integer"));
    }

    private static int parseInt(String envVar, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigLoadException("Invalid integer for " + envVar + ": '" + value + "'", e);
        }
    }

    private static double parseDouble(String envVar, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ConfigLoadException("Invalid number for " + envVar + ": '" + value + "'", e);
        }
    }
}
