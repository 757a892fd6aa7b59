package io.stelli.core.config;

import io.stelli.core.engine.FilterEngine;
import io.stelli.core.engine.ListViewEngine;
import io.stelli.core.engine.SortEngine;
import io.stelli.core.engine.ViewCache;
import io.stelli.core.validation.RatingPrecision;
import io.stelli.core.validation.ValidationEngine;
import io.stelli.core.validation.ValidationOptions;
import java.time.Clock;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Engine configuration. Every field has a default; use {@link #builder()} or {@link #DEFAULT}.
 *
 * @param starsMinimum       lowest valid star rating
 * @param starsPrecision     precision of star ratings
 * @param pointsPrecision    precision of point ratings
 * @param scalePrecision     precision of scale ratings
 * @param scaleMaxFromConfig whether scale lists honour {@code ratingConfig.max}
 * @param zone               zone defining calendar days for date filters
 * @param dateWindowDays     length of the default date filter window
 * @param cacheMaxEntries    views retained by the render cache; 0 disables it
 */
public record EngineConfig(
        double starsMinimum,
        RatingPrecision starsPrecision,
        RatingPrecision pointsPrecision,
        RatingPrecision scalePrecision,
        boolean scaleMaxFromConfig,
        ZoneId zone,
        int dateWindowDays,
        int cacheMaxEntries) {

    public static final EngineConfig DEFAULT = builder().build();

    public EngineConfig {
        ValidationOptions.requireValid(starsMinimum, starsPrecision, pointsPrecision, scalePrecision);
        Objects.requireNonNull(zone, "zone must not be null");
        if (dateWindowDays <= 0) {
            throw new IllegalArgumentException("dateWindowDays must be positive, got: " + dateWindowDays);
        }
        if (cacheMaxEntries < 0) {
            throw new IllegalArgumentException("cacheMaxEntries must not be negative, got: " + cacheMaxEntries);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /** The rating options, validated on construction. */
    public ValidationOptions validationOptions() {
        return new ValidationOptions(starsMinimum, starsPrecision, pointsPrecision, scalePrecision, scaleMaxFromConfig);
    }

    public ValidationEngine validationEngine() {
        return new ValidationEngine(validationOptions());
    }

    /** A filter engine reading the system clock in {@link #zone()}. */
    public FilterEngine filterEngine() {
        return filterEngine(Clock.system(zone));
    }

    public FilterEngine filterEngine(Clock clock) {
        return new FilterEngine(validationOptions(), clock, dateWindowDays);
    }

    /** A new render cache, or {@code null} when caching is disabled. */
    public ViewCache viewCache() {
        return cacheMaxEntries == 0 ? null : new ViewCache(cacheMaxEntries);
    }

    /** A view engine wired from this configuration. */
    public ListViewEngine listViewEngine() {
        return new ListViewEngine(new SortEngine(), filterEngine(), viewCache());
    }

    /** Builder for {@link EngineConfig}. */
    public static final class Builder {

        private double starsMinimum = ValidationOptions.DEFAULT.starsMinimum();
        private RatingPrecision starsPrecision = ValidationOptions.DEFAULT.starsPrecision();
        private RatingPrecision pointsPrecision = ValidationOptions.DEFAULT.pointsPrecision();
        private RatingPrecision scalePrecision = ValidationOptions.DEFAULT.scalePrecision();
        private boolean scaleMaxFromConfig = ValidationOptions.DEFAULT.scaleMaxFromConfig();
        private ZoneId zone = ZoneId.of("UTC");
        private int dateWindowDays = FilterEngine.DEFAULT_DATE_WINDOW_DAYS;
        private int cacheMaxEntries = 64;

        private Builder() {}

        public Builder starsMinimum(double starsMinimum) {
            this.starsMinimum = starsMinimum;
            return this;
        }

        public Builder starsPrecision(RatingPrecision starsPrecision) {
            this.starsPrecision = starsPrecision;
            return this;
        }

        public Builder pointsPrecision(RatingPrecision pointsPrecision) {
            this.pointsPrecision = pointsPrecision;
            return this;
        }

        public Builder scalePrecision(RatingPrecision scalePrecision) {
            this.scalePrecision = scalePrecision;
            return this;
        }

        public Builder scaleMaxFromConfig(boolean scaleMaxFromConfig) {
            this.scaleMaxFromConfig = scaleMaxFromConfig;
            return this;
        }

        public Builder zone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        public Builder dateWindowDays(int dateWindowDays) {
            this.dateWindowDays = dateWindowDays;
            return this;
        }

        public Builder cacheMaxEntries(int cacheMaxEntries) {
            this.cacheMaxEntries = cacheMaxEntries;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(
                    starsMinimum,
                    starsPrecision,
                    pointsPrecision,
                    scalePrecision,
                    scaleMaxFromConfig,
                    zone,
                    dateWindowDays,
                    cacheMaxEntries);
        }
    }
}
