package com.rebootearth.burnrisk.infrastructure.config;

import com.rebootearth.burnrisk.domain.model.ScoreScale;
import com.rebootearth.burnrisk.domain.model.ScoringPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Application configuration under the {@code app} prefix.
 *
 * Credentials for the geocoding and statistics backends are mandatory: a blank key
 * fails bean validation and the application does not start.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app")
public class BurnRiskProperties {

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Orchestrator orchestrator = new Orchestrator();

    @Valid
    private Geocoding geocoding = new Geocoding();

    @Valid
    private Weather weather = new Weather();

    @Valid
    private NearbyTowns nearbyTowns = new NearbyTowns();

    @Valid
    private StatisticsBackend statistics = new StatisticsBackend();

    @Valid
    private RiskOracle riskOracle = new RiskOracle();

    @Valid
    private Scoring scoring = new Scoring();

    @Valid
    private Precompute precompute = new Precompute();

    @Data
    public static class Cache {
        @NotBlank
        private String file = "data/burn-areas.json";
        @Min(0)
        private int gridDecimalPlaces = 2;
        @NotNull
        private Duration ttl = Duration.ofHours(24);
        @NotNull
        private Duration degradedTtl = Duration.ofHours(1);
    }

    @Data
    public static class Orchestrator {
        @NotNull
        private Duration deadlineMargin = Duration.ofSeconds(2);
        @Min(0)
        private int weatherPastDays = 7;
        @Min(0)
        private int weatherForecastDays = 7;
        @Min(1)
        private int maxPoolSize = 32;
        @NotNull
        private Duration idleThreadKeepAlive = Duration.ofSeconds(60);
        @Min(0)
        private int queueCapacity = 100;
    }

    @Data
    public static class Geocoding {
        @NotBlank
        private String baseUrl = "https://us1.locationiq.com";
        @NotBlank(message = "LOCATIONIQ_API_KEY must be set")
        private String apiKey;
        @NotNull
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Weather {
        @NotBlank
        private String baseUrl = "https://api.open-meteo.com";
        @NotNull
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    public static class NearbyTowns {
        @NotBlank
        private String overpassUrl = "https://overpass-api.de/api";
        @NotBlank
        private String countyUrl = "https://geo.fcc.gov";
        @Min(1)
        private int radiusMeters = 5000;
        @NotNull
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class StatisticsBackend {
        @NotBlank
        private String baseUrl = "https://api.openai.com/v1";
        @NotBlank(message = "OPENAI_API_KEY must be set")
        private String apiKey;
        @NotBlank
        private String researchModel = "gpt-4o-mini-search-preview";
        @NotBlank
        private String extractionModel = "gpt-4o-mini";
        @DecimalMin("0.0")
        @DecimalMax("2.0")
        private double temperature = 0.1;
        @NotNull
        private Duration timeout = Duration.ofSeconds(90);
    }

    @Data
    public static class RiskOracle {
        @NotBlank
        private String baseUrl = "http://localhost:8000";
        @NotNull
        private ScoreScale scale = ScoreScale.UNIT;
        @NotNull
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Scoring {
        @DecimalMin("0.0")
        private double riskWeight = 0.70;
        @DecimalMin("0.0")
        private double statisticsWeight = 0.15;
        @DecimalMin("0.0")
        private double weatherWeight = 0.05;
        @DecimalMin("0.0")
        private double exposureWeight = 0.10;
        @Min(1)
        private int populationSaturation = 100_000;
        @DecimalMin("1.0")
        private double valueSaturation = 1.0e10;
        @DecimalMin("0.0")
        private double managementOrganizationsWeight = 1.0;
        @DecimalMin("0.0")
        private double projectLogisticsWeight = 1.0;
        @DecimalMin("0.0")
        private double constraintsWeight = 1.0;

        public ScoringPolicy toPolicy() {
            return ScoringPolicy.builder()
                    .riskWeight(riskWeight)
                    .statisticsWeight(statisticsWeight)
                    .weatherWeight(weatherWeight)
                    .exposureWeight(exposureWeight)
                    .populationSaturation(populationSaturation)
                    .valueSaturation(valueSaturation)
                    .managementOrganizationsWeight(managementOrganizationsWeight)
                    .projectLogisticsWeight(projectLogisticsWeight)
                    .constraintsWeight(constraintsWeight)
                    .build();
        }
    }

    @Data
    public static class Precompute {
        private boolean enabled = false;
        @Valid
        private List<Location> locations = new ArrayList<>();

        @Data
        public static class Location {
            @NotNull
            private BigDecimal lat;
            @NotNull
            private BigDecimal lng;
            private LocalDate lastBurnDate;
        }
    }
}
