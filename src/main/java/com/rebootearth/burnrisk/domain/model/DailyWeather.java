package com.rebootearth.burnrisk.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Daily weather aggregates. A value is null when the provider had no reading for that day.
 */
@Getter
@EqualsAndHashCode
@ToString
public class DailyWeather {

    /** Degrees Fahrenheit. */
    @JsonProperty("temperature-mean")
    private final Double temperatureMean;

    /** Kilometres per hour at 10 m. */
    @JsonProperty("wind-speed-mean")
    private final Double windSpeedMean;

    /** Millimetres. */
    @JsonProperty("precipitation-sum")
    private final Double precipitationSum;

    @JsonCreator
    public DailyWeather(
            @JsonProperty("temperature-mean") Double temperatureMean,
            @JsonProperty("wind-speed-mean") Double windSpeedMean,
            @JsonProperty("precipitation-sum") Double precipitationSum) {
        this.temperatureMean = temperatureMean;
        this.windSpeedMean = windSpeedMean;
        this.precipitationSum = precipitationSum;
    }
}
