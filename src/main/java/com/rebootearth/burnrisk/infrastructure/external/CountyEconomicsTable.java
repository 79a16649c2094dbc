package com.rebootearth.burnrisk.infrastructure.external;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Optional;

/**
 * County GDP and population figures bundled with the application, used to attribute a
 * share of county output to each nearby town.
 */
@Component
public class CountyEconomicsTable {

    private static final Logger logger = LoggerFactory.getLogger(CountyEconomicsTable.class);

    static final String RESOURCE = "county-economics.json";

    private final Map<String, CountyEconomics> counties;

    @Autowired
    public CountyEconomicsTable(ObjectMapper objectMapper) {
        this(objectMapper, new ClassPathResource(RESOURCE));
    }

    CountyEconomicsTable(ObjectMapper objectMapper, ClassPathResource resource) {
        try (InputStream in = resource.getInputStream()) {
            this.counties = Map.copyOf(objectMapper.readValue(in, new TypeReference<Map<String, CountyEconomics>>() {
            }));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load county economics from " + resource.getPath(), e);
        }
        logger.info("Loaded economics for {} counties", counties.size());
    }

    public Optional<CountyEconomics> find(String county) {
        if (county == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(counties.get(county));
    }

    /**
     * Town value as its population share of county GDP. Zero when the county is unknown.
     */
    public double valueEstimate(String county, int townPopulation) {
        return find(county)
            .filter(economics -> economics.getPopulation() > 0)
            .map(economics -> economics.getGdp() * ((double) townPopulation / economics.getPopulation()))
            .orElse(0.0);
    }

    public int size() {
        return counties.size();
    }

    @Getter
    public static class CountyEconomics {
        private double gdp;
        private long population;

        CountyEconomics() {
        }

        public CountyEconomics(double gdp, long population) {
            this.gdp = gdp;
            this.population = population;
        }
    }
}
