package com.rebootearth.burnrisk.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebootearth.burnrisk.domain.model.ScoringPolicy;
import com.rebootearth.burnrisk.domain.service.CompositeScoreCalculator;
import com.rebootearth.burnrisk.domain.service.StatisticsValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the pure scoring components with their configured policy.
 */
@Configuration
public class ScoringConfig {

    private static final Logger logger = LoggerFactory.getLogger(ScoringConfig.class);

    @Bean
    public CompositeScoreCalculator compositeScoreCalculator(BurnRiskProperties properties) {
        ScoringPolicy policy = properties.getScoring().toPolicy();
        logger.info("Scoring policy: {}", policy);
        return new CompositeScoreCalculator(policy);
    }

    @Bean
    public StatisticsValidator statisticsValidator(ObjectMapper objectMapper) {
        return new StatisticsValidator(objectMapper);
    }
}
