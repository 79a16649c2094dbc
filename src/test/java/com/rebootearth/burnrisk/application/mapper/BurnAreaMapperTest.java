package com.rebootearth.burnrisk.application.mapper;

import com.rebootearth.burnrisk.api.dto.BurnAreaResponseDto;
import com.rebootearth.burnrisk.domain.model.BurnArea;
import com.rebootearth.burnrisk.domain.model.Resolution;
import com.rebootearth.burnrisk.domain.model.ScoreScale;
import com.rebootearth.burnrisk.domain.model.UpstreamSource;
import com.rebootearth.burnrisk.module.test.support.TestFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BurnAreaMapperTest {

    private final BurnAreaMapper mapper = new BurnAreaMapper();
    private final BurnArea burnArea = TestFixtures.burnArea(TestFixtures.location("34.05", "-118.24"), 0.81);

    @Test
    void testToDto_UnitScaleKeepsCanonicalValues() {
        BurnAreaResponseDto dto = mapper.toDto(burnArea, ScoreScale.UNIT);

        assertThat(dto.getId()).isEqualTo(burnArea.getId());
        assertThat(dto.getCalculatedThreatRating()).isEqualTo(0.81);
        assertThat(dto.getThreatRating()).isEqualTo(0.5);
        assertThat(dto.getStatistics()).hasSize(11).containsEntry("safety", 0.6);
        assertThat(dto.getThreatLevel()).isEqualTo(5);
        assertThat(dto.getDegraded()).isNull();
        assertThat(dto.getSource()).isNull();
    }

    @Test
    void testToDto_DecileScaleMultipliesScoresOnly() {
        BurnAreaResponseDto dto = mapper.toDto(burnArea, ScoreScale.DECILE);

        assertThat(dto.getCalculatedThreatRating()).isCloseTo(8.1, within(1e-9));
        assertThat(dto.getPreliminaryFeasibilityScore()).isCloseTo(4.0, within(1e-9));
        assertThat(dto.getStatistics().get("fire-behavior")).isCloseTo(6.0, within(1e-9));
        assertThat(dto.getTotalPopulation()).isEqualTo(10_000);
        assertThat(dto.getTotalValueEstimate()).isEqualTo(3.78e8);
        assertThat(dto.getThreatLevel()).isEqualTo(5);
    }

    @Test
    void testToDto_ResolutionCarriesDegradedSources() {
        Resolution resolution = Resolution.computed(burnArea,
                List.of(UpstreamSource.WEATHER, UpstreamSource.RISK_ORACLE));

        BurnAreaResponseDto dto = mapper.toDto(resolution, ScoreScale.UNIT);

        assertThat(dto.getDegraded()).isTrue();
        assertThat(dto.getDegradedSources()).containsExactly("weather", "risk-oracle");
        assertThat(dto.getSource()).isEqualTo("computed");
    }

    @Test
    void testToDto_CacheHitIsNotDegraded() {
        BurnAreaResponseDto dto = mapper.toDto(Resolution.fromCache(burnArea), ScoreScale.UNIT);

        assertThat(dto.getDegraded()).isFalse();
        assertThat(dto.getDegradedSources()).isEmpty();
        assertThat(dto.getSource()).isEqualTo("cache");
    }

    @Test
    void testThreatLevel_EqualWidthBuckets() {
        assertThat(BurnAreaMapper.threatLevel(0.0)).isEqualTo(1);
        assertThat(BurnAreaMapper.threatLevel(0.19)).isEqualTo(1);
        assertThat(BurnAreaMapper.threatLevel(0.2)).isEqualTo(2);
        assertThat(BurnAreaMapper.threatLevel(0.5)).isEqualTo(3);
        assertThat(BurnAreaMapper.threatLevel(0.79)).isEqualTo(4);
        assertThat(BurnAreaMapper.threatLevel(0.8)).isEqualTo(5);
        assertThat(BurnAreaMapper.threatLevel(1.0)).isEqualTo(BurnAreaMapper.MAX_THREAT_LEVEL);
    }
}
