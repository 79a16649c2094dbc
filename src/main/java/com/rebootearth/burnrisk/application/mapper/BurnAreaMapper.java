package com.rebootearth.burnrisk.application.mapper;

import com.rebootearth.burnrisk.api.dto.BurnAreaResponseDto;
import com.rebootearth.burnrisk.domain.model.BurnArea;
import com.rebootearth.burnrisk.domain.model.Resolution;
import com.rebootearth.burnrisk.domain.model.ScoreScale;
import com.rebootearth.burnrisk.domain.model.UpstreamSource;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mapper for converting burn areas into response DTOs.
 * The only place canonical scores are converted to a presentation scale.
 */
@Component
public class BurnAreaMapper {

  static final int MAX_THREAT_LEVEL = 5;

  /**
   * Maps a stored burn area, as listed by GET /v0.
   */
  public BurnAreaResponseDto toDto(BurnArea burnArea, ScoreScale scale) {
    Map<String, Double> statistics = new LinkedHashMap<>();
    burnArea.getStatistics().toJson().forEach((key, value) -> statistics.put(key, scale.present(value)));

    return BurnAreaResponseDto.builder()
        .id(burnArea.getId())
        .name(burnArea.getName())
        .coordinates(burnArea.getCoordinates())
        .statistics(statistics)
        .threatRating(scale.present(burnArea.getThreatRating()))
        .calculatedThreatRating(scale.present(burnArea.getCalculatedThreatRating()))
        .preliminaryFeasibilityScore(scale.present(burnArea.getPreliminaryFeasibilityScore()))
        .threatLevel(threatLevel(burnArea.getCalculatedThreatRating()))
        .totalPopulation(burnArea.getTotalPopulation())
        .totalValueEstimate(burnArea.getTotalValueEstimate())
        .lastBurnDate(burnArea.getLastBurnDate())
        .weather(burnArea.getWeather())
        .nearbyTowns(burnArea.getNearbyTowns())
        .build();
  }

  /**
   * Maps a resolution, as returned by GET /v1, including how it was obtained.
   */
  public BurnAreaResponseDto toDto(Resolution resolution, ScoreScale scale) {
    BurnAreaResponseDto dto = toDto(resolution.getBurnArea(), scale);
    dto.setDegraded(resolution.isDegraded());
    dto.setDegradedSources(resolution.getDegradedSources().stream().map(UpstreamSource::getId).toList());
    dto.setSource(resolution.getSource().id());
    return dto;
  }

  /**
   * Buckets a [0,1] rating into levels 1 to 5 of equal width.
   */
  static int threatLevel(double calculatedThreatRating) {
    int bucket = (int) Math.floor(calculatedThreatRating * MAX_THREAT_LEVEL);
    return 1 + Math.min(MAX_THREAT_LEVEL - 1, Math.max(0, bucket));
  }
}
