package com.rebootearth.burnrisk.api.controller;

import com.rebootearth.burnrisk.api.dto.BurnAreaResponseDto;
import com.rebootearth.burnrisk.application.exception.InvalidRequestException;
import com.rebootearth.burnrisk.application.mapper.BurnAreaMapper;
import com.rebootearth.burnrisk.application.port.in.QueryBurnAreasUseCase;
import com.rebootearth.burnrisk.application.port.in.ResolveBurnAreaUseCase;
import com.rebootearth.burnrisk.domain.model.LocationQuery;
import com.rebootearth.burnrisk.domain.model.Resolution;
import com.rebootearth.burnrisk.domain.model.ScoreScale;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;

/**
 * Controller for the burn map dashboard.
 * GET /v0 lists precomputed burn areas; /v1 resolves or invalidates a single location.
 */
@RestController
@Validated
public class BurnAreaController {

    private static final Logger logger = LoggerFactory.getLogger(BurnAreaController.class);

    private final ResolveBurnAreaUseCase resolveBurnAreaUseCase;
    private final QueryBurnAreasUseCase queryBurnAreasUseCase;
    private final BurnAreaMapper burnAreaMapper;

    public BurnAreaController(
        ResolveBurnAreaUseCase resolveBurnAreaUseCase,
        QueryBurnAreasUseCase queryBurnAreasUseCase,
        BurnAreaMapper burnAreaMapper
    ) {
        this.resolveBurnAreaUseCase = resolveBurnAreaUseCase;
        this.queryBurnAreasUseCase = queryBurnAreasUseCase;
        this.burnAreaMapper = burnAreaMapper;
    }

    /**
     * GET /v0[?scale=unit|decile]
     *
     * All cached burn areas, highest calculated threat first. Never computes.
     */
    @GetMapping("/v0")
    public ResponseEntity<List<BurnAreaResponseDto>> listBurnAreas(
        @RequestParam(required = false) String scale
    ) {
        ScoreScale presentation = presentationScale(scale);
        List<BurnAreaResponseDto> response = queryBurnAreasUseCase.listBurnAreas().stream()
            .map(burnArea -> burnAreaMapper.toDto(burnArea, presentation))
            .toList();
        return ResponseEntity.ok(response);
    }

    /**
     * GET /v1?lat=X&lng=Y[&scale=unit|decile]
     *
     * Resolve one location.
     * Strategy: Cache-first → single-flight computation → write-through cache
     *
     * @param lat Latitude (-90 to 90)
     * @param lng Longitude (-180 to 180)
     * @param scale presentation scale for score fields, {@code unit} by default
     * @return burn area with degradation details and source indicator (cache/computed/stale)
     */
    @GetMapping("/v1")
    public ResponseEntity<BurnAreaResponseDto> getBurnArea(
        @RequestParam @NotNull(message = "Latitude is required")
        @DecimalMin(value = "-90.0", message = "Latitude must be between -90 and 90")
        @DecimalMax(value = "90.0", message = "Latitude must be between -90 and 90")
        BigDecimal lat,

        @RequestParam @NotNull(message = "Longitude is required")
        @DecimalMin(value = "-180.0", message = "Longitude must be between -180 and 180")
        @DecimalMax(value = "180.0", message = "Longitude must be between -180 and 180")
        BigDecimal lng,

        @RequestParam(required = false) String scale
    ) {
        ScoreScale presentation = presentationScale(scale);
        logger.info("Resolving burn area: lat={}, lng={}, scale={}", lat, lng, presentation);

        Resolution resolution = resolveBurnAreaUseCase.resolve(locationQuery(lat, lng));
        return ResponseEntity.ok(burnAreaMapper.toDto(resolution, presentation));
    }

    /**
     * DELETE /v1?lat=X&lng=Y
     *
     * Drop the cached burn area for the grid cell. Idempotent.
     */
    @DeleteMapping("/v1")
    public ResponseEntity<Void> invalidateBurnArea(
        @RequestParam @NotNull(message = "Latitude is required")
        @DecimalMin(value = "-90.0", message = "Latitude must be between -90 and 90")
        @DecimalMax(value = "90.0", message = "Latitude must be between -90 and 90")
        BigDecimal lat,

        @RequestParam @NotNull(message = "Longitude is required")
        @DecimalMin(value = "-180.0", message = "Longitude must be between -180 and 180")
        @DecimalMax(value = "180.0", message = "Longitude must be between -180 and 180")
        BigDecimal lng
    ) {
        boolean removed = resolveBurnAreaUseCase.invalidate(locationQuery(lat, lng));
        logger.info("Invalidate burn area: lat={}, lng={}, removed={}", lat, lng, removed);
        return ResponseEntity.noContent().build();
    }

    private static ScoreScale presentationScale(String scale) {
        try {
            return ScoreScale.fromParameter(scale);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(e.getMessage(), e);
        }
    }

    private static LocationQuery locationQuery(BigDecimal lat, BigDecimal lng) {
        try {
            return new LocationQuery(lat, lng);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(e.getMessage(), e);
        }
    }
}
