package com.rebootearth.burnrisk.api.controller;

import com.rebootearth.burnrisk.application.exception.ResolutionTimeoutException;
import com.rebootearth.burnrisk.application.mapper.BurnAreaMapper;
import com.rebootearth.burnrisk.application.port.in.QueryBurnAreasUseCase;
import com.rebootearth.burnrisk.application.port.in.ResolveBurnAreaUseCase;
import com.rebootearth.burnrisk.domain.model.BurnArea;
import com.rebootearth.burnrisk.domain.model.Resolution;
import com.rebootearth.burnrisk.domain.model.UpstreamSource;
import com.rebootearth.burnrisk.module.test.support.TestFixtures;
import com.rebootearth.burnrisk.presentation.exception.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class BurnAreaControllerTest {

    @Mock
    private ResolveBurnAreaUseCase resolveBurnAreaUseCase;

    @Mock
    private QueryBurnAreasUseCase queryBurnAreasUseCase;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        BurnAreaController controller = new BurnAreaController(resolveBurnAreaUseCase, queryBurnAreasUseCase,
                new BurnAreaMapper());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void testGetBurnArea_StaleEntryReportsSourceAndDegradation() throws Exception {
        BurnArea burnArea = TestFixtures.burnArea(TestFixtures.location("34.05", "-118.24"), 0.66);
        when(resolveBurnAreaUseCase.resolve(any()))
                .thenReturn(Resolution.stale(burnArea, List.of(UpstreamSource.values())));

        mockMvc.perform(get("/v1").param("lat", "34.05").param("lng", "-118.24"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source").value("stale"))
                .andExpect(jsonPath("$.degraded").value(true))
                .andExpect(jsonPath("$['degraded-sources'].length()").value(5))
                .andExpect(jsonPath("$['threat-level']").value(4));
    }

    @Test
    void testGetBurnArea_Timeout_Returns504() throws Exception {
        when(resolveBurnAreaUseCase.resolve(any()))
                .thenThrow(new ResolutionTimeoutException("Resolution of 34.05:-118.24 exceeded PT1M32S",
                        new TimeoutException()));

        mockMvc.perform(get("/v1").param("lat", "34.05").param("lng", "-118.24"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.code").value("RESOLUTION_TIMEOUT"));
    }

    @Test
    void testGetBurnArea_UnexpectedError_Returns500WithoutDetails() throws Exception {
        when(resolveBurnAreaUseCase.resolve(any())).thenThrow(new IllegalStateException("executor on fire"));

        mockMvc.perform(get("/v1").param("lat", "34.05").param("lng", "-118.24"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.error").value("An unexpected error occurred"));
    }

    @Test
    void testListBurnAreas_UnitScale() throws Exception {
        when(queryBurnAreasUseCase.listBurnAreas()).thenReturn(List.of(
                TestFixtures.burnArea(TestFixtures.location("40.05", "-122.74"), 0.9),
                TestFixtures.burnArea(TestFixtures.location("36.07", "-121.03"), 0.3)));

        mockMvc.perform(get("/v0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0]['calculated-threat-rating']").value(0.9))
                .andExpect(jsonPath("$[0].source").doesNotExist());
    }

    @Test
    void testListBurnAreas_DecileScale() throws Exception {
        when(queryBurnAreasUseCase.listBurnAreas()).thenReturn(List.of(
                TestFixtures.burnArea(TestFixtures.location("40.05", "-122.74"), 0.9)));

        mockMvc.perform(get("/v0").param("scale", "decile"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]['calculated-threat-rating']").value(9.0))
                .andExpect(jsonPath("$[0]['threat-level']").value(5));
    }

    @Test
    void testListBurnAreas_UnknownScale_Returns400() throws Exception {
        mockMvc.perform(get("/v0").param("scale", "percent"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_INPUT"));
    }

    @Test
    void testGetBurnArea_InternalInvariantFailure_Returns500() throws Exception {
        when(resolveBurnAreaUseCase.resolve(any()))
                .thenThrow(new IllegalArgumentException("calculatedThreatRating must be within [0,1] but was 1.4"));

        mockMvc.perform(get("/v1").param("lat", "34.05").param("lng", "-118.24"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.error").value("An unexpected error occurred"));
    }
}
