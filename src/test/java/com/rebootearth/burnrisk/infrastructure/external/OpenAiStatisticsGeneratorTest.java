package com.rebootearth.burnrisk.infrastructure.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebootearth.burnrisk.application.exception.MalformedUpstreamResponseException;
import com.rebootearth.burnrisk.application.exception.UpstreamTimeoutException;
import com.rebootearth.burnrisk.domain.model.Statistics;
import com.rebootearth.burnrisk.domain.model.StatisticsFactor;
import com.rebootearth.burnrisk.domain.model.StatisticsResult;
import com.rebootearth.burnrisk.domain.model.UpstreamSource;
import com.rebootearth.burnrisk.domain.service.StatisticsValidator;
import com.rebootearth.burnrisk.infrastructure.config.BurnRiskProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OpenAiStatisticsGeneratorTest {

    private static final String RESEARCH_MODEL = "research-model";
    private static final String EXTRACTION_MODEL = "extraction-model";
    private static final BigDecimal LAT = new BigDecimal("34.05");
    private static final BigDecimal LNG = new BigDecimal("-118.24");
    private static final String PLACE = "Los Angeles, California";

    @Mock
    private OpenAiChatClient chatClient;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private OpenAiStatisticsGenerator generator;

    @BeforeEach
    void setUp() {
        BurnRiskProperties properties = new BurnRiskProperties();
        properties.getStatistics().setResearchModel(RESEARCH_MODEL);
        properties.getStatistics().setExtractionModel(EXTRACTION_MODEL);
        properties.getStatistics().setTemperature(0.1);
        generator = new OpenAiStatisticsGenerator(chatClient, new StatisticsValidator(objectMapper),
                objectMapper, properties);
    }

    private void researchReturns(String notes) {
        when(chatClient.complete(eq(RESEARCH_MODEL), anyString(), anyString(), isNull(), isNull()))
                .thenReturn(notes);
    }

    private String statisticsJson(double value, String... omitted) throws Exception {
        Map<String, Object> factors = new LinkedHashMap<>();
        for (StatisticsFactor factor : StatisticsFactor.values()) {
            factors.put(factor.getKey(), value);
        }
        for (String key : omitted) {
            factors.remove(key);
        }
        return objectMapper.writeValueAsString(Map.of("statistics", factors));
    }

    @Test
    void testGenerate_ValidExtraction() throws Exception {
        researchReturns("Steep chaparral, limited road access.");
        when(chatClient.complete(eq(EXTRACTION_MODEL), anyString(), anyString(), eq(0.1), any()))
                .thenReturn(statisticsJson(0.7));

        StatisticsResult result = generator.generateStatistics(LAT, LNG, PLACE);

        assertThat(result.isFallback()).isFalse();
        assertThat(result.getStatistics().get(StatisticsFactor.FIRE_BEHAVIOR)).isEqualTo(0.7);
        verify(chatClient, times(1)).complete(eq(EXTRACTION_MODEL), anyString(), anyString(), eq(0.1), any());
    }

    @Test
    void testGenerate_PromptsNamePlaceAndSchema() throws Exception {
        researchReturns("notes");
        when(chatClient.complete(eq(EXTRACTION_MODEL), anyString(), anyString(), eq(0.1), any()))
                .thenReturn(statisticsJson(0.4));
        ArgumentCaptor<String> researchPrompt = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<JsonNode> format = ArgumentCaptor.forClass(JsonNode.class);

        generator.generateStatistics(LAT, LNG, PLACE);

        verify(chatClient).complete(eq(RESEARCH_MODEL), eq(OpenAiStatisticsGenerator.RESEARCH_SYSTEM_PROMPT),
                researchPrompt.capture(), isNull(), isNull());
        verify(chatClient).complete(eq(EXTRACTION_MODEL), eq(OpenAiStatisticsGenerator.EXTRACTION_SYSTEM_PROMPT),
                anyString(), eq(0.1), format.capture());
        assertThat(researchPrompt.getValue()).contains(PLACE, "34.05, -118.24");
        assertThat(format.getValue().at("/json_schema/strict").asBoolean()).isTrue();
        assertThat(format.getValue().at("/json_schema/schema/properties/statistics/required")).hasSize(11);
    }

    @Test
    void testGenerate_InvalidThenValid_Reprompts() throws Exception {
        researchReturns("notes");
        when(chatClient.complete(eq(EXTRACTION_MODEL), anyString(), anyString(), eq(0.1), any()))
                .thenReturn("I cannot rate this location.", statisticsJson(0.3));

        StatisticsResult result = generator.generateStatistics(LAT, LNG, PLACE);

        assertThat(result.isFallback()).isFalse();
        ArgumentCaptor<String> prompts = ArgumentCaptor.forClass(String.class);
        verify(chatClient, times(2)).complete(eq(EXTRACTION_MODEL), anyString(), prompts.capture(), eq(0.1), any());
        assertThat(prompts.getAllValues().get(1)).contains("Your previous answer was rejected", "smoke-management");
    }

    @Test
    void testGenerate_MalformedTwice_NeutralFallback() {
        researchReturns("notes");
        when(chatClient.complete(eq(EXTRACTION_MODEL), anyString(), anyString(), eq(0.1), any()))
                .thenReturn("not json", "{\"statistics\": \"n/a\"}");

        StatisticsResult result = generator.generateStatistics(LAT, LNG, PLACE);

        assertThat(result.isFallback()).isTrue();
        assertThat(result.getStatistics()).isEqualTo(Statistics.neutral());
        assertThat(result.getReason()).contains("rejected twice");
    }

    @Test
    void testGenerate_MissingKeysTwice_PartialFill() throws Exception {
        researchReturns("notes");
        String partial = statisticsJson(0.9, "safety", "constraints");
        when(chatClient.complete(eq(EXTRACTION_MODEL), anyString(), anyString(), eq(0.1), any()))
                .thenReturn(partial, partial);

        StatisticsResult result = generator.generateStatistics(LAT, LNG, PLACE);

        assertThat(result.isFallback()).isTrue();
        assertThat(result.getStatistics().get(StatisticsFactor.FIRE_BEHAVIOR)).isEqualTo(0.9);
        assertThat(result.getStatistics().get(StatisticsFactor.SAFETY)).isEqualTo(Statistics.NEUTRAL_VALUE);
        assertThat(result.getStatistics().get(StatisticsFactor.CONSTRAINTS)).isEqualTo(Statistics.NEUTRAL_VALUE);
    }

    @Test
    void testGenerate_OutOfRangeTwice_NeutralFallbackWithoutClamping() throws Exception {
        researchReturns("notes");
        String outOfRange = statisticsJson(1.4);
        when(chatClient.complete(eq(EXTRACTION_MODEL), anyString(), anyString(), eq(0.1), any()))
                .thenReturn(outOfRange, outOfRange);

        StatisticsResult result = generator.generateStatistics(LAT, LNG, PLACE);

        assertThat(result.isFallback()).isTrue();
        assertThat(result.getStatistics()).isEqualTo(Statistics.neutral());
    }

    @Test
    void testGenerate_EmptyExtractionCountsAsRejection() throws Exception {
        researchReturns("notes");
        when(chatClient.complete(eq(EXTRACTION_MODEL), anyString(), anyString(), eq(0.1), any()))
                .thenThrow(new MalformedUpstreamResponseException(UpstreamSource.STATISTICS, "no content"))
                .thenReturn(statisticsJson(0.2));

        StatisticsResult result = generator.generateStatistics(LAT, LNG, PLACE);

        assertThat(result.isFallback()).isFalse();
        assertThat(result.getStatistics().get(StatisticsFactor.SMOKE_MANAGEMENT)).isEqualTo(0.2);
    }

    @Test
    void testGenerate_ResearchTransportFailurePropagates() {
        when(chatClient.complete(eq(RESEARCH_MODEL), anyString(), anyString(), isNull(), isNull()))
                .thenThrow(new UpstreamTimeoutException(UpstreamSource.STATISTICS, "timed out"));

        assertThatThrownBy(() -> generator.generateStatistics(LAT, LNG, PLACE))
                .isInstanceOf(UpstreamTimeoutException.class);
        verify(chatClient, never()).complete(eq(EXTRACTION_MODEL), anyString(), anyString(), any(), any());
    }
}
