package com.rebootearth.burnrisk.infrastructure.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rebootearth.burnrisk.application.exception.MalformedUpstreamResponseException;
import com.rebootearth.burnrisk.application.port.out.StatisticsGenerator;
import com.rebootearth.burnrisk.domain.model.Statistics;
import com.rebootearth.burnrisk.domain.model.StatisticsFactor;
import com.rebootearth.burnrisk.domain.model.StatisticsResult;
import com.rebootearth.burnrisk.domain.service.StatisticsValidator;
import com.rebootearth.burnrisk.infrastructure.config.BurnRiskProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

/**
 * Two-stage statistics generation: a web-search model gathers findings about the
 * location, then a second model extracts the eleven factors under a strict JSON schema.
 *
 * A rejected extraction is re-prompted once. After that the result is a fallback:
 * partial values topped up with 0.5 when only keys were missing, all 0.5 otherwise.
 */
@Service
public class OpenAiStatisticsGenerator implements StatisticsGenerator {

    private static final Logger logger = LoggerFactory.getLogger(OpenAiStatisticsGenerator.class);

    static final String RESEARCH_SYSTEM_PROMPT = """
        You support prescribed burn planning. Search the web for current, location-specific \
        information and report it as plain prose. Be concrete and cite place names. If nothing \
        reliable is found for a topic, say so instead of guessing.""";

    static final String EXTRACTION_SYSTEM_PROMPT = """
        You convert research notes about a prescribed burn site into complexity ratings. \
        Rate each element from 0.00 (low complexity, favourable) to 1.00 (high complexity, \
        adverse), rounded to two decimals. Use 0.20 for low, 0.50 for moderate and 0.80 for high \
        when the notes only support a qualitative judgement, and 0.50 when they say nothing. \
        Reply with a single JSON object matching the schema and nothing else.""";

    private final OpenAiChatClient chatClient;
    private final StatisticsValidator validator;
    private final ObjectMapper objectMapper;
    private final String researchModel;
    private final String extractionModel;
    private final double temperature;
    private final JsonNode responseFormat;

    public OpenAiStatisticsGenerator(
        OpenAiChatClient chatClient,
        StatisticsValidator validator,
        ObjectMapper objectMapper,
        BurnRiskProperties properties
    ) {
        BurnRiskProperties.StatisticsBackend config = properties.getStatistics();
        this.chatClient = chatClient;
        this.validator = validator;
        this.objectMapper = objectMapper;
        this.researchModel = config.getResearchModel();
        this.extractionModel = config.getExtractionModel();
        this.temperature = config.getTemperature();
        this.responseFormat = buildResponseFormat();
    }

    @Override
    public StatisticsResult generateStatistics(BigDecimal lat, BigDecimal lng, String placeName) {
        String location = describeLocation(lat, lng, placeName);
        logger.info("Generating statistics for {}", location);

        String findings = chatClient.complete(researchModel, RESEARCH_SYSTEM_PROMPT,
            researchPrompt(location), null, null);

        StatisticsValidator.Validation first = extract(extractionPrompt(location, findings));
        if (first.isValid()) {
            return StatisticsResult.generated(first.getStatistics());
        }
        logger.warn("Statistics rejected for {}: {}; re-prompting", location, first.getProblems());

        StatisticsValidator.Validation second = extract(strictPrompt(location, findings, first.getProblems()));
        if (second.isValid()) {
            return StatisticsResult.generated(second.getStatistics());
        }

        String reason = "statistics rejected twice: " + String.join("; ", second.getProblems());
        if (second.isOnlyMissingKeys()) {
            logger.warn("Filling missing statistics for {} with neutral values: {}", location, second.getProblems());
            return StatisticsResult.fallback(Statistics.withNeutralDefaults(second.getAcceptedFactors()), reason);
        }
        logger.warn("Using neutral statistics for {}: {}", location, second.getProblems());
        return StatisticsResult.neutralFallback(reason);
    }

    private StatisticsValidator.Validation extract(String prompt) {
        String content;
        try {
            content = chatClient.complete(extractionModel, EXTRACTION_SYSTEM_PROMPT, prompt,
                temperature, responseFormat);
        } catch (MalformedUpstreamResponseException e) {
            // An empty completion is a content problem, not a transport one
            logger.debug("Extraction returned no content: {}", e.getMessage());
            content = null;
        }
        return validator.validate(content);
    }

    private static String describeLocation(BigDecimal lat, BigDecimal lng, String placeName) {
        String coordinates = lat.toPlainString() + ", " + lng.toPlainString();
        return placeName == null ? coordinates : placeName + " (" + coordinates + ")";
    }

    static String researchPrompt(String location) {
        return "Location: " + location + "\n\n"
            + "Describe the fire management context of this location:\n"
            + "- firefighting resources and emergency medical services nearby\n"
            + "- hazards to crews and the public\n"
            + "- fuel types, vegetation density and fuel load\n"
            + "- terrain, slope and prevailing winds\n"
            + "- ignition likelihood and fire history\n"
            + "- difficulty of containment and suppression constraints\n"
            + "- road access and accessibility for equipment\n";
    }

    static String extractionPrompt(String location, String findings) {
        return "Location: " + location + "\n\nResearch notes:\n" + findings + "\n\n"
            + "Rate every element of the schema for this location.";
    }

    static String strictPrompt(String location, String findings, List<String> problems) {
        return extractionPrompt(location, findings) + "\n\n"
            + "Your previous answer was rejected: " + String.join("; ", problems) + ".\n"
            + "Every one of these keys is required and must be a number between 0 and 1: "
            + String.join(", ", factorKeys()) + ".\n"
            + "Return only the JSON object.";
    }

    private static List<String> factorKeys() {
        return Arrays.stream(StatisticsFactor.values()).map(StatisticsFactor::getKey).toList();
    }

    /**
     * {@code response_format} demanding {"statistics": {eleven numeric keys}}.
     */
    private JsonNode buildResponseFormat() {
        ObjectNode factors = objectMapper.createObjectNode();
        factors.put("type", "object");
        ObjectNode properties = factors.putObject("properties");
        ArrayNode required = factors.putArray("required");
        for (StatisticsFactor factor : StatisticsFactor.values()) {
            properties.putObject(factor.getKey()).put("type", "number");
            required.add(factor.getKey());
        }
        factors.put("additionalProperties", false);

        ObjectNode schema = objectMapper.createObjectNode();
        schema.put("type", "object");
        schema.putObject("properties").set("statistics", factors);
        schema.putArray("required").add("statistics");
        schema.put("additionalProperties", false);

        ObjectNode format = objectMapper.createObjectNode();
        format.put("type", "json_schema");
        ObjectNode jsonSchema = format.putObject("json_schema");
        jsonSchema.put("name", "burn_statistics");
        jsonSchema.put("strict", true);
        jsonSchema.set("schema", schema);
        return format;
    }
}
