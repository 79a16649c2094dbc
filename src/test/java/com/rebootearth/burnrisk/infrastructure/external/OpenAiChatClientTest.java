package com.rebootearth.burnrisk.infrastructure.external;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebootearth.burnrisk.application.exception.MalformedUpstreamResponseException;
import com.rebootearth.burnrisk.application.exception.UpstreamUnavailableException;
import com.rebootearth.burnrisk.infrastructure.config.BurnRiskProperties;
import com.rebootearth.burnrisk.module.test.support.StubExchangeFunction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiChatClientTest {

    private final StubExchangeFunction exchange = new StubExchangeFunction();
    private OpenAiChatClient client;

    @BeforeEach
    void setUp() {
        BurnRiskProperties properties = new BurnRiskProperties();
        properties.getStatistics().setBaseUrl("https://openai.test/v1");
        properties.getStatistics().setApiKey("sk-test");
        client = new OpenAiChatClient(exchange.builder(), new ObjectMapper(), properties);
    }

    @Test
    void testComplete_ReturnsFirstChoiceContent() {
        exchange.respondJson("{\"id\":\"chatcmpl-1\",\"choices\":[{\"index\":0,"
                + "\"message\":{\"role\":\"assistant\",\"content\":\"Dense chaparral on steep slopes.\"}}]}");

        String content = client.complete("gpt-4o-mini", "system", "user", 0.1, null);

        assertThat(content).isEqualTo("Dense chaparral on steep slopes.");
        assertThat(exchange.lastRequest().url().getPath()).isEqualTo("/v1/chat/completions");
        assertThat(exchange.lastRequest().headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer sk-test");
    }

    @Test
    void testComplete_NoContent_Malformed() {
        exchange.respondJson("{\"choices\":[]}");

        assertThatThrownBy(() -> client.complete("gpt-4o-mini", "system", "user", null, null))
                .isInstanceOf(MalformedUpstreamResponseException.class);
    }

    @Test
    void testComplete_ServerError_Unavailable() {
        exchange.respond(HttpStatus.SERVICE_UNAVAILABLE, "{\"error\":{\"message\":\"overloaded\"}}");

        assertThatThrownBy(() -> client.complete("gpt-4o-mini", "system", "user", null, null))
                .isInstanceOf(UpstreamUnavailableException.class);
    }
}
