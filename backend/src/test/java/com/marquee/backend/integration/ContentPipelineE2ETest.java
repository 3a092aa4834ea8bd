package com.marquee.backend.integration;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.marquee.backend.model.CircuitState;
import com.marquee.backend.model.ContentHistory;
import com.marquee.backend.repository.ContentHistoryRepository;
import com.marquee.backend.service.ContentOrchestrator;
import com.marquee.backend.service.circuit.CircuitBreakerService;
import com.marquee.backend.service.circuit.CircuitRegistry;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;

import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.containing;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ContentPipelineE2ETest {

    private static final WireMockServer wireMock = new WireMockServer(0);
    private static final String OPENAI_PATH = "/v1/chat/completions";
    private static final String DISPLAY_PATH = "/local-api/message";

    static {
        wireMock.start();
    }

    @DynamicPropertySource
    static void registerProperties(DynamicPropertyRegistry registry) {
        registry.add("marquee.providers.openai.api-key", () -> "sk-e2e");
        registry.add("marquee.providers.openai.base-url", wireMock::baseUrl);
        registry.add("marquee.display.base-url", wireMock::baseUrl);
    }

    @AfterAll
    static void stopWireMock() {
        wireMock.stop();
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private CircuitBreakerService circuitBreakerService;

    @Autowired
    private ContentHistoryRepository historyRepository;

    @Autowired
    private ContentOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        wireMock.resetAll();
        wireMock.stubFor(post(urlEqualTo(DISPLAY_PATH)).willReturn(aResponse().withStatus(200)));
        circuitBreakerService.setCircuitState(CircuitRegistry.MASTER, CircuitState.ON);
        circuitBreakerService.setCircuitState(CircuitRegistry.SLEEP_MODE, CircuitState.OFF);
        circuitBreakerService.resetProviderCircuit(CircuitRegistry.PROVIDER_OPENAI);
        historyRepository.deleteAll();
        orchestrator.clearCache();
    }

    @Test
    void notificationEventFlowsThroughToolLoopToDisplay() throws Exception {
        wireMock.stubFor(post(urlEqualTo(OPENAI_PATH)).willReturn(aResponse()
                .withStatus(200)
                .withHeader("Content-Type", "application/json")
                .withBody("""
                        {"model":"gpt-e2e","usage":{"total_tokens":64},
                         "choices":[{"finish_reason":"tool_calls","message":{"content":null,"tool_calls":[
                           {"id":"call_1","type":"function",
                            "function":{"name":"submit_content","arguments":"{\\"content\\":\\"front door opened\\"}"}}]}}]}
                        """)));

        mockMvc.perform(MockMvcRequestBuilders.post("/api/content/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"eventData\":{\"event_type\":\"door.opened\",\"entity_id\":\"door.front\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SENT"))
                .andExpect(jsonPath("$.text").value("FRONT DOOR OPENED"))
                .andExpect(jsonPath("$.metadata.generatorId").value("door-notification"))
                .andExpect(jsonPath("$.metadata.provider").value("openai"))
                .andExpect(jsonPath("$.metadata.toolAccepted").value(true))
                .andExpect(jsonPath("$.board").value(containsString("FRONT DOOR OPENED")));

        wireMock.verify(postRequestedFor(urlEqualTo(OPENAI_PATH))
                .withHeader("Authorization", equalTo("Bearer sk-e2e"))
                .withRequestBody(matchingJsonPath("$.tools[0].function.name", equalTo("submit_content")))
                .withRequestBody(matchingJsonPath("$.messages[1].content", containing("event.event_type: door.opened"))));
        wireMock.verify(postRequestedFor(urlEqualTo(DISPLAY_PATH))
                .withHeader("X-Vestaboard-Local-Api-Key", equalTo("test-display-key"))
                .withRequestBody(matchingJsonPath("$[5][21]")));

        mockMvc.perform(get("/api/content/latest"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CACHED"))
                .andExpect(jsonPath("$.text").value("FRONT DOOR OPENED"));

        List<ContentHistory> history = historyRepository.findAll();
        assertThat(history).singleElement().satisfies(row -> {
            assertThat(row.getStatus()).isEqualTo(ContentHistory.Status.SUCCESS);
            assertThat(row.getGeneratorId()).isEqualTo("door-notification");
            assertThat(row.getAiProvider()).isEqualTo("openai");
            assertThat(row.getTokensUsed()).isEqualTo(64);
        });
    }

    @Test
    void providerOutageStillUpdatesTheBoardWithFallback() throws Exception {
        wireMock.stubFor(post(urlEqualTo(OPENAI_PATH)).willReturn(aResponse().withStatus(500).withBody("oops")));

        mockMvc.perform(MockMvcRequestBuilders.post("/api/content/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"generatorId\":\"haiku\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metadata.fallback").value(true))
                .andExpect(jsonPath("$.metadata.failedGenerator").value("Haiku"))
                .andExpect(jsonPath("$.metadata.source").value("static-fallback"));

        wireMock.verify(1, postRequestedFor(urlEqualTo(DISPLAY_PATH)));
        assertThat(historyRepository.findAll()).extracting(ContentHistory::getStatus)
                .containsExactlyInAnyOrder(ContentHistory.Status.FAILED, ContentHistory.Status.SUCCESS);
        assertThat(circuitBreakerService.getCircuitStatus(CircuitRegistry.PROVIDER_OPENAI)).get()
                .satisfies(state -> assertThat(state.getFailureCount()).isEqualTo(1));
    }

    @Test
    void masterSwitchOffBlocksManualUpdates() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.put("/api/circuits/MASTER/state")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"state\":\"OFF\"}"))
                .andExpect(status().isOk());

        mockMvc.perform(MockMvcRequestBuilders.post("/api/content/generate"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value("SKIPPED"));

        wireMock.verify(0, postRequestedFor(urlEqualTo(OPENAI_PATH)));
        wireMock.verify(0, postRequestedFor(urlEqualTo(DISPLAY_PATH)));
        assertThat(historyRepository.findAll()).isEmpty();
    }
}
