package com.koni.energy.infrastructure.web.controller;

import com.koni.energy.application.service.FallbackReplayService;
import com.koni.energy.tags.IntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@IntegrationTest
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class FallbackReplayControllerIntegrationTest {

    @MockBean
    private KafkaTemplate<?, ?> kafkaTemplate;

    @MockBean
    private FallbackReplayService fallbackReplayService;

    @Autowired
    private MockMvc mockMvc;

    @Test
    void shouldReportReplayedCount() throws Exception {
        when(fallbackReplayService.replayEvents()).thenReturn(3);

        mockMvc.perform(post("/api/v1/admin/fallback/replay")
                        .with(jwt().jwt(token -> token.subject(UUID.randomUUID().toString()))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Successfully replayed 3 events"))
                .andExpect(jsonPath("$.replayedCount").value(3));
    }

    @Test
    void shouldReportNothingToReplay() throws Exception {
        when(fallbackReplayService.replayEvents()).thenReturn(0);

        mockMvc.perform(post("/api/v1/admin/fallback/replay")
                        .with(jwt().jwt(token -> token.subject(UUID.randomUUID().toString()))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("No fallback events to replay"))
                .andExpect(jsonPath("$.replayedCount").value(0));
    }

    @Test
    void shouldRequireAuthentication() throws Exception {
        mockMvc.perform(post("/api/v1/admin/fallback/replay"))
                .andExpect(status().isUnauthorized());
    }
}
