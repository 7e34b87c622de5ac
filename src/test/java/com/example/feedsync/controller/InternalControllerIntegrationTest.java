package com.example.feedsync.controller;

import com.example.feedsync.model.SubscriptionState;
import com.example.feedsync.support.IntegrationTestBase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static com.example.feedsync.support.FeedFixtures.ANI;
import static com.example.feedsync.support.FeedFixtures.BLOOMBERG;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@DisplayName("Internal API Integration Tests")
class InternalControllerIntegrationTest extends IntegrationTestBase {

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("Should list subscriptions without exposing secrets")
    void shouldListSubscriptions() throws Exception {
        mockMvc.perform(get("/api/internal/subscriptions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].state").value("PENDING"))
                .andExpect(jsonPath("$[0].secret").doesNotExist());
    }

    @Test
    @DisplayName("Should register a new channel as pending")
    void shouldRegisterChannel() throws Exception {
        mockMvc.perform(post("/api/internal/subscriptions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"UCnewChannel01\",\"name\":\"New Channel\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("PENDING"))
                .andExpect(jsonPath("$.topicUrl").value("https://www.youtube.com/xml/feeds/videos.xml?channel_id=UCnewChannel01"));

        assertThat(registry.isTracked("UCnewChannel01")).isTrue();
    }

    @Test
    @DisplayName("Should unsubscribe a channel and tell the hub")
    void shouldUnsubscribe() throws Exception {
        mockMvc.perform(delete("/api/internal/subscriptions/" + ANI))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("UNSUBSCRIBED"));

        verify(hubClient).unsubscribe(any());
        assertThat(registry.get(ANI).orElseThrow().getState()).isEqualTo(SubscriptionState.UNSUBSCRIBED);
    }

    @Test
    @DisplayName("Should renew a single channel on demand")
    void shouldRenewChannel() throws Exception {
        mockMvc.perform(post("/api/internal/subscriptions/" + BLOOMBERG + "/renew"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("ACTIVE")));
    }

    @Test
    @DisplayName("Should run a backfill and return its report")
    void shouldRunBackfill() throws Exception {
        when(metadataSource.listRecentItemIds(BLOOMBERG, 2)).thenReturn(List.of("bf000000001", "bf000000002"));
        when(metadataSource.fetchItem("bf000000001")).thenReturn(metadata("bf000000001", BLOOMBERG, 1));
        when(metadataSource.fetchItem("bf000000002")).thenReturn(metadata("bf000000002", BLOOMBERG, 2));

        mockMvc.perform(post("/api/internal/backfill/" + BLOOMBERG).param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.listed").value(2))
                .andExpect(jsonPath("$.inserted").value(2));

        assertThat(recordRepository.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should refuse a backfill for an unknown channel")
    void shouldRefuseUnknownBackfill() throws Exception {
        mockMvc.perform(post("/api/internal/backfill/UCnobody"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Should refuse a backfill with a non-positive limit")
    void shouldRefuseNonPositiveLimit() throws Exception {
        mockMvc.perform(post("/api/internal/backfill/" + BLOOMBERG).param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("limit")));
    }

    @Test
    @DisplayName("Should report queue and dead-letter health")
    void shouldReportHealth() throws Exception {
        mockMvc.perform(get("/api/internal/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.deadLetters").value(0))
                .andExpect(jsonPath("$.queueRemaining").value(50));
    }
}
