package com.example.feedsync.controller;

import com.example.feedsync.exception.QueueFullException;
import com.example.feedsync.ingestion.FeedParseResult;
import com.example.feedsync.model.ItemOrigin;
import com.example.feedsync.model.ItemStub;
import com.example.feedsync.model.PushNotification;
import com.example.feedsync.webhook.PushIngestionService;
import com.example.feedsync.webhook.WebhookVerifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = WebhookController.class)
@DisplayName("WebhookController Tests")
class WebhookControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private WebhookVerifier verifier;

    @MockBean
    private PushIngestionService pushIngestionService;

    @MockBean
    private Clock clock;

    @Test
    @DisplayName("Should answer 503 with Retry-After when the queue is full")
    void shouldSignalBackpressure() throws Exception {
        when(pushIngestionService.accept(any())).thenThrow(new QueueFullException(3, 0));

        mockMvc.perform(post("/webhook").header("X-Hub-Signature", "sha1=00").content("<feed/>"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string(HttpHeaders.RETRY_AFTER, "30"));
    }

    @Test
    @DisplayName("Should pass the raw body, signature and self topic to ingestion")
    void shouldPassRequestThrough() throws Exception {
        // Given
        Instant now = Instant.parse("2024-05-01T12:00:00Z");
        when(clock.instant()).thenReturn(now);
        ItemStub stub = new ItemStub("vid00000001", "UCIALMKvObZNtJ6AmdCLP7Lg", null, ItemOrigin.PUSH);
        when(pushIngestionService.accept(any())).thenReturn(new FeedParseResult(List.of(stub), 1, 0));

        // When
        mockMvc.perform(post("/webhook")
                        .header("X-Hub-Signature", "sha1=abcdef")
                        .header("Link", "<https://pubsubhubbub.appspot.com>; rel=hub, <https://topic.example/feed?id=1>; rel=\"self\"")
                        .content("<feed/>"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.queued").value(1));

        // Then
        ArgumentCaptor<PushNotification> captor = ArgumentCaptor.forClass(PushNotification.class);
        verify(pushIngestionService).accept(captor.capture());
        assertThat(new String(captor.getValue().body())).isEqualTo("<feed/>");
        assertThat(captor.getValue().signature()).isEqualTo("sha1=abcdef");
        assertThat(captor.getValue().topicHint()).isEqualTo("https://topic.example/feed?id=1");
        assertThat(captor.getValue().receivedAt()).isEqualTo(now);
    }

    @Test
    @DisplayName("Should reject a handshake without mode or topic")
    void shouldRejectIncompleteHandshake() throws Exception {
        mockMvc.perform(get("/webhook")
                        .param("hub.challenge", "abc123"))
                .andExpect(status().isBadRequest());
    }
}
