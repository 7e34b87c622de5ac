package com.example.feedsync.controller;

import com.example.feedsync.model.CanonicalRecord;
import com.example.feedsync.model.ItemOrigin;
import com.example.feedsync.model.SubscriptionState;
import com.example.feedsync.support.IntegrationTestBase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;

import static com.example.feedsync.support.FeedFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@DisplayName("Webhook Integration Tests")
class WebhookFlowIntegrationTest extends IntegrationTestBase {

    private static final Duration WAIT = Duration.ofSeconds(5);

    @Autowired
    private MockMvc mockMvc;

    @Nested
    @DisplayName("Handshake")
    class Handshake {

        @Test
        @DisplayName("Should echo the challenge verbatim for a known topic")
        void shouldEchoChallenge() throws Exception {
            mockMvc.perform(get("/webhook")
                            .param("hub.mode", "subscribe")
                            .param("hub.topic", topicFor(BLOOMBERG))
                            .param("hub.challenge", "abc123"))
                    .andExpect(status().isOk())
                    .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
                    .andExpect(content().string("abc123"));
        }

        @Test
        @DisplayName("Should answer not found for a topic it never requested")
        void shouldRejectUnknownTopic() throws Exception {
            mockMvc.perform(get("/webhook")
                            .param("hub.mode", "subscribe")
                            .param("hub.topic", "https://www.youtube.com/xml/feeds/videos.xml?channel_id=UCother")
                            .param("hub.challenge", "abc123"))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("Should answer not found for a mode other than subscribe or unsubscribe")
        void shouldRejectUnknownMode() throws Exception {
            mockMvc.perform(get("/webhook")
                            .param("hub.mode", "foo")
                            .param("hub.topic", topicFor(BLOOMBERG))
                            .param("hub.challenge", "abc123")
                            .param("hub.lease_seconds", "432000"))
                    .andExpect(status().isNotFound());

            assertThat(registry.get(BLOOMBERG).orElseThrow().getState()).isEqualTo(SubscriptionState.PENDING);
        }

        @Test
        @DisplayName("Should activate the channel with the lease the hub granted")
        void shouldActivateWithGrantedLease() throws Exception {
            mockMvc.perform(get("/webhook")
                            .param("hub.mode", "subscribe")
                            .param("hub.topic", topicFor(ANI))
                            .param("hub.challenge", "c-1")
                            .param("hub.lease_seconds", "432000"))
                    .andExpect(status().isOk());

            assertThat(registry.get(ANI).orElseThrow().getState()).isEqualTo(SubscriptionState.ACTIVE);
            assertThat(registry.get(ANI).orElseThrow().getLeaseExpiresAt()).isEqualTo(clock.instant().plusSeconds(432000));
        }

        @Test
        @DisplayName("Should reject a handshake without a challenge")
        void shouldRejectMissingChallenge() throws Exception {
            mockMvc.perform(get("/webhook")
                            .param("hub.mode", "subscribe")
                            .param("hub.topic", topicFor(BLOOMBERG)))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("Should mark the channel failed when the hub denies the subscription")
        void shouldRecordDenial() throws Exception {
            mockMvc.perform(get("/webhook")
                            .param("hub.mode", "denied")
                            .param("hub.topic", topicFor(BLOOMBERG))
                            .param("hub.reason", "unverified"))
                    .andExpect(status().isOk());

            assertThat(registry.get(BLOOMBERG).orElseThrow().getState()).isEqualTo(SubscriptionState.FAILED);
            assertThat(registry.get(BLOOMBERG).orElseThrow().getStateReason()).contains("unverified");
        }
    }

    @Nested
    @DisplayName("Push")
    class Push {

        @Test
        @DisplayName("Should acknowledge a signed push and store the item asynchronously")
        void shouldStoreSignedPush() throws Exception {
            // Given
            byte[] body = bytes(feed(entry("pushVideo01", BLOOMBERG, "2024-05-01T10:00:00+00:00")));
            when(metadataSource.fetchItem("pushVideo01")).thenReturn(metadata("pushVideo01", BLOOMBERG, 100));

            // When
            mockMvc.perform(post("/webhook")
                            .contentType(MediaType.APPLICATION_ATOM_XML)
                            .header("X-Hub-Signature", sign("sha1", SECRET, body))
                            .header("Link", "<" + topicFor(BLOOMBERG) + ">; rel=self, <https://pubsubhubbub.appspot.com>; rel=hub")
                            .content(body))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.status").value("received"))
                    .andExpect(jsonPath("$.count").value(1));

            // Then
            awaitCondition(() -> recordRepository.existsById("pushVideo01"), WAIT);
            CanonicalRecord record = recordRepository.findById("pushVideo01").orElseThrow();
            assertThat(record.getFirstSeenOrigin()).isEqualTo(ItemOrigin.PUSH);
            assertThat(record.getViewCount()).isEqualTo(100);
            assertThat(record.getChannelId()).isEqualTo(BLOOMBERG);
        }

        @Test
        @DisplayName("Should keep one record when the hub delivers the same push three times")
        void shouldDeduplicateRedeliveries() throws Exception {
            // Given
            byte[] body = bytes(feed(entry("dupVideo001", ANI, "2024-05-01T10:00:00Z")));
            String signature = sign("sha256", SECRET, body);
            when(metadataSource.fetchItem("dupVideo001")).thenReturn(metadata("dupVideo001", ANI, 5));
            Instant firstSeen = clock.instant();

            // When
            for (int i = 0; i < 3; i++) {
                mockMvc.perform(post("/webhook").header("X-Hub-Signature", signature).content(body))
                        .andExpect(status().isAccepted());
                Instant expected = clock.instant();
                awaitCondition(() -> recordRepository.findById("dupVideo001")
                        .map(r -> r.getLastUpdatedAt().equals(expected)).orElse(false), WAIT);
                clock.advance(Duration.ofMinutes(1));
            }

            // Then
            assertThat(recordRepository.count()).isEqualTo(1);
            CanonicalRecord record = recordRepository.findById("dupVideo001").orElseThrow();
            assertThat(record.getFirstSeenAt()).isEqualTo(firstSeen);
            assertThat(record.getLastUpdatedAt()).isEqualTo(firstSeen.plus(Duration.ofMinutes(2)));
            assertThat(record.getFirstSeenOrigin()).isEqualTo(ItemOrigin.PUSH);
        }

        @Test
        @DisplayName("Should reject a tampered body and leave the store unchanged")
        void shouldRejectTamperedPush() throws Exception {
            // Given
            byte[] original = bytes(feed(entry("origVideo01", BLOOMBERG, "2024-05-01T10:00:00Z")));
            byte[] tampered = bytes(feed(entry("evilVideo01", BLOOMBERG, "2024-05-01T10:00:00Z")));

            // When
            mockMvc.perform(post("/webhook")
                            .header("X-Hub-Signature", sign("sha1", SECRET, original))
                            .content(tampered))
                    .andExpect(status().isForbidden());

            // Then
            assertThat(recordRepository.count()).isZero();
            verify(metadataSource, never()).fetchItem(anyString());
        }

        @Test
        @DisplayName("Should reject an unsigned push")
        void shouldRejectUnsignedPush() throws Exception {
            byte[] body = bytes(feed(entry("noSig000001", BLOOMBERG, "2024-05-01T10:00:00Z")));

            mockMvc.perform(post("/webhook").content(body))
                    .andExpect(status().isForbidden());
        }

        @Test
        @DisplayName("Should reject a signed body that is not a feed")
        void shouldRejectMalformedBody() throws Exception {
            byte[] body = bytes("not xml at all");

            mockMvc.perform(post("/webhook").header("X-Hub-Signature", sign("sha1", SECRET, body)).content(body))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("Should drop entries for a channel that was unsubscribed")
        void shouldDropUnsubscribedChannel() throws Exception {
            registry.unsubscribe(ANI);
            byte[] body = bytes(feed(entry("lateVideo01", ANI, "2024-05-01T10:00:00Z")));

            mockMvc.perform(post("/webhook").header("X-Hub-Signature", sign("sha1", SECRET, body)).content(body))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.queued").value(0));

            verify(metadataSource, never()).fetchItem(anyString());
        }
    }
}
